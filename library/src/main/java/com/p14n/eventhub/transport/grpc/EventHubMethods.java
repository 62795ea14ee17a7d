package com.p14n.eventhub.transport.grpc;

import com.p14n.eventhub.data.EventMarshaller;
import com.p14n.eventhub.data.JsonEventMarshaller;

import io.grpc.MethodDescriptor;

/**
 * Method descriptors of an event hub service. The service is named after the
 * fully-qualified event type and has two methods: {@code sub}, server
 * streaming from a subscriber id, and {@code pub}, unary from an event.
 */
public final class EventHubMethods {

    public static final String SUBSCRIBE = "sub";
    public static final String PUBLISH = "pub";

    private EventHubMethods() {
    }

    public static <E> MethodDescriptor<String, E> subscribe(String eventType, EventMarshaller<E> marshaller) {
        return MethodDescriptor.<String, E>newBuilder()
                .setType(MethodDescriptor.MethodType.SERVER_STREAMING)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(eventType, SUBSCRIBE))
                .setRequestMarshaller(new JsonMarshaller<>(new JsonEventMarshaller<>(String.class)))
                .setResponseMarshaller(new JsonMarshaller<>(marshaller))
                .build();
    }

    public static <E> MethodDescriptor<E, PublishAck> publish(String eventType, EventMarshaller<E> marshaller) {
        return MethodDescriptor.<E, PublishAck>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(eventType, PUBLISH))
                .setRequestMarshaller(new JsonMarshaller<>(marshaller))
                .setResponseMarshaller(new JsonMarshaller<>(new JsonEventMarshaller<>(PublishAck.class)))
                .build();
    }
}

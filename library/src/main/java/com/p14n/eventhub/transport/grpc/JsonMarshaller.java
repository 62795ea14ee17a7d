package com.p14n.eventhub.transport.grpc;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.p14n.eventhub.data.EventMarshaller;

import io.grpc.MethodDescriptor;
import io.grpc.Status;

/**
 * Adapts an {@link EventMarshaller} to a gRPC message marshaller, so hub
 * methods carry the same bytes that are stored.
 *
 * @param <T> the message type
 */
public class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    private final EventMarshaller<T> marshaller;

    public JsonMarshaller(EventMarshaller<T> marshaller) {
        this.marshaller = marshaller;
    }

    @Override
    public InputStream stream(T value) {
        return new ByteArrayInputStream(marshaller.serialize(value));
    }

    @Override
    public T parse(InputStream stream) {
        try {
            return marshaller.deserialize(stream.readAllBytes());
        } catch (IOException | UncheckedIOException e) {
            throw Status.INTERNAL
                    .withDescription("Unable to parse message")
                    .withCause(e)
                    .asRuntimeException();
        }
    }
}

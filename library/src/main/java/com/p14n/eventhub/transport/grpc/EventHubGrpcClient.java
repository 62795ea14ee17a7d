package com.p14n.eventhub.transport.grpc;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.p14n.eventhub.data.EventMarshaller;
import com.p14n.eventhub.data.JsonEventMarshaller;

import io.grpc.CallOptions;
import io.grpc.ClientCall;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.MethodDescriptor;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.StreamObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remote counterpart of {@link EventHubGrpcService}: subscribes to and
 * publishes events of one type.
 *
 * <p>
 * A subscription ends when the stream fails or the server completes it;
 * callers resubscribe with the same subscriber id to resume, records queued in
 * the meantime are delivered then.
 * </p>
 *
 * @param <E> the event type
 */
public class EventHubGrpcClient<E> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventHubGrpcClient.class);

    private final ManagedChannel channel;
    private final MethodDescriptor<String, E> subscribeMethod;
    private final MethodDescriptor<E, PublishAck> publishMethod;

    /**
     * A running subscription. Closing it cancels the stream.
     */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    public EventHubGrpcClient(Class<E> eventClass, String host, int port) {
        this(eventClass, new JsonEventMarshaller<>(eventClass), ManagedChannelBuilder.forAddress(host, port)
                .keepAliveTime(1, TimeUnit.HOURS)
                .keepAliveTimeout(30, TimeUnit.SECONDS)
                .usePlaintext()
                .build());
    }

    public EventHubGrpcClient(Class<E> eventClass, EventMarshaller<E> marshaller, ManagedChannel channel) {
        this.channel = channel;
        this.subscribeMethod = EventHubMethods.subscribe(eventClass.getName(), marshaller);
        this.publishMethod = EventHubMethods.publish(eventClass.getName(), marshaller);
    }

    public Subscription subscribe(String subscriberId, Consumer<E> onEvent) {
        return subscribe(subscriberId, onEvent, t -> {
        });
    }

    public Subscription subscribe(String subscriberId, Consumer<E> onEvent, Consumer<Throwable> onError) {
        ClientCall<String, E> call = channel.newCall(subscribeMethod, CallOptions.DEFAULT);

        ClientCalls.asyncServerStreamingCall(call, subscriberId, new StreamObserver<E>() {
            @Override
            public void onNext(E event) {
                try {
                    onEvent.accept(event);
                } catch (Exception e) {
                    logger.atError().setCause(e).log("Error processing event for subscriber {}", subscriberId);
                }
            }

            @Override
            public void onError(Throwable t) {
                logger.atInfo().setCause(t).log("Event stream of subscriber {} failed", subscriberId);
                onError.accept(t);
            }

            @Override
            public void onCompleted() {
                logger.atInfo().log("Event stream of subscriber {} completed", subscriberId);
            }
        });

        return () -> call.cancel("Unsubscribed", null);
    }

    /**
     * Publishes an event through the hub's unary publish call.
     *
     * @param event the event
     * @return the acknowledgement
     * @throws io.grpc.StatusRuntimeException if the hub does not accept remote
     *                                        publishing or is unreachable
     */
    public PublishAck publish(E event) {
        return ClientCalls.blockingUnaryCall(channel, publishMethod, CallOptions.DEFAULT, event);
    }

    @Override
    public void close() throws InterruptedException {
        channel.shutdownNow();
        channel.awaitTermination(5, TimeUnit.SECONDS);
    }
}

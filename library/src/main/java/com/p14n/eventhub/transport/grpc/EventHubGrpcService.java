package com.p14n.eventhub.transport.grpc;

import com.p14n.eventhub.broker.AsyncExecutor;
import com.p14n.eventhub.broker.CancellationSignal;
import com.p14n.eventhub.broker.EventHub;
import com.p14n.eventhub.broker.HubRegistry;

import io.grpc.BindableService;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC service exposing one event hub.
 *
 * <p>
 * {@code sub} attaches the caller as a subscriber and streams its events until
 * the call is cancelled; the streaming loop runs on the {@link AsyncExecutor}.
 * {@code pub} is only bound when the hub mode accepts remote publishing. It
 * acknowledges at once and routes the event through the {@link HubRegistry} in
 * the background.
 * </p>
 *
 * @param <E> the event type
 */
public class EventHubGrpcService<E> implements BindableService {
    private static final Logger logger = LoggerFactory.getLogger(EventHubGrpcService.class);

    private final EventHub<E, ?> hub;
    private final HubRegistry registry;
    private final AsyncExecutor asyncExecutor;
    private final CancellationSignal appStopping;

    public EventHubGrpcService(EventHub<E, ?> hub, HubRegistry registry, AsyncExecutor asyncExecutor,
            CancellationSignal appStopping) {
        this.hub = hub;
        this.registry = registry;
        this.asyncExecutor = asyncExecutor;
        this.appStopping = appStopping;
    }

    @Override
    public ServerServiceDefinition bindService() {
        var builder = ServerServiceDefinition.builder(hub.eventType())
                .addMethod(EventHubMethods.subscribe(hub.eventType(), hub.marshaller()),
                        ServerCalls.asyncServerStreamingCall(this::subscribe));

        if (hub.hubMode().acceptsRemotePublish()) {
            builder.addMethod(EventHubMethods.publish(hub.eventType(), hub.marshaller()),
                    ServerCalls.asyncUnaryCall(this::publish));
        }
        return builder.build();
    }

    void subscribe(String subscriberId, StreamObserver<E> responseObserver) {
        if (subscriberId == null || subscriberId.isBlank()) {
            logger.atError().log("Invalid subscriber id received for {}", hub.eventType());
            responseObserver.onError(Status.INVALID_ARGUMENT
                    .withDescription("Subscriber id cannot be empty")
                    .asRuntimeException());
            return;
        }

        var call = (ServerCallStreamObserver<E>) responseObserver;
        var callSignal = CancellationSignal.none();
        call.setOnCancelHandler(callSignal::cancel);

        asyncExecutor.submit(() -> {
            try {
                hub.onSubscriberConnected(subscriberId, new GrpcEventChannel<>(call), callSignal);
            } catch (RuntimeException e) {
                logger.atError()
                        .setCause(e)
                        .log("Streaming to subscriber {} failed", subscriberId);
            } finally {
                complete(call, subscriberId);
            }
            return null;
        });
    }

    private void complete(ServerCallStreamObserver<E> call, String subscriberId) {
        if (call.isCancelled()) {
            return;
        }
        try {
            synchronized (call) {
                call.onCompleted();
            }
        } catch (RuntimeException e) {
            logger.atDebug()
                    .setCause(e)
                    .log("Unable to complete the stream of subscriber {}", subscriberId);
        }
    }

    void publish(E event, StreamObserver<PublishAck> responseObserver) {
        asyncExecutor.submit(() -> {
            try {
                registry.routeEvent(event, appStopping);
            } catch (RuntimeException e) {
                logger.atError()
                        .setCause(e)
                        .log("Unable to publish event of type {}", hub.eventType());
            }
            return null;
        });

        responseObserver.onNext(new PublishAck(true));
        responseObserver.onCompleted();
    }
}

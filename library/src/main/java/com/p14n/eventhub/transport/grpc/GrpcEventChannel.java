package com.p14n.eventhub.transport.grpc;

import com.p14n.eventhub.transport.ChannelClosedException;
import com.p14n.eventhub.transport.EventChannel;

import io.grpc.stub.ServerCallStreamObserver;

/**
 * {@link EventChannel} over the response stream of a {@code sub} call.
 */
class GrpcEventChannel<E> implements EventChannel<E> {

    private final ServerCallStreamObserver<E> call;

    GrpcEventChannel(ServerCallStreamObserver<E> call) {
        this.call = call;
    }

    @Override
    public void write(E event) throws ChannelClosedException {
        // with an on-cancel handler set, onNext silently drops after cancellation
        if (call.isCancelled()) {
            throw new ChannelClosedException("Subscriber call was cancelled");
        }
        synchronized (call) {
            call.onNext(event);
        }
    }
}

package com.p14n.eventhub.transport.grpc;

/**
 * Response of the unary publish call. Sent once the event is accepted for
 * fan-out, before it is stored.
 */
public record PublishAck(boolean accepted) {
}

package com.p14n.eventhub.transport;

/**
 * Thrown by an {@link EventChannel} written to after the remote side went away.
 */
public class ChannelClosedException extends Exception {

    public ChannelClosedException(String message) {
        super(message);
    }
}

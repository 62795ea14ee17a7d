package com.p14n.eventhub.broker;

/**
 * A durable hub could not restore its subscribers in time. Starting without
 * them would silently drop their queued events, so the host must not start.
 */
public class HubInitializationException extends RuntimeException {

    public HubInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.p14n.eventhub.transport;

/**
 * Outbound stream of events to one connected subscriber.
 *
 * @param <E> the event type
 */
@FunctionalInterface
public interface EventChannel<E> {

    /**
     * Writes an event to the subscriber.
     *
     * @param event the event
     * @throws Exception if the channel is broken or closed; the hub treats any
     *                   failure as a disconnect
     */
    void write(E event) throws Exception;
}

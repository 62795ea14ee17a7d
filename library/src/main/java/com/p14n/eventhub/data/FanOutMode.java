package com.p14n.eventhub.data;

/**
 * How a hub picks the subscribers that receive a published event.
 */
public enum FanOutMode {

    /**
     * Every known subscriber receives the event.
     */
    BROADCAST,

    /**
     * Exactly one connected subscriber receives the event, rotating between
     * publishes.
     */
    ROUND_ROBIN
}

package com.p14n.eventhub.data;

/**
 * Which remote operations a hub exposes.
 */
public enum HubMode {

    /**
     * Events are published in-process only; remote clients can subscribe.
     */
    EVENT_PUBLISHER,

    /**
     * Remote clients can also publish events through the unary publish call.
     */
    EVENT_BROKER;

    public boolean acceptsRemotePublish() {
        return this == EVENT_BROKER;
    }
}

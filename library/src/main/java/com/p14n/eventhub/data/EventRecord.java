package com.p14n.eventhub.data;

import java.time.Instant;
import java.util.UUID;

/**
 * Default {@link StorageRecord} used by the in-memory and PostgreSQL providers.
 */
public class EventRecord implements StorageRecord {

    private volatile String id = UUID.randomUUID().toString();
    private volatile String subscriberId;
    private volatile String eventType;
    private volatile byte[] payload;
    private volatile boolean complete;
    private volatile Instant expireOn;
    private volatile boolean queueOverflowed;

    public EventRecord() {
    }

    public EventRecord(String subscriberId, String eventType, byte[] payload, Instant expireOn) {
        this.subscriberId = subscriberId;
        this.eventType = eventType;
        this.payload = payload;
        this.expireOn = expireOn;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void setId(String id) {
        this.id = id;
    }

    @Override
    public String getSubscriberId() {
        return subscriberId;
    }

    @Override
    public void setSubscriberId(String subscriberId) {
        this.subscriberId = subscriberId;
    }

    @Override
    public String getEventType() {
        return eventType;
    }

    @Override
    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    @Override
    public byte[] getPayload() {
        return payload;
    }

    @Override
    public void setPayload(byte[] payload) {
        this.payload = payload;
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    @Override
    public void setComplete(boolean complete) {
        this.complete = complete;
    }

    @Override
    public Instant getExpireOn() {
        return expireOn;
    }

    @Override
    public void setExpireOn(Instant expireOn) {
        this.expireOn = expireOn;
    }

    @Override
    public boolean isQueueOverflowed() {
        return queueOverflowed;
    }

    @Override
    public void setQueueOverflowed(boolean queueOverflowed) {
        this.queueOverflowed = queueOverflowed;
    }

    @Override
    public String toString() {
        return "EventRecord{id=" + id + ", subscriberId=" + subscriberId + ", eventType=" + eventType
                + ", complete=" + complete + ", expireOn=" + expireOn + "}";
    }
}

package com.p14n.eventhub.data;

import java.time.Instant;

/**
 * Persisted envelope of one event destined for one subscriber.
 *
 * <p>
 * Storage providers may supply their own implementation; the hub creates
 * instances through a supplier so any type with these accessors can be stored.
 * A record is visible to a consumer only while it is not complete and not
 * expired, see {@link #isPending(Instant)}.
 * </p>
 */
public interface StorageRecord {

    /**
     * Returns the unique identifier of the record.
     *
     * @return the record id
     */
    String getId();

    void setId(String id);

    /**
     * Returns the subscriber this record is queued for.
     *
     * @return the subscriber id
     */
    String getSubscriberId();

    void setSubscriberId(String subscriberId);

    /**
     * Returns the fully-qualified event type tag.
     *
     * @return the event type
     */
    String getEventType();

    void setEventType(String eventType);

    byte[] getPayload();

    void setPayload(byte[] payload);

    boolean isComplete();

    void setComplete(boolean complete);

    Instant getExpireOn();

    void setExpireOn(Instant expireOn);

    boolean isQueueOverflowed();

    void setQueueOverflowed(boolean queueOverflowed);

    /**
     * Serializes the event into this record's payload.
     *
     * @param event      the event
     * @param marshaller the marshaller for the event type
     * @param <E>        the event type
     */
    default <E> void setEvent(E event, EventMarshaller<E> marshaller) {
        setPayload(marshaller.serialize(event));
    }

    /**
     * Deserializes the event held in this record's payload.
     *
     * @param marshaller the marshaller for the event type
     * @param <E>        the event type
     * @return the event
     */
    default <E> E getEvent(EventMarshaller<E> marshaller) {
        return marshaller.deserialize(getPayload());
    }

    /**
     * Checks whether this record can still be delivered.
     *
     * @param now the reference time
     * @return true if the record is incomplete and not expired at {@code now}
     */
    default boolean isPending(Instant now) {
        return !isComplete() && getExpireOn() != null && !now.isAfter(getExpireOn());
    }
}

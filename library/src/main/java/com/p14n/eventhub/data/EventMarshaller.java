package com.p14n.eventhub.data;

/**
 * Converts events of one type to and from bytes, both for storage payloads and
 * for the wire.
 *
 * @param <E> the event type
 */
public interface EventMarshaller<E> {

    byte[] serialize(E event);

    E deserialize(byte[] bytes);
}

package com.p14n.eventhub.data;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson based {@link EventMarshaller}. Events are written as JSON.
 *
 * @param <E> the event type
 */
public class JsonEventMarshaller<E> implements EventMarshaller<E> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ObjectMapper mapper;
    private final Class<E> type;

    public JsonEventMarshaller(Class<E> type) {
        this(DEFAULT_MAPPER, type);
    }

    public JsonEventMarshaller(ObjectMapper mapper, Class<E> type) {
        this.mapper = mapper;
        this.type = type;
    }

    @Override
    public byte[] serialize(E event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to serialize " + type.getName(), e);
        }
    }

    @Override
    public E deserialize(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to deserialize " + type.getName(), e);
        }
    }
}

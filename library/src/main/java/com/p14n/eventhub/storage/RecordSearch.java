package com.p14n.eventhub.storage;

import java.time.Instant;
import java.util.function.Predicate;

import com.p14n.eventhub.broker.CancellationSignal;
import com.p14n.eventhub.data.StorageRecord;

/**
 * Criteria handed to a {@link StorageProvider}.
 *
 * <p>
 * The structured fields let SQL-backed providers build their query; the
 * {@code match} predicate expresses the same criteria for providers that filter
 * in memory, and is applied to every candidate record.
 * </p>
 *
 * @param eventType    the event type tag
 * @param subscriberId the subscriber, or null when the search spans subscribers
 * @param limit        the maximum number of records to return
 * @param match        predicate every returned record satisfies
 * @param now          reference time for expiry checks
 * @param cancellation cancellation for the call
 * @param <R>          the record type
 */
public record RecordSearch<R extends StorageRecord>(String eventType,
        String subscriberId,
        int limit,
        Predicate<R> match,
        Instant now,
        CancellationSignal cancellation) {

    /**
     * Criteria for the pending records of one subscriber.
     */
    public static <R extends StorageRecord> RecordSearch<R> pending(String eventType, String subscriberId, int limit,
            Instant now, CancellationSignal cancellation) {
        Predicate<R> match = r -> subscriberId.equals(r.getSubscriberId())
                && eventType.equals(r.getEventType())
                && r.isPending(now);
        return new RecordSearch<>(eventType, subscriberId, limit, match, now, cancellation);
    }

    /**
     * Criteria for every pending record of an event type, used when restoring
     * subscriber ids.
     */
    public static <R extends StorageRecord> RecordSearch<R> restorable(String eventType, Instant now,
            CancellationSignal cancellation) {
        Predicate<R> match = r -> eventType.equals(r.getEventType()) && r.isPending(now);
        return new RecordSearch<>(eventType, null, Integer.MAX_VALUE, match, now, cancellation);
    }

    /**
     * Criteria for records of an event type that can be discarded: complete or
     * expired.
     */
    public static <R extends StorageRecord> RecordSearch<R> stale(String eventType, Instant now,
            CancellationSignal cancellation) {
        Predicate<R> match = r -> eventType.equals(r.getEventType()) && !r.isPending(now);
        return new RecordSearch<>(eventType, null, Integer.MAX_VALUE, match, now, cancellation);
    }
}

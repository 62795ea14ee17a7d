package com.p14n.eventhub.storage;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.p14n.eventhub.broker.CancellationSignal;
import com.p14n.eventhub.data.StorageRecord;

/**
 * Backing store for event hub records.
 *
 * <p>
 * Implementations must tolerate interleaved calls from many subscriber loops
 * and publishers. Calls for one subscriber are never concurrent: the hub runs
 * a single streaming loop per subscriber.
 * </p>
 *
 * @param <R> the record type
 */
public interface StorageProvider<R extends StorageRecord> {

    /**
     * Returns the ids of subscribers that still have deliverable records for an
     * event type. Called once per hub at startup.
     *
     * @param search the restoration criteria
     * @return distinct subscriber ids
     * @throws StorageException if the store cannot be read
     */
    Set<String> restoreSubscriberIds(RecordSearch<R> search) throws StorageException;

    /**
     * Persists records. Once this returns every record is visible to
     * {@link #getNextBatch(RecordSearch)} for its subscriber.
     *
     * @param records      the records to store
     * @param cancellation cancellation for the call
     * @throws QueueOverflowException if any record was refused; the refused
     *                                records are flagged, the rest were stored
     * @throws StorageException       if the store failed
     */
    void storeEvents(Collection<R> records, CancellationSignal cancellation) throws StorageException;

    /**
     * Returns up to {@code search.limit()} pending records for a subscriber,
     * oldest first.
     *
     * @param search the pending record criteria
     * @return the next records to deliver, possibly empty
     * @throws StorageException if the store cannot be read
     */
    List<R> getNextBatch(RecordSearch<R> search) throws StorageException;

    /**
     * Marks a delivered record complete so it is excluded from later batches.
     * Must be idempotent.
     *
     * @param record       the delivered record
     * @param cancellation cancellation for the call
     * @throws StorageException if the update failed
     */
    void markComplete(R record, CancellationSignal cancellation) throws StorageException;

    /**
     * Removes expired or abandoned records.
     *
     * @param search the stale record criteria
     * @throws StorageException if the store failed
     */
    void purgeStale(RecordSearch<R> search) throws StorageException;

    /**
     * Whether records survive a restart. Durable providers restore subscribers at
     * startup and mark records complete after delivery; non-durable providers
     * remove records as they are read.
     *
     * @return true for durable providers
     */
    default boolean isDurable() {
        return true;
    }

    default void storeEvent(R record, CancellationSignal cancellation) throws StorageException {
        storeEvents(List.of(record), cancellation);
    }
}

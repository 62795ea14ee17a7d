package com.p14n.eventhub.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.LinkedBlockingQueue;

import com.p14n.eventhub.data.StorageRecord;

/**
 * Bounded FIFO queue of one subscriber's records.
 *
 * <p>
 * The queue is stale once nothing has been dequeued from it for longer than the
 * idle time to live; the subscriber is presumed gone. A stale or full queue
 * refuses new records.
 * </p>
 */
class InMemoryEventQueue<R extends StorageRecord> {

    private final LinkedBlockingQueue<R> records;
    private final Duration idleTtl;
    private volatile Instant lastDequeueAt;

    InMemoryEventQueue(Duration idleTtl, int maxDepth, Instant createdAt) {
        this.records = new LinkedBlockingQueue<>(maxDepth);
        this.idleTtl = idleTtl;
        this.lastDequeueAt = createdAt;
    }

    boolean isStale(Instant now) {
        return Duration.between(lastDequeueAt, now).compareTo(idleTtl) > 0;
    }

    /**
     * @return false if the queue is stale or full
     */
    boolean offer(R record, Instant now) {
        return !isStale(now) && records.offer(record);
    }

    R poll(Instant now) {
        lastDequeueAt = now;
        return records.poll();
    }

    int size() {
        return records.size();
    }

    void clear() {
        records.clear();
    }
}

package com.p14n.eventhub.storage;

/**
 * One or more records of a store call were refused because their target queue
 * is stale or full. The refused records have
 * {@link com.p14n.eventhub.data.StorageRecord#isQueueOverflowed()} set; the
 * others were stored.
 */
public class QueueOverflowException extends StorageException {

    private final int overflowed;

    public QueueOverflowException(int overflowed) {
        super(overflowed + " record(s) could not be queued");
        this.overflowed = overflowed;
    }

    public int getOverflowed() {
        return overflowed;
    }
}

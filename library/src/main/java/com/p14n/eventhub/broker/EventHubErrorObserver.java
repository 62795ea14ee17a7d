package com.p14n.eventhub.broker;

import com.p14n.eventhub.data.StorageRecord;

/**
 * Optional hook notified of storage failures and queue overflows. The hub
 * retries or recovers on its own; implementations are for observability only
 * and should return quickly.
 *
 * <p>
 * The {@code attempt} argument counts consecutive failures of the same
 * operation, starting at zero, and is reset after a success.
 * </p>
 */
public interface EventHubErrorObserver {

    EventHubErrorObserver NONE = new EventHubErrorObserver() {
    };

    default void onRestoreSubscriberIdsError(String eventType, int attempt, Exception error) {
    }

    default void onGetNextBatchError(String eventType, String subscriberId, int attempt, Exception error) {
    }

    default void onMarkCompleteError(StorageRecord record, int attempt, Exception error) {
    }

    default void onStoreEventError(StorageRecord record, int attempt, Exception error) {
    }

    default void onQueueOverflow(StorageRecord record) {
    }
}

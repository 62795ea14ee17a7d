package com.p14n.eventhub.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.p14n.eventhub.broker.CancellationSignal;
import com.p14n.eventhub.data.EventRecord;
import com.p14n.eventhub.data.HubConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default, non-durable storage: one bounded queue per event type and subscriber.
 *
 * <p>
 * Reads dequeue permanently, so there is nothing to mark complete and nothing
 * to restore after a restart. A single instance can be shared by every hub;
 * queues are keyed by event type as well as subscriber.
 * </p>
 */
public class InMemoryStorage implements StorageProvider<EventRecord> {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStorage.class);

    private record QueueKey(String eventType, String subscriberId) {
    }

    private final ConcurrentHashMap<QueueKey, InMemoryEventQueue<EventRecord>> queues = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTtl;
    private final int maxDepth;

    public InMemoryStorage(HubConfig cfg) {
        this(Clock.systemUTC(), cfg.queueIdleTtl(), cfg.queueMaxDepth());
    }

    public InMemoryStorage(Clock clock, Duration idleTtl, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.clock = clock;
        this.idleTtl = idleTtl;
        this.maxDepth = maxDepth;
    }

    @Override
    public Set<String> restoreSubscriberIds(RecordSearch<EventRecord> search) {
        return Set.of();
    }

    @Override
    public void storeEvents(Collection<EventRecord> records, CancellationSignal cancellation)
            throws QueueOverflowException {
        int overflowed = 0;
        Instant now = clock.instant();

        for (var r : records) {
            var q = queue(r.getEventType(), r.getSubscriberId());
            if (!q.offer(r, now)) {
                r.setQueueOverflowed(true);
                overflowed++;
            }
        }

        if (overflowed > 0) {
            throw new QueueOverflowException(overflowed);
        }
    }

    @Override
    public List<EventRecord> getNextBatch(RecordSearch<EventRecord> search) {
        var q = queue(search.eventType(), search.subscriberId());

        // one record at a time keeps in-memory delivery latency low
        EventRecord r;
        while ((r = q.poll(clock.instant())) != null) {
            if (search.match().test(r)) {
                return List.of(r);
            }
            logger.atDebug().log("Dropping expired record {} for subscriber {}", r.getId(), r.getSubscriberId());
        }
        return List.of();
    }

    @Override
    public void markComplete(EventRecord record, CancellationSignal cancellation) {
        throw new UnsupportedOperationException("In-memory records are removed when read");
    }

    @Override
    public void purgeStale(RecordSearch<EventRecord> search) {
        Instant now = clock.instant();
        queues.forEach((key, q) -> {
            if (key.eventType().equals(search.eventType()) && q.isStale(now) && queues.remove(key, q)) {
                logger.atInfo().log("Purging stale queue of subscriber {} for event type {} ({} records)",
                        key.subscriberId(), key.eventType(), q.size());
                q.clear();
            }
        });
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    /**
     * Checks whether the queue of a subscriber is stale. Unknown subscribers have
     * no queue and are never stale.
     */
    public boolean isStale(String eventType, String subscriberId) {
        var q = queues.get(new QueueKey(eventType, subscriberId));
        return q != null && q.isStale(clock.instant());
    }

    public int queueSize(String eventType, String subscriberId) {
        var q = queues.get(new QueueKey(eventType, subscriberId));
        return q == null ? 0 : q.size();
    }

    private InMemoryEventQueue<EventRecord> queue(String eventType, String subscriberId) {
        return queues.computeIfAbsent(new QueueKey(eventType, subscriberId),
                k -> new InMemoryEventQueue<>(idleTtl, maxDepth, clock.instant()));
    }
}

package com.p14n.eventhub.broker;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.p14n.eventhub.data.EventMarshaller;
import com.p14n.eventhub.data.FanOutMode;
import com.p14n.eventhub.data.HubConfig;
import com.p14n.eventhub.data.HubMode;
import com.p14n.eventhub.data.JsonEventMarshaller;
import com.p14n.eventhub.data.StorageRecord;
import com.p14n.eventhub.storage.QueueOverflowException;
import com.p14n.eventhub.storage.RecordSearch;
import com.p14n.eventhub.storage.StorageException;
import com.p14n.eventhub.storage.StorageProvider;
import com.p14n.eventhub.telemetry.HubMetrics;
import com.p14n.eventhub.transport.EventChannel;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.eventhub.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Broker for a single event type.
 *
 * <p>
 * Published events are fanned out to one storage record per selected
 * subscriber. Each connected subscriber runs a streaming loop, see
 * {@link #onSubscriberConnected(String, EventChannel, CancellationSignal)},
 * that drains its records from storage and writes them to its channel.
 * Delivery is at least once: durable records are only marked complete after a
 * successful write.
 * </p>
 *
 * <p>
 * Hubs are created with {@link #builder(Class)}; building a hub registers it in
 * the {@link HubRegistry} under its event type.
 * </p>
 *
 * @param <E> the event type
 * @param <R> the storage record type
 */
public class EventHub<E, R extends StorageRecord> {
    private static final Logger logger = LoggerFactory.getLogger(EventHub.class);

    private final Class<E> eventClass;
    private final String eventType;
    private final HubConfig cfg;
    private final StorageProvider<R> storage;
    private final Supplier<R> recordFactory;
    private final EventMarshaller<E> marshaller;
    private final CancellationSignal appStopping;
    private final AsyncExecutor asyncExecutor;
    private final EventHubErrorObserver errors;
    private final Clock clock;
    private final HubMetrics metrics;
    private final Tracer tracer;

    private final SubscriberTable subscribers = new SubscriberTable();
    private final Object lock = new Object();
    private String lastReceivedBy;

    private EventHub(Builder<E, R> b) {
        this.eventClass = b.eventClass;
        this.eventType = b.eventClass.getName();
        this.cfg = Objects.requireNonNull(b.cfg, "config");
        this.storage = Objects.requireNonNull(b.storage, "storage");
        this.recordFactory = Objects.requireNonNull(b.recordFactory, "recordFactory");
        this.marshaller = b.marshaller != null ? b.marshaller : new JsonEventMarshaller<>(b.eventClass);
        this.appStopping = b.appStopping != null ? b.appStopping : CancellationSignal.none();
        this.asyncExecutor = Objects.requireNonNull(b.asyncExecutor, "asyncExecutor");
        this.errors = b.errors != null ? b.errors : EventHubErrorObserver.NONE;
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        var ot = b.openTelemetry != null ? b.openTelemetry : OpenTelemetry.noop();
        this.metrics = new HubMetrics(ot.getMeter("event_hub"));
        this.tracer = ot.getTracer("event_hub");
    }

    public static <E> Builder<E, StorageRecord> builder(Class<E> eventClass) {
        return new Builder<>(eventClass);
    }

    /**
     * Restores the subscribers of a durable hub from storage.
     *
     * <p>
     * Failures are reported and retried after the backoff until the restore
     * timeout elapses, at which point startup is aborted. Non-durable hubs have
     * nothing to restore and return at once.
     * </p>
     *
     * @throws HubInitializationException if restoration did not succeed in time
     */
    public void initialize() {
        if (!storage.isDurable()) {
            return;
        }

        int attempt = 0;
        Exception lastError = null;

        try (var timeout = CancellationSignal.linked(appStopping)) {
            ScheduledFuture<?> timer = asyncExecutor.schedule(timeout::cancel,
                    cfg.restoreTimeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
                while (!appStopping.isCancelled()) {
                    if (lastError != null && timeout.isCancelled()) {
                        throw new HubInitializationException("Unable to restore subscribers for event ["
                                + eventType + "] via storage provider in a timely manner!", lastError);
                    }
                    try {
                        var ids = storage.restoreSubscriberIds(
                                RecordSearch.restorable(eventType, clock.instant(), timeout));
                        ids.forEach(subscribers::getOrAdd);
                        logger.atInfo().log("Restored {} subscribers for event type {}", ids.size(), eventType);
                        return;
                    } catch (Exception e) {
                        lastError = e;
                        errors.onRestoreSubscriberIdsError(eventType, attempt++, e);
                        metrics.recordStorageError(eventType);
                        logger.atError()
                                .setCause(e)
                                .log("Unable to restore subscribers for event type {}, retrying", eventType);
                        timeout.await(cfg.retryBackoff());
                    }
                }
            } finally {
                timer.cancel(false);
            }
        }
    }

    /**
     * Streams records to a connected subscriber until the call or the
     * application is cancelled, the channel fails, the subscriber is evicted or
     * connects again on another stream.
     *
     * <p>
     * Blocks for the lifetime of the connection, callers run it on a worker
     * thread.
     * </p>
     *
     * @param subscriberId the subscriber
     * @param channel      where events are written
     * @param callSignal   cancelled when the connection ends
     */
    public void onSubscriberConnected(String subscriberId, EventChannel<E> channel, CancellationSignal callSignal) {
        logger.atInfo().log("Subscriber {} connected for event type {}", subscriberId, eventType);

        var cancellation = CancellationSignal.linked(callSignal, appStopping);
        var subscriber = subscribers.attach(subscriberId, cancellation);
        metrics.recordSubscriberConnected(eventType);
        int retrievalErrorCount = 0;
        int updateErrorCount = 0;

        try (cancellation; var wakeOnCancel = cancellation.onCancel(subscriber::signal)) {

            while (!cancellation.isCancelled()) {
                if (subscribers.get(subscriberId) != subscriber) {
                    logger.atInfo().log("Subscriber {} was evicted from event type {}", subscriberId, eventType);
                    return;
                }

                List<R> records;
                try {
                    records = storage.getNextBatch(RecordSearch.pending(eventType, subscriberId,
                            cfg.batchLimit(), clock.instant(), cancellation));
                    retrievalErrorCount = 0;
                } catch (Exception e) {
                    errors.onGetNextBatchError(eventType, subscriberId, retrievalErrorCount++, e);
                    metrics.recordStorageError(eventType);
                    logger.atError()
                            .setCause(e)
                            .log("Unable to read records of subscriber {} for event type {}", subscriberId, eventType);
                    cancellation.await(cfg.retryBackoff());
                    continue;
                }

                if (records.isEmpty()) {
                    // bounded, a missed signal only delays delivery
                    if (!subscriber.awaitSignal(cfg.wakeWait()) && Thread.currentThread().isInterrupted()) {
                        cancellation.cancel();
                    }
                    continue;
                }

                for (R record : records) {
                    if (cancellation.isCancelled()) {
                        break;
                    }
                    try {
                        channel.write(record.getEvent(marshaller));
                        metrics.recordDelivered(eventType);
                    } catch (Exception e) {
                        logger.atInfo()
                                .setCause(e)
                                .log("Unable to write to subscriber {} for event type {}", subscriberId, eventType);
                        if (!storage.isDurable()) {
                            requeue(record, cancellation);
                        }
                        // the subscriber reconnects to resume
                        return;
                    }

                    while (storage.isDurable()) {
                        try {
                            record.setComplete(true);
                            storage.markComplete(record, cancellation);
                            updateErrorCount = 0;
                            break;
                        } catch (Exception e) {
                            errors.onMarkCompleteError(record, updateErrorCount++, e);
                            metrics.recordStorageError(eventType);
                            logger.atError()
                                    .setCause(e)
                                    .log("Unable to mark record {} of subscriber {} complete", record.getId(),
                                            subscriberId);
                            if (cancellation.isCancelled() || cancellation.await(cfg.retryBackoff())) {
                                break;
                            }
                        }
                    }
                }
            }
        } finally {
            if (subscriber.detach(cancellation, cfg.fanOutMode() == FanOutMode.ROUND_ROBIN)) {
                logger.atInfo().log("Subscriber {} disconnected from event type {}", subscriberId, eventType);
            } else {
                logger.atInfo().log("Subscriber {} reconnected to event type {}, previous stream ended",
                        subscriberId, eventType);
            }
            metrics.recordSubscriberDisconnected(eventType);
        }
    }

    private void requeue(R record, CancellationSignal cancellation) {
        try {
            storage.storeEvent(record, cancellation);
        } catch (StorageException | RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .log("Discarding undelivered record {} of subscriber {}", record.getId(),
                            record.getSubscriberId());
        }
    }

    /**
     * Picks the subscribers that receive the next event: every known subscriber
     * in broadcast mode, otherwise the connected subscriber after the last one
     * chosen.
     */
    List<String> receiveCandidates() {
        if (cfg.fanOutMode() == FanOutMode.BROADCAST) {
            return subscribers.allIds();
        }

        List<String> connected = subscribers.connectedIds();
        if (connected.isEmpty()) {
            return connected;
        }

        // a lone subscriber still becomes the cursor, so rotation resumes after it

        synchronized (lock) {
            String next = connected.get(0);
            if (lastReceivedBy != null) {
                for (String id : connected) {
                    if (id.compareTo(lastReceivedBy) > 0) {
                        next = id;
                        break;
                    }
                }
            }
            lastReceivedBy = next;
            return List.of(next);
        }
    }

    /**
     * Queues an event for the subscribers selected by the fan-out mode.
     *
     * <p>
     * Waits up to the no-subscriber wait for a subscriber to appear and drops the
     * event if none does. Storage failures are retried until
     * {@code cancellation} fires; subscribers whose queue overflows are evicted.
     * </p>
     *
     * @param event        the event, an instance of this hub's event type
     * @param cancellation cancellation for the publish
     */
    public void broadcastEvent(Object event, CancellationSignal cancellation) {
        E typed = eventClass.cast(event);
        processWithTelemetry(tracer, "broadcast_event", eventType, () -> {
            fanOut(typed, cancellation);
            return null;
        });
    }

    private void fanOut(E event, CancellationSignal cancellation) {
        metrics.recordPublished(eventType);
        List<String> candidates = receiveCandidates();

        long deadline = System.nanoTime() + cfg.noSubscriberWait().toNanos();
        while (candidates.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            logger.atWarn().log("No subscribers connected to event hub of {}, waiting", eventType);
            if (cancellation.await(Duration.ofNanos(Math.min(cfg.noSubscriberPoll().toNanos(), remaining)))) {
                break;
            }
            candidates = receiveCandidates();
        }

        if (candidates.isEmpty()) {
            logger.atWarn().log("Dropping event of type {}, no subscribers", eventType);
            return;
        }

        byte[] payload = marshaller.serialize(event);
        for (String subscriberId : candidates) {
            R record = recordFactory.get();
            record.setSubscriberId(subscriberId);
            record.setEventType(eventType);
            record.setExpireOn(clock.instant().plus(cfg.recordTtl()));
            record.setPayload(payload);
            store(record, cancellation);
        }
    }

    private void store(R record, CancellationSignal cancellation) {
        String subscriberId = record.getSubscriberId();
        int createErrorCount = 0;

        while (true) {
            try {
                storage.storeEvent(record, cancellation);
                subscribers.signal(subscriberId);
                return;
            } catch (QueueOverflowException e) {
                subscribers.remove(subscriberId);
                metrics.recordOverflow(eventType);
                errors.onQueueOverflow(record);
                logger.atWarn().log("Queue of subscriber {} for event type {} overflowed, subscriber removed",
                        subscriberId, eventType);
                return;
            } catch (Exception e) {
                errors.onStoreEventError(record, createErrorCount++, e);
                metrics.recordStorageError(eventType);
                logger.atError()
                        .setCause(e)
                        .log("Unable to store record for subscriber {} of event type {}", subscriberId, eventType);
                if (cancellation.isCancelled() || cancellation.await(cfg.retryBackoff())) {
                    return;
                }
            }
        }
    }

    /**
     * Removes stale records of this hub's event type from storage.
     *
     * @throws StorageException if the storage provider failed
     */
    public void purgeStaleRecords() throws StorageException {
        storage.purgeStale(RecordSearch.stale(eventType, clock.instant(), appStopping));
    }

    public Class<E> eventClass() {
        return eventClass;
    }

    public String eventType() {
        return eventType;
    }

    public EventMarshaller<E> marshaller() {
        return marshaller;
    }

    public HubMode hubMode() {
        return cfg.hubMode();
    }

    public FanOutMode fanOutMode() {
        return cfg.fanOutMode();
    }

    public boolean isDurable() {
        return storage.isDurable();
    }

    public SubscriberTable subscribers() {
        return subscribers;
    }

    public static class Builder<E, R extends StorageRecord> {
        private final Class<E> eventClass;
        private HubConfig cfg;
        private StorageProvider<R> storage;
        private Supplier<R> recordFactory;
        private EventMarshaller<E> marshaller;
        private HubRegistry registry;
        private CancellationSignal appStopping;
        private AsyncExecutor asyncExecutor;
        private EventHubErrorObserver errors;
        private Clock clock;
        private OpenTelemetry openTelemetry;

        Builder(Class<E> eventClass) {
            this.eventClass = Objects.requireNonNull(eventClass, "eventClass");
        }

        public Builder<E, R> config(HubConfig cfg) {
            this.cfg = cfg;
            return this;
        }

        @SuppressWarnings("unchecked")
        public <S extends StorageRecord> Builder<E, S> storage(StorageProvider<S> storage, Supplier<S> recordFactory) {
            var b = (Builder<E, S>) this;
            b.storage = storage;
            b.recordFactory = recordFactory;
            return b;
        }

        public Builder<E, R> marshaller(EventMarshaller<E> marshaller) {
            this.marshaller = marshaller;
            return this;
        }

        public Builder<E, R> registry(HubRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder<E, R> appStopping(CancellationSignal appStopping) {
            this.appStopping = appStopping;
            return this;
        }

        public Builder<E, R> asyncExecutor(AsyncExecutor asyncExecutor) {
            this.asyncExecutor = asyncExecutor;
            return this;
        }

        public Builder<E, R> errorObserver(EventHubErrorObserver errors) {
            this.errors = errors;
            return this;
        }

        public Builder<E, R> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder<E, R> openTelemetry(OpenTelemetry openTelemetry) {
            this.openTelemetry = openTelemetry;
            return this;
        }

        public EventHub<E, R> build() {
            var hub = new EventHub<>(this);
            if (registry != null) {
                registry.register(hub);
            }
            return hub;
        }
    }
}

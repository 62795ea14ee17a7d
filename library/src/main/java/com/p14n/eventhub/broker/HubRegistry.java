package com.p14n.eventhub.broker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import com.p14n.eventhub.storage.StorageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes published events to the hub of their runtime type.
 *
 * <p>
 * One registry is created per process and handed to every hub and to the
 * publish path. There is at most one hub per event type; registering another
 * hub for the same type replaces the first.
 * </p>
 */
public class HubRegistry {
    private static final Logger logger = LoggerFactory.getLogger(HubRegistry.class);

    private final ConcurrentHashMap<Class<?>, EventHub<?, ?>> hubs = new ConcurrentHashMap<>();
    private final AsyncExecutor asyncExecutor;

    public HubRegistry(AsyncExecutor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    public void register(EventHub<?, ?> hub) {
        var previous = hubs.put(hub.eventClass(), hub);
        if (previous != null && previous != hub) {
            logger.atWarn().log("Replaced the event hub registered for {}", hub.eventType());
        }
    }

    @SuppressWarnings("unchecked")
    public <E> EventHub<E, ?> hubFor(Class<E> eventClass) {
        return (EventHub<E, ?>) hubs.get(eventClass);
    }

    public Collection<EventHub<?, ?>> hubs() {
        return List.copyOf(hubs.values());
    }

    /**
     * Hands an event to the hub registered for its runtime type.
     *
     * @param event        the event
     * @param cancellation cancellation for the publish
     * @throws IllegalStateException if no hub is registered for the event type
     */
    public void routeEvent(Object event, CancellationSignal cancellation) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        var hub = hubs.get(event.getClass());
        if (hub == null) {
            throw new IllegalStateException(
                    "An event hub has not been registered for [" + event.getClass().getName() + "]");
        }
        hub.broadcastEvent(event, cancellation);
    }

    /**
     * Restores subscribers of every durable hub concurrently and waits for all of
     * them.
     *
     * @throws HubInitializationException if any hub failed to restore
     */
    public void initializeAll() {
        List<Future<Void>> pending = new ArrayList<>();
        for (var hub : hubs.values()) {
            if (hub.isDurable()) {
                pending.add(asyncExecutor.submit(() -> {
                    hub.initialize();
                    return null;
                }));
            }
        }

        HubInitializationException failure = null;
        for (var f : pending) {
            try {
                f.get();
            } catch (ExecutionException e) {
                var cause = e.getCause();
                var error = cause instanceof HubInitializationException hie ? hie
                        : new HubInitializationException("Event hub initialization failed", cause);
                if (failure == null) {
                    failure = error;
                } else {
                    failure.addSuppressed(error);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HubInitializationException("Interrupted while initializing event hubs", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Purges stale records of every hub. Failures are logged and the remaining
     * hubs are still purged.
     */
    public void purgeStaleRecords() {
        for (var hub : hubs.values()) {
            try {
                hub.purgeStaleRecords();
            } catch (StorageException | RuntimeException e) {
                logger.atError()
                        .setCause(e)
                        .log("Unable to purge stale records for event type {}", hub.eventType());
            }
        }
    }
}

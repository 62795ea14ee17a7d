package com.p14n.eventhub.broker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Subscribers known to one hub, keyed by subscriber id.
 *
 * <p>
 * Operations are atomic per key only.
 * </p>
 */
public class SubscriberTable {

    /**
     * Liveness and wake gate of a subscriber.
     */
    public static class Subscriber {
        // counts records stored since the streaming loop last looked
        private final Semaphore wake = new Semaphore(0);
        private volatile boolean connected;
        // lifetime of the streaming loop currently reading for this subscriber
        private CancellationSignal attachment;

        public boolean isConnected() {
            return connected;
        }

        void setConnected(boolean connected) {
            this.connected = connected;
        }

        synchronized CancellationSignal attach(CancellationSignal loop) {
            var previous = attachment;
            attachment = loop;
            connected = true;
            return previous;
        }

        /**
         * Releases the subscriber if {@code loop} is still the attached one.
         *
         * @param loop       the lifetime of the exiting streaming loop
         * @param disconnect whether to clear the connected flag
         * @return false if another loop has attached since
         */
        synchronized boolean detach(CancellationSignal loop, boolean disconnect) {
            if (attachment != loop) {
                return false;
            }
            attachment = null;
            if (disconnect) {
                connected = false;
            }
            return true;
        }

        void signal() {
            wake.release();
        }

        /**
         * Waits for a signal for at most the given duration. An interrupt is
         * restored on the calling thread and ends the wait.
         *
         * @return true if a signal was consumed
         */
        boolean awaitSignal(Duration max) {
            try {
                return wake.tryAcquire(max.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private final ConcurrentHashMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    public Subscriber getOrAdd(String subscriberId) {
        return subscribers.computeIfAbsent(subscriberId, id -> new Subscriber());
    }

    public Subscriber get(String subscriberId) {
        return subscribers.get(subscriberId);
    }

    /**
     * Marks a subscriber connected, adding it if unknown.
     */
    public Subscriber connect(String subscriberId) {
        return subscribers.compute(subscriberId, (id, s) -> {
            var sub = s == null ? new Subscriber() : s;
            sub.setConnected(true);
            return sub;
        });
    }

    /**
     * Attaches a streaming loop to a subscriber, adding it if unknown, and marks
     * it connected. A loop still attached for the same id is cancelled, so only
     * one loop reads a subscriber's records.
     *
     * @param subscriberId the subscriber
     * @param loop         cancelled when the new loop ends
     * @return the subscriber
     */
    public Subscriber attach(String subscriberId, CancellationSignal loop) {
        var sub = getOrAdd(subscriberId);
        var previous = sub.attach(loop);
        if (previous != null && previous != loop) {
            previous.cancel();
        }
        return sub;
    }

    public boolean remove(String subscriberId) {
        return subscribers.remove(subscriberId) != null;
    }

    /**
     * Wakes the streaming loop of a subscriber, adding the subscriber if unknown.
     */
    public void signal(String subscriberId) {
        getOrAdd(subscriberId).signal();
    }

    public List<String> allIds() {
        return List.copyOf(subscribers.keySet());
    }

    /**
     * Snapshot of the connected subscriber ids in sorted order.
     */
    public List<String> connectedIds() {
        return subscribers.entrySet().stream()
                .filter(e -> e.getValue().isConnected())
                .map(e -> e.getKey())
                .sorted()
                .collect(Collectors.toList());
    }

    public boolean contains(String subscriberId) {
        return subscribers.containsKey(subscriberId);
    }

    public int size() {
        return subscribers.size();
    }
}

package com.p14n.eventhub.broker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot cancellation flag that long running hub loops observe.
 *
 * <p>
 * A signal can be linked to parent signals, in which case it is cancelled as
 * soon as any parent is. This is how a subscriber's connection lifetime is
 * combined with the application stopping signal. Closing a linked signal
 * detaches it from its parents.
 * </p>
 *
 * <p>
 * Backoff waits use {@link #await(Duration)} so that they return as soon as
 * the signal is cancelled.
 * </p>
 */
public class CancellationSignal implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final List<Registration> parentRegistrations = new CopyOnWriteArrayList<>();

    /**
     * Handle returned by {@link #onCancel(Runnable)}; closing it removes the
     * callback.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Creates a signal that is cancelled when any of the given parents is.
     *
     * @param parents the signals this one follows
     * @return a new linked signal
     */
    public static CancellationSignal linked(CancellationSignal... parents) {
        var signal = new CancellationSignal();
        for (var parent : parents) {
            signal.parentRegistrations.add(parent.onCancel(signal::cancel));
        }
        return signal;
    }

    /**
     * Creates a signal that is never cancelled by anything but an explicit
     * {@link #cancel()}.
     *
     * @return a new signal
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Cancels this signal and runs the registered callbacks once.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        // whoever removes a callback first runs it, see onCancel
        for (var callback : callbacks) {
            if (callbacks.remove(callback)) {
                run(callback);
            }
        }
    }

    private void run(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Cancellation callback failed");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits for the given duration or until the signal is cancelled.
     *
     * @param duration maximum time to wait
     * @return true if the signal was cancelled
     */
    public boolean await(Duration duration) {
        try {
            return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }

    /**
     * Registers a callback to run on cancellation. Runs immediately if the signal
     * is already cancelled.
     *
     * @param callback the callback
     * @return a registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            run(callback);
        }
        return () -> callbacks.remove(callback);
    }

    @Override
    public void close() {
        for (var registration : parentRegistrations) {
            registration.close();
        }
        parentRegistrations.clear();
    }
}

package express.mvp.kiva.ipc.lifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coordinates the orderly shutdown of a server and its sessions.
 *
 * <p>The coordinator counts running sessions, refuses new ones once shutdown begins, and walks the
 * server through the {@link ShutdownPhase} sequence.
 *
 * <h2>Shutdown Flow</h2>
 *
 * <pre>
 * 1. shutdown(timeout) called
 *    └─▶ RUNNING → DRAINING
 *        └─▶ sessionStarted() now returns false
 *        └─▶ wait for running sessions (up to timeout)
 *
 * 2. Drained OR timeout
 *    └─▶ DRAINING → CLOSING
 *        └─▶ cancel remaining sessions
 *        └─▶ release the listener
 *
 * 3. Released
 *    └─▶ CLOSING → TERMINATED
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * if (!coordinator.sessionStarted()) {
 *     channel.close();   // shutting down, refuse
 *     return;
 * }
 * try {
 *     runSession();
 * } finally {
 *     coordinator.sessionCompleted();
 * }
 *
 * boolean graceful = coordinator.shutdown(Duration.ofSeconds(5), pool::cancelAll, adapter::close);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Only the first shutdown request runs the shutdown steps;
 * concurrent callers wait for it to finish.
 *
 * @see ShutdownPhase
 * @see ShutdownListener
 */
public final class ShutdownCoordinator {

    private static final Logger LOGGER = Logger.getLogger(ShutdownCoordinator.class.getName());

    private final AtomicReference<ShutdownPhase> phase =
            new AtomicReference<>(ShutdownPhase.RUNNING);

    private final AtomicInteger runningSessions = new AtomicInteger(0);

    /** Sessions running when draining started, for progress reports. */
    private volatile int drainStartCount = 0;

    private volatile long shutdownStartTimeNanos = 0;

    private final CountDownLatch drainCompleteLatch = new CountDownLatch(1);

    private final CountDownLatch terminatedLatch = new CountDownLatch(1);

    private final List<ShutdownListener> listeners = new CopyOnWriteArrayList<>();

    /** Whether every session finished before the drain timeout. */
    private volatile boolean gracefulShutdown = true;

    /**
     * Returns the current shutdown phase.
     *
     * @return the current phase
     */
    public ShutdownPhase getPhase() {
        return phase.get();
    }

    /**
     * Checks if new sessions may start.
     *
     * @return true only in RUNNING phase
     */
    public boolean isAcceptingSessions() {
        return phase.get().isAcceptingSessions();
    }

    /**
     * Checks if shutdown has completed.
     *
     * @return true if in TERMINATED phase
     */
    public boolean isTerminated() {
        return phase.get().isTerminated();
    }

    /**
     * Returns the number of sessions that started and have not completed.
     *
     * @return the running session count
     */
    public int getRunningCount() {
        return runningSessions.get();
    }

    /**
     * Registers a listener for shutdown events.
     *
     * @param listener the listener to register
     */
    public void addListener(ShutdownListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ShutdownListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Records that a session is about to start.
     *
     * <p>Must be paired with {@link #sessionCompleted()} when this returns true.
     *
     * @return true if the session may run, false if shutdown is in progress
     */
    public boolean sessionStarted() {
        while (true) {
            if (!phase.get().isAcceptingSessions()) {
                return false;
            }

            int current = runningSessions.get();
            if (runningSessions.compareAndSet(current, current + 1)) {
                // shutdown may have begun between the phase check and the increment
                if (phase.get().isAcceptingSessions()) {
                    return true;
                }
                sessionCompleted();
                return false;
            }
        }
    }

    /** Records that a session has finished, normally or not. */
    public void sessionCompleted() {
        int remaining = runningSessions.decrementAndGet();
        if (remaining < 0) {
            runningSessions.compareAndSet(remaining, 0);
            remaining = 0;
        }

        if (phase.get() != ShutdownPhase.DRAINING) {
            return;
        }
        if (remaining == 0) {
            drainCompleteLatch.countDown();
        }
        if (drainStartCount > 0) {
            for (ShutdownListener listener : listeners) {
                try {
                    listener.onDrainProgress(remaining, drainStartCount);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Shutdown listener failed on drain progress", e);
                }
            }
        }
    }

    /**
     * Shuts down gracefully: waits for running sessions, then cancels the rest and releases
     * resources.
     *
     * <p>Blocks until the coordinator is TERMINATED. A second caller waits for the first one.
     *
     * @param drainTimeout maximum time to wait for running sessions to finish on their own
     * @param sessionCanceller cancels whatever is still running (called in CLOSING)
     * @param resourceReleaser releases the listener (called in CLOSING, after the canceller)
     * @return true if every session finished before the timeout
     * @throws InterruptedException if the calling thread is interrupted while draining
     */
    public boolean shutdown(
            Duration drainTimeout, Runnable sessionCanceller, Runnable resourceReleaser)
            throws InterruptedException {

        if (!phase.compareAndSet(ShutdownPhase.RUNNING, ShutdownPhase.DRAINING)) {
            awaitTermination(drainTimeout);
            return gracefulShutdown;
        }

        shutdownStartTimeNanos = System.nanoTime();
        drainStartCount = runningSessions.get();
        notifyPhaseChange(ShutdownPhase.RUNNING, ShutdownPhase.DRAINING);

        if (drainStartCount == 0) {
            drainCompleteLatch.countDown();
        }

        try {
            boolean drained =
                    drainCompleteLatch.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            // shutdownNow may have released the latch with sessions still running
            gracefulShutdown = drained && gracefulShutdown;
        } finally {
            // even when interrupted, never leave sessions or the listener behind
            transitionToPhase(ShutdownPhase.CLOSING);
            release(sessionCanceller, resourceReleaser);
            terminate();
        }
        return gracefulShutdown;
    }

    /**
     * Shuts down immediately, skipping the drain phase.
     *
     * @param sessionCanceller cancels running sessions
     * @param resourceReleaser releases the listener
     */
    public void shutdownNow(Runnable sessionCanceller, Runnable resourceReleaser) {
        ShutdownPhase previous = phase.get();
        while (previous.isAcceptingSessions()) {
            if (phase.compareAndSet(previous, ShutdownPhase.CLOSING)) {
                break;
            }
            previous = phase.get();
        }
        if (!previous.isAcceptingSessions()) {
            // someone else owns the shutdown; a DRAINING one is cut short by cancelling now
            if (previous == ShutdownPhase.DRAINING) {
                gracefulShutdown = false;
                drainCompleteLatch.countDown();
            }
            return;
        }

        shutdownStartTimeNanos = System.nanoTime();
        gracefulShutdown = runningSessions.get() == 0;
        notifyPhaseChange(previous, ShutdownPhase.CLOSING);
        drainCompleteLatch.countDown();

        release(sessionCanceller, resourceReleaser);
        terminate();
    }

    /**
     * Waits for shutdown to complete.
     *
     * @param timeout maximum time to wait
     * @return true if terminated within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminatedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void release(Runnable sessionCanceller, Runnable resourceReleaser) {
        try {
            if (sessionCanceller != null) {
                sessionCanceller.run();
            }
        } catch (RuntimeException e) {
            notifyError(ShutdownPhase.CLOSING, e);
        }

        try {
            if (resourceReleaser != null) {
                resourceReleaser.run();
            }
        } catch (RuntimeException e) {
            notifyError(ShutdownPhase.CLOSING, e);
        }
    }

    private void terminate() {
        transitionToPhase(ShutdownPhase.TERMINATED);
        terminatedLatch.countDown();

        long durationMs =
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - shutdownStartTimeNanos);
        for (ShutdownListener listener : listeners) {
            try {
                listener.onShutdownComplete(gracefulShutdown, durationMs);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed on completion", e);
            }
        }
    }

    private void transitionToPhase(ShutdownPhase newPhase) {
        ShutdownPhase previous = phase.getAndSet(newPhase);
        if (previous != newPhase) {
            notifyPhaseChange(previous, newPhase);
        }
    }

    private void notifyPhaseChange(ShutdownPhase previous, ShutdownPhase current) {
        for (ShutdownListener listener : listeners) {
            try {
                listener.onPhaseChange(previous, current);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed on phase change", e);
            }
        }
    }

    private void notifyError(ShutdownPhase errorPhase, Throwable error) {
        LOGGER.log(Level.WARNING, "Shutdown step failed in phase " + errorPhase, error);
        for (ShutdownListener listener : listeners) {
            try {
                listener.onShutdownError(errorPhase, error);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed on error report", e);
            }
        }
    }
}

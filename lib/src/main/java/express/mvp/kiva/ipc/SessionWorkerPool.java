package express.mvp.kiva.ipc;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs each session task on its own daemon thread.
 *
 * <p>A session blocks on socket reads for as long as its peer stays connected, so tasks are never
 * queued behind one another: the underlying cached executor reuses an idle thread or starts a new
 * one. How many sessions run at once is decided by the {@link ConnectionPool}.
 *
 * <h2>Stopping</h2>
 *
 * <pre>{@code
 * workers.shutdownNow();                             // interrupts every session thread
 * workers.awaitTermination(Duration.ofSeconds(5));   // waits for them to finish closing
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see SessionThreadFactory
 */
public final class SessionWorkerPool {

    private final SessionThreadFactory threadFactory;
    private final ExecutorService executor;

    private final AtomicLong submitted = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);

    private SessionWorkerPool(SessionThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Creates a pool whose threads are named after the given prefix.
     *
     * @param namePrefix the prefix for worker thread names
     * @return a new worker pool
     */
    public static SessionWorkerPool create(String namePrefix) {
        return new SessionWorkerPool(new SessionThreadFactory(namePrefix));
    }

    /**
     * Starts a task on a worker thread.
     *
     * @param task the session task
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        try {
            executor.execute(task);
            submitted.incrementAndGet();
        } catch (RejectedExecutionException e) {
            rejected.incrementAndGet();
            throw e;
        }
    }

    /** Refuses further tasks and interrupts the running ones. */
    public void shutdownNow() {
        executor.shutdownNow();
    }

    /**
     * Waits for the worker threads to finish after {@link #shutdownNow()}.
     *
     * <p>Returns false at once when called from one of this pool's own threads, which could
     * otherwise only wait for itself.
     *
     * @param timeout how long to wait
     * @return true if every worker finished
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (threadFactory.isFactoryThread()) {
            return false;
        }
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "SessionWorkerPool[submitted=" + submitted.get()
                + ", rejected=" + rejected.get()
                + ", threads=" + threadFactory.getThreadCount()
                + ", shutdown=" + executor.isShutdown() + "]";
    }
}

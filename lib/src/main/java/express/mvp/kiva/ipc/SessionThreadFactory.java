package express.mvp.kiva.ipc;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the daemon threads that sessions run on.
 *
 * <p>Threads are named "{prefix}-{n}", numbered from one, so a thread dump shows how many session
 * threads the server has started. A server that is never shut down does not keep the JVM alive.
 *
 * <p>The factory remembers its own threads: {@link #isFactoryThread()} tells a caller whether it
 * is running on one of them.
 *
 * @see SessionWorkerPool
 */
public final class SessionThreadFactory implements ThreadFactory {

    private final AtomicLong created = new AtomicLong(0);
    private final String namePrefix;
    private final ThreadLocal<Boolean> ownThread = ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Creates a factory.
     *
     * @param namePrefix the prefix for thread names
     */
    public SessionThreadFactory(String namePrefix) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix must not be null");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable must not be null");
        Thread thread = new Thread(() -> {
            ownThread.set(Boolean.TRUE);
            runnable.run();
        }, namePrefix + "-" + created.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    /**
     * Checks whether the calling thread was created by this factory.
     *
     * @return true on a session thread of this factory
     */
    public boolean isFactoryThread() {
        return ownThread.get();
    }

    /**
     * Returns how many threads this factory has created.
     *
     * @return the created thread count
     */
    public long getThreadCount() {
        return created.get();
    }

    @Override
    public String toString() {
        return "SessionThreadFactory[prefix=" + namePrefix + ", created=" + created.get() + "]";
    }
}

package express.mvp.kiva.ipc;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe connection pool implementation.
 *
 * <h2>Implementation Details</h2>
 *
 * <ul>
 *   <li><b>Capacity:</b> a {@link Semaphore} with one permit per slot; {@link #admit} uses {@code
 *       tryAcquire}, so admission never blocks and two admissions can never both take the last
 *       permit
 *   <li><b>Tracking:</b> a {@link ConcurrentHashMap} from handle to slot; a slot's permit is
 *       released by whichever call removes it from the map, exactly once
 *   <li><b>Cancellation:</b> a generation counter bumped by {@link #cancelAll()}; a task registered
 *       on a slot admitted in an older generation is cancelled on registration
 * </ul>
 *
 * @see ConnectionPool
 */
public final class ConnectionPoolImpl implements ConnectionPool {

    private static final Logger LOGGER = Logger.getLogger(ConnectionPoolImpl.class.getName());

    /** Admitted slots keyed by handle. */
    private final Map<SessionHandle, Slot> slots = new ConcurrentHashMap<>();

    /** One permit per free slot. */
    private final Semaphore permits;

    /** Maximum sessions, or {@link #UNBOUNDED}. */
    private final int capacity;

    /** Bumped by every cancelAll, so late registrations can be cancelled. */
    private final AtomicLong cancelGeneration = new AtomicLong(0);

    /** Flag indicating whether the pool has been closed. */
    private volatile boolean closed = false;

    /** Creates an unbounded pool. */
    public ConnectionPoolImpl() {
        this(UNBOUNDED);
    }

    /**
     * Creates a pool with the given capacity.
     *
     * @param capacity maximum concurrent sessions, or {@link #UNBOUNDED}
     * @throws IllegalArgumentException if capacity is negative
     */
    public ConnectionPoolImpl(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity == UNBOUNDED ? Integer.MAX_VALUE : capacity);
    }

    @Override
    public SessionHandle admit(Connection candidate) {
        if (closed || !permits.tryAcquire()) {
            return null;
        }

        // close() may have drained the map between the check and the acquire
        if (closed) {
            permits.release();
            return null;
        }

        SessionHandle handle = SessionHandle.next(candidate);
        slots.put(handle, new Slot(cancelGeneration.get()));
        return handle;
    }

    @Override
    public void register(SessionHandle handle, Future<?> task) {
        Slot slot = slots.get(handle);
        if (slot == null) {
            throw new IllegalStateException("Unknown or freed session: " + handle);
        }
        slot.task = task;
        if (closed || slot.generation != cancelGeneration.get()) {
            task.cancel(true);
        }
    }

    @Override
    public boolean deregister(SessionHandle handle) {
        if (handle == null) {
            return false;
        }
        if (slots.remove(handle) == null) {
            return false;
        }
        permits.release();
        return true;
    }

    @Override
    public int cancelAll() {
        cancelGeneration.incrementAndGet();
        int requested = 0;
        for (Map.Entry<SessionHandle, Slot> entry : slots.entrySet()) {
            Future<?> task = entry.getValue().task;
            if (task == null) {
                // not registered yet: register() sees the generation change
                continue;
            }
            try {
                task.cancel(true);
                requested++;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed to cancel " + entry.getKey(), e);
            }
        }
        return requested;
    }

    @Override
    public boolean isFull() {
        return capacity != UNBOUNDED && permits.availablePermits() == 0;
    }

    @Override
    public int size() {
        return slots.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cancelAll();
    }

    @Override
    public String toString() {
        return "ConnectionPoolImpl[size=" + slots.size()
                + ", capacity=" + (capacity == UNBOUNDED ? "unbounded" : capacity)
                + ", closed=" + closed + "]";
    }

    /** A reserved session slot. */
    private static final class Slot {
        /** cancelAll generation at admission time. */
        final long generation;

        /** The task serving the session; null until registered. */
        volatile Future<?> task;

        Slot(long generation) {
            this.generation = generation;
        }
    }
}

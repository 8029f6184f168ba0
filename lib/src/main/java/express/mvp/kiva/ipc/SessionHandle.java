package express.mvp.kiva.ipc;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque key of a session slot in a {@link ConnectionPool}.
 *
 * <p>Handles are issued by {@link ConnectionPool#admit(Connection)} and compare by identity of
 * their sequence number; two admissions never share a handle.
 *
 * @param sequence pool-unique admission number
 * @param connectionId id of the admitted connection, for diagnostics
 */
public record SessionHandle(long sequence, long connectionId) {

    private static final AtomicLong SEQUENCE = new AtomicLong(0);

    /**
     * Issues a fresh handle for a connection.
     *
     * @param connection the admitted connection
     * @return a new handle
     */
    static SessionHandle next(Connection connection) {
        return new SessionHandle(SEQUENCE.incrementAndGet(), connection.id());
    }

    @Override
    public String toString() {
        return "session-" + sequence + "(conn-" + connectionId + ")";
    }
}

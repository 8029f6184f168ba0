package express.mvp.kiva.ipc;

/**
 * Framing discipline applied to the inbound bytes of a connection.
 *
 * <p>The mode is chosen from the server's default at acceptance and may be switched by the
 * command sub-protocol before payload framing begins.
 *
 * <h2>Modes</h2>
 *
 * <ul>
 *   <li>{@link #TEXT_DATA}: discrete framing, one message assembled from all bytes up to
 *       end-of-stream
 *   <li>{@link #STREAM_DATA}: chunked framing, one message per read, no assembly across reads
 *   <li>{@link #PERSISTENT}: chunked framing on a connection that stays writable after replies
 * </ul>
 */
public enum ConnectionMode {

    /** One message per connection, assembled from all bytes until end-of-stream. */
    TEXT_DATA("Text data", false, true),

    /** One message per read event, delivered as soon as it arrives. */
    STREAM_DATA("Stream data", true, true),

    /**
     * Chunked framing where replies do not signal end-of-output, so several request/reply rounds
     * can share one connection.
     */
    PERSISTENT("Persistent", true, false);

    private final String displayName;
    private final boolean chunked;
    private final boolean closesOutputAfterReply;

    ConnectionMode(String displayName, boolean chunked, boolean closesOutputAfterReply) {
        this.displayName = displayName;
        this.chunked = chunked;
        this.closesOutputAfterReply = closesOutputAfterReply;
    }

    /**
     * Returns a human-readable name for this mode.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks whether each read produces its own message.
     *
     * @return true for {@link #STREAM_DATA} and {@link #PERSISTENT}
     */
    public boolean isChunked() {
        return chunked;
    }

    /**
     * Checks whether a reply sent on this connection ends its outbound side.
     *
     * @return false only for {@link #PERSISTENT}
     */
    public boolean closesOutputAfterReply() {
        return closesOutputAfterReply;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

package express.mvp.kiva.ipc.framing;

/**
 * Thrown when a discrete message grows past the configured read limit before the peer ends its
 * output.
 */
public class MessageLimitExceededException extends FramingException {

    private final long limit;
    private final long received;

    /**
     * Creates the exception.
     *
     * @param limit the configured maximum message size in bytes
     * @param received the number of bytes received when the limit was detected
     */
    public MessageLimitExceededException(long limit, long received) {
        super(String.format(
                "Message exceeds read limit: received %d bytes, limit %d", received, limit));
        this.limit = limit;
        this.received = received;
    }

    /**
     * Returns the configured limit.
     *
     * @return the limit in bytes
     */
    public long limit() {
        return limit;
    }

    /**
     * Returns how many bytes had arrived when the limit was detected.
     *
     * @return bytes received, always greater than {@link #limit()}
     */
    public long received() {
        return received;
    }
}

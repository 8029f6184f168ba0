package express.mvp.kiva.ipc.framing;

import express.mvp.kiva.ipc.IpcException;

/**
 * Exception thrown when inbound bytes cannot be framed into messages.
 *
 * <p>A framing failure ends only the session it occurred in. The byte stream is in an unknown
 * position afterwards, so the session goes straight to closing.
 *
 * @see FramingHandler
 * @see MessageLimitExceededException
 */
public class FramingException extends IpcException {

    /**
     * Constructs a new framing exception with the specified detail message.
     *
     * @param message the detail message describing the framing error
     */
    public FramingException(String message) {
        super(message);
    }

    /**
     * Constructs a new framing exception with the specified detail message and cause.
     *
     * @param message the detail message describing the framing error
     * @param cause the underlying cause of the framing error
     */
    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}

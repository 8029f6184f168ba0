package express.mvp.kiva.server;

import express.mvp.kiva.ipc.IpcException;
import express.mvp.kiva.ipc.Message;

/**
 * Wraps a checked exception thrown by {@link IpcServerHandler#onMessage(Message)}.
 *
 * <p>Ends the session it was thrown in, with outcome {@link
 * express.mvp.kiva.ipc.error.SessionOutcome#FAILED}.
 */
public class MessageHandlerException extends IpcException {

    /**
     * Creates the exception.
     *
     * @param message the message being handled
     * @param cause what the handler threw
     */
    public MessageHandlerException(Message message, Throwable cause) {
        super("Message handler failed on " + message, cause);
    }
}

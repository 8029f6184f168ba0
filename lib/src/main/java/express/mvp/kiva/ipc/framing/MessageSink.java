package express.mvp.kiva.ipc.framing;

import express.mvp.kiva.ipc.Message;
import java.io.IOException;

/**
 * Receives the messages a {@link FramingHandler} produces, in arrival order.
 */
@FunctionalInterface
public interface MessageSink {

    /**
     * Accepts one framed message.
     *
     * @param message the message
     * @throws IOException if delivery needs I/O that fails, such as a reply
     */
    void deliver(Message message) throws IOException;
}

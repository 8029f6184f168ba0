/**
 * Message framing for IPC sessions.
 *
 * <p>A {@link express.mvp.kiva.ipc.framing.FramingHandler} owns a session's read loop after
 * command negotiation and turns inbound bytes into {@link express.mvp.kiva.ipc.Message}s:
 *
 * <ul>
 *   <li>{@link express.mvp.kiva.ipc.framing.DiscreteFramingHandler}: one message per connection,
 *       everything up to end-of-stream, optionally bounded by a read limit
 *   <li>{@link express.mvp.kiva.ipc.framing.ChunkedFramingHandler}: one message per read
 * </ul>
 *
 * <p>Framing violations are reported as {@link express.mvp.kiva.ipc.framing.FramingException}
 * and end only the session they occur in.
 */
package express.mvp.kiva.ipc.framing;

package express.mvp.kiva.ipc.command;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Codec for the fixed-width command header.
 *
 * <h2>Wire Format</h2>
 *
 * <pre>
 * ┌───┬───┬───┬───┬───┬───┬───┬───┐
 * │ @ │ I │ P │ C │ d │ d │ d │ d │    8 ASCII bytes
 * └───┴───┴───┴───┴───┴───┴───┴───┘
 *   magic prefix    decimal code
 * </pre>
 *
 * <h2>Advisory Parsing</h2>
 *
 * <p>Headers are recognised only at the start of a session, before any payload. {@link
 * #scan(ByteBuffer)} looks at the readable bytes of a buffer without consuming them and answers
 * one of:
 *
 * <ul>
 *   <li>{@link Scan#MATCH}: a complete header with an assigned code; {@link #decode} it
 *   <li>{@link Scan#PARTIAL}: every available byte agrees with some header; read more
 *   <li>{@link Scan#NO_MATCH}: these bytes are payload
 * </ul>
 *
 * <p>Anything that is not a complete, assigned header is payload, never a protocol error. A payload
 * can be mistaken for a command only if it starts with the eight bytes of a real header.
 */
public final class CommandHeader {

    /** Header width in bytes. */
    public static final int WIDTH = 8;

    /** Magic prefix of every header. */
    public static final String MAGIC = "@IPC";

    private static final byte[] MAGIC_BYTES = MAGIC.getBytes(StandardCharsets.US_ASCII);

    private static final int CODE_DIGITS = WIDTH - MAGIC_BYTES.length;

    /** Result of {@link #scan(ByteBuffer)}. */
    public enum Scan {
        /** A complete header with an assigned command code. */
        MATCH,
        /** Too few bytes to decide; every byte so far is consistent with a header. */
        PARTIAL,
        /** Not a command header. */
        NO_MATCH
    }

    private CommandHeader() {
        // Utility class
    }

    /**
     * Encodes a command as its header bytes.
     *
     * @param command the command
     * @return a new 8-byte array
     */
    public static byte[] encode(Command command) {
        Objects.requireNonNull(command, "command must not be null");
        String header = MAGIC + String.format("%0" + CODE_DIGITS + "d", command.code());
        return header.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Classifies the readable bytes of a buffer. Does not move the buffer's position.
     *
     * @param buffer the bytes to examine, flipped for reading
     * @return whether the bytes start with a command header
     */
    public static Scan scan(ByteBuffer buffer) {
        int available = Math.min(buffer.remaining(), WIDTH);
        int start = buffer.position();
        int code = 0;
        for (int i = 0; i < available; i++) {
            byte b = buffer.get(start + i);
            if (i < MAGIC_BYTES.length) {
                if (b != MAGIC_BYTES[i]) {
                    return Scan.NO_MATCH;
                }
            } else {
                if (b < '0' || b > '9') {
                    return Scan.NO_MATCH;
                }
                code = code * 10 + (b - '0');
            }
        }
        if (available < WIDTH) {
            return available == 0 ? Scan.PARTIAL : partialCodeCanMatch(buffer, available);
        }
        return Command.fromCode(code) != null ? Scan.MATCH : Scan.NO_MATCH;
    }

    /**
     * Consumes a header from the buffer.
     *
     * @param buffer a buffer for which {@link #scan} answered {@link Scan#MATCH}
     * @return the command
     * @throws IllegalArgumentException if the buffer does not start with a valid header
     */
    public static Command decode(ByteBuffer buffer) {
        if (scan(buffer) != Scan.MATCH) {
            throw new IllegalArgumentException("Buffer does not start with a command header");
        }
        int code = 0;
        for (int i = 0; i < WIDTH; i++) {
            byte b = buffer.get();
            if (i >= MAGIC_BYTES.length) {
                code = code * 10 + (b - '0');
            }
        }
        return Command.fromCode(code);
    }

    /**
     * Checks whether some assigned code starts with the digits already available.
     */
    private static Scan partialCodeCanMatch(ByteBuffer buffer, int available) {
        int digits = available - MAGIC_BYTES.length;
        if (digits <= 0) {
            return Scan.PARTIAL;
        }
        byte[] seen = new byte[digits];
        for (int i = 0; i < digits; i++) {
            seen[i] = buffer.get(buffer.position() + MAGIC_BYTES.length + i);
        }
        for (Command command : Command.values()) {
            byte[] header = encode(command);
            boolean prefix = true;
            for (int i = 0; i < digits && prefix; i++) {
                prefix = header[MAGIC_BYTES.length + i] == seen[i];
            }
            if (prefix) {
                return Scan.PARTIAL;
            }
        }
        return Scan.NO_MATCH;
    }
}

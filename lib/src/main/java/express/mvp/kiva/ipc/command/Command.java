package express.mvp.kiva.ipc.command;

/**
 * Commands of the in-band control sub-protocol.
 *
 * <p>Each command travels as an 8-byte {@link CommandHeader}: the magic {@code "@IPC"} followed by
 * the command's 4-digit code.
 *
 * <pre>
 * ┌──────────────┬───────┬──────────────────────────────────────────────┐
 * │ Command      │ Code  │ Effect                                       │
 * ├──────────────┼───────┼──────────────────────────────────────────────┤
 * │ PING         │ 0001  │ server replies PONG, session continues       │
 * │ PONG         │ 0002  │ acknowledged, no reply                       │
 * │ SET_STREAM   │ 0003  │ subsequent payload framed as STREAM_DATA     │
 * │ SET_DATA     │ 0004  │ subsequent payload framed as TEXT_DATA       │
 * └──────────────┴───────┴──────────────────────────────────────────────┘
 * </pre>
 */
public enum Command {
    /** Liveness check; answered with {@link #PONG}. */
    PING(1),

    /** Answer to {@link #PING}. */
    PONG(2),

    /** Switch the session to chunked framing. */
    SET_STREAM(3),

    /** Switch the session to discrete framing. */
    SET_DATA(4);

    private static final Command[] BY_CODE = new Command[5];

    static {
        for (Command command : values()) {
            BY_CODE[command.code] = command;
        }
    }

    private final int code;

    Command(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric wire code.
     *
     * @return the command code
     */
    public int code() {
        return code;
    }

    /**
     * Looks up a command by wire code.
     *
     * @param code the numeric code
     * @return the command, or null if the code is not assigned
     */
    public static Command fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }
}

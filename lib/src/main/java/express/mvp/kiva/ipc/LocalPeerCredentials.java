package express.mvp.kiva.ipc;

/**
 * Kernel-supplied credentials of a peer connected over a Unix domain socket.
 *
 * <p>Read from the socket's peer credentials ({@code SO_PEERCRED} on Linux, {@code
 * LOCAL_PEERCRED} on BSD-derived systems). Platforms that do not report a field leave it at
 * {@link #UNKNOWN}.
 *
 * @param pid the peer process id, or {@link #UNKNOWN}
 * @param uid the peer's effective user id, or {@link #UNKNOWN}
 * @param gid the peer's effective group id, or {@link #UNKNOWN}
 */
public record LocalPeerCredentials(long pid, long uid, long gid) implements PeerIdentity {

    /** Value of a field the platform did not report. */
    public static final long UNKNOWN = -1L;

    /** Credentials of a peer whose identity could not be looked up. */
    public static final LocalPeerCredentials UNAVAILABLE =
            new LocalPeerCredentials(UNKNOWN, UNKNOWN, UNKNOWN);

    /**
     * Checks whether the kernel lookup reported the peer's user.
     *
     * @return false for {@link #UNAVAILABLE}
     */
    public boolean isKnown() {
        return uid != UNKNOWN;
    }

    @Override
    public String transport() {
        return "unix";
    }

    @Override
    public String describe() {
        return "pid=" + pid + ", uid=" + uid + ", gid=" + gid;
    }
}

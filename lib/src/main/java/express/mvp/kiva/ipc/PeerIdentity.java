package express.mvp.kiva.ipc;

/**
 * Transport-specific identity of a connected peer.
 *
 * <p>The identity is extracted once, when the connection is accepted, and never changes
 * afterwards.
 *
 * @see LocalPeerCredentials
 * @see NetworkPeerAddress
 */
public interface PeerIdentity {

    /**
     * Returns a short label for the transport that produced this identity.
     *
     * @return "unix" or "tcp"
     */
    String transport();

    /**
     * Returns a compact description for log lines.
     *
     * @return the identity rendered for diagnostics
     */
    String describe();
}

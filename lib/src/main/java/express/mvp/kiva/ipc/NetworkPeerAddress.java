package express.mvp.kiva.ipc;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * Identity of a peer connected over a network socket.
 *
 * @param remote the peer's address
 * @param local the server-side address the peer connected to
 */
public record NetworkPeerAddress(SocketAddress remote, SocketAddress local)
        implements PeerIdentity {

    public NetworkPeerAddress {
        Objects.requireNonNull(remote, "remote must not be null");
        Objects.requireNonNull(local, "local must not be null");
    }

    @Override
    public String transport() {
        return "tcp";
    }

    @Override
    public String describe() {
        return remote + " -> " + local;
    }
}

package io.zonemaster.api.transport;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Transport-level identity of a connected peer.
 *
 * <p>Opaque to the master beyond equality: it is only ever compared and
 * handed back to the transport as a send target.</p>
 *
 * @param host peer host as reported by the transport
 * @param port peer port as reported by the transport
 */
public record PeerAddress(@Nonnull String host, int port) {

    public PeerAddress {
        Objects.requireNonNull(host, "host");
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}

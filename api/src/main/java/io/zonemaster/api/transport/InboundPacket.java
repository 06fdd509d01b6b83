package io.zonemaster.api.transport;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A packet received from the transport together with its sender.
 *
 * @param sender peer the packet came from
 * @param data raw packet bytes, header included
 */
public record InboundPacket(@Nonnull PeerAddress sender, @Nonnull byte[] data) {

    public InboundPacket {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(data, "data");
    }

    /**
     * Get the packet length.
     *
     * @return number of bytes
     */
    public int length() {
        return data.length;
    }
}

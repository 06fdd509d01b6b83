package io.zonemaster.api.transport;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Reliable, ordered, peer-addressed packet transport used by the master.
 *
 * <p>Implementations are expected to be non-blocking: {@link #receive()}
 * returns immediately and the send methods only enqueue. The master calls
 * every method from its tick thread.</p>
 *
 * <p>Besides control messages, the transport reports peer loss by delivering
 * a one-byte packet whose first byte is the transport's disconnection or
 * connection-lost tag, with the lost peer as sender.</p>
 */
public interface ControlTransport {

    /**
     * Poll the next inbound packet.
     *
     * @return the next packet, or null if none is pending
     */
    @Nullable
    InboundPacket receive();

    /**
     * Send a packet to a single peer.
     *
     * @param data encoded packet
     * @param peer destination
     */
    void send(@Nonnull byte[] data, @Nonnull PeerAddress peer);

    /**
     * Send a packet to every connected peer.
     *
     * @param data encoded packet
     */
    void broadcast(@Nonnull byte[] data);
}

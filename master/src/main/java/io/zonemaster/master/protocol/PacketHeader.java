package io.zonemaster.master.protocol;

import javax.annotation.Nonnull;

/**
 * The 8-byte header in front of every control message.
 *
 * <pre>
 * u8  family          0x53 for user packets
 * u16 connectionType  5 for the master
 * u32 messageId
 * u8  reserved
 * </pre>
 *
 * @param family packet family tag
 * @param connectionType connection type of the addressed service
 * @param messageId message id within the connection type
 */
public record PacketHeader(int family, int connectionType, long messageId) {

    public static final int LENGTH = 8;

    public static final int FAMILY_USER_PACKET = 0x53;
    public static final int CONNECTION_TYPE_MASTER = 5;

    /** Transport notification: the peer disconnected cleanly. */
    public static final int DISCONNECTION_NOTIFICATION = 0x13;
    /** Transport notification: the connection to the peer was lost. */
    public static final int CONNECTION_LOST = 0x14;

    @Nonnull
    public static PacketHeader master(@Nonnull MessageType type) {
        return new PacketHeader(FAMILY_USER_PACKET, CONNECTION_TYPE_MASTER, type.getId());
    }

    @Nonnull
    public static PacketHeader read(@Nonnull PacketReader reader) throws MalformedPacketException {
        int family = reader.readU8();
        int connectionType = reader.readU16();
        long messageId = reader.readU32();
        reader.readU8();
        return new PacketHeader(family, connectionType, messageId);
    }

    public void write(@Nonnull PacketWriter writer) {
        writer.writeU8(family)
                .writeU16(connectionType)
                .writeU32(messageId)
                .writeU8(0);
    }

    /**
     * Check whether this header addresses the master.
     *
     * @return true for user packets on the master connection type
     */
    public boolean isMaster() {
        return family == FAMILY_USER_PACKET && connectionType == CONNECTION_TYPE_MASTER;
    }

    /**
     * Check whether the first byte of a packet is a transport notification.
     *
     * @param firstByte first byte of the packet
     * @return true for disconnect and connection-lost notifications
     */
    public static boolean isTransportNotification(int firstByte) {
        return firstByte == DISCONNECTION_NOTIFICATION || firstByte == CONNECTION_LOST;
    }
}

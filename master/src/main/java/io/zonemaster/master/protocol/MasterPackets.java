package io.zonemaster.master.protocol;

import io.zonemaster.master.instance.Instance;

import javax.annotation.Nonnull;
import java.util.Collection;

/**
 * Encoders for the messages the master sends.
 */
public final class MasterPackets {

    public static final int IP_FIELD_WIDTH = 255;
    public static final int ACCOUNT_FIELD_WIDTH = 64;

    private MasterPackets() {
    }

    @Nonnull
    public static byte[] persistentIdResponse(long requestId, long objectId) {
        return PacketWriter.forMessage(MessageType.PERSISTENT_ID_RESPONSE)
                .writeU64(requestId)
                .writeU32(objectId)
                .toByteArray();
    }

    /**
     * Tell a client-facing worker where its player goes.
     *
     * @param requestId id of the transfer
     * @param firstEntry first-entry flag as received
     * @param target instance the player is sent to
     * @return encoded packet
     */
    @Nonnull
    public static byte[] zoneTransferResponse(long requestId, boolean firstEntry, @Nonnull Instance target) {
        return PacketWriter.forMessage(MessageType.ZONE_TRANSFER_RESPONSE)
                .writeU64(requestId)
                .writeBoolean(firstEntry)
                .writeU16(target.getZoneId())
                .writeU16(target.getInstanceId())
                .writeU32(target.getCloneId())
                .writeFixedString(target.getIp(), IP_FIELD_WIDTH)
                .writeU16(target.getPort())
                .toByteArray();
    }

    @Nonnull
    public static byte[] sessionKeyResponse(long sessionKey, @Nonnull String accountName) {
        return PacketWriter.forMessage(MessageType.SESSION_KEY_RESPONSE)
                .writeU32(sessionKey)
                .writeFixedString(accountName, ACCOUNT_FIELD_WIDTH)
                .toByteArray();
    }

    @Nonnull
    public static byte[] shutdown() {
        return PacketWriter.forMessage(MessageType.SHUTDOWN).toByteArray();
    }

    @Nonnull
    public static byte[] affirmTransferRequest(long requestId) {
        return PacketWriter.forMessage(MessageType.AFFIRM_TRANSFER_REQUEST)
                .writeU64(requestId)
                .toByteArray();
    }

    @Nonnull
    public static byte[] newSessionAlert(long sessionKey, @Nonnull String accountName) {
        return PacketWriter.forMessage(MessageType.NEW_SESSION_ALERT)
                .writeU32(sessionKey)
                .writeString(accountName)
                .toByteArray();
    }

    /**
     * List instances for a {@code GetInstances} query.
     *
     * @param objectId id of the object that asked, echoed back
     * @param instances instances to list
     * @return encoded packet
     */
    @Nonnull
    public static byte[] respondInstances(long objectId, @Nonnull Collection<Instance> instances) {
        PacketWriter writer = PacketWriter.forMessage(MessageType.RESPOND_INSTANCES)
                .writeU64(objectId)
                .writeU32(instances.size());
        for (Instance instance : instances) {
            writer.writeU16(instance.getZoneId())
                    .writeU32(instance.getCloneId())
                    .writeU16(instance.getInstanceId());
        }
        return writer.toByteArray();
    }
}

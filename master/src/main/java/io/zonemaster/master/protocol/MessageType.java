package io.zonemaster.master.protocol;

import javax.annotation.Nullable;

/**
 * Message ids of the master control protocol.
 *
 * <p>Ids are carried as the {@code u32} after the connection type in every
 * packet header.</p>
 */
public enum MessageType {
    REQUEST_PERSISTENT_ID(1),
    PERSISTENT_ID_RESPONSE(2),
    REQUEST_ZONE_TRANSFER(3),
    ZONE_TRANSFER_RESPONSE(4),
    SERVER_INFO(5),
    REQUEST_SESSION_KEY(6),
    SET_SESSION_KEY(7),
    SESSION_KEY_RESPONSE(8),
    PLAYER_ADDED(9),
    PLAYER_REMOVED(10),
    CREATE_PRIVATE_ZONE(11),
    REQUEST_PRIVATE_ZONE(12),
    WORLD_READY(13),
    PREP_ZONE(14),
    SHUTDOWN(15),
    SHUTDOWN_RESPONSE(16),
    SHUTDOWN_IMMEDIATE(17),
    SHUTDOWN_UNIVERSE(18),
    AFFIRM_TRANSFER_REQUEST(19),
    AFFIRM_TRANSFER_RESPONSE(20),
    NEW_SESSION_ALERT(21),
    SHUTDOWN_INSTANCE(22),
    GET_INSTANCES(23),
    RESPOND_INSTANCES(24);

    private static final MessageType[] BY_ID = new MessageType[25];

    static {
        for (MessageType type : values()) {
            BY_ID[type.id] = type;
        }
    }

    private final int id;

    MessageType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Look up a message type by its wire id.
     *
     * @param id wire id
     * @return the type, or null if unknown
     */
    @Nullable
    public static MessageType fromId(long id) {
        if (id < 0 || id >= BY_ID.length) {
            return null;
        }
        return BY_ID[(int) id];
    }
}

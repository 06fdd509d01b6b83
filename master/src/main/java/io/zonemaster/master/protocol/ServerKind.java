package io.zonemaster.master.protocol;

import javax.annotation.Nullable;

/**
 * Defines the kind of worker announcing itself with {@code ServerInfo}.
 */
public enum ServerKind {
    /**
     * The master itself. Never announced in practice.
     */
    MASTER(0),

    /**
     * Authentication worker.
     */
    AUTH(1),

    /**
     * Chat service worker. Restarted when its connection drops.
     */
    CHAT(2),

    /**
     * World worker serving one zone instance.
     */
    WORLD(3);

    private final int id;

    ServerKind(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Look up a kind by its wire id.
     *
     * @param id wire id
     * @return the kind, or null if unknown
     */
    @Nullable
    public static ServerKind fromId(long id) {
        for (ServerKind kind : values()) {
            if (kind.id == id) {
                return kind;
            }
        }
        return null;
    }
}

package io.zonemaster.master.protocol;

import io.zonemaster.api.storage.ObjectIdAllocator;
import io.zonemaster.api.transport.ControlTransport;
import io.zonemaster.api.transport.InboundPacket;
import io.zonemaster.api.transport.PeerAddress;
import io.zonemaster.master.affirmation.AffirmationEngine;
import io.zonemaster.master.instance.Instance;
import io.zonemaster.master.instance.InstanceRegistry;
import io.zonemaster.master.process.WorkerLauncher;
import io.zonemaster.master.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Decodes inbound control packets and routes them to the master's services.
 *
 * <p>Runs on the tick thread, one packet at a time. Packets that cannot be
 * decoded and unknown message ids are logged and dropped; the connection
 * they came from is left alone.</p>
 */
public class ControlDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlDispatcher.class);

    private final InstanceRegistry registry;
    private final AffirmationEngine engine;
    private final SessionRegistry sessions;
    private final ObjectIdAllocator allocator;
    private final ControlTransport transport;
    private final WorkerLauncher launcher;

    private volatile PeerAddress chatPeer;

    public ControlDispatcher(
            @Nonnull InstanceRegistry registry,
            @Nonnull AffirmationEngine engine,
            @Nonnull SessionRegistry sessions,
            @Nonnull ObjectIdAllocator allocator,
            @Nonnull ControlTransport transport,
            @Nonnull WorkerLauncher launcher) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    /**
     * Handle one inbound packet.
     *
     * @param packet the packet
     */
    public void dispatch(@Nonnull InboundPacket packet) {
        Objects.requireNonNull(packet, "packet");
        byte[] data = packet.data();
        PeerAddress sender = packet.sender();

        if (data.length == 0) {
            LOGGER.warn("Empty packet from {}", sender);
            return;
        }

        int firstByte = data[0] & 0xFF;
        if (PacketHeader.isTransportNotification(firstByte)) {
            handleDisconnect(sender, firstByte == PacketHeader.CONNECTION_LOST);
            return;
        }

        try {
            PacketReader reader = new PacketReader(data);
            PacketHeader header = PacketHeader.read(reader);
            if (!header.isMaster()) {
                LOGGER.warn("Dropping packet from {} with family {} connection type {}",
                        sender, header.family(), header.connectionType());
                return;
            }

            MessageType type = MessageType.fromId(header.messageId());
            if (type == null) {
                LOGGER.warn("Unknown message id {} from {}", header.messageId(), sender);
                return;
            }

            handle(type, reader, sender);
        } catch (MalformedPacketException e) {
            LOGGER.warn("Malformed packet from {}: {}", sender, e.getMessage());
        }
    }

    private void handle(MessageType type, PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        switch (type) {
            case REQUEST_PERSISTENT_ID -> handleRequestPersistentId(reader, sender);
            case REQUEST_ZONE_TRANSFER -> handleRequestZoneTransfer(reader, sender);
            case SERVER_INFO -> handleServerInfo(reader, sender);
            case REQUEST_SESSION_KEY -> handleRequestSessionKey(reader, sender);
            case SET_SESSION_KEY -> handleSetSessionKey(reader);
            case PLAYER_ADDED -> handlePlayerCount(reader, true);
            case PLAYER_REMOVED -> handlePlayerCount(reader, false);
            case CREATE_PRIVATE_ZONE -> handleCreatePrivateZone(reader);
            case REQUEST_PRIVATE_ZONE -> handleRequestPrivateZone(reader, sender);
            case WORLD_READY -> handleWorldReady(reader);
            case PREP_ZONE -> handlePrepZone(reader);
            case AFFIRM_TRANSFER_RESPONSE -> handleAffirmTransferResponse(reader, sender);
            case SHUTDOWN_RESPONSE -> handleShutdownResponse(sender);
            case SHUTDOWN_UNIVERSE -> engine.requestUniverseShutdown();
            case SHUTDOWN_INSTANCE -> handleShutdownInstance(reader);
            case GET_INSTANCES -> handleGetInstances(reader);
            default -> LOGGER.warn("Unexpected inbound message {} from {}", type, sender);
        }
    }

    // ==================== Identifiers ====================

    private void handleRequestPersistentId(PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        long requestId = reader.readU64();
        long objectId = allocator.generate();
        transport.send(MasterPackets.persistentIdResponse(requestId, objectId), sender);
    }

    // ==================== Transfers ====================

    private void handleRequestZoneTransfer(PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        long requestId = reader.readU64();
        boolean firstEntry = reader.readBoolean();
        int zoneId = (int) reader.readU32();
        int cloneId = (int) reader.readU32();

        LOGGER.info("Transfer {} requested to zone {} clone {} by {}", requestId, zoneId, cloneId, sender);
        engine.requestTransfer(requestId, firstEntry, zoneId, cloneId, sender);
    }

    private void handleAffirmTransferResponse(PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        long requestId = reader.readU64();

        Instance instance = registry.findByPeer(sender);
        if (instance == null) {
            LOGGER.warn("Affirmation of transfer {} from unknown peer {}", requestId, sender);
            return;
        }
        engine.affirmTransfer(instance, requestId);
    }

    private void handleWorldReady(PacketReader reader) throws MalformedPacketException {
        int zoneId = reader.readU16();
        int instanceId = reader.readU16();

        Instance instance = registry.find(zoneId, instanceId);
        if (instance == null) {
            LOGGER.warn("Ready from unknown instance: zone {} instance {}", zoneId, instanceId);
            return;
        }
        engine.readyInstance(instance);
    }

    private void handlePrepZone(PacketReader reader) throws MalformedPacketException {
        int zoneId = reader.readI32();
        LOGGER.info("Prepping zone {}", zoneId);
        registry.getOrSpawn(zoneId, 0);
    }

    // ==================== Private Zones ====================

    private void handleCreatePrivateZone(PacketReader reader) throws MalformedPacketException {
        int zoneId = (int) reader.readU32();
        int cloneId = reader.readU16();
        String password = reader.readString();

        engine.createPrivate(zoneId, cloneId, password);
    }

    private void handleRequestPrivateZone(PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        long requestId = reader.readU64();
        boolean firstEntry = reader.readBoolean();
        String password = reader.readString();

        engine.requestPrivate(requestId, firstEntry, password, sender);
    }

    // ==================== Workers ====================

    private void handleServerInfo(PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        int port = (int) reader.readU32();
        int zoneId = (int) reader.readU32();
        int instanceId = (int) reader.readU32();
        long kindId = reader.readU32();
        String ip = reader.readString();

        ServerKind kind = ServerKind.fromId(kindId);
        if (kind == null) {
            LOGGER.warn("Server info with unknown kind {} from {}", kindId, sender);
            return;
        }

        LOGGER.info("{} server announced at {}:{} (zone {} instance {}) from {}",
                kind, ip, port, zoneId, instanceId, sender);

        if (kind == ServerKind.WORLD) {
            registry.registerAnnouncement(zoneId, instanceId, ip, port, sender);
            return;
        }

        if (kind == ServerKind.CHAT) {
            chatPeer = sender;
        }

        Instance instance = registry.find(zoneId, instanceId);
        if (instance != null) {
            instance.attachPeer(sender);
        }
    }

    private void handlePlayerCount(PacketReader reader, boolean added) throws MalformedPacketException {
        int zoneId = reader.readU16();
        int instanceId = reader.readU16();

        Instance instance = registry.find(zoneId, instanceId);
        if (instance == null) {
            LOGGER.warn("Player {} for unknown instance: zone {} instance {}",
                    added ? "added" : "removed", zoneId, instanceId);
            return;
        }

        if (added) {
            instance.addPlayer();
        } else {
            instance.removePlayer();
        }
    }

    private void handleShutdownResponse(PeerAddress sender) {
        Instance instance = registry.findByPeer(sender);
        if (instance == null) {
            return;
        }

        LOGGER.info("Got shutdown response from {}", instance);
        instance.markShutdownComplete();
    }

    private void handleShutdownInstance(PacketReader reader) throws MalformedPacketException {
        int zoneId = (int) reader.readU32();
        int instanceId = reader.readU16();

        Instance instance = registry.find(zoneId, instanceId);
        if (instance == null) {
            LOGGER.warn("Shutdown requested for unknown instance: zone {} instance {}", zoneId, instanceId);
            return;
        }
        engine.forceShutdown(instance);
    }

    private void handleGetInstances(PacketReader reader) throws MalformedPacketException {
        long objectId = reader.readU64();
        boolean hasZone = reader.readBoolean();
        int zoneId = hasZone ? reader.readU16() : 0;
        int respondingZoneId = reader.readU16();
        int respondingInstanceId = reader.readU16();

        Instance responding = registry.find(respondingZoneId, respondingInstanceId);
        PeerAddress peer = responding != null ? responding.getPeerAddress() : null;
        if (peer == null) {
            LOGGER.warn("Instance list for object {} has no reachable responder: zone {} instance {}",
                    objectId, respondingZoneId, respondingInstanceId);
            return;
        }

        List<Instance> instances = hasZone ? registry.findAllByZone(zoneId) : registry.getAll();
        transport.send(MasterPackets.respondInstances(objectId, instances), peer);
    }

    // ==================== Sessions ====================

    private void handleRequestSessionKey(PacketReader reader, PeerAddress sender) throws MalformedPacketException {
        String accountName = reader.readString();

        Long sessionKey = sessions.lookupByName(accountName);
        if (sessionKey == null) {
            LOGGER.debug("No session for account {}", accountName);
            return;
        }
        transport.send(MasterPackets.sessionKeyResponse(sessionKey, accountName), sender);
    }

    private void handleSetSessionKey(PacketReader reader) throws MalformedPacketException {
        long sessionKey = reader.readU32();
        String accountName = reader.readString();

        sessions.setKey(accountName, sessionKey);
    }

    // ==================== Connections ====================

    private void handleDisconnect(PeerAddress sender, boolean lost) {
        LOGGER.info("{} from {}", lost ? "Connection lost" : "Disconnect", sender);

        Instance instance = registry.findByPeer(sender);
        if (instance != null) {
            registry.remove(instance);
        }

        if (sender.equals(chatPeer)) {
            chatPeer = null;
            if (!engine.isUniverseShutdownRequested() && !engine.isTearingDown()) {
                LOGGER.info("Chat service went away, restarting it");
                launcher.launchChat();
            }
        }
    }

    /**
     * Get the peer of the chat service.
     *
     * @return the chat peer, or null if none announced itself
     */
    @Nullable
    public PeerAddress getChatPeer() {
        return chatPeer;
    }
}

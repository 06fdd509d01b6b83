package io.zonemaster.master.api;

import io.zonemaster.api.ClusterAPI;
import io.zonemaster.master.affirmation.AffirmationEngine;
import io.zonemaster.master.instance.Instance;
import io.zonemaster.master.instance.InstanceRegistry;
import io.zonemaster.master.session.SessionRegistry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Implementation of the {@link ClusterAPI} over the master's live state.
 */
public class ClusterAPIImpl implements ClusterAPI {

    private final InstanceRegistry registry;
    private final SessionRegistry sessions;
    private final AffirmationEngine engine;

    public ClusterAPIImpl(
            @Nonnull InstanceRegistry registry,
            @Nonnull SessionRegistry sessions,
            @Nonnull AffirmationEngine engine) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    @Nullable
    public InstanceInfo getInstance(int zoneId, int instanceId) {
        Instance instance = registry.find(zoneId, instanceId);
        return instance != null ? toInstanceInfo(instance) : null;
    }

    @Override
    @Nonnull
    public Collection<InstanceInfo> getAllInstances() {
        return toInstanceInfos(registry.getAll());
    }

    @Override
    @Nonnull
    public Collection<InstanceInfo> getInstancesByZone(int zoneId) {
        return toInstanceInfos(registry.findAllByZone(zoneId));
    }

    @Override
    @Nonnull
    public ClusterStats getStats() {
        List<Instance> instances = registry.getAll();

        int ready = 0;
        int privateCount = 0;
        int shuttingDown = 0;
        int players = 0;
        for (Instance instance : instances) {
            if (instance.isReady()) {
                ready++;
            }
            if (instance.isPrivate()) {
                privateCount++;
            }
            if (instance.isShuttingDown()) {
                shuttingDown++;
            }
            players += instance.getPlayerCount();
        }

        return new ClusterStatsImpl(
                instances.size(),
                ready,
                privateCount,
                shuttingDown,
                players,
                sessions.size(),
                engine.isUniverseShutdownRequested()
        );
    }

    private Collection<InstanceInfo> toInstanceInfos(List<Instance> instances) {
        return instances.stream()
                .map(this::toInstanceInfo)
                .collect(Collectors.toUnmodifiableList());
    }

    private InstanceInfo toInstanceInfo(Instance instance) {
        return new InstanceInfoImpl(
                instance.getZoneId(),
                instance.getCloneId(),
                instance.getInstanceId(),
                instance.getStatus().name(),
                instance.getIp(),
                instance.getPort(),
                instance.getPlayerCount(),
                instance.getSoftCap(),
                instance.getHardCap(),
                instance.isPrivate(),
                instance.getPendingRequests().size(),
                instance.getPendingAffirmations().size()
        );
    }

    private record InstanceInfoImpl(
            int zoneId,
            int cloneId,
            int instanceId,
            String status,
            String ip,
            int port,
            int playerCount,
            int softCap,
            int hardCap,
            boolean privateInstance,
            int pendingRequestCount,
            int pendingAffirmationCount
    ) implements InstanceInfo {

        @Override
        public int getZoneId() {
            return zoneId;
        }

        @Override
        public int getCloneId() {
            return cloneId;
        }

        @Override
        public int getInstanceId() {
            return instanceId;
        }

        @Override
        @Nonnull
        public String getStatus() {
            return status;
        }

        @Override
        @Nonnull
        public String getIp() {
            return ip;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        public int getPlayerCount() {
            return playerCount;
        }

        @Override
        public int getSoftCap() {
            return softCap;
        }

        @Override
        public int getHardCap() {
            return hardCap;
        }

        @Override
        public boolean isPrivate() {
            return privateInstance;
        }

        @Override
        public int getPendingRequestCount() {
            return pendingRequestCount;
        }

        @Override
        public int getPendingAffirmationCount() {
            return pendingAffirmationCount;
        }
    }

    private record ClusterStatsImpl(
            int totalInstances,
            int readyInstances,
            int privateInstances,
            int shuttingDownInstances,
            int totalPlayers,
            int activeSessions,
            boolean universeShutdownRequested
    ) implements ClusterStats {

        @Override
        public int getTotalInstances() {
            return totalInstances;
        }

        @Override
        public int getReadyInstances() {
            return readyInstances;
        }

        @Override
        public int getPrivateInstances() {
            return privateInstances;
        }

        @Override
        public int getShuttingDownInstances() {
            return shuttingDownInstances;
        }

        @Override
        public int getTotalPlayers() {
            return totalPlayers;
        }

        @Override
        public int getActiveSessions() {
            return activeSessions;
        }

        @Override
        public boolean isUniverseShutdownRequested() {
            return universeShutdownRequested;
        }
    }
}

package io.zonemaster.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Read-only view of the cluster held by the master.
 *
 * <p>Every call returns immutable snapshots; it is safe to call from any
 * thread while the master is running.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ClusterAPI api = masterServer.getApi();
 *
 * for (InstanceInfo info : api.getInstancesByZone(1200)) {
 *     System.out.println(info.getZoneId() + "/" + info.getInstanceId()
 *         + " players=" + info.getPlayerCount());
 * }
 * }</pre>
 */
public interface ClusterAPI {

    /**
     * Get information about an instance.
     *
     * @param zoneId zone (map) identifier
     * @param instanceId instance identifier
     * @return instance info, or null if not found
     */
    @Nullable
    InstanceInfo getInstance(int zoneId, int instanceId);

    /**
     * Get all live instances.
     *
     * @return collection of instance info
     */
    @Nonnull
    Collection<InstanceInfo> getAllInstances();

    /**
     * Get the live instances of one zone.
     *
     * @param zoneId zone (map) identifier
     * @return collection of matching instances
     */
    @Nonnull
    Collection<InstanceInfo> getInstancesByZone(int zoneId);

    /**
     * Get cluster statistics.
     *
     * @return statistics
     */
    @Nonnull
    ClusterStats getStats();

    /**
     * Instance information.
     */
    interface InstanceInfo {
        int getZoneId();

        int getCloneId();

        int getInstanceId();

        /**
         * Get the lifecycle status name (STARTING, READY, SHUTTING_DOWN, SHUTDOWN_COMPLETE).
         */
        @Nonnull
        String getStatus();

        @Nonnull
        String getIp();

        int getPort();

        int getPlayerCount();

        int getSoftCap();

        int getHardCap();

        /**
         * Check whether the instance is reachable only by password.
         */
        boolean isPrivate();

        /**
         * Get the number of transfers queued until the instance is ready.
         */
        int getPendingRequestCount();

        /**
         * Get the number of transfers awaiting the instance's affirmation.
         */
        int getPendingAffirmationCount();
    }

    /**
     * Cluster statistics.
     */
    interface ClusterStats {
        int getTotalInstances();

        int getReadyInstances();

        int getPrivateInstances();

        int getShuttingDownInstances();

        int getTotalPlayers();

        int getActiveSessions();

        boolean isUniverseShutdownRequested();
    }
}

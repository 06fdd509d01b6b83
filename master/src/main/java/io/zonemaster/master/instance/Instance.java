package io.zonemaster.master.instance;

import io.zonemaster.api.transport.PeerAddress;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Represents one world instance: a worker process simulating a zone clone.
 *
 * <p>Tracks the instance's lifecycle, its transfer queues and the player
 * count its worker reports. Mutated only from the master's tick thread;
 * fields read by the cluster API are safe to read from other threads.</p>
 *
 * <h2>Lifecycle States</h2>
 * <pre>
 * STARTING → READY → SHUTTING_DOWN → SHUTDOWN_COMPLETE
 *     └──────────────────↑
 * </pre>
 */
public class Instance {

    private final int zoneId;
    private final int cloneId;
    private final int instanceId;
    private final String ip;
    private final int port;
    private final int softCap;
    private final int hardCap;

    @Nullable
    private final String password;

    private volatile InstanceStatus status = InstanceStatus.STARTING;
    private volatile PeerAddress peerAddress;
    private volatile int playerCount;
    private int affirmationTimeoutTicks;

    private final Queue<PendingTransferRequest> pendingRequests = new ConcurrentLinkedQueue<>();
    private final Queue<PendingTransferRequest> pendingAffirmations = new ConcurrentLinkedQueue<>();

    /**
     * Create an instance record.
     *
     * @param zoneId zone (map) identifier
     * @param cloneId clone of the zone
     * @param instanceId serial among running instances
     * @param ip address players connect to
     * @param port port players connect to
     * @param softCap player count at which transfers look elsewhere
     * @param hardCap absolute player limit of the worker
     * @param password password of a private instance, null for public ones
     */
    public Instance(
            int zoneId,
            int cloneId,
            int instanceId,
            @Nonnull String ip,
            int port,
            int softCap,
            int hardCap,
            @Nullable String password) {
        this.zoneId = zoneId;
        this.cloneId = cloneId;
        this.instanceId = instanceId;
        this.ip = Objects.requireNonNull(ip, "ip");
        this.port = port;
        this.softCap = softCap;
        this.hardCap = hardCap;
        this.password = password;
    }

    // ==================== Lifecycle ====================

    /**
     * Mark the instance ready for transfers.
     *
     * @return true if the instance was starting and is now ready
     */
    public boolean markReady() {
        if (status != InstanceStatus.STARTING) {
            return false;
        }
        status = InstanceStatus.READY;
        return true;
    }

    /**
     * Mark the instance as shutting down.
     *
     * @return true if this call started the shutdown
     */
    public boolean markShuttingDown() {
        if (status.isShuttingDown()) {
            return false;
        }
        status = InstanceStatus.SHUTTING_DOWN;
        return true;
    }

    /**
     * Mark the instance's shutdown as confirmed.
     */
    public void markShutdownComplete() {
        status = InstanceStatus.SHUTDOWN_COMPLETE;
    }

    /**
     * Record the transport identity of the instance's worker.
     *
     * @param peerAddress worker peer
     */
    public void attachPeer(@Nonnull PeerAddress peerAddress) {
        this.peerAddress = Objects.requireNonNull(peerAddress, "peerAddress");
    }

    // ==================== Transfer Queues ====================

    /**
     * Queue a transfer until the instance is ready.
     *
     * @param request the transfer
     */
    public void queueRequest(@Nonnull PendingTransferRequest request) {
        pendingRequests.add(Objects.requireNonNull(request, "request"));
    }

    /**
     * Remove and return every queued transfer, oldest first.
     *
     * @return drained transfers
     */
    @Nonnull
    public List<PendingTransferRequest> drainPendingRequests() {
        return drain(pendingRequests);
    }

    /**
     * Record a transfer sent to the worker for affirmation.
     *
     * @param request the transfer
     */
    public void addPendingAffirmation(@Nonnull PendingTransferRequest request) {
        pendingAffirmations.add(Objects.requireNonNull(request, "request"));
    }

    /**
     * Remove the transfer the worker just affirmed.
     *
     * @param requestId id of the affirmed transfer
     * @return the removed transfer, or null if none was pending under that id
     */
    @Nullable
    public PendingTransferRequest removePendingAffirmation(long requestId) {
        Iterator<PendingTransferRequest> it = pendingAffirmations.iterator();
        while (it.hasNext()) {
            PendingTransferRequest request = it.next();
            if (request.requestId() == requestId) {
                it.remove();
                return request;
            }
        }
        return null;
    }

    /**
     * Remove and return every transfer awaiting affirmation, oldest first.
     *
     * @return drained transfers
     */
    @Nonnull
    public List<PendingTransferRequest> drainPendingAffirmations() {
        return drain(pendingAffirmations);
    }

    private static List<PendingTransferRequest> drain(Queue<PendingTransferRequest> queue) {
        List<PendingTransferRequest> drained = new ArrayList<>(queue.size());
        PendingTransferRequest request;
        while ((request = queue.poll()) != null) {
            drained.add(request);
        }
        return drained;
    }

    /**
     * Advance the affirmation timer by one tick.
     *
     * <p>The timer counts consecutive ticks with at least one unaffirmed
     * transfer and falls back to zero as soon as none is pending.</p>
     *
     * @return the timer value after this tick
     */
    public int ageAffirmationTimeout() {
        if (pendingAffirmations.isEmpty()) {
            affirmationTimeoutTicks = 0;
        } else {
            affirmationTimeoutTicks++;
        }
        return affirmationTimeoutTicks;
    }

    // ==================== Player Management ====================

    /**
     * Count a player joining the instance.
     */
    public void addPlayer() {
        playerCount++;
    }

    /**
     * Count a player leaving the instance.
     */
    public void removePlayer() {
        if (playerCount > 0) {
            playerCount--;
        }
    }

    /**
     * Check whether transfers should look for another instance.
     *
     * @return true if the soft cap is reached
     */
    public boolean isFull() {
        return playerCount >= softCap;
    }

    // ==================== Status Checks ====================

    public boolean isReady() {
        return status.isReady();
    }

    public boolean isShuttingDown() {
        return status.isShuttingDown();
    }

    public boolean isShutdownComplete() {
        return status.isTerminal();
    }

    /**
     * Check if this is a private instance.
     *
     * @return true if reachable only by password
     */
    public boolean isPrivate() {
        return password != null;
    }

    /**
     * Check whether the instance carries the given identity.
     *
     * @param zoneId zone identifier
     * @param instanceId instance identifier
     * @return true on match
     */
    public boolean matches(int zoneId, int instanceId) {
        return this.zoneId == zoneId && this.instanceId == instanceId;
    }

    /**
     * Check whether new public transfers for the zone clone may land here.
     *
     * @param zoneId zone identifier
     * @param cloneId clone identifier
     * @return true if same zone clone, public, not shutting down and below soft cap
     */
    public boolean acceptsTransfersFor(int zoneId, int cloneId) {
        return this.zoneId == zoneId
                && this.cloneId == cloneId
                && !isPrivate()
                && !isShuttingDown()
                && !isFull();
    }

    // ==================== Getters ====================

    public int getZoneId() {
        return zoneId;
    }

    public int getCloneId() {
        return cloneId;
    }

    public int getInstanceId() {
        return instanceId;
    }

    @Nonnull
    public String getIp() {
        return ip;
    }

    public int getPort() {
        return port;
    }

    public int getSoftCap() {
        return softCap;
    }

    public int getHardCap() {
        return hardCap;
    }

    @Nullable
    public String getPassword() {
        return password;
    }

    @Nonnull
    public InstanceStatus getStatus() {
        return status;
    }

    /**
     * Get the worker's transport identity.
     *
     * @return peer, or null until the worker announced itself
     */
    @Nullable
    public PeerAddress getPeerAddress() {
        return peerAddress;
    }

    public int getPlayerCount() {
        return playerCount;
    }

    public int getAffirmationTimeoutTicks() {
        return affirmationTimeoutTicks;
    }

    /**
     * Get a snapshot of the queued transfers.
     *
     * @return transfers, oldest first
     */
    @Nonnull
    public List<PendingTransferRequest> getPendingRequests() {
        return List.copyOf(pendingRequests);
    }

    /**
     * Get a snapshot of the transfers awaiting affirmation.
     *
     * @return transfers, oldest first
     */
    @Nonnull
    public List<PendingTransferRequest> getPendingAffirmations() {
        return List.copyOf(pendingAffirmations);
    }

    @Override
    public String toString() {
        return "Instance{" +
                "zone=" + zoneId +
                ", clone=" + cloneId +
                ", instance=" + instanceId +
                ", status=" + status +
                ", port=" + port +
                ", players=" + playerCount + "/" + softCap +
                (isPrivate() ? ", private" : "") +
                '}';
    }
}

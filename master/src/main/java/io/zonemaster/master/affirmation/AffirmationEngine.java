package io.zonemaster.master.affirmation;

import io.zonemaster.api.transport.ControlTransport;
import io.zonemaster.api.transport.PeerAddress;
import io.zonemaster.master.config.MasterConfig;
import io.zonemaster.master.instance.Instance;
import io.zonemaster.master.instance.InstanceListener;
import io.zonemaster.master.instance.InstanceRegistry;
import io.zonemaster.master.instance.PendingTransferRequest;
import io.zonemaster.master.protocol.MasterPackets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives zone transfers through the affirmation handshake.
 *
 * <p>A transfer lands on an instance of the requested zone clone. While the
 * instance is starting the transfer waits in its pending queue; once the
 * instance is ready the master asks the worker to affirm the transfer and
 * forwards the affirmed destination to the worker that requested it.</p>
 *
 * <h2>Timeouts</h2>
 * <p>An instance that leaves transfers unaffirmed for
 * {@link MasterConfig#getAffirmationTimeoutTicks()} consecutive ticks is shut
 * down and every transfer it held is moved to another instance of the same
 * zone clone, keeping its request id. The same redirect happens whenever an
 * instance leaves the registry, except during cluster teardown.</p>
 */
public class AffirmationEngine implements InstanceListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(AffirmationEngine.class);

    private final InstanceRegistry registry;
    private final ControlTransport transport;
    private final int affirmationTimeoutTicks;

    private volatile boolean universeShutdownRequested;
    private volatile boolean tearingDown;

    /**
     * Create the engine and register it for instance removals.
     *
     * @param registry instance registry
     * @param transport control transport
     * @param config master configuration
     */
    public AffirmationEngine(
            @Nonnull InstanceRegistry registry,
            @Nonnull ControlTransport transport,
            @Nonnull MasterConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.affirmationTimeoutTicks = Objects.requireNonNull(config, "config").getAffirmationTimeoutTicks();
        registry.addListener(this);
    }

    // ==================== Transfers ====================

    /**
     * Start a zone transfer.
     *
     * @param requestId id chosen by the requester
     * @param firstEntry first-entry flag, passed through
     * @param zoneId destination zone
     * @param cloneId destination clone
     * @param requester peer to answer once the transfer is affirmed
     * @return the instance the transfer was attached to
     */
    @Nonnull
    public Instance requestTransfer(
            long requestId,
            boolean firstEntry,
            int zoneId,
            int cloneId,
            @Nonnull PeerAddress requester) {
        PendingTransferRequest request = new PendingTransferRequest(requestId, firstEntry, requester);
        Instance target = registry.getOrSpawn(zoneId, cloneId);
        route(target, request);
        return target;
    }

    /**
     * Handle a worker reporting its world loaded.
     *
     * <p>Queued transfers are sent for affirmation in arrival order.</p>
     *
     * @param instance the instance that became ready
     */
    public void readyInstance(@Nonnull Instance instance) {
        if (instance.markReady()) {
            LOGGER.info("Instance ready: {}", instance);
        }
        if (!instance.isReady()) {
            LOGGER.debug("Ignoring ready from {}", instance);
            return;
        }

        for (PendingTransferRequest request : instance.drainPendingRequests()) {
            requestAffirmation(instance, request);
        }
    }

    /**
     * Ask an instance's worker to affirm a transfer.
     *
     * @param instance target instance
     * @param request the transfer
     */
    public void requestAffirmation(@Nonnull Instance instance, @Nonnull PendingTransferRequest request) {
        instance.addPendingAffirmation(request);

        PeerAddress peer = instance.getPeerAddress();
        if (peer == null) {
            LOGGER.warn("Instance {} has no peer, transfer {} waits for timeout", instance, request.requestId());
            return;
        }
        transport.send(MasterPackets.affirmTransferRequest(request.requestId()), peer);
        LOGGER.debug("Requested affirmation of transfer {} from {}", request.requestId(), instance);
    }

    /**
     * Handle a worker affirming a transfer.
     *
     * <p>The requester is told which instance to send its player to.</p>
     *
     * @param instance the affirming instance
     * @param requestId id of the affirmed transfer
     * @return true if the transfer was pending on the instance
     */
    public boolean affirmTransfer(@Nonnull Instance instance, long requestId) {
        PendingTransferRequest request = instance.removePendingAffirmation(requestId);
        if (request == null) {
            LOGGER.warn("Affirmation of unknown transfer {} from {}", requestId, instance);
            return false;
        }

        transport.send(
                MasterPackets.zoneTransferResponse(request.requestId(), request.firstEntry(), instance),
                request.requester());
        LOGGER.info("Transfer {} affirmed by {}", requestId, instance);
        return true;
    }

    private void route(Instance target, PendingTransferRequest request) {
        if (target.isReady()) {
            requestAffirmation(target, request);
        } else {
            target.queueRequest(request);
            LOGGER.debug("Queued transfer {} on {}", request.requestId(), target);
        }
    }

    // ==================== Timeouts ====================

    /**
     * Advance every instance's affirmation timer by one tick and shut down
     * the instances that reached the timeout.
     *
     * <p>An instance already shutting down keeps its timer, so transfers it
     * still holds move elsewhere if its worker never confirms.</p>
     */
    public void ageAffirmations() {
        List<Instance> expired = new ArrayList<>();
        for (Instance instance : registry.getAll()) {
            int ticks = instance.ageAffirmationTimeout();
            if (ticks >= affirmationTimeoutTicks) {
                expired.add(instance);
            }
        }

        for (Instance instance : expired) {
            LOGGER.warn("Affirmation timeout after {} ticks on {}, {} transfer(s) to redirect",
                    instance.getAffirmationTimeoutTicks(), instance,
                    instance.getPendingAffirmations().size() + instance.getPendingRequests().size());
            if (instance.isShuttingDown()) {
                redirectPendingRequests(instance);
            } else {
                forceShutdown(instance);
            }
        }
    }

    /**
     * Shut an instance down and move its transfers elsewhere.
     *
     * @param instance the instance
     */
    public void forceShutdown(@Nonnull Instance instance) {
        shutdownInstance(instance);
        redirectPendingRequests(instance);
    }

    /**
     * Move every transfer held by an instance to another instance of the
     * same zone clone, unaffirmed transfers first.
     *
     * @param from the instance giving up its transfers
     */
    public void redirectPendingRequests(@Nonnull Instance from) {
        List<PendingTransferRequest> moved = new ArrayList<>(from.drainPendingAffirmations());
        moved.addAll(from.drainPendingRequests());
        if (moved.isEmpty()) {
            return;
        }

        for (PendingTransferRequest request : moved) {
            Instance target = registry.getOrSpawn(from.getZoneId(), from.getCloneId());
            route(target, request);
            LOGGER.info("Redirected transfer {} from {} to {}", request.requestId(), from, target);
        }
    }

    @Override
    public void onInstanceRemoving(@Nonnull Instance instance) {
        if (tearingDown) {
            return;
        }
        instance.markShuttingDown();
        redirectPendingRequests(instance);
    }

    // ==================== Shutdown ====================

    /**
     * Tell an instance's worker to shut down.
     *
     * <p>An instance whose worker never announced itself cannot confirm, so
     * it is marked complete right away and the next sweep releases it.</p>
     *
     * @param instance the instance
     */
    public void shutdownInstance(@Nonnull Instance instance) {
        instance.markShuttingDown();

        PeerAddress peer = instance.getPeerAddress();
        if (peer == null) {
            instance.markShutdownComplete();
            LOGGER.info("Instance {} never connected, marked shut down", instance);
            return;
        }
        transport.send(MasterPackets.shutdown(), peer);
        LOGGER.info("Sent shutdown to {}", instance);
    }

    /**
     * Enter cluster teardown: every instance is told to shut down and no
     * transfer is redirected any more.
     */
    public void shutdownAll() {
        tearingDown = true;
        for (Instance instance : registry.getAll()) {
            shutdownInstance(instance);
        }
    }

    public void requestUniverseShutdown() {
        if (!universeShutdownRequested) {
            universeShutdownRequested = true;
            LOGGER.info("Universe shutdown requested");
        }
    }

    public boolean isUniverseShutdownRequested() {
        return universeShutdownRequested;
    }

    public boolean isTearingDown() {
        return tearingDown;
    }

    // ==================== Private Zones ====================

    /**
     * Create (or reuse) the private instance for a password.
     *
     * @param zoneId zone identifier
     * @param cloneId clone identifier
     * @param password password of the private instance
     * @return the private instance
     */
    @Nonnull
    public Instance createPrivate(int zoneId, int cloneId, @Nonnull String password) {
        return registry.spawnPrivate(zoneId, cloneId, password);
    }

    /**
     * Send a player to a private instance.
     *
     * <p>Private instances skip the affirmation handshake. When no ready
     * instance matches the password nothing is sent.</p>
     *
     * @param requestId id chosen by the requester
     * @param firstEntry first-entry flag, passed through
     * @param password password of the private instance
     * @param requester peer to answer
     * @return the instance the player was sent to, or null
     */
    @Nullable
    public Instance requestPrivate(
            long requestId,
            boolean firstEntry,
            @Nonnull String password,
            @Nonnull PeerAddress requester) {
        Instance instance = registry.findPrivate(password);
        if (instance == null || !instance.isReady()) {
            LOGGER.debug("No ready private instance for transfer {}", requestId);
            return null;
        }

        transport.send(MasterPackets.zoneTransferResponse(requestId, firstEntry, instance), requester);
        return instance;
    }
}

package io.zonemaster.master.tick;

import io.zonemaster.api.storage.IdentifierExhaustedException;
import io.zonemaster.api.storage.ObjectIdAllocator;
import io.zonemaster.api.storage.StorageKeepAlive;
import io.zonemaster.api.transport.ControlTransport;
import io.zonemaster.api.transport.InboundPacket;
import io.zonemaster.master.affirmation.AffirmationEngine;
import io.zonemaster.master.config.MasterConfig;
import io.zonemaster.master.instance.Instance;
import io.zonemaster.master.instance.InstanceRegistry;
import io.zonemaster.master.protocol.ControlDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The master's fixed-period main loop.
 *
 * <p>Every tick drains the inbound packets, pings the external storage at
 * its interval, ages pending affirmations, sweeps instances that confirmed
 * their shutdown and advances a requested universe shutdown. All of the
 * master's state is mutated from this loop's thread.</p>
 *
 * <h2>Teardown</h2>
 * <p>When the universe shutdown countdown runs out (or an immediate shutdown
 * is requested) every instance is told to shut down and the object id
 * allocator is saved. The loop then keeps handling packets until every
 * instance confirmed or {@link MasterConfig#getShutdownCeilingTicks()} ticks
 * passed, and completes {@link #getTermination()}.</p>
 */
public class ClusterTickLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterTickLoop.class);

    /**
     * Phases of the loop.
     */
    public enum Phase {
        /** Normal operation. */
        RUNNING,
        /** Waiting for instances to confirm their shutdown. */
        TEARDOWN,
        /** Loop finished; ticks are ignored. */
        TERMINATED
    }

    private final ControlTransport transport;
    private final ControlDispatcher dispatcher;
    private final InstanceRegistry registry;
    private final AffirmationEngine engine;
    private final ObjectIdAllocator allocator;
    private final StorageKeepAlive keepAlive;

    private final int tickPeriodMillis;
    private final int storageKeepAliveTicks;
    private final int universeShutdownTicks;
    private final int shutdownCeilingTicks;

    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile Phase phase = Phase.RUNNING;
    private volatile boolean immediateShutdownRequested;
    private volatile long tickCount;
    private int universeShutdownRemaining = -1;
    private int teardownTicks;

    private ScheduledExecutorService scheduler;

    public ClusterTickLoop(
            @Nonnull MasterConfig config,
            @Nonnull ControlTransport transport,
            @Nonnull ControlDispatcher dispatcher,
            @Nonnull InstanceRegistry registry,
            @Nonnull AffirmationEngine engine,
            @Nonnull ObjectIdAllocator allocator,
            @Nonnull StorageKeepAlive keepAlive) {
        Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.keepAlive = Objects.requireNonNull(keepAlive, "keepAlive");
        this.tickPeriodMillis = config.getTickPeriodMillis();
        this.storageKeepAliveTicks = config.getStorageKeepAliveTicks();
        this.universeShutdownTicks = config.getUniverseShutdownTicks();
        this.shutdownCeilingTicks = config.getShutdownCeilingTicks();
    }

    // ==================== Lifecycle ====================

    /**
     * Start ticking on a dedicated thread.
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("Tick loop already started");
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ClusterTick");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::runTick, 0, tickPeriodMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Tick loop started ({} ms per tick)", tickPeriodMillis);
    }

    /**
     * Skip the universe shutdown countdown and tear the cluster down on the
     * next tick.
     */
    public void requestImmediateShutdown() {
        immediateShutdownRequested = true;
    }

    private void runTick() {
        try {
            tick();
        } catch (IdentifierExhaustedException e) {
            LOGGER.error("Object ids exhausted, terminating", e);
            phase = Phase.TERMINATED;
            termination.completeExceptionally(e);
            stopScheduler();
        } catch (RuntimeException e) {
            LOGGER.error("Error during tick {}", tickCount, e);
        }
    }

    // ==================== Tick ====================

    /**
     * Run one iteration of the loop.
     */
    public void tick() {
        if (phase == Phase.TERMINATED) {
            return;
        }
        tickCount++;

        if (phase == Phase.RUNNING && immediateShutdownRequested) {
            beginTeardown();
        }

        if (phase == Phase.TEARDOWN) {
            teardownTick();
            return;
        }

        drainPackets();

        if (storageKeepAliveTicks > 0 && tickCount % storageKeepAliveTicks == 0) {
            pingStorage();
        }

        engine.ageAffirmations();
        sweepCompleted();

        if (engine.isUniverseShutdownRequested()) {
            advanceUniverseShutdown();
        }
    }

    private void drainPackets() {
        InboundPacket packet;
        while ((packet = transport.receive()) != null) {
            try {
                dispatcher.dispatch(packet);
            } catch (IdentifierExhaustedException e) {
                throw e;
            } catch (RuntimeException e) {
                LOGGER.error("Failed to handle packet from {}", packet.sender(), e);
            }
        }
    }

    private void pingStorage() {
        try {
            keepAlive.ping();
        } catch (RuntimeException e) {
            LOGGER.warn("Storage keep-alive failed: {}", e.getMessage());
        }
    }

    private void sweepCompleted() {
        for (Instance instance : registry.getAll()) {
            if (instance.isShutdownComplete()) {
                registry.remove(instance);
            }
        }
    }

    private void advanceUniverseShutdown() {
        if (universeShutdownRemaining < 0) {
            universeShutdownRemaining = universeShutdownTicks;
            LOGGER.info("Universe shutdown in {} ticks", universeShutdownTicks);
        }

        universeShutdownRemaining--;
        if (universeShutdownRemaining <= 0) {
            beginTeardown();
        }
    }

    // ==================== Teardown ====================

    private void beginTeardown() {
        phase = Phase.TEARDOWN;
        teardownTicks = 0;
        LOGGER.info("Tearing down cluster: {} instance(s) to shut down", registry.getInstanceCount());

        engine.shutdownAll();
        try {
            allocator.save();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to save object id allocator", e);
        }
    }

    private void teardownTick() {
        drainPackets();
        sweepCompleted();
        teardownTicks++;

        if (registry.isEmpty()) {
            LOGGER.info("All instances shut down after {} tick(s)", teardownTicks);
            terminate();
        } else if (teardownTicks >= shutdownCeilingTicks) {
            LOGGER.warn("Shutdown ceiling of {} ticks reached with {} instance(s) still running",
                    shutdownCeilingTicks, registry.getInstanceCount());
            terminate();
        }
    }

    private void terminate() {
        phase = Phase.TERMINATED;
        termination.complete(null);
        stopScheduler();
        LOGGER.info("Tick loop terminated after {} tick(s)", tickCount);
    }

    private synchronized void stopScheduler() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    // ==================== Getters ====================

    /**
     * Get the handle completed when the loop terminates.
     *
     * <p>Completed exceptionally with {@link IdentifierExhaustedException}
     * if the object id space ran out.</p>
     *
     * @return termination future
     */
    @Nonnull
    public CompletableFuture<Void> getTermination() {
        return termination;
    }

    @Nonnull
    public Phase getPhase() {
        return phase;
    }

    public long getTickCount() {
        return tickCount;
    }
}

package io.zonemaster.master.tick;

import io.zonemaster.api.storage.IdentifierExhaustedException;
import io.zonemaster.api.storage.ObjectIdAllocator;
import io.zonemaster.api.transport.PeerAddress;
import io.zonemaster.master.affirmation.AffirmationEngine;
import io.zonemaster.master.config.MasterConfig;
import io.zonemaster.master.instance.Instance;
import io.zonemaster.master.instance.InstanceRegistry;
import io.zonemaster.master.protocol.ControlDispatcher;
import io.zonemaster.master.protocol.MessageType;
import io.zonemaster.master.session.SessionRegistry;
import io.zonemaster.master.support.Packets;
import io.zonemaster.master.support.RecordingLauncher;
import io.zonemaster.master.support.RecordingTransport;
import io.zonemaster.master.support.SequenceAllocator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class ClusterTickLoopTest {

    private static final PeerAddress CLIENT_WORKER = new PeerAddress("10.0.0.1", 4001);
    private static final PeerAddress WORLD_A = new PeerAddress("10.0.0.2", 4002);
    private static final PeerAddress WORLD_B = new PeerAddress("10.0.0.3", 4003);

    private final RecordingTransport transport = new RecordingTransport();
    private final RecordingLauncher launcher = new RecordingLauncher();
    private final AtomicInteger pings = new AtomicInteger();

    private MasterConfig config;
    private InstanceRegistry registry;
    private AffirmationEngine engine;
    private SequenceAllocator allocator;
    private ClusterTickLoop loop;

    private void build(long allocatorLimit) {
        registry = new InstanceRegistry(config, launcher);
        engine = new AffirmationEngine(registry, transport, config);
        SessionRegistry sessions = new SessionRegistry(transport);
        allocator = new SequenceAllocator(allocatorLimit);
        ControlDispatcher dispatcher = new ControlDispatcher(registry, engine, sessions, allocator, transport, launcher);
        loop = new ClusterTickLoop(config, transport, dispatcher, registry, engine, allocator, pings::incrementAndGet);
    }

    private void buildDefault() {
        config = new MasterConfig();
        config.setUniverseShutdownTicks(3);
        config.setShutdownCeilingTicks(5);
        config.setStorageKeepAliveTicks(10);
        config.setAffirmationTimeoutTicks(4);
        build(ObjectIdAllocator.MAX_ID);
    }

    @Test
    void tickDrainsAllInboundPackets() {
        buildDefault();
        transport.enqueue(CLIENT_WORKER, Packets.requestPersistentId(1));
        transport.enqueue(CLIENT_WORKER, Packets.requestPersistentId(2));
        transport.enqueue(CLIENT_WORKER, Packets.prepZone(1000));

        loop.tick();

        Assertions.assertEquals(0, transport.pendingInbound());
        Assertions.assertEquals(2, transport.sentOfType(MessageType.PERSISTENT_ID_RESPONSE).size());
        Assertions.assertEquals(1, registry.getInstanceCount());
        Assertions.assertEquals(1L, loop.getTickCount());
    }

    @Test
    void storageIsPingedAtInterval() {
        buildDefault();

        for (int i = 0; i < 25; i++) {
            loop.tick();
        }

        Assertions.assertEquals(2, pings.get());
    }

    @Test
    void failingKeepAliveDoesNotStopTick() {
        config = new MasterConfig();
        config.setStorageKeepAliveTicks(1);
        registry = new InstanceRegistry(config, launcher);
        engine = new AffirmationEngine(registry, transport, config);
        ControlDispatcher dispatcher = new ControlDispatcher(registry, engine, new SessionRegistry(transport),
                new SequenceAllocator(), transport, launcher);
        loop = new ClusterTickLoop(config, transport, dispatcher, registry, engine, new SequenceAllocator(), () -> {
            throw new IllegalStateException("storage down");
        });
        transport.enqueue(CLIENT_WORKER, Packets.prepZone(1000));

        loop.tick();

        Assertions.assertEquals(1, registry.getInstanceCount());
        Assertions.assertEquals(ClusterTickLoop.Phase.RUNNING, loop.getPhase());
    }

    @Test
    void affirmationTimeoutIsTickCounted() {
        buildDefault();
        transport.enqueue(CLIENT_WORKER, Packets.requestZoneTransfer(9, false, 1200, 0));
        loop.tick();
        Instance stuck = registry.findAllByZone(1200).get(0);
        stuck.attachPeer(WORLD_A);
        engine.readyInstance(stuck);

        for (int i = 0; i < 3; i++) {
            loop.tick();
        }
        Assertions.assertFalse(stuck.isShuttingDown());

        loop.tick();

        Assertions.assertTrue(stuck.isShuttingDown());
        Assertions.assertEquals(2, registry.findAllByZone(1200).size());
    }

    @Test
    void completedInstancesAreSwept() {
        buildDefault();
        Instance instance = registry.create(1200, 0, "127.0.0.1", 3000, 1);
        instance.attachPeer(WORLD_A);
        instance.markShuttingDown();
        transport.enqueue(WORLD_A, Packets.shutdownResponse());

        loop.tick();

        Assertions.assertTrue(registry.isEmpty());
        Assertions.assertEquals(1, launcher.released().size());
    }

    @Test
    void universeShutdownCountsDownThenTearsDownUntilAllConfirm() {
        buildDefault();
        Instance a = registry.create(1200, 0, "127.0.0.1", 3000, 1);
        a.attachPeer(WORLD_A);
        Instance b = registry.create(1300, 0, "127.0.0.1", 3001, 2);
        b.attachPeer(WORLD_B);
        transport.enqueue(CLIENT_WORKER, Packets.shutdownUniverse());

        loop.tick();
        loop.tick();
        Assertions.assertEquals(ClusterTickLoop.Phase.RUNNING, loop.getPhase());
        Assertions.assertTrue(transport.sentOfType(MessageType.SHUTDOWN).isEmpty());

        loop.tick();
        Assertions.assertEquals(ClusterTickLoop.Phase.TEARDOWN, loop.getPhase());
        Assertions.assertEquals(2, transport.sentOfType(MessageType.SHUTDOWN).size());
        Assertions.assertEquals(1, allocator.saves());

        transport.enqueue(WORLD_A, Packets.shutdownResponse());
        loop.tick();
        Assertions.assertEquals(1, registry.getInstanceCount());
        Assertions.assertFalse(loop.getTermination().isDone());

        transport.enqueue(WORLD_B, Packets.shutdownResponse());
        loop.tick();

        Assertions.assertTrue(registry.isEmpty());
        Assertions.assertEquals(ClusterTickLoop.Phase.TERMINATED, loop.getPhase());
        Assertions.assertTrue(loop.getTermination().isDone());
        Assertions.assertFalse(loop.getTermination().isCompletedExceptionally());
    }

    @Test
    void teardownStopsAtCeiling() {
        buildDefault();
        Instance silent = registry.create(1200, 0, "127.0.0.1", 3000, 1);
        silent.attachPeer(WORLD_A);
        loop.requestImmediateShutdown();

        for (int i = 0; i < 4; i++) {
            loop.tick();
        }
        Assertions.assertFalse(loop.getTermination().isDone());

        loop.tick();

        Assertions.assertTrue(loop.getTermination().isDone());
        Assertions.assertEquals(1, registry.getInstanceCount());

        long ticks = loop.getTickCount();
        loop.tick();
        Assertions.assertEquals(ticks, loop.getTickCount());
    }

    @Test
    void teardownDoesNotRespawnWork() {
        buildDefault();
        transport.enqueue(CLIENT_WORKER, Packets.requestZoneTransfer(9, false, 1200, 0));
        loop.tick();
        Instance instance = registry.findAllByZone(1200).get(0);
        instance.attachPeer(WORLD_A);
        loop.requestImmediateShutdown();

        loop.tick();
        transport.enqueue(WORLD_A, Packets.disconnect());
        loop.tick();

        Assertions.assertTrue(registry.isEmpty());
        Assertions.assertEquals(1, launcher.launchedWorlds().size());
        Assertions.assertTrue(loop.getTermination().isDone());
    }

    @Test
    void exhaustedAllocatorTerminatesLoopExceptionally() throws Exception {
        config = new MasterConfig();
        config.setTickPeriodMillis(1);
        build(0);
        transport.enqueue(CLIENT_WORKER, Packets.requestPersistentId(1));

        loop.start();

        CompletionException e = Assertions.assertThrows(CompletionException.class,
                () -> loop.getTermination().orTimeout(5, TimeUnit.SECONDS).join());
        Assertions.assertInstanceOf(IdentifierExhaustedException.class, e.getCause());
        Assertions.assertEquals(ClusterTickLoop.Phase.TERMINATED, loop.getPhase());
    }

    @Test
    void startedLoopTerminatesOnImmediateShutdown() {
        config = new MasterConfig();
        config.setTickPeriodMillis(1);
        build(ObjectIdAllocator.MAX_ID);

        loop.start();
        loop.requestImmediateShutdown();

        Assertions.assertDoesNotThrow(() -> loop.getTermination().get(5, TimeUnit.SECONDS));
        Assertions.assertThrows(IllegalStateException.class, loop::start);
    }
}

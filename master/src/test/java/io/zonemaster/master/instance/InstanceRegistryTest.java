package io.zonemaster.master.instance;

import io.zonemaster.api.transport.PeerAddress;
import io.zonemaster.master.config.MasterConfig;
import io.zonemaster.master.support.RecordingLauncher;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

final class InstanceRegistryTest {

    private MasterConfig config;
    private RecordingLauncher launcher;
    private InstanceRegistry registry;

    @BeforeEach
    void setUp() {
        config = new MasterConfig();
        config.setWorldPortStart(3000);
        config.setWorldPortEnd(3004);
        launcher = new RecordingLauncher();
        registry = new InstanceRegistry(config, launcher);
    }

    @Test
    void createRejectsPortInUse() {
        registry.create(1000, 0, "10.0.0.1", 3000, 1);

        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> registry.create(1100, 0, "10.0.0.1", 3000, 2));
        Assertions.assertTrue(e.getMessage().contains("Port already in use"));
    }

    @Test
    void createRejectsDuplicateIdentity() {
        registry.create(1000, 0, "10.0.0.1", 3000, 1);

        Assertions.assertThrows(IllegalStateException.class,
                () -> registry.create(1000, 0, "10.0.0.1", 3001, 1));
        Assertions.assertEquals(1, registry.getInstanceCount());
    }

    @Test
    void getOrSpawnReusesMatchingInstance() {
        Instance first = registry.getOrSpawn(1200, 0);
        Instance second = registry.getOrSpawn(1200, 0);

        Assertions.assertSame(first, second);
        Assertions.assertEquals(List.of(first), launcher.launchedWorlds());
        Assertions.assertEquals(3000, first.getPort());
        Assertions.assertEquals(1, first.getInstanceId());
        Assertions.assertFalse(first.isReady());
    }

    @Test
    void getOrSpawnSeparatesClones() {
        Instance clone0 = registry.getOrSpawn(1200, 0);
        Instance clone1 = registry.getOrSpawn(1200, 1);

        Assertions.assertNotSame(clone0, clone1);
        Assertions.assertEquals(2, clone1.getInstanceId());
        Assertions.assertEquals(3001, clone1.getPort());
    }

    @Test
    void getOrSpawnSkipsInstanceAtSoftCap() {
        MasterConfig.ZoneCapacityConfig capacity = new MasterConfig.ZoneCapacityConfig();
        capacity.setSoftCap(2);
        capacity.setHardCap(4);
        config.getZoneCapacities().put(1200, capacity);

        Instance first = registry.getOrSpawn(1200, 0);
        first.addPlayer();
        Assertions.assertSame(first, registry.getOrSpawn(1200, 0));

        first.addPlayer();
        Instance second = registry.getOrSpawn(1200, 0);

        Assertions.assertNotSame(first, second);
        Assertions.assertEquals(2, second.getSoftCap());
        Assertions.assertEquals(4, second.getHardCap());
    }

    @Test
    void getOrSpawnSkipsShuttingDownAndPrivateInstances() {
        Instance shuttingDown = registry.getOrSpawn(1200, 0);
        shuttingDown.markShuttingDown();
        Instance privateInstance = registry.spawnPrivate(1200, 0, "secret");

        Instance spawned = registry.getOrSpawn(1200, 0);

        Assertions.assertNotSame(shuttingDown, spawned);
        Assertions.assertNotSame(privateInstance, spawned);
        Assertions.assertEquals(3, registry.getInstanceCount());
    }

    @Test
    void spawnPrivateReusesPassword() {
        Instance first = registry.spawnPrivate(1000, 0, "secret");
        Instance again = registry.spawnPrivate(1000, 0, "secret");

        Assertions.assertSame(first, again);
        Assertions.assertTrue(first.isPrivate());
        Assertions.assertEquals(999, first.getSoftCap());
        Assertions.assertSame(first, registry.findPrivate("secret"));
        Assertions.assertNull(registry.findPrivate("other"));
    }

    @Test
    void spawnFailsWhenPortRangeExhausted() {
        for (int zone = 0; zone < 5; zone++) {
            registry.getOrSpawn(zone, 0);
        }

        Assertions.assertThrows(IllegalStateException.class, () -> registry.getOrSpawn(99, 0));
    }

    @Test
    void removedPortIsReusedButInstanceIdIsNot() {
        Instance first = registry.getOrSpawn(1200, 0);
        Assertions.assertTrue(registry.remove(first));

        Instance second = registry.getOrSpawn(1200, 0);

        Assertions.assertEquals(first.getPort(), second.getPort());
        Assertions.assertEquals(2, second.getInstanceId());
        Assertions.assertEquals(List.of(first), launcher.released());
    }

    @Test
    void announcedInstanceIdAdvancesCounter() {
        registry.create(1000, 0, "10.0.0.1", 3004, 40);

        Instance spawned = registry.getOrSpawn(1200, 0);

        Assertions.assertEquals(41, spawned.getInstanceId());
    }

    @Test
    void removeNotifiesListenersWhileInstanceIsRegistered() {
        Instance instance = registry.getOrSpawn(1200, 0);
        List<Boolean> registeredDuringCallback = new ArrayList<>();
        registry.addListener(i -> registeredDuringCallback.add(registry.find(i.getZoneId(), i.getInstanceId()) != null));

        registry.remove(instance);

        Assertions.assertEquals(List.of(true), registeredDuringCallback);
        Assertions.assertNull(registry.find(1200, instance.getInstanceId()));
        Assertions.assertFalse(registry.findByPort(instance.getPort()));
        Assertions.assertFalse(registry.remove(instance));
    }

    @Test
    void getAllIsSnapshot() {
        registry.getOrSpawn(1200, 0);
        List<Instance> snapshot = registry.getAll();

        registry.getOrSpawn(1300, 0);

        Assertions.assertEquals(1, snapshot.size());
        Assertions.assertEquals(2, registry.getAll().size());
    }

    @Test
    void findByPeerAndZone() {
        Instance a = registry.getOrSpawn(1200, 0);
        Instance b = registry.getOrSpawn(1200, 1);
        Instance c = registry.getOrSpawn(1300, 0);
        PeerAddress peer = new PeerAddress("10.0.0.7", 40000);
        b.attachPeer(peer);

        Assertions.assertSame(b, registry.findByPeer(peer));
        Assertions.assertNull(registry.findByPeer(new PeerAddress("10.0.0.8", 40000)));
        Assertions.assertEquals(List.of(a, b), registry.findAllByZone(1200));
        Assertions.assertEquals(List.of(c), registry.findAllByZone(1300));
    }

    @Test
    void announcementOnFreePortRegistersInstance() {
        PeerAddress peer = new PeerAddress("10.0.0.2", 50000);

        Instance instance = registry.registerAnnouncement(1000, 7, "10.0.0.2", 3100, peer);

        Assertions.assertSame(instance, registry.find(1000, 7));
        Assertions.assertEquals(peer, instance.getPeerAddress());
        Assertions.assertEquals(12, instance.getSoftCap());
        Assertions.assertTrue(launcher.launchedWorlds().isEmpty());
    }

    @Test
    void announcementFromSameIdentityAttachesPeer() {
        Instance spawned = registry.getOrSpawn(1200, 0);
        PeerAddress peer = new PeerAddress("10.0.0.2", 50001);

        Instance announced = registry.registerAnnouncement(1200, spawned.getInstanceId(), "127.0.0.1", spawned.getPort(), peer);

        Assertions.assertSame(spawned, announced);
        Assertions.assertEquals(peer, spawned.getPeerAddress());
        Assertions.assertEquals(1, registry.getInstanceCount());
    }

    @Test
    void announcementOnPortOfOtherIdentityEvictsStaleInstance() {
        Instance stale = registry.getOrSpawn(1200, 0);
        PeerAddress peer = new PeerAddress("10.0.0.2", 50002);

        Instance announced = registry.registerAnnouncement(1300, 9, "10.0.0.2", stale.getPort(), peer);

        Assertions.assertNull(registry.find(1200, stale.getInstanceId()));
        Assertions.assertSame(announced, registry.getByPort(stale.getPort()));
        Assertions.assertEquals(List.of(stale), launcher.released());
    }

    @Test
    void announcementOfMovedIdentityKeepsAnnouncedPort() {
        Instance original = registry.getOrSpawn(1200, 0);
        List<Instance> redirectTargets = new ArrayList<>();
        registry.addListener(i -> redirectTargets.add(registry.getOrSpawn(i.getZoneId(), i.getCloneId())));
        PeerAddress peer = new PeerAddress("10.0.0.2", 50003);

        Instance announced = registry.registerAnnouncement(1200, original.getInstanceId(), "10.0.0.2", 3001, peer);

        Assertions.assertNotSame(original, announced);
        Assertions.assertSame(announced, registry.find(1200, original.getInstanceId()));
        Assertions.assertSame(announced, registry.getByPort(3001));
        Assertions.assertEquals(peer, announced.getPeerAddress());
        Assertions.assertFalse(registry.findByPort(original.getPort()));
        Assertions.assertEquals(List.of(announced), redirectTargets);
        Assertions.assertEquals(1, registry.getInstanceCount());
        Assertions.assertEquals(List.of(original), launcher.launchedWorlds());
        Assertions.assertTrue(launcher.released().isEmpty());
    }

    @Test
    void announcementEvictingPortOwnerNeverRespawnsOnAnnouncedPort() {
        Instance stale = registry.getOrSpawn(1200, 0);
        List<Instance> redirectTargets = new ArrayList<>();
        registry.addListener(i -> redirectTargets.add(registry.getOrSpawn(i.getZoneId(), i.getCloneId())));

        Instance announced = registry.registerAnnouncement(1300, 9, "10.0.0.2", stale.getPort(),
                new PeerAddress("10.0.0.2", 50004));

        Assertions.assertSame(announced, registry.getByPort(stale.getPort()));
        Assertions.assertEquals(1, redirectTargets.size());
        Assertions.assertNotEquals(stale.getPort(), redirectTargets.get(0).getPort());
        Assertions.assertEquals(2, registry.getInstanceCount());
    }

    @Test
    void noTwoLiveInstancesSharePortAcrossRandomOperations() {
        Random random = new Random(42);
        List<Instance> live = new ArrayList<>();

        for (int step = 0; step < 500; step++) {
            if (!live.isEmpty() && (live.size() == 5 || random.nextBoolean())) {
                Instance victim = live.remove(random.nextInt(live.size()));
                registry.remove(victim);
            } else {
                live.add(registry.getOrSpawn(random.nextInt(1000), 0));
                live = new ArrayList<>(registry.getAll());
            }

            Set<Integer> ports = new HashSet<>();
            for (Instance instance : registry.getAll()) {
                Assertions.assertTrue(ports.add(instance.getPort()), "duplicate port " + instance.getPort());
            }
        }
    }
}

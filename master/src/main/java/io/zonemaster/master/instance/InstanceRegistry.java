package io.zonemaster.master.instance;

import io.zonemaster.api.transport.PeerAddress;
import io.zonemaster.master.config.MasterConfig;
import io.zonemaster.master.process.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory registry of all world instances.
 *
 * <p>The only component that creates or discards {@link Instance}s. Port and
 * identity bookkeeping guarantee that no two live instances share a port or
 * a {@code (zoneId, instanceId)} pair. Instance ids handed out here grow
 * monotonically for the lifetime of the process.</p>
 *
 * <p>{@link #getAll()} returns a snapshot, so callers may create or remove
 * instances while iterating it.</p>
 */
public class InstanceRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceRegistry.class);

    private final MasterConfig config;
    private final WorkerLauncher launcher;

    private final List<Instance> instances = new CopyOnWriteArrayList<>();
    private final Map<Integer, Instance> portToInstance = new ConcurrentHashMap<>();
    private final List<InstanceListener> listeners = new CopyOnWriteArrayList<>();

    private int lastInstanceId = 0;

    /**
     * Create an instance registry.
     *
     * @param config master configuration
     * @param launcher launcher for the world workers of spawned instances
     */
    public InstanceRegistry(@Nonnull MasterConfig config, @Nonnull WorkerLauncher launcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    /**
     * Register a listener notified before instances are removed.
     *
     * @param listener the listener
     */
    public void addListener(@Nonnull InstanceListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ==================== Creation ====================

    /**
     * Register an instance with a known identity and address.
     *
     * <p>Does not start a worker: used for workers that already run.</p>
     *
     * @param zoneId zone identifier
     * @param cloneId clone identifier
     * @param ip address players connect to
     * @param port port players connect to
     * @param instanceId instance identifier
     * @return the registered instance
     * @throws IllegalStateException if the port or identity is already in use
     */
    @Nonnull
    public Instance create(int zoneId, int cloneId, @Nonnull String ip, int port, int instanceId) {
        return register(new Instance(
                zoneId,
                cloneId,
                instanceId,
                ip,
                port,
                config.softCapFor(zoneId),
                config.hardCapFor(zoneId),
                null
        ));
    }

    /**
     * Find an instance that can take a transfer to a zone clone, spawning one
     * if none can.
     *
     * @param zoneId zone identifier
     * @param cloneId clone identifier
     * @return a live, public, non-full instance (possibly still starting)
     * @throws IllegalStateException if no world port is free
     */
    @Nonnull
    public Instance getOrSpawn(int zoneId, int cloneId) {
        for (Instance instance : instances) {
            if (instance.acceptsTransfersFor(zoneId, cloneId)) {
                return instance;
            }
        }
        return spawn(zoneId, cloneId, config.softCapFor(zoneId), config.hardCapFor(zoneId), null);
    }

    /**
     * Get the private instance for a password, spawning it if it does not exist.
     *
     * @param zoneId zone identifier
     * @param cloneId clone identifier
     * @param password password of the private instance
     * @return the private instance
     * @throws IllegalStateException if no world port is free
     */
    @Nonnull
    public Instance spawnPrivate(int zoneId, int cloneId, @Nonnull String password) {
        Objects.requireNonNull(password, "password");
        Instance existing = findPrivate(password);
        if (existing != null) {
            return existing;
        }
        int cap = config.getPrivateInstanceCap();
        return spawn(zoneId, cloneId, cap, cap, password);
    }

    private Instance spawn(int zoneId, int cloneId, int softCap, int hardCap, @Nullable String password) {
        int port = allocatePort();
        Instance instance = register(new Instance(
                zoneId,
                cloneId,
                nextInstanceId(),
                config.getExternalIp(),
                port,
                softCap,
                hardCap,
                password
        ));

        LOGGER.info("Spawning world for zone {} clone {} instance {} on port {}{}",
                zoneId, cloneId, instance.getInstanceId(), port, password != null ? " (private)" : "");
        launcher.launchWorld(instance);
        return instance;
    }

    private Instance register(Instance instance) {
        int port = instance.getPort();

        Instance portOwner = portToInstance.get(port);
        if (portOwner != null) {
            throw new IllegalStateException("Port already in use: " + port + " (by " + portOwner + ")");
        }

        if (find(instance.getZoneId(), instance.getInstanceId()) != null) {
            throw new IllegalStateException("Instance already registered: zone " + instance.getZoneId()
                    + " instance " + instance.getInstanceId());
        }

        instances.add(instance);
        portToInstance.put(port, instance);
        if (instance.getInstanceId() > lastInstanceId) {
            lastInstanceId = instance.getInstanceId();
        }

        LOGGER.debug("Registered instance: {}", instance);
        return instance;
    }

    private int nextInstanceId() {
        return ++lastInstanceId;
    }

    private int allocatePort() {
        for (int port = config.getWorldPortStart(); port <= config.getWorldPortEnd(); port++) {
            if (!portToInstance.containsKey(port)) {
                return port;
            }
        }
        throw new IllegalStateException("No available world ports in range "
                + config.getWorldPortStart() + "-" + config.getWorldPortEnd());
    }

    // ==================== Announcements ====================

    /**
     * Record a world worker announcing itself.
     *
     * <p>A worker whose port is unknown is registered as a new instance. A
     * worker on the port of an instance with the same identity is attached
     * to it. An instance holding the port (or the identity) under different
     * coordinates is a stale leftover and is discarded.</p>
     *
     * <p>Stale instances give up their port and identity before the announced
     * instance is registered, and their transfers are redirected only once it
     * is. Transfers of an instance that merely moved port therefore land on
     * the announced instance, and no replacement can be spawned on the
     * announced port.</p>
     *
     * @param zoneId announced zone
     * @param instanceId announced instance id
     * @param ip announced address
     * @param port announced port
     * @param peer transport identity of the worker
     * @return the instance now bound to the worker
     */
    @Nonnull
    public Instance registerAnnouncement(
            int zoneId,
            int instanceId,
            @Nonnull String ip,
            int port,
            @Nonnull PeerAddress peer) {
        Objects.requireNonNull(peer, "peer");

        Instance portOwner = portToInstance.get(port);
        if (portOwner != null && portOwner.matches(zoneId, instanceId)) {
            portOwner.attachPeer(peer);
            return portOwner;
        }

        if (portOwner != null) {
            LOGGER.warn("Port {} announced by zone {} instance {}, discarding stale {}",
                    port, zoneId, instanceId, portOwner);
            unbind(portOwner);
        }

        Instance moved = find(zoneId, instanceId);
        if (moved != null) {
            LOGGER.warn("Zone {} instance {} moved to port {}, discarding stale {}",
                    zoneId, instanceId, port, moved);
            unbind(moved);
        }

        Instance instance = create(zoneId, 0, ip, port, instanceId);
        instance.attachPeer(peer);

        if (portOwner != null) {
            retire(portOwner, true);
        }
        if (moved != null) {
            // same worker, now behind the announced instance
            retire(moved, false);
        }
        return instance;
    }

    // ==================== Removal ====================

    /**
     * Remove an instance.
     *
     * <p>Listeners run first, while the instance is still registered.</p>
     *
     * @param instance the instance
     * @return true if the instance was registered
     */
    public boolean remove(@Nonnull Instance instance) {
        Objects.requireNonNull(instance, "instance");
        if (!instances.contains(instance)) {
            return false;
        }

        notifyRemoving(instance);
        unbind(instance);
        launcher.release(instance);

        LOGGER.info("Removed instance: zone {} clone {} instance {} port {}",
                instance.getZoneId(), instance.getCloneId(), instance.getInstanceId(), instance.getPort());
        return true;
    }

    private void retire(Instance instance, boolean releaseWorker) {
        notifyRemoving(instance);
        if (releaseWorker) {
            launcher.release(instance);
        }
        LOGGER.info("Discarded instance: zone {} clone {} instance {} port {}",
                instance.getZoneId(), instance.getCloneId(), instance.getInstanceId(), instance.getPort());
    }

    private void notifyRemoving(Instance instance) {
        for (InstanceListener listener : listeners) {
            listener.onInstanceRemoving(instance);
        }
    }

    private void unbind(Instance instance) {
        instances.remove(instance);
        portToInstance.remove(instance.getPort(), instance);
    }

    // ==================== Queries ====================

    /**
     * Find an instance by identity.
     *
     * @param zoneId zone identifier
     * @param instanceId instance identifier
     * @return the instance, or null if not found
     */
    @Nullable
    public Instance find(int zoneId, int instanceId) {
        for (Instance instance : instances) {
            if (instance.matches(zoneId, instanceId)) {
                return instance;
            }
        }
        return null;
    }

    /**
     * Find the instance whose worker is the given peer.
     *
     * @param peer transport identity
     * @return the instance, or null if not found
     */
    @Nullable
    public Instance findByPeer(@Nonnull PeerAddress peer) {
        Objects.requireNonNull(peer, "peer");
        for (Instance instance : instances) {
            if (peer.equals(instance.getPeerAddress())) {
                return instance;
            }
        }
        return null;
    }

    /**
     * Check if a port is held by a live instance.
     *
     * @param port port number
     * @return true if in use
     */
    public boolean findByPort(int port) {
        return portToInstance.containsKey(port);
    }

    /**
     * Get the instance holding a port.
     *
     * @param port port number
     * @return the instance, or null if the port is free
     */
    @Nullable
    public Instance getByPort(int port) {
        return portToInstance.get(port);
    }

    /**
     * Get the live instances of a zone.
     *
     * @param zoneId zone identifier
     * @return matching instances
     */
    @Nonnull
    public List<Instance> findAllByZone(int zoneId) {
        return getInstances(i -> i.getZoneId() == zoneId);
    }

    /**
     * Find a private instance by password.
     *
     * @param password the password
     * @return the instance, or null if no private instance uses the password
     */
    @Nullable
    public Instance findPrivate(@Nonnull String password) {
        Objects.requireNonNull(password, "password");
        for (Instance instance : instances) {
            if (password.equals(instance.getPassword())) {
                return instance;
            }
        }
        return null;
    }

    /**
     * Get instances matching a predicate.
     *
     * @param predicate filter predicate
     * @return matching instances
     */
    @Nonnull
    public List<Instance> getInstances(@Nonnull Predicate<Instance> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return instances.stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }

    /**
     * Get a snapshot of all live instances.
     *
     * @return instances in registration order
     */
    @Nonnull
    public List<Instance> getAll() {
        return List.copyOf(instances);
    }

    /**
     * Get the number of live instances.
     *
     * @return instance count
     */
    public int getInstanceCount() {
        return instances.size();
    }

    /**
     * Check whether no instance is live.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return instances.isEmpty();
    }
}

package io.zonemaster.master;

import io.zonemaster.api.ClusterAPI;
import io.zonemaster.api.storage.ObjectIdAllocator;
import io.zonemaster.api.storage.StorageKeepAlive;
import io.zonemaster.api.transport.ControlTransport;
import io.zonemaster.master.affirmation.AffirmationEngine;
import io.zonemaster.master.api.ClusterAPIImpl;
import io.zonemaster.master.config.MasterConfig;
import io.zonemaster.master.id.FileObjectIdAllocator;
import io.zonemaster.master.instance.InstanceRegistry;
import io.zonemaster.master.process.ProcessManager;
import io.zonemaster.master.process.WorkerLauncher;
import io.zonemaster.master.protocol.ControlDispatcher;
import io.zonemaster.master.session.SessionRegistry;
import io.zonemaster.master.tick.ClusterTickLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * The master server of a world-zone cluster.
 *
 * <p>Wires the instance registry, the affirmation engine, the session
 * registry, the control dispatcher and the tick loop around a control
 * transport, an object id allocator and a worker launcher supplied by the
 * caller.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MasterConfig config = MasterConfig.load(Path.of("master.yml"));
 * MasterServer master = MasterServer.create(config, transport, StorageKeepAlive.NONE);
 * master.initialize();
 * master.start();
 *
 * Runtime.getRuntime().addShutdownHook(new Thread(master::shutdown));
 * master.awaitTermination();
 * }</pre>
 */
public class MasterServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterServer.class);

    private final MasterConfig config;
    private final WorkerLauncher launcher;
    private final InstanceRegistry registry;
    private final AffirmationEngine engine;
    private final SessionRegistry sessions;
    private final ControlDispatcher dispatcher;
    private final ClusterTickLoop tickLoop;
    private final ClusterAPI api;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a master server.
     *
     * @param config master configuration
     * @param transport control transport to the workers
     * @param allocator object id allocator
     * @param keepAlive keep-alive of the external storage
     * @param launcher launcher of worker processes
     */
    public MasterServer(
            @Nonnull MasterConfig config,
            @Nonnull ControlTransport transport,
            @Nonnull ObjectIdAllocator allocator,
            @Nonnull StorageKeepAlive keepAlive,
            @Nonnull WorkerLauncher launcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(allocator, "allocator");
        Objects.requireNonNull(keepAlive, "keepAlive");

        this.registry = new InstanceRegistry(config, launcher);
        this.engine = new AffirmationEngine(registry, transport, config);
        this.sessions = new SessionRegistry(transport);
        this.dispatcher = new ControlDispatcher(registry, engine, sessions, allocator, transport, launcher);
        this.tickLoop = new ClusterTickLoop(config, transport, dispatcher, registry, engine, allocator, keepAlive);
        this.api = new ClusterAPIImpl(registry, sessions, engine);
    }

    /**
     * Create a master server with the file-backed id allocator and native
     * worker processes configured in {@code config}.
     *
     * @param config master configuration
     * @param transport control transport to the workers
     * @param keepAlive keep-alive of the external storage
     * @return the master server
     * @throws IOException if the id file or the worker logs directory is unusable
     */
    @Nonnull
    public static MasterServer create(
            @Nonnull MasterConfig config,
            @Nonnull ControlTransport transport,
            @Nonnull StorageKeepAlive keepAlive) throws IOException {
        FileObjectIdAllocator allocator = FileObjectIdAllocator.open(
                Path.of(config.getObjectIdFile()), config.getObjectIdBlockSize());

        ProcessManager processManager = new ProcessManager(config.getWorkers());
        processManager.initialize();

        MasterServer server = new MasterServer(config, transport, allocator, keepAlive, processManager);
        server.getTermination().whenCompleteAsync((v, e) -> processManager.shutdown());
        return server;
    }

    // ==================== Lifecycle ====================

    /**
     * Initialize the master, starting the prestart workers if configured.
     */
    public void initialize() {
        if (initialized) {
            throw new IllegalStateException("Master server already initialized");
        }

        LOGGER.info("Initializing master server...");

        if (config.isPrestartServers()) {
            LOGGER.info("Prestarting chat, auth and {} zone(s)", config.getPrestartZones().size());
            launcher.launchChat();
            launcher.launchAuth();
            for (int zoneId : config.getPrestartZones()) {
                registry.getOrSpawn(zoneId, 0);
            }
        }

        initialized = true;
        LOGGER.info("Master server initialized");
        LOGGER.info("  World ports: {}-{}", config.getWorldPortStart(), config.getWorldPortEnd());
        LOGGER.info("  Instances: {}", registry.getInstanceCount());
    }

    /**
     * Start the tick loop.
     */
    public void start() {
        checkInitialized();
        tickLoop.start();
        tickLoop.getTermination().whenComplete((v, e) -> {
            if (e != null) {
                LOGGER.error("Master server terminated abnormally: {}", e.getMessage());
            } else {
                LOGGER.info("Master server shut down");
            }
        });
    }

    /**
     * Tear the cluster down without the universe shutdown countdown.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down master server...");
        tickLoop.requestImmediateShutdown();
    }

    /**
     * Block until the tick loop terminated.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws ExecutionException if the loop terminated abnormally
     */
    public void awaitTermination() throws InterruptedException, ExecutionException {
        tickLoop.getTermination().get();
    }

    @Nonnull
    public CompletableFuture<Void> getTermination() {
        return tickLoop.getTermination();
    }

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Master server not initialized");
        }
    }

    // ==================== Getters ====================

    @Nonnull
    public MasterConfig getConfig() {
        return config;
    }

    /**
     * Get the read-only view of the cluster.
     *
     * @return cluster API
     */
    @Nonnull
    public ClusterAPI getApi() {
        return api;
    }

    @Nonnull
    public InstanceRegistry getRegistry() {
        return registry;
    }

    @Nonnull
    public AffirmationEngine getEngine() {
        return engine;
    }

    @Nonnull
    public SessionRegistry getSessions() {
        return sessions;
    }

    @Nonnull
    public ControlDispatcher getDispatcher() {
        return dispatcher;
    }

    @Nonnull
    public ClusterTickLoop getTickLoop() {
        return tickLoop;
    }
}

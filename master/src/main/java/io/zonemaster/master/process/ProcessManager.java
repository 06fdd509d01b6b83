package io.zonemaster.master.process;

import io.zonemaster.master.config.MasterConfig.WorkerProcessConfig;
import io.zonemaster.master.instance.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Starts and stops the native worker processes of the cluster.
 *
 * <p>World workers are started once per spawned instance; the chat and
 * authentication services run once each. Worker output is copied to a log
 * file per worker.</p>
 *
 * <p>Terminating a worker may wait for it to exit, so it always runs on the
 * manager's own executor and never on the caller's thread.</p>
 */
public class ProcessManager implements WorkerLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessManager.class);

    static final String CHAT_WORKER_ID = "chat";
    static final String AUTH_WORKER_ID = "auth";

    private final Map<String, ManagedProcess> processes = new ConcurrentHashMap<>();
    private final ExecutorService releaseExecutor;
    private final WorkerProcessConfig workers;
    private final Path binaryDirectory;
    private final Path logsDirectory;

    private volatile boolean shutdown = false;

    /**
     * Create a process manager.
     *
     * @param workers worker process configuration
     */
    public ProcessManager(@Nonnull WorkerProcessConfig workers) {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.binaryDirectory = Path.of(workers.getBinaryDirectory());
        this.logsDirectory = Path.of(workers.getLogsDirectory());
        this.releaseExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "WorkerRelease");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Initialize the process manager.
     *
     * @throws IOException if the logs directory cannot be created
     */
    public void initialize() throws IOException {
        Files.createDirectories(logsDirectory);
    }

    // ==================== WorkerLauncher ====================

    @Override
    public void launchWorld(@Nonnull Instance instance) {
        spawnQuietly(worldWorkerId(instance), worldCommand(workers, instance));
    }

    @Override
    public void launchChat() {
        replace(CHAT_WORKER_ID, serviceCommand(workers, workers.getChatExecutable(), workers.isUseSudoChat()));
    }

    @Override
    public void launchAuth() {
        replace(AUTH_WORKER_ID, serviceCommand(workers, workers.getAuthExecutable(), workers.isUseSudoAuth()));
    }

    @Override
    public void release(@Nonnull Instance instance) {
        ManagedProcess managed = processes.remove(worldWorkerId(instance));
        if (managed == null) {
            return;
        }
        releaseAsync(managed);
    }

    private void replace(String workerId, List<String> command) {
        ManagedProcess previous = processes.remove(workerId);
        if (previous != null) {
            releaseAsync(previous);
        }
        spawnQuietly(workerId, command);
    }

    private void releaseAsync(ManagedProcess managed) {
        releaseExecutor.execute(() -> terminate(managed, workers.getReleaseGraceSeconds()));
    }

    // ==================== Spawning ====================

    private void spawnQuietly(String workerId, List<String> command) {
        try {
            spawn(workerId, command);
        } catch (IOException e) {
            LOGGER.error("Failed to start worker '{}': {}", workerId, e.getMessage());
        }
    }

    /**
     * Start a worker process.
     *
     * @param workerId worker identifier
     * @param command command line
     * @return the managed process
     * @throws IOException if the process cannot be started
     */
    @Nonnull
    public ManagedProcess spawn(@Nonnull String workerId, @Nonnull List<String> command) throws IOException {
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(command, "command");

        if (processes.containsKey(workerId)) {
            throw new IllegalStateException("Process already exists for worker: " + workerId);
        }

        LOGGER.info("Starting worker '{}'", workerId);
        LOGGER.debug("Command: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(binaryDirectory.toFile());
        builder.redirectErrorStream(true);

        Map<String, String> env = builder.environment();
        env.put("ZONEMASTER_WORKER_ID", workerId);
        env.putAll(workers.getEnvironment());

        Process process = builder.start();

        Path logFile = logsDirectory.resolve(workerId + ".log");
        ManagedProcess managed = new ManagedProcess(workerId, process, logFile);
        processes.put(workerId, managed);

        startLogCapture(managed);
        process.onExit().thenAccept(p -> {
            if (!shutdown) {
                LOGGER.warn("Worker '{}' exited with code {}", workerId, p.exitValue());
            }
        });

        LOGGER.info("Worker '{}' started with PID {}", workerId, process.pid());
        return managed;
    }

    private void startLogCapture(ManagedProcess managed) {
        Thread logThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(managed.getProcess().getInputStream(), StandardCharsets.UTF_8));
                 BufferedWriter writer = Files.newBufferedWriter(managed.getLogFile())) {

                String line;
                while ((line = reader.readLine()) != null) {
                    writer.write(line);
                    writer.newLine();
                    writer.flush();
                }
            } catch (IOException e) {
                if (!shutdown) {
                    LOGGER.error("Error capturing output of '{}': {}", managed.getWorkerId(), e.getMessage());
                }
            }
        }, "LogCapture-" + managed.getWorkerId());
        logThread.setDaemon(true);
        logThread.start();
    }

    // ==================== Commands ====================

    static String worldWorkerId(Instance instance) {
        return "world-" + instance.getZoneId() + "-" + instance.getInstanceId();
    }

    /**
     * Build the command line of a world worker.
     *
     * @param workers worker configuration
     * @param instance instance the worker serves
     * @return command line
     */
    static List<String> worldCommand(WorkerProcessConfig workers, Instance instance) {
        List<String> command = new ArrayList<>();
        command.add(executable(workers, workers.getWorldExecutable()));
        command.add("-zone");
        command.add(String.valueOf(instance.getZoneId()));
        command.add("-port");
        command.add(String.valueOf(instance.getPort()));
        command.add("-instance");
        command.add(String.valueOf(instance.getInstanceId()));
        command.add("-maxclients");
        command.add(String.valueOf(instance.getHardCap()));
        command.add("-clone");
        command.add(String.valueOf(instance.getCloneId()));
        return command;
    }

    static List<String> serviceCommand(WorkerProcessConfig workers, String executable, boolean sudo) {
        List<String> command = new ArrayList<>();
        if (sudo) {
            command.add("sudo");
        }
        command.add(executable(workers, executable));
        return command;
    }

    private static String executable(WorkerProcessConfig workers, String name) {
        return Path.of(workers.getBinaryDirectory()).resolve(name).toString();
    }

    // ==================== Termination ====================

    /**
     * Terminate a worker, asking politely first.
     *
     * @param managed the worker
     * @param timeoutSeconds how long to wait before killing it
     */
    void terminate(@Nonnull ManagedProcess managed, int timeoutSeconds) {
        Process process = managed.getProcess();
        if (!process.isAlive()) {
            return;
        }

        process.destroy();
        try {
            if (process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                LOGGER.info("Worker '{}' stopped", managed.getWorkerId());
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.warn("Worker '{}' did not stop in {}s, forcing...", managed.getWorkerId(), timeoutSeconds);
        process.destroyForcibly();
    }

    // ==================== Queries ====================

    /**
     * Get a managed process.
     *
     * @param workerId worker identifier
     * @return the managed process, or null if not found
     */
    @Nullable
    public ManagedProcess getProcess(@Nonnull String workerId) {
        return processes.get(workerId);
    }

    @Nonnull
    public Collection<ManagedProcess> getAllProcesses() {
        return Collections.unmodifiableCollection(processes.values());
    }

    /**
     * Shutdown the process manager, terminating every worker still running.
     */
    public void shutdown() {
        shutdown = true;
        LOGGER.info("Shutting down process manager...");

        for (ManagedProcess managed : new ArrayList<>(processes.values())) {
            releaseAsync(managed);
        }
        processes.clear();

        releaseExecutor.shutdown();
        try {
            if (!releaseExecutor.awaitTermination(workers.getReleaseGraceSeconds() + 5L, TimeUnit.SECONDS)) {
                releaseExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            releaseExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        LOGGER.info("Process manager shut down");
    }
}

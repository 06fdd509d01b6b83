package io.zonemaster.master.process;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A worker process started by the {@link ProcessManager}, with the log file
 * its output is copied to.
 */
public class ManagedProcess {

    private final String workerId;
    private final Process process;
    private final Path logFile;

    /**
     * Create a managed process.
     *
     * @param workerId worker identifier, e.g. {@code world-1200-3}
     * @param process the started process
     * @param logFile file the worker's output is copied to
     */
    public ManagedProcess(@Nonnull String workerId, @Nonnull Process process, @Nonnull Path logFile) {
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.process = Objects.requireNonNull(process, "process");
        this.logFile = Objects.requireNonNull(logFile, "logFile");
    }

    @Nonnull
    public String getWorkerId() {
        return workerId;
    }

    @Nonnull
    public Process getProcess() {
        return process;
    }

    @Nonnull
    public Path getLogFile() {
        return logFile;
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "workerId='" + workerId + '\'' +
                ", pid=" + process.pid() +
                ", alive=" + process.isAlive() +
                '}';
    }
}

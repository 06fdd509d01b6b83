package io.zonemaster.master.process;

import io.zonemaster.master.config.MasterConfig.WorkerProcessConfig;
import io.zonemaster.master.instance.Instance;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ProcessManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void worldCommandCarriesInstanceCoordinates() {
        WorkerProcessConfig workers = new WorkerProcessConfig();
        workers.setBinaryDirectory("/opt/cluster");
        Instance instance = new Instance(1200, 2, 5, "127.0.0.1", 3007, 12, 20, null);

        List<String> command = ProcessManager.worldCommand(workers, instance);

        Assertions.assertEquals(List.of(
                Path.of("/opt/cluster").resolve("WorldServer").toString(),
                "-zone", "1200",
                "-port", "3007",
                "-instance", "5",
                "-maxclients", "20",
                "-clone", "2"
        ), command);
        Assertions.assertEquals("world-1200-5", ProcessManager.worldWorkerId(instance));
    }

    @Test
    void serviceCommandHonorsSudo() {
        WorkerProcessConfig workers = new WorkerProcessConfig();
        workers.setBinaryDirectory("/opt/cluster");
        String chat = Path.of("/opt/cluster").resolve("ChatServer").toString();

        Assertions.assertEquals(List.of(chat),
                ProcessManager.serviceCommand(workers, "ChatServer", false));
        Assertions.assertEquals(List.of("sudo", chat),
                ProcessManager.serviceCommand(workers, "ChatServer", true));
    }

    @Test
    void failedLaunchIsLoggedAndLeavesNoProcess() throws Exception {
        WorkerProcessConfig workers = new WorkerProcessConfig();
        workers.setBinaryDirectory(tempDir.resolve("missing-bin").toString());
        workers.setLogsDirectory(tempDir.resolve("logs").toString());
        ProcessManager manager = new ProcessManager(workers);
        manager.initialize();
        Instance instance = new Instance(1200, 0, 1, "127.0.0.1", 3000, 12, 12, null);

        manager.launchWorld(instance);
        manager.release(instance);

        Assertions.assertTrue(Files.isDirectory(tempDir.resolve("logs")));
        Assertions.assertNull(manager.getProcess("world-1200-1"));
        Assertions.assertTrue(manager.getAllProcesses().isEmpty());
        manager.shutdown();
    }
}

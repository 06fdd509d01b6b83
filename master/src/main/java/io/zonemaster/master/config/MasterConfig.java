package io.zonemaster.master.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the master server.
 *
 * <p>Loaded from {@code master.yml}. Tick-based values are counted in
 * loop iterations of {@link #getTickPeriodMillis()} each.</p>
 */
public class MasterConfig {

    private String externalIp = "127.0.0.1";
    private int worldPortStart = 3000;
    private int worldPortEnd = 3999;
    private int tickPeriodMillis = 16;
    private int affirmationTimeoutTicks = 1000;
    private int universeShutdownTicks = 40000;
    private int shutdownCeilingTicks = 3600;
    private int storageKeepAliveTicks = 40000;
    private boolean prestartServers = false;
    private List<Integer> prestartZones = new ArrayList<>(List.of(0, 1000));
    private int defaultSoftCap = 12;
    private int defaultHardCap = 12;
    private int privateInstanceCap = 999;
    private Map<Integer, ZoneCapacityConfig> zoneCapacities = new HashMap<>();
    private String objectIdFile = "data/object-ids.yml";
    private int objectIdBlockSize = 100;
    private WorkerProcessConfig workers = new WorkerProcessConfig();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static MasterConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            MasterConfig config = new MasterConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(MasterConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            MasterConfig config = yaml.load(is);
            return config != null ? config : new MasterConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    /**
     * Get the soft player cap for a zone. Transfers skip instances at this cap.
     *
     * @param zoneId zone identifier
     * @return configured override, or the default soft cap
     */
    public int softCapFor(int zoneId) {
        ZoneCapacityConfig capacity = zoneCapacities.get(zoneId);
        return capacity != null ? capacity.getSoftCap() : defaultSoftCap;
    }

    /**
     * Get the hard player cap for a zone.
     *
     * @param zoneId zone identifier
     * @return configured override, or the default hard cap
     */
    public int hardCapFor(int zoneId) {
        ZoneCapacityConfig capacity = zoneCapacities.get(zoneId);
        return capacity != null ? capacity.getHardCap() : defaultHardCap;
    }

    // Getters and Setters

    public String getExternalIp() {
        return externalIp;
    }

    public void setExternalIp(String externalIp) {
        this.externalIp = externalIp;
    }

    public int getWorldPortStart() {
        return worldPortStart;
    }

    public void setWorldPortStart(int worldPortStart) {
        this.worldPortStart = worldPortStart;
    }

    public int getWorldPortEnd() {
        return worldPortEnd;
    }

    public void setWorldPortEnd(int worldPortEnd) {
        this.worldPortEnd = worldPortEnd;
    }

    public int getTickPeriodMillis() {
        return tickPeriodMillis;
    }

    public void setTickPeriodMillis(int tickPeriodMillis) {
        this.tickPeriodMillis = tickPeriodMillis;
    }

    public int getAffirmationTimeoutTicks() {
        return affirmationTimeoutTicks;
    }

    public void setAffirmationTimeoutTicks(int affirmationTimeoutTicks) {
        this.affirmationTimeoutTicks = affirmationTimeoutTicks;
    }

    public int getUniverseShutdownTicks() {
        return universeShutdownTicks;
    }

    public void setUniverseShutdownTicks(int universeShutdownTicks) {
        this.universeShutdownTicks = universeShutdownTicks;
    }

    public int getShutdownCeilingTicks() {
        return shutdownCeilingTicks;
    }

    public void setShutdownCeilingTicks(int shutdownCeilingTicks) {
        this.shutdownCeilingTicks = shutdownCeilingTicks;
    }

    public int getStorageKeepAliveTicks() {
        return storageKeepAliveTicks;
    }

    public void setStorageKeepAliveTicks(int storageKeepAliveTicks) {
        this.storageKeepAliveTicks = storageKeepAliveTicks;
    }

    public boolean isPrestartServers() {
        return prestartServers;
    }

    public void setPrestartServers(boolean prestartServers) {
        this.prestartServers = prestartServers;
    }

    public List<Integer> getPrestartZones() {
        return prestartZones;
    }

    public void setPrestartZones(List<Integer> prestartZones) {
        this.prestartZones = prestartZones;
    }

    public int getDefaultSoftCap() {
        return defaultSoftCap;
    }

    public void setDefaultSoftCap(int defaultSoftCap) {
        this.defaultSoftCap = defaultSoftCap;
    }

    public int getDefaultHardCap() {
        return defaultHardCap;
    }

    public void setDefaultHardCap(int defaultHardCap) {
        this.defaultHardCap = defaultHardCap;
    }

    public int getPrivateInstanceCap() {
        return privateInstanceCap;
    }

    public void setPrivateInstanceCap(int privateInstanceCap) {
        this.privateInstanceCap = privateInstanceCap;
    }

    public Map<Integer, ZoneCapacityConfig> getZoneCapacities() {
        return zoneCapacities;
    }

    public void setZoneCapacities(Map<Integer, ZoneCapacityConfig> zoneCapacities) {
        this.zoneCapacities = zoneCapacities;
    }

    public String getObjectIdFile() {
        return objectIdFile;
    }

    public void setObjectIdFile(String objectIdFile) {
        this.objectIdFile = objectIdFile;
    }

    public int getObjectIdBlockSize() {
        return objectIdBlockSize;
    }

    public void setObjectIdBlockSize(int objectIdBlockSize) {
        this.objectIdBlockSize = objectIdBlockSize;
    }

    public WorkerProcessConfig getWorkers() {
        return workers;
    }

    public void setWorkers(WorkerProcessConfig workers) {
        this.workers = workers;
    }

    /**
     * Player capacity override for one zone.
     */
    public static class ZoneCapacityConfig {
        private int softCap = 12;
        private int hardCap = 12;

        public int getSoftCap() {
            return softCap;
        }

        public void setSoftCap(int softCap) {
            this.softCap = softCap;
        }

        public int getHardCap() {
            return hardCap;
        }

        public void setHardCap(int hardCap) {
            this.hardCap = hardCap;
        }
    }

    /**
     * Configuration for spawning worker processes.
     */
    public static class WorkerProcessConfig {
        private String binaryDirectory = ".";
        private String logsDirectory = "logs/workers";
        private String worldExecutable = "WorldServer";
        private String chatExecutable = "ChatServer";
        private String authExecutable = "AuthServer";
        private boolean useSudoChat = false;
        private boolean useSudoAuth = false;
        private int releaseGraceSeconds = 30;
        private Map<String, String> environment = new HashMap<>();

        public String getBinaryDirectory() {
            return binaryDirectory;
        }

        public void setBinaryDirectory(String binaryDirectory) {
            this.binaryDirectory = binaryDirectory;
        }

        public String getLogsDirectory() {
            return logsDirectory;
        }

        public void setLogsDirectory(String logsDirectory) {
            this.logsDirectory = logsDirectory;
        }

        public String getWorldExecutable() {
            return worldExecutable;
        }

        public void setWorldExecutable(String worldExecutable) {
            this.worldExecutable = worldExecutable;
        }

        public String getChatExecutable() {
            return chatExecutable;
        }

        public void setChatExecutable(String chatExecutable) {
            this.chatExecutable = chatExecutable;
        }

        public String getAuthExecutable() {
            return authExecutable;
        }

        public void setAuthExecutable(String authExecutable) {
            this.authExecutable = authExecutable;
        }

        public boolean isUseSudoChat() {
            return useSudoChat;
        }

        public void setUseSudoChat(boolean useSudoChat) {
            this.useSudoChat = useSudoChat;
        }

        public boolean isUseSudoAuth() {
            return useSudoAuth;
        }

        public void setUseSudoAuth(boolean useSudoAuth) {
            this.useSudoAuth = useSudoAuth;
        }

        public int getReleaseGraceSeconds() {
            return releaseGraceSeconds;
        }

        public void setReleaseGraceSeconds(int releaseGraceSeconds) {
            this.releaseGraceSeconds = releaseGraceSeconds;
        }

        public Map<String, String> getEnvironment() {
            return environment;
        }

        public void setEnvironment(Map<String, String> environment) {
            this.environment = environment;
        }
    }
}

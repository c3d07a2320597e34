package io.fleetward.manager.config;

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
import java.time.Duration;

/**
 * Configuration for the fleet manager.
 *
 * <p>Loaded from {@code fleet.yml} under the fleet root and holds SSH,
 * monitoring, sync and persistence settings.</p>
 */
public class FleetConfig {

    private SshSettings ssh = new SshSettings();
    private MonitorSettings monitor = new MonitorSettings();
    private SyncSettings sync = new SyncSettings();
    private PersistenceSettings persistence = new PersistenceSettings();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static FleetConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            FleetConfig config = new FleetConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(FleetConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            FleetConfig config = yaml.load(is);
            return config != null ? config : new FleetConfig();
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
            // Plain map tag so the file loads back without a class tag
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    // Getters and Setters

    public SshSettings getSsh() {
        return ssh;
    }

    public void setSsh(SshSettings ssh) {
        this.ssh = ssh;
    }

    public MonitorSettings getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorSettings monitor) {
        this.monitor = monitor;
    }

    public SyncSettings getSync() {
        return sync;
    }

    public void setSync(SyncSettings sync) {
        this.sync = sync;
    }

    public PersistenceSettings getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceSettings persistence) {
        this.persistence = persistence;
    }

    /**
     * SSH transport settings.
     */
    public static class SshSettings {
        private int connectTimeoutSeconds = 10;
        private int commandTimeoutSeconds = 60;
        private int transferTimeoutSeconds = 300;
        private boolean strictHostKeyChecking = false;
        private String knownHostsFile;

        public Duration connectTimeout() {
            return Duration.ofSeconds(connectTimeoutSeconds);
        }

        public Duration commandTimeout() {
            return Duration.ofSeconds(commandTimeoutSeconds);
        }

        public Duration transferTimeout() {
            return Duration.ofSeconds(transferTimeoutSeconds);
        }

        public int getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        public int getCommandTimeoutSeconds() {
            return commandTimeoutSeconds;
        }

        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
            this.commandTimeoutSeconds = commandTimeoutSeconds;
        }

        public int getTransferTimeoutSeconds() {
            return transferTimeoutSeconds;
        }

        public void setTransferTimeoutSeconds(int transferTimeoutSeconds) {
            this.transferTimeoutSeconds = transferTimeoutSeconds;
        }

        public boolean isStrictHostKeyChecking() {
            return strictHostKeyChecking;
        }

        public void setStrictHostKeyChecking(boolean strictHostKeyChecking) {
            this.strictHostKeyChecking = strictHostKeyChecking;
        }

        public String getKnownHostsFile() {
            return knownHostsFile;
        }

        public void setKnownHostsFile(String knownHostsFile) {
            this.knownHostsFile = knownHostsFile;
        }
    }

    /**
     * Cluster monitor settings.
     */
    public static class MonitorSettings {
        private int tickIntervalSeconds = 10;
        private int maxAlerts = 1000;
        private int defaultTaskIntervalSeconds = 60;
        private int defaultTaskTimeoutSeconds = 30;
        private int defaultCheckTimeoutSeconds = 10;
        private boolean autoStart = false;

        public Duration tickInterval() {
            return Duration.ofSeconds(tickIntervalSeconds);
        }

        public int getTickIntervalSeconds() {
            return tickIntervalSeconds;
        }

        public void setTickIntervalSeconds(int tickIntervalSeconds) {
            this.tickIntervalSeconds = tickIntervalSeconds;
        }

        public int getMaxAlerts() {
            return maxAlerts;
        }

        public void setMaxAlerts(int maxAlerts) {
            this.maxAlerts = maxAlerts;
        }

        public int getDefaultTaskIntervalSeconds() {
            return defaultTaskIntervalSeconds;
        }

        public void setDefaultTaskIntervalSeconds(int defaultTaskIntervalSeconds) {
            this.defaultTaskIntervalSeconds = defaultTaskIntervalSeconds;
        }

        public int getDefaultTaskTimeoutSeconds() {
            return defaultTaskTimeoutSeconds;
        }

        public void setDefaultTaskTimeoutSeconds(int defaultTaskTimeoutSeconds) {
            this.defaultTaskTimeoutSeconds = defaultTaskTimeoutSeconds;
        }

        public int getDefaultCheckTimeoutSeconds() {
            return defaultCheckTimeoutSeconds;
        }

        public void setDefaultCheckTimeoutSeconds(int defaultCheckTimeoutSeconds) {
            this.defaultCheckTimeoutSeconds = defaultCheckTimeoutSeconds;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    /**
     * Config sync settings.
     */
    public static class SyncSettings {
        private int maxHistory = 1000;
        private String tempDirectory = "/tmp";

        public int getMaxHistory() {
            return maxHistory;
        }

        public void setMaxHistory(int maxHistory) {
            this.maxHistory = maxHistory;
        }

        public String getTempDirectory() {
            return tempDirectory;
        }

        public void setTempDirectory(String tempDirectory) {
            this.tempDirectory = tempDirectory;
        }
    }

    /**
     * Definition persistence settings.
     */
    public static class PersistenceSettings {
        private boolean enabled = true;
        private String stateDirectory = "state";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getStateDirectory() {
            return stateDirectory;
        }

        public void setStateDirectory(String stateDirectory) {
            this.stateDirectory = stateDirectory;
        }
    }
}

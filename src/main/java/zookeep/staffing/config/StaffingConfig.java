package zookeep.staffing.config;

import zookeep.staffing.model.TaskInput;
import zookeep.staffing.staff.StaffSettings;

import java.time.Duration;

/**
 * Configuration holder for the staffing server.
 * All settings have sensible defaults.
 */
public final class StaffingConfig {

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduler settings
    private int defaultMaxRetries = TaskInput.DEFAULT_MAX_RETRIES;
    private Duration taskGenerationInterval = Duration.ofSeconds(3);

    // Simulation settings
    private Duration tickInterval = Duration.ofMillis(100);
    private long seed = 42L;
    private int zookeepers = 2;
    private int maintenanceWorkers = 1;

    // Staff settings
    private StaffSettings staff = StaffSettings.defaults();

    private StaffingConfig() {
    }

    public static StaffingConfig defaults() {
        return new StaffingConfig();
    }

    public static StaffingConfig fromEnv() {
        StaffingConfig config = new StaffingConfig();

        // Override from environment variables
        String port = System.getenv("ZOOKEEP_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String tickMs = System.getenv("ZOOKEEP_TICK_MS");
        if (tickMs != null && !tickMs.isBlank()) {
            config.tickInterval = Duration.ofMillis(Long.parseLong(tickMs.trim()));
        }

        String maxRetries = System.getenv("ZOOKEEP_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.defaultMaxRetries = Integer.parseInt(maxRetries.trim());
        }

        String seed = System.getenv("ZOOKEEP_SEED");
        if (seed != null && !seed.isBlank()) {
            config.seed = Long.parseLong(seed.trim());
        }

        return config;
    }

    /** Independent copy, so a failed override leaves the original untouched */
    public StaffingConfig copy() {
        StaffingConfig c = new StaffingConfig();
        c.serverPort = serverPort;
        c.serverHost = serverHost;
        c.defaultMaxRetries = defaultMaxRetries;
        c.taskGenerationInterval = taskGenerationInterval;
        c.tickInterval = tickInterval;
        c.seed = seed;
        c.zookeepers = zookeepers;
        c.maintenanceWorkers = maintenanceWorkers;
        c.staff = staff;
        return c;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration taskGenerationInterval() {
        return taskGenerationInterval;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public long seed() {
        return seed;
    }

    public int zookeepers() {
        return zookeepers;
    }

    public int maintenanceWorkers() {
        return maintenanceWorkers;
    }

    public StaffSettings staff() {
        return staff;
    }

    // Fluent setters for testing/customization
    public StaffingConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public StaffingConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public StaffingConfig withMaxRetries(int retries) {
        if (retries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        this.defaultMaxRetries = retries;
        return this;
    }

    public StaffingConfig withTaskGenerationInterval(Duration interval) {
        this.taskGenerationInterval = interval;
        return this;
    }

    public StaffingConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public StaffingConfig withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public StaffingConfig withStaffCount(int zookeepers, int maintenanceWorkers) {
        if (zookeepers < 0 || maintenanceWorkers < 0) {
            throw new IllegalArgumentException("staff counts must not be negative");
        }
        this.zookeepers = zookeepers;
        this.maintenanceWorkers = maintenanceWorkers;
        return this;
    }

    public StaffingConfig withStaff(StaffSettings staff) {
        this.staff = staff;
        return this;
    }

    @Override
    public String toString() {
        return "StaffingConfig{" +
                "serverPort=" + serverPort +
                ", tickMs=" + tickInterval.toMillis() +
                ", maxRetries=" + defaultMaxRetries +
                ", seed=" + seed +
                ", staff=" + zookeepers + "+" + maintenanceWorkers +
                '}';
    }
}

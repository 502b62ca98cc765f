package zookeep.staffing.config;

import zookeep.staffing.staff.StaffSettings;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Loads staffing settings from an INI file on top of a base configuration.
 * Supports sections [SERVER], [SCHEDULER], [STAFF], [SIMULATION]; every
 * section and key is optional.
 *
 * <pre>
 * [SERVER]
 * port = 8080
 * [SCHEDULER]
 * max_retries = 3
 * task_generation_interval_s = 3
 * [STAFF]
 * speed = 2.5
 * walk_timeout_s = 30
 * [SIMULATION]
 * tick_ms = 100
 * zookeepers = 2
 * </pre>
 */
public final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private IniConfigLoader() {
    }

    /**
     * @return the merged configuration, or empty if the file cannot be read or holds bad values
     */
    public static Optional<StaffingConfig> load(File file, StaffingConfig defaults) {
        try {
            Ini ini = new Ini(file);
            StaffingConfig base = defaults.copy();

            Profile.Section server = ini.get("SERVER");
            Profile.Section scheduler = ini.get("SCHEDULER");
            Profile.Section staff = ini.get("STAFF");
            Profile.Section simulation = ini.get("SIMULATION");

            // SERVER
            String host = opt(server, "host");
            if (host != null) {
                base.withServerHost(host);
            }
            String port = opt(server, "port");
            if (port != null) {
                base.withServerPort(Integer.parseInt(port));
            }

            // SCHEDULER
            String retries = opt(scheduler, "max_retries");
            if (retries != null) {
                base.withMaxRetries(Integer.parseInt(retries));
            }
            String generation = opt(scheduler, "task_generation_interval_s");
            if (generation != null) {
                base.withTaskGenerationInterval(seconds(generation));
            }

            // STAFF
            if (staff != null) {
                StaffSettings current = base.staff();
                base.withStaff(new StaffSettings(
                        seconds(opt(staff, "wander_interval_s"), current.wanderInterval()),
                        Double.parseDouble(opt(staff, "speed", String.valueOf(current.speed()))),
                        seconds(opt(staff, "walk_timeout_s"), current.walkTimeout()),
                        seconds(opt(staff, "unreachable_ttl_s"), current.unreachableTtl()),
                        Integer.parseInt(opt(staff, "wander_radius", String.valueOf(current.wanderRadius()))),
                        Integer.parseInt(opt(staff, "path_search_radius",
                                String.valueOf(current.pathSearchRadius())))));
            }

            // SIMULATION
            String tickMs = opt(simulation, "tick_ms");
            if (tickMs != null) {
                base.withTickInterval(Duration.ofMillis(Long.parseLong(tickMs)));
            }
            String seed = opt(simulation, "seed");
            if (seed != null) {
                base.withSeed(Long.parseLong(seed));
            }
            String keepers = opt(simulation, "zookeepers");
            String maintenance = opt(simulation, "maintenance");
            if (keepers != null || maintenance != null) {
                base.withStaffCount(
                        keepers != null ? Integer.parseInt(keepers) : base.zookeepers(),
                        maintenance != null ? Integer.parseInt(maintenance) : base.maintenanceWorkers());
            }

            log.info("Loaded configuration from {}", file);
            return Optional.of(base);
        } catch (IOException | RuntimeException ex) {
            log.warn("Could not load configuration from {}: {}", file, ex.toString());
            return Optional.empty();
        }
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static Duration seconds(String value) {
        return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000));
    }

    private static Duration seconds(String value, Duration def) {
        return value == null ? def : seconds(value);
    }
}

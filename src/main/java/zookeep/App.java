package zookeep;

import zookeep.staffing.config.Dependencies;
import zookeep.staffing.config.IniConfigLoader;
import zookeep.staffing.config.StaffingConfig;
import zookeep.staffing.server.StaffingNettyServer;
import zookeep.staffing.simulation.ZooLayouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Starts the demo zoo with its staff and serves the staffing API.
 *
 * Usage: {@code App [config.ini]}. Environment variables set the defaults,
 * the INI file (when given and readable) overrides them.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        StaffingConfig config = StaffingConfig.fromEnv();
        if (args.length > 0) {
            File iniFile = new File(args[0]);
            StaffingConfig base = config;
            config = IniConfigLoader.load(iniFile, base).orElseGet(() -> {
                log.warn("Using environment defaults, could not load {}", iniFile);
                return base;
            });
        }

        Dependencies deps = Dependencies.create(config);
        ZooLayouts.demo(deps.simulation(), config.zookeepers(), config.maintenanceWorkers());

        StaffingNettyServer server = new StaffingNettyServer(config, deps.routerHandler());
        server.start();
        deps.startTicking();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.stop();
            deps.close();
        }, "zookeep-shutdown"));

        log.info("Zoo open with {} staff", deps.simulation().workers().size());
    }
}

package zookeep.staffing.config;

import zookeep.staffing.api.v1.HealthController;
import zookeep.staffing.api.v1.StaffController;
import zookeep.staffing.api.v1.TaskController;
import zookeep.staffing.path.GridPathService;
import zookeep.staffing.path.PathService;
import zookeep.staffing.producer.FeedingTaskProducer;
import zookeep.staffing.producer.FenceRepairTaskProducer;
import zookeep.staffing.producer.SanitationTaskProducer;
import zookeep.staffing.producer.TaskProducer;
import zookeep.staffing.repository.TaskQueueRepository;
import zookeep.staffing.scheduler.TickScheduler;
import zookeep.staffing.server.RouterHandler;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.simulation.Simulation;
import zookeep.staffing.simulation.SimulationClock;
import zookeep.staffing.simulation.ZooLayouts;
import zookeep.staffing.staff.WorkerContext;
import zookeep.staffing.staff.handler.TaskHandlerRegistry;
import zookeep.staffing.store.InMemoryTaskQueueRepository;
import zookeep.staffing.world.ZooWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(StaffingConfig.fromEnv());
 * ZooLayouts.demo(deps.simulation(), 2, 1);
 * deps.startTicking();
 * // ... serve deps.routerHandler() ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final StaffingConfig config;
    private final SimulationClock clock;
    private final TaskQueueRepository queueRepository;
    private final TaskService taskService;
    private final ZooWorld world;
    private final PathService pathService;
    private final TaskHandlerRegistry handlers;
    private final Simulation simulation;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final StaffController staffController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private TickScheduler tickScheduler;

    private Dependencies(StaffingConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Core
        this.clock = new SimulationClock(Instant.now());
        this.queueRepository = new InMemoryTaskQueueRepository();
        this.taskService = new TaskService(queueRepository, clock);

        // World and staff collaborators
        this.world = new ZooWorld(ZooLayouts.DEMO_WIDTH, ZooLayouts.DEMO_HEIGHT, new Random(config.seed()));
        this.pathService = new GridPathService(world::navigationSnapshot);
        this.handlers = TaskHandlerRegistry.defaults(world);
        WorkerContext workerContext = new WorkerContext(taskService, pathService, handlers,
                world::navigationSnapshot, clock, new Random(config.seed() + 1), config.staff());

        List<TaskProducer> producers = List.of(
                new FeedingTaskProducer(world, taskService, new Random(config.seed() + 2)),
                new FenceRepairTaskProducer(world, taskService),
                new SanitationTaskProducer(world, taskService));

        this.simulation = new Simulation(clock, world, taskService, workerContext, producers,
                config.taskGenerationInterval());

        // Controllers
        this.healthController = new HealthController(taskService, simulation);
        this.taskController = new TaskController(taskService, config);
        this.staffController = new StaffController(simulation);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(StaffingConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(StaffingConfig.fromEnv());
    }

    public StaffingConfig config() {
        return config;
    }

    public SimulationClock clock() {
        return clock;
    }

    public TaskService taskService() {
        return taskService;
    }

    public ZooWorld world() {
        return world;
    }

    public PathService pathService() {
        return pathService;
    }

    public TaskHandlerRegistry handlers() {
        return handlers;
    }

    public Simulation simulation() {
        return simulation;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(staffController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the tick scheduler (creates it if not yet created).
     */
    public synchronized TickScheduler tickScheduler() {
        if (tickScheduler == null) {
            tickScheduler = new TickScheduler(simulation, config.tickInterval());
        }
        return tickScheduler;
    }

    /**
     * Start advancing the simulation in real time.
     */
    public void startTicking() {
        tickScheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop ticking first so no worker issues new path requests
        if (tickScheduler != null) {
            try {
                tickScheduler.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping tick scheduler: {}", e.getMessage());
            }
        }

        try {
            pathService.close();
        } catch (RuntimeException e) {
            log.warn("Error closing path service: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}

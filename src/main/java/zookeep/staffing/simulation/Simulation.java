package zookeep.staffing.simulation;

import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.producer.TaskProducer;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.staff.StaffSnapshot;
import zookeep.staffing.staff.StaffWorker;
import zookeep.staffing.staff.WorkerContext;
import zookeep.staffing.world.Zone;
import zookeep.staffing.world.ZooWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One zoo: world, producers and staff, advanced in fixed steps.
 *
 * Each tick runs in a fixed order: clock, world, producers (on their own
 * interval), then every worker in hire order. Workers never run concurrently,
 * so one worker's claim is fully done before the next one looks at the queues.
 */
public final class Simulation {

    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private final SimulationClock clock;
    private final ZooWorld world;
    private final TaskService tasks;
    private final WorkerContext workerContext;
    private final List<TaskProducer> producers;
    private final Duration productionInterval;

    private final Map<String, StaffWorker> staff = new LinkedHashMap<>();
    private final Map<StaffRole, Integer> hiredPerRole = new EnumMap<>(StaffRole.class);

    private double productionTimer;
    private long ticks;
    private volatile List<StaffSnapshot> staffView = List.of();

    public Simulation(SimulationClock clock, ZooWorld world, TaskService tasks, WorkerContext workerContext,
            List<TaskProducer> producers, Duration productionInterval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.world = Objects.requireNonNull(world, "world");
        this.tasks = Objects.requireNonNull(tasks, "tasks");
        this.workerContext = Objects.requireNonNull(workerContext, "workerContext");
        this.producers = List.copyOf(producers);
        this.productionInterval = Objects.requireNonNull(productionInterval, "productionInterval");
    }

    /**
     * Advance the whole zoo by one step.
     */
    public synchronized void tick(Duration dt) {
        clock.advance(dt);
        double seconds = dt.toMillis() / 1000.0;

        world.tick(seconds);

        productionTimer += seconds;
        if (productionTimer >= productionInterval.toMillis() / 1000.0) {
            productionTimer = 0;
            runProducers();
        }

        for (StaffWorker worker : staff.values()) {
            worker.update(seconds);
        }

        ticks++;
        publishStaffView();
    }

    /**
     * Run every producer once, regardless of the interval.
     *
     * @return tasks added
     */
    public synchronized int runProducers() {
        int added = 0;
        for (TaskProducer producer : producers) {
            added += producer.produce();
        }
        return added;
    }

    // =========================================
    // Staff
    // =========================================

    public synchronized StaffWorker hire(StaffRole role, GridPos position) {
        int n = hiredPerRole.merge(role, 1, Integer::sum);
        String id = role.name().toLowerCase() + "-" + n;
        StaffWorker worker = new StaffWorker(id, role.displayName() + " #" + n, role, position, workerContext);
        staff.put(id, worker);
        publishStaffView();
        log.info("Hired {} at {}", worker.name(), position);
        return worker;
    }

    public synchronized Optional<StaffWorker> worker(String staffId) {
        return Optional.ofNullable(staff.get(staffId));
    }

    /** Workers in hire order */
    public synchronized List<StaffWorker> workers() {
        return new ArrayList<>(staff.values());
    }

    public synchronized void assignZone(String staffId, int zoneId) {
        StaffWorker worker = requireWorker(staffId);
        if (world.zone(zoneId).isEmpty()) {
            throw new IllegalArgumentException("Unknown zone: " + zoneId);
        }
        worker.assignZone(zoneId);
        publishStaffView();
    }

    /**
     * @return false if the worker was not assigned to the zone
     */
    public synchronized boolean unassignZone(String staffId, int zoneId) {
        boolean removed = requireWorker(staffId).unassignZone(zoneId);
        publishStaffView();
        return removed;
    }

    /**
     * Let a worker take, or stop taking, tasks of one type.
     *
     * @throws IllegalArgumentException for an unknown worker or a type of another role
     */
    public synchronized void setTaskTypeEnabled(String staffId, TaskType type, boolean enabled) {
        StaffWorker worker = requireWorker(staffId);
        if (enabled) {
            worker.enableTaskType(type);
        } else {
            worker.disableTaskType(type);
        }
        publishStaffView();
        log.info("{} {} {}", worker.name(), enabled ? "now takes" : "no longer takes", type);
    }

    private StaffWorker requireWorker(String staffId) {
        StaffWorker worker = staff.get(staffId);
        if (worker == null) {
            throw new IllegalArgumentException("Unknown staff member: " + staffId);
        }
        return worker;
    }

    /**
     * Latest staff view. Safe to call from any thread.
     */
    public List<StaffSnapshot> staffSnapshots() {
        return staffView;
    }

    private void publishStaffView() {
        List<StaffSnapshot> view = new ArrayList<>(staff.size());
        for (StaffWorker worker : staff.values()) {
            view.add(worker.snapshot());
        }
        staffView = List.copyOf(view);
    }

    // =========================================
    // Zones
    // =========================================

    /**
     * Create an exhibit in the world and give it task queues.
     */
    public synchronized Zone createZone(String name, Collection<GridPos> interior, Collection<FenceEdge> perimeter,
            FenceEdge gate) {
        Zone zone = world.createZone(name, interior, perimeter, gate);
        tasks.registerZone(zone.id());
        return zone;
    }

    /**
     * Tear down an exhibit. The scheduler goes first so nothing is filed into
     * an orphaned queue, then staff assignments, then the world.
     */
    public synchronized boolean removeZone(int zoneId) {
        if (world.zone(zoneId).isEmpty()) {
            return false;
        }
        int dropped = tasks.removeZone(zoneId);
        for (StaffWorker worker : staff.values()) {
            worker.unassignZone(zoneId);
        }
        world.removeZone(zoneId);
        publishStaffView();
        log.info("Zone {} torn down ({} tasks dropped)", zoneId, dropped);
        return true;
    }

    // =========================================
    // Accessors
    // =========================================

    public ZooWorld world() {
        return world;
    }

    public TaskService tasks() {
        return tasks;
    }

    public SimulationClock clock() {
        return clock;
    }

    public synchronized long ticks() {
        return ticks;
    }
}

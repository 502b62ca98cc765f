package zookeep.staffing.staff;

import zookeep.staffing.path.NavigationGrid;
import zookeep.staffing.path.PathService;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.staff.handler.TaskHandlerRegistry;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Collaborators every worker talks to. One instance is shared by the whole staff.
 *
 * @param grid current walkability view, used to pick wander targets
 */
public record WorkerContext(
        TaskService tasks,
        PathService paths,
        TaskHandlerRegistry handlers,
        Supplier<NavigationGrid> grid,
        Clock clock,
        Random random,
        StaffSettings settings) {

    public WorkerContext {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(handlers, "handlers");
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(settings, "settings");
    }
}

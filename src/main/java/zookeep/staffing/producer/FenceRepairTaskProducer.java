package zookeep.staffing.producer;

import zookeep.staffing.model.FenceCondition;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.PayloadFilter;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.world.Zone;
import zookeep.staffing.world.ZooWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Files a repair task for every worn fence.
 */
public class FenceRepairTaskProducer implements TaskProducer {

    private static final Logger log = LoggerFactory.getLogger(FenceRepairTaskProducer.class);

    static final int MAX_RETRIES = 3;

    private final ZooWorld world;
    private final TaskService tasks;

    public FenceRepairTaskProducer(ZooWorld world, TaskService tasks) {
        this.world = world;
        this.tasks = tasks;
    }

    @Override
    public int produce() {
        int added = 0;
        for (Map.Entry<FenceEdge, FenceCondition> entry : world.fenceConditions().entrySet()) {
            FenceEdge fence = entry.getKey();
            FenceCondition condition = entry.getValue();
            if (condition == FenceCondition.GOOD) {
                continue;
            }
            if (tasks.hasTaskFor(TaskType.REPAIR_FENCE, null, PayloadFilter.fence(fence))) {
                continue;
            }

            Optional<GridPos> spot = findWorkSpot(fence);
            if (spot.isEmpty()) {
                continue;
            }

            Integer zoneId = world.zoneByFence(fence).map(Zone::id).orElse(null);
            int priority = priorityFor(condition);
            long taskId = tasks.addTask(new TaskInput(TaskType.REPAIR_FENCE, priority, spot.get(), zoneId,
                    new TaskPayload.RepairFence(fence), MAX_RETRIES));
            log.info("Repair task {} for fence {} ({})", taskId, fence, condition);
            added++;
        }
        return added;
    }

    static int priorityFor(FenceCondition condition) {
        return switch (condition) {
            case FAILED -> Priority.URGENT;
            case DAMAGED -> Priority.NORMAL;
            default -> Priority.LOW;
        };
    }

    /**
     * Where a worker stands to fix the fence: the fence's own tile or the one
     * across, path tiles first, never water.
     */
    Optional<GridPos> findWorkSpot(FenceEdge fence) {
        List<GridPos> spots = List.of(fence.tile(), fence.across());
        for (GridPos spot : spots) {
            if (world.isWalkable(spot) && world.isPath(spot)) {
                return Optional.of(spot);
            }
        }
        for (GridPos spot : spots) {
            if (world.isWalkable(spot)) {
                return Optional.of(spot);
            }
        }
        return Optional.empty();
    }
}

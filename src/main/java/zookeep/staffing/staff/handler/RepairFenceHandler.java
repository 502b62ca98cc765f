package zookeep.staffing.staff.handler;

import zookeep.staffing.model.FenceCondition;
import zookeep.staffing.model.TaskPayload.RepairFence;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.world.WorldActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores a fence to GOOD. A fence that was torn down meanwhile is ignored.
 */
public class RepairFenceHandler implements TaskHandler<RepairFence> {

    private static final Logger log = LoggerFactory.getLogger(RepairFenceHandler.class);

    private final WorldActions world;

    public RepairFenceHandler(WorldActions world) {
        this.world = world;
    }

    @Override
    public TaskType type() {
        return TaskType.REPAIR_FENCE;
    }

    @Override
    public Class<RepairFence> payloadType() {
        return RepairFence.class;
    }

    @Override
    public void perform(RepairFence payload, TaskContext context) {
        if (world.setFenceCondition(payload.fence(), FenceCondition.GOOD)) {
            log.info("{} repaired fence {}", context.workerId(), payload.fence());
        } else {
            log.debug("{} found no fence at {}", context.workerId(), payload.fence());
        }
    }
}

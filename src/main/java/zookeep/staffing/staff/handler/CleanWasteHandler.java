package zookeep.staffing.staff.handler;

import zookeep.staffing.model.TaskPayload.CleanWaste;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.world.WorldActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CleanWasteHandler implements TaskHandler<CleanWaste> {

    private static final Logger log = LoggerFactory.getLogger(CleanWasteHandler.class);

    private final WorldActions world;

    public CleanWasteHandler(WorldActions world) {
        this.world = world;
    }

    @Override
    public TaskType type() {
        return TaskType.CLEAN_WASTE;
    }

    @Override
    public Class<CleanWaste> payloadType() {
        return CleanWaste.class;
    }

    @Override
    public void perform(CleanWaste payload, TaskContext context) {
        if (!world.clearWaste(payload.tile())) {
            log.debug("{} found no waste left at {}", context.workerId(), payload.tile());
        }
    }
}

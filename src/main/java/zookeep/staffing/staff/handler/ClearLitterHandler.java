package zookeep.staffing.staff.handler;

import zookeep.staffing.model.TaskPayload.ClearLitter;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.world.WorldActions;

public class ClearLitterHandler implements TaskHandler<ClearLitter> {

    private final WorldActions world;

    public ClearLitterHandler(WorldActions world) {
        this.world = world;
    }

    @Override
    public TaskType type() {
        return TaskType.CLEAR_LITTER;
    }

    @Override
    public Class<ClearLitter> payloadType() {
        return ClearLitter.class;
    }

    @Override
    public void perform(ClearLitter payload, TaskContext context) {
        world.clearLitter(payload.tile());
    }
}

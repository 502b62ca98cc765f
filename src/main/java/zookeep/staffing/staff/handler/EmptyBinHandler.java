package zookeep.staffing.staff.handler;

import zookeep.staffing.model.TaskPayload.EmptyBin;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.world.WorldActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EmptyBinHandler implements TaskHandler<EmptyBin> {

    private static final Logger log = LoggerFactory.getLogger(EmptyBinHandler.class);

    private final WorldActions world;

    public EmptyBinHandler(WorldActions world) {
        this.world = world;
    }

    @Override
    public TaskType type() {
        return TaskType.EMPTY_BIN;
    }

    @Override
    public Class<EmptyBin> payloadType() {
        return EmptyBin.class;
    }

    @Override
    public void perform(EmptyBin payload, TaskContext context) {
        if (!world.emptyBin(payload.binId())) {
            log.warn("{} could not find bin {}", context.workerId(), payload.binId());
        }
    }
}

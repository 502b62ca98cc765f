package zookeep.staffing.staff.handler;

import zookeep.staffing.model.TaskPayload.FeedAnimals;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.world.WorldActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts a food pile down where the zookeeper stands.
 */
public class FeedAnimalsHandler implements TaskHandler<FeedAnimals> {

    private static final Logger log = LoggerFactory.getLogger(FeedAnimalsHandler.class);

    private final WorldActions world;

    public FeedAnimalsHandler(WorldActions world) {
        this.world = world;
    }

    @Override
    public TaskType type() {
        return TaskType.FEED_ANIMALS;
    }

    @Override
    public Class<FeedAnimals> payloadType() {
        return FeedAnimals.class;
    }

    @Override
    public void perform(FeedAnimals payload, TaskContext context) {
        world.placeFood(context.position(), payload.foodType(), WorldActions.DEFAULT_FOOD_AMOUNT);
        log.info("{} placed {} at {} (zone {})", context.workerId(), payload.foodType(),
                context.position(), context.task().zoneId());
    }
}

package zookeep.staffing.model;

import java.util.Objects;

/**
 * Type-specific task data. One variant per {@link TaskType}, so a handler
 * receives exactly the fields its work needs.
 */
public sealed interface TaskPayload permits TaskPayload.FeedAnimals, TaskPayload.CleanWaste,
        TaskPayload.RepairFence, TaskPayload.ClearLitter, TaskPayload.EmptyBin {

    /** The task type this variant belongs to */
    TaskType type();

    /** Food to put down for the animals of a zone. animalId names the animal the need was detected on. */
    record FeedAnimals(FoodType foodType, long animalId) implements TaskPayload {
        public FeedAnimals {
            Objects.requireNonNull(foodType, "foodType is required");
        }

        @Override
        public TaskType type() {
            return TaskType.FEED_ANIMALS;
        }
    }

    /** Animal waste lying on an exhibit tile */
    record CleanWaste(GridPos tile) implements TaskPayload {
        public CleanWaste {
            Objects.requireNonNull(tile, "tile is required");
        }

        @Override
        public TaskType type() {
            return TaskType.CLEAN_WASTE;
        }
    }

    /** A fence segment to bring back to GOOD condition */
    record RepairFence(FenceEdge fence) implements TaskPayload {
        public RepairFence {
            Objects.requireNonNull(fence, "fence is required");
        }

        @Override
        public TaskType type() {
            return TaskType.REPAIR_FENCE;
        }
    }

    /** Guest litter on a walkable tile */
    record ClearLitter(GridPos tile) implements TaskPayload {
        public ClearLitter {
            Objects.requireNonNull(tile, "tile is required");
        }

        @Override
        public TaskType type() {
            return TaskType.CLEAR_LITTER;
        }
    }

    /** A garbage bin to empty */
    record EmptyBin(long binId) implements TaskPayload {
        @Override
        public TaskType type() {
            return TaskType.EMPTY_BIN;
        }
    }
}

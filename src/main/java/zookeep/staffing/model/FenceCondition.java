package zookeep.staffing.model;

/**
 * Fence wear, from intact to broken.
 */
public enum FenceCondition {
    GOOD,
    LIGHT_DAMAGE,
    DAMAGED,
    /** Broken through: animals and people can pass */
    FAILED;

    /** Next stage of wear; FAILED stays FAILED */
    public FenceCondition degrade() {
        return switch (this) {
            case GOOD -> LIGHT_DAMAGE;
            case LIGHT_DAMAGE -> DAMAGED;
            case DAMAGED, FAILED -> FAILED;
        };
    }
}

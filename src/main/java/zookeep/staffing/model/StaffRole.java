package zookeep.staffing.model;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Staff category. Restricts which task types a worker may claim.
 */
public enum StaffRole {
    /** Feeds animals and cleans exhibits */
    ZOOKEEPER("Zookeeper", Duration.ofSeconds(8)),
    /** Repairs fences and keeps the paths clean */
    MAINTENANCE("Maintenance", Duration.ofSeconds(6));

    private final String displayName;
    private final Duration pollInterval;

    StaffRole(String displayName, Duration pollInterval) {
        this.displayName = displayName;
        this.pollInterval = pollInterval;
    }

    public String displayName() {
        return displayName;
    }

    /** How often an idle worker of this role asks the scheduler for work */
    public Duration pollInterval() {
        return pollInterval;
    }

    /** All task types this role performs; also the default enabled set */
    public Set<TaskType> taskTypes() {
        EnumSet<TaskType> types = EnumSet.noneOf(TaskType.class);
        for (TaskType type : TaskType.values()) {
            if (type.role() == this) {
                types.add(type);
            }
        }
        return types;
    }
}

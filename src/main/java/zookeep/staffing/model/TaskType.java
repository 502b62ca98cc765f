package zookeep.staffing.model;

import java.time.Duration;

/**
 * Closed set of task types. Each type fixes the role that performs it,
 * how long the work takes once on site, and the payload variant it carries.
 */
public enum TaskType {
    FEED_ANIMALS(StaffRole.ZOOKEEPER, Duration.ofSeconds(4), TaskPayload.FeedAnimals.class),
    CLEAN_WASTE(StaffRole.ZOOKEEPER, Duration.ofSeconds(4), TaskPayload.CleanWaste.class),
    REPAIR_FENCE(StaffRole.MAINTENANCE, Duration.ofSeconds(5), TaskPayload.RepairFence.class),
    CLEAR_LITTER(StaffRole.MAINTENANCE, Duration.ofSeconds(5), TaskPayload.ClearLitter.class),
    EMPTY_BIN(StaffRole.MAINTENANCE, Duration.ofSeconds(5), TaskPayload.EmptyBin.class);

    private final StaffRole role;
    private final Duration workDuration;
    private final Class<? extends TaskPayload> payloadType;

    TaskType(StaffRole role, Duration workDuration, Class<? extends TaskPayload> payloadType) {
        this.role = role;
        this.workDuration = workDuration;
        this.payloadType = payloadType;
    }

    public StaffRole role() {
        return role;
    }

    public Duration workDuration() {
        return workDuration;
    }

    public Class<? extends TaskPayload> payloadType() {
        return payloadType;
    }
}

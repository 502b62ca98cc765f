package zookeep.staffing.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable unit of staff work.
 * Identity, type, target and zone never change; a failed task is re-queued
 * as a copy with a higher fail count (see {@link #toBuilder()}).
 */
public final class Task {
    private final long id;
    private final TaskType type;
    private final int priority;
    private final GridPos target;
    private final Integer zoneId; // null for global tasks
    private final TaskPayload payload;
    private final Instant createdAt;
    private final int failCount;
    private final int maxRetries;

    private Task(Builder builder) {
        this.id = builder.id;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.priority = builder.priority;
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.zoneId = builder.zoneId;
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.failCount = builder.failCount;
        this.maxRetries = builder.maxRetries;

        if (payload.type() != type) {
            throw new IllegalArgumentException(
                    "payload " + payload.getClass().getSimpleName() + " does not belong to task type " + type);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
    }

    // Getters
    public long id() {
        return id;
    }

    public TaskType type() {
        return type;
    }

    public int priority() {
        return priority;
    }

    public GridPos target() {
        return target;
    }

    public Integer zoneId() {
        return zoneId;
    }

    public TaskPayload payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int failCount() {
        return failCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /** Role whose queue this task lives in */
    public StaffRole role() {
        return type.role();
    }

    public boolean isGlobal() {
        return zoneId == null;
    }

    public boolean belongsToZone(int zone) {
        return zoneId != null && zoneId == zone;
    }

    /** Check if the task may still be queued after its recorded failures */
    public boolean canRetry() {
        return failCount < maxRetries;
    }

    /** Copy of this task with one more failure recorded */
    public Task withFailure() {
        return toBuilder().failCount(failCount + 1).build();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .priority(priority)
                .target(target)
                .zoneId(zoneId)
                .payload(payload)
                .createdAt(createdAt)
                .failCount(failCount)
                .maxRetries(maxRetries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private TaskType type;
        private int priority = Priority.NORMAL;
        private GridPos target;
        private Integer zoneId;
        private TaskPayload payload;
        private Instant createdAt;
        private int failCount = 0;
        private int maxRetries = 3;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder target(GridPos target) {
            this.target = target;
            return this;
        }

        public Builder zoneId(Integer zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        public Builder payload(TaskPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder failCount(int failCount) {
            this.failCount = failCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", type=" + type + ", priority=" + Priority.label(priority)
                + ", target=" + target + ", zone=" + zoneId + ", failCount=" + failCount + "}";
    }
}

package zookeep.staffing.model;

/**
 * Result of completing a task.
 */
public enum TaskCompleteResult {
    /** Task was active and is now done */
    COMPLETED,

    /** Task was not active (already completed, cancelled or its zone removed) - idempotent no-op */
    NOT_ACTIVE
}

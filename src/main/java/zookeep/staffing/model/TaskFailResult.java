package zookeep.staffing.model;

/**
 * Result of failing a task.
 */
public enum TaskFailResult {
    /** Task failed and went back to the tail of its queue */
    RETRIED,

    /** Task failed permanently (retry ceiling reached) and was dropped */
    DISCARDED,

    /** Task was not active - nothing to fail */
    NOT_ACTIVE
}

package zookeep.staffing.model;

/**
 * Staff worker state.
 */
public enum WorkerState {
    /** No task, waiting for the next poll */
    IDLE,
    /** Heading to the current task's target (or awaiting its path) */
    WALKING,
    /** On site, accumulating work time */
    WORKING,
    /** No task, strolling along the paths */
    WANDERING
}

package zookeep.staffing.model;

/**
 * Queue counts for health checks and logging.
 */
public record SchedulerStats(int queued, int active, int zones) {
}

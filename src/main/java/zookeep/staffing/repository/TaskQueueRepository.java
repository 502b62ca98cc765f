package zookeep.staffing.repository;

import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for queued tasks: one queue per role for every zone, plus one
 * global queue per role. Holds no active tasks and applies no ordering
 * policy beyond insertion order.
 */
public interface TaskQueueRepository {

    /**
     * Create the queue pair for a zone if it does not exist yet.
     *
     * @param zoneId the zone ID
     * @return true if the zone was created, false if it already existed
     */
    boolean ensureZone(int zoneId);

    /**
     * Check whether a zone has a queue pair.
     *
     * @param zoneId the zone ID
     * @return true if registered
     */
    boolean hasZone(int zoneId);

    /**
     * Append a task to the tail of the queue selected by its role and zone.
     * A zone queue is created on first use.
     *
     * @param task the task to queue
     */
    void append(Task task);

    /**
     * Remove a task from the queue selected by its role and zone.
     *
     * @param task the task to remove
     * @return true if it was queued
     */
    boolean remove(Task task);

    /**
     * Remove a task by ID from whichever queue holds it.
     *
     * @param taskId the task ID
     * @return the removed task, if any
     */
    Optional<Task> removeById(long taskId);

    /**
     * Tasks a worker of the given role could claim: the role queue of each
     * listed zone that exists, followed by the global role queue.
     *
     * @param role    the worker's role
     * @param zoneIds zones the worker is assigned to
     * @return candidate tasks in queue order
     */
    List<Task> findCandidates(StaffRole role, Collection<Integer> zoneIds);

    /**
     * All queued tasks for a zone (both roles).
     *
     * @param zoneId the zone ID
     * @return tasks, empty if the zone is unknown
     */
    List<Task> findByZone(int zoneId);

    /**
     * Every queued task across all zone and global queues.
     *
     * @return tasks
     */
    List<Task> findAll();

    /**
     * Drop a zone's queue pair together with its tasks.
     *
     * @param zoneId the zone ID
     * @return the tasks that were dropped
     */
    List<Task> dropZone(int zoneId);

    /**
     * Registered zone IDs.
     *
     * @return zone IDs
     */
    Set<Integer> zoneIds();

    /**
     * Number of queued tasks.
     *
     * @return count
     */
    int size();
}

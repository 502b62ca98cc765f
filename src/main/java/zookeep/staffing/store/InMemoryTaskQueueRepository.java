package zookeep.staffing.store;

import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;
import zookeep.staffing.repository.TaskQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of TaskQueueRepository.
 * Not thread-safe: callers serialize access (TaskService holds one lock).
 */
public class InMemoryTaskQueueRepository implements TaskQueueRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskQueueRepository.class);

    private final Map<Integer, ZoneQueues> zoneQueues = new LinkedHashMap<>();
    private final ZoneQueues globalQueues = new ZoneQueues();

    @Override
    public boolean ensureZone(int zoneId) {
        if (zoneQueues.containsKey(zoneId)) {
            return false;
        }
        zoneQueues.put(zoneId, new ZoneQueues());
        log.debug("Created task queues for zone {}", zoneId);
        return true;
    }

    @Override
    public boolean hasZone(int zoneId) {
        return zoneQueues.containsKey(zoneId);
    }

    @Override
    public void append(Task task) {
        queueFor(task).add(task);
    }

    @Override
    public boolean remove(Task task) {
        ZoneQueues queues = task.isGlobal() ? globalQueues : zoneQueues.get(task.zoneId());
        if (queues == null) {
            return false;
        }
        return queues.queue(task.role()).removeIf(t -> t.id() == task.id());
    }

    @Override
    public Optional<Task> removeById(long taskId) {
        for (ZoneQueues queues : zoneQueues.values()) {
            Optional<Task> removed = queues.removeById(taskId);
            if (removed.isPresent()) {
                return removed;
            }
        }
        return globalQueues.removeById(taskId);
    }

    @Override
    public List<Task> findCandidates(StaffRole role, Collection<Integer> zoneIds) {
        List<Task> candidates = new ArrayList<>();
        for (Integer zoneId : new LinkedHashSet<>(zoneIds)) {
            ZoneQueues queues = zoneQueues.get(zoneId);
            if (queues == null) {
                continue;
            }
            candidates.addAll(queues.queue(role));
        }
        candidates.addAll(globalQueues.queue(role));
        return candidates;
    }

    @Override
    public List<Task> findByZone(int zoneId) {
        ZoneQueues queues = zoneQueues.get(zoneId);
        if (queues == null) {
            return List.of();
        }
        List<Task> tasks = new ArrayList<>();
        queues.copyTo(tasks);
        return tasks;
    }

    @Override
    public List<Task> findAll() {
        List<Task> tasks = new ArrayList<>();
        for (ZoneQueues queues : zoneQueues.values()) {
            queues.copyTo(tasks);
        }
        globalQueues.copyTo(tasks);
        return tasks;
    }

    @Override
    public List<Task> dropZone(int zoneId) {
        ZoneQueues removed = zoneQueues.remove(zoneId);
        if (removed == null) {
            return List.of();
        }
        List<Task> dropped = new ArrayList<>();
        removed.copyTo(dropped);
        return dropped;
    }

    @Override
    public Set<Integer> zoneIds() {
        return Set.copyOf(zoneQueues.keySet());
    }

    @Override
    public int size() {
        int n = globalQueues.size();
        for (ZoneQueues queues : zoneQueues.values()) {
            n += queues.size();
        }
        return n;
    }

    private List<Task> queueFor(Task task) {
        if (task.isGlobal()) {
            return globalQueues.queue(task.role());
        }
        ensureZone(task.zoneId());
        return zoneQueues.get(task.zoneId()).queue(task.role());
    }
}

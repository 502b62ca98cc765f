package zookeep.staffing.store;

import zookeep.staffing.model.StaffRole;
import zookeep.staffing.model.Task;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One insertion-ordered queue per staff role.
 */
final class ZoneQueues {

    private final Map<StaffRole, List<Task>> queues = new EnumMap<>(StaffRole.class);

    ZoneQueues() {
        for (StaffRole role : StaffRole.values()) {
            queues.put(role, new ArrayList<>());
        }
    }

    List<Task> queue(StaffRole role) {
        return queues.get(role);
    }

    Optional<Task> removeById(long taskId) {
        for (List<Task> queue : queues.values()) {
            for (Iterator<Task> it = queue.iterator(); it.hasNext();) {
                Task task = it.next();
                if (task.id() == taskId) {
                    it.remove();
                    return Optional.of(task);
                }
            }
        }
        return Optional.empty();
    }

    void copyTo(List<Task> out) {
        for (List<Task> queue : queues.values()) {
            out.addAll(queue);
        }
    }

    int size() {
        int n = 0;
        for (List<Task> queue : queues.values()) {
            n += queue.size();
        }
        return n;
    }
}

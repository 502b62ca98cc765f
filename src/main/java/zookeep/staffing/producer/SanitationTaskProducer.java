package zookeep.staffing.producer;

import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.PayloadFilter;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.world.Bin;
import zookeep.staffing.world.Zone;
import zookeep.staffing.world.ZooWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Files cleaning tasks: waste inside exhibits for zookeepers, litter and full
 * bins along the paths for maintenance.
 */
public class SanitationTaskProducer implements TaskProducer {

    private static final Logger log = LoggerFactory.getLogger(SanitationTaskProducer.class);

    private final ZooWorld world;
    private final TaskService tasks;

    public SanitationTaskProducer(ZooWorld world, TaskService tasks) {
        this.world = world;
        this.tasks = tasks;
    }

    @Override
    public int produce() {
        return produceWaste() + produceLitter() + produceBins();
    }

    private int produceWaste() {
        int added = 0;
        for (GridPos tile : world.wasteInOrder()) {
            Optional<Zone> zone = world.zoneAt(tile);
            if (zone.isEmpty()) {
                continue;
            }
            if (tasks.hasTaskFor(TaskType.CLEAN_WASTE, zone.get().id(), PayloadFilter.tile(tile))) {
                continue;
            }
            tasks.addTask(TaskInput.of(new TaskPayload.CleanWaste(tile), Priority.NORMAL, tile, zone.get().id()));
            added++;
        }
        if (added > 0) {
            log.debug("Filed {} waste tasks", added);
        }
        return added;
    }

    private int produceLitter() {
        int added = 0;
        for (GridPos tile : world.litterInOrder()) {
            if (!world.isWalkable(tile)) {
                continue;
            }
            if (tasks.hasTaskFor(TaskType.CLEAR_LITTER, null, PayloadFilter.tile(tile))) {
                continue;
            }
            tasks.addTask(TaskInput.of(new TaskPayload.ClearLitter(tile), Priority.LOW, tile, null));
            added++;
        }
        return added;
    }

    private int produceBins() {
        int added = 0;
        for (Bin bin : world.bins()) {
            if (!bin.needsEmptying()) {
                continue;
            }
            if (tasks.hasTaskFor(TaskType.EMPTY_BIN, null, PayloadFilter.bin(bin.id()))) {
                continue;
            }
            int priority = bin.isCompletelyFull() ? Priority.URGENT : Priority.NORMAL;
            long taskId = tasks.addTask(TaskInput.of(new TaskPayload.EmptyBin(bin.id()), priority, bin.position(), null));
            log.debug("Bin task {} for bin {} at {}%", taskId, bin.id(), Math.round(bin.fill()));
            added++;
        }
        return added;
    }
}

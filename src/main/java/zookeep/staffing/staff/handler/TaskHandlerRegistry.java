package zookeep.staffing.staff.handler;

import zookeep.staffing.model.Task;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.world.WorldActions;

import java.util.EnumMap;
import java.util.Map;

/**
 * Task type to handler lookup used by workers at the end of their work time.
 */
public final class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler<?>> handlers = new EnumMap<>(TaskType.class);

    /**
     * Registry with a handler for every task type.
     */
    public static TaskHandlerRegistry defaults(WorldActions world) {
        return new TaskHandlerRegistry()
                .register(new FeedAnimalsHandler(world))
                .register(new CleanWasteHandler(world))
                .register(new RepairFenceHandler(world))
                .register(new ClearLitterHandler(world))
                .register(new EmptyBinHandler(world));
    }

    public TaskHandlerRegistry register(TaskHandler<?> handler) {
        if (!handler.payloadType().equals(handler.type().payloadType())) {
            throw new IllegalArgumentException("handler for " + handler.type()
                    + " expects " + handler.payloadType().getSimpleName());
        }
        handlers.put(handler.type(), handler);
        return this;
    }

    public boolean supports(TaskType type) {
        return handlers.containsKey(type);
    }

    /**
     * Run the handler for the task's type.
     *
     * @throws IllegalStateException if no handler is registered for the type
     */
    public void dispatch(Task task, TaskContext context) {
        TaskHandler<?> handler = handlers.get(task.type());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for task type " + task.type()
                    + " (task " + task.id() + ")");
        }
        perform(handler, task.payload(), context);
    }

    private static <P extends TaskPayload> void perform(TaskHandler<P> handler, TaskPayload payload,
            TaskContext context) {
        handler.perform(handler.payloadType().cast(payload), context);
    }
}

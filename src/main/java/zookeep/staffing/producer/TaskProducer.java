package zookeep.staffing.producer;

/**
 * Watches the world for one kind of unmet need and files tasks for it.
 * Producers only talk to the scheduler through addTask and hasTaskFor.
 */
public interface TaskProducer {

    /**
     * Scan the world once.
     *
     * @return number of tasks added
     */
    int produce();
}

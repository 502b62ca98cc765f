package zookeep.staffing.producer;

import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.PayloadFilter;
import zookeep.staffing.model.Priority;
import zookeep.staffing.model.TaskInput;
import zookeep.staffing.model.TaskPayload;
import zookeep.staffing.model.TaskType;
import zookeep.staffing.service.TaskService;
import zookeep.staffing.world.Animal;
import zookeep.staffing.world.FoodPile;
import zookeep.staffing.world.Zone;
import zookeep.staffing.world.ZooWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Files a feeding task for every zone with hungry animals and too little food down.
 */
public class FeedingTaskProducer implements TaskProducer {

    private static final Logger log = LoggerFactory.getLogger(FeedingTaskProducer.class);

    /** Food already in the zone that counts as enough, per animal */
    static final int FOOD_PER_ANIMAL = 100;
    static final double URGENT_BELOW = 20;
    static final double LOW_ABOVE = 40;
    static final int MAX_RETRIES = 3;

    private final ZooWorld world;
    private final TaskService tasks;
    private final Random random;

    public FeedingTaskProducer(ZooWorld world, TaskService tasks, Random random) {
        this.world = world;
        this.tasks = tasks;
        this.random = random;
    }

    @Override
    public int produce() {
        int added = 0;
        for (Zone zone : world.zones()) {
            if (produceFor(zone)) {
                added++;
            }
        }
        return added;
    }

    private boolean produceFor(Zone zone) {
        List<Animal> animals = world.animalsIn(zone.id());
        if (animals.isEmpty()) {
            return false;
        }
        boolean anyHungry = animals.stream().anyMatch(a -> a.hunger() < Animal.HUNGRY_BELOW);
        if (!anyHungry) {
            return false;
        }

        int foodDown = world.foodPilesIn(zone.id()).stream().mapToInt(FoodPile::amount).sum();
        if (foodDown >= animals.size() * FOOD_PER_ANIMAL) {
            return false;
        }

        Optional<GridPos> spot = findFoodSpot(zone);
        if (spot.isEmpty()) {
            log.debug("No free tile to put food down in zone {}", zone.id());
            return false;
        }

        Animal first = animals.get(0);
        if (tasks.hasTaskFor(TaskType.FEED_ANIMALS, zone.id(), PayloadFilter.animal(first.id()))) {
            return false;
        }

        FoodType food = first.preferredFood() != null ? first.preferredFood() : FoodType.MEAT;
        double lowest = animals.stream().mapToDouble(Animal::hunger).min().orElse(100);

        TaskInput input = new TaskInput(TaskType.FEED_ANIMALS, priorityFor(lowest), spot.get(), zone.id(),
                new TaskPayload.FeedAnimals(food, first.id()), MAX_RETRIES);
        long taskId = tasks.addTask(input);
        log.info("Feeding task {} for zone {} ({}, lowest hunger {})",
                taskId, zone.id(), Priority.label(input.priority()), Math.round(lowest));
        return true;
    }

    static int priorityFor(double lowestHunger) {
        if (lowestHunger < URGENT_BELOW) {
            return Priority.URGENT;
        }
        if (lowestHunger > LOW_ABOVE) {
            return Priority.LOW;
        }
        return Priority.NORMAL;
    }

    /**
     * Random interior tile that is not water, not path and has no food on it.
     */
    private Optional<GridPos> findFoodSpot(Zone zone) {
        List<GridPos> tiles = new ArrayList<>(zone.interior());
        tiles.sort((a, b) -> a.y() != b.y() ? Integer.compare(a.y(), b.y()) : Integer.compare(a.x(), b.x()));
        Collections.shuffle(tiles, random);
        for (GridPos tile : tiles) {
            if (world.isWater(tile) || world.isPath(tile) || world.hasFoodAt(tile)) {
                continue;
            }
            return Optional.of(tile);
        }
        return Optional.empty();
    }
}

package zookeep.staffing.world;

import zookeep.staffing.model.FenceCondition;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.path.NavigationGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Live state of the zoo: terrain, fences, exhibits, animals and the mess
 * they and the visitors leave behind.
 *
 * Not thread-safe. Owned by the simulation thread; the path service only
 * ever sees {@link #navigationSnapshot()} copies.
 */
public class ZooWorld implements WorldActions {

    private static final Logger log = LoggerFactory.getLogger(ZooWorld.class);

    /** Seconds before a fresh fence wears one stage, plus or minus the variance */
    static final double FENCE_DEGRADE_BASE = 300;
    static final double FENCE_DEGRADE_VARIANCE = 200;

    /** Chance per animal per second of leaving waste on its tile */
    static final double WASTE_RATE = 0.005;
    /** Chance per second of a visitor dropping litter somewhere on the paths */
    static final double LITTER_RATE = 0.01;
    static final double BIN_FILL_RATE = 0.5;

    private final int width;
    private final int height;
    private final Random random;

    private final Set<GridPos> water = new HashSet<>();
    private final Set<GridPos> paths = new LinkedHashSet<>();
    private final Map<FenceEdge, FenceWear> fences = new LinkedHashMap<>();
    private final Set<FenceEdge> gates = new HashSet<>();

    private final Map<Integer, Zone> zones = new LinkedHashMap<>();
    private final Map<Long, Animal> animals = new LinkedHashMap<>();
    private final Map<Long, FoodPile> foodPiles = new LinkedHashMap<>();
    private final Map<Long, Bin> bins = new LinkedHashMap<>();
    private final Set<GridPos> waste = new LinkedHashSet<>();
    private final Set<GridPos> litter = new LinkedHashSet<>();

    private int nextZoneId = 1;
    private long nextAnimalId = 1;
    private long nextFoodId = 1;
    private long nextBinId = 1;

    private NavigationGrid snapshot;

    private static final class FenceWear {
        FenceCondition condition = FenceCondition.GOOD;
        double degradeTimer;
    }

    public ZooWorld(int width, int height, Random random) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("world size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.random = Objects.requireNonNull(random, "random");
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    // =========================================
    // Terrain
    // =========================================

    public void addWater(GridPos pos) {
        requireInBounds(pos);
        water.add(pos);
        invalidateSnapshot();
    }

    public void addPath(GridPos pos) {
        requireInBounds(pos);
        paths.add(pos);
        invalidateSnapshot();
    }

    public boolean inBounds(GridPos pos) {
        return pos.x() >= 0 && pos.y() >= 0 && pos.x() < width && pos.y() < height;
    }

    public boolean isWater(GridPos pos) {
        return water.contains(pos);
    }

    public boolean isPath(GridPos pos) {
        return paths.contains(pos);
    }

    /** In bounds and not water */
    public boolean isWalkable(GridPos pos) {
        return inBounds(pos) && !water.contains(pos);
    }

    // =========================================
    // Fences
    // =========================================

    public void addFence(FenceEdge fence) {
        requireInBounds(fence.tile());
        if (!fences.containsKey(fence)) {
            FenceWear wear = new FenceWear();
            wear.degradeTimer = randomDegradeTimer();
            fences.put(fence, wear);
            invalidateSnapshot();
        }
    }

    public void removeFence(FenceEdge fence) {
        if (fences.remove(fence) != null) {
            gates.remove(fence);
            invalidateSnapshot();
        }
    }

    public boolean hasFence(FenceEdge fence) {
        return fences.containsKey(fence);
    }

    public Optional<FenceCondition> fenceCondition(FenceEdge fence) {
        FenceWear wear = fences.get(fence);
        return wear == null ? Optional.empty() : Optional.of(wear.condition);
    }

    /** Condition of every fence, in placement order */
    public Map<FenceEdge, FenceCondition> fenceConditions() {
        Map<FenceEdge, FenceCondition> out = new LinkedHashMap<>();
        fences.forEach((edge, wear) -> out.put(edge, wear.condition));
        return out;
    }

    public boolean isGate(FenceEdge fence) {
        return gates.contains(fence);
    }

    @Override
    public boolean setFenceCondition(FenceEdge fence, FenceCondition condition) {
        FenceWear wear = fences.get(fence);
        if (wear == null) {
            log.debug("No fence at {} to set {}", fence, condition);
            return false;
        }
        wear.condition = Objects.requireNonNull(condition, "condition");
        if (condition == FenceCondition.GOOD) {
            wear.degradeTimer = randomDegradeTimer();
        }
        invalidateSnapshot();
        return true;
    }

    // =========================================
    // Zones and animals
    // =========================================

    /**
     * Create an exhibit. Perimeter fences are placed if missing; the gate, if
     * any, becomes passable for staff.
     */
    public Zone createZone(String name, Collection<GridPos> interior, Collection<FenceEdge> perimeter, FenceEdge gate) {
        Zone zone = new Zone(nextZoneId++, name, new LinkedHashSet<>(interior), new LinkedHashSet<>(perimeter), gate);
        for (FenceEdge fence : zone.perimeter()) {
            addFence(fence);
        }
        if (gate != null) {
            gates.add(gate);
            invalidateSnapshot();
        }
        zones.put(zone.id(), zone);
        log.info("Zone {} '{}' created with {} tiles", zone.id(), name, zone.interior().size());
        return zone;
    }

    /**
     * Remove an exhibit with its animals, food and waste. Fences stay standing.
     */
    public boolean removeZone(int zoneId) {
        Zone zone = zones.remove(zoneId);
        if (zone == null) {
            return false;
        }
        animals.values().removeIf(a -> a.zoneId() == zoneId);
        foodPiles.values().removeIf(p -> zone.contains(p.position()));
        waste.removeIf(zone::contains);
        gates.remove(zone.gate());
        invalidateSnapshot();
        log.info("Zone {} '{}' removed", zoneId, zone.name());
        return true;
    }

    public Optional<Zone> zone(int zoneId) {
        return Optional.ofNullable(zones.get(zoneId));
    }

    public List<Zone> zones() {
        return List.copyOf(zones.values());
    }

    public Optional<Zone> zoneAt(GridPos pos) {
        for (Zone zone : zones.values()) {
            if (zone.contains(pos)) {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    /** Zone whose perimeter holds the fence */
    public Optional<Zone> zoneByFence(FenceEdge fence) {
        for (Zone zone : zones.values()) {
            if (zone.hasFence(fence)) {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    public Animal addAnimal(int zoneId, GridPos pos, FoodType preferredFood) {
        Zone zone = zones.get(zoneId);
        if (zone == null) {
            throw new IllegalArgumentException("Unknown zone: " + zoneId);
        }
        if (!zone.contains(pos)) {
            throw new IllegalArgumentException(pos + " is outside zone " + zoneId);
        }
        Animal animal = new Animal(nextAnimalId++, zoneId, pos, preferredFood, Animal.DEFAULT_HUNGER_DECAY);
        animals.put(animal.id(), animal);
        return animal;
    }

    public Optional<Animal> animal(long animalId) {
        return Optional.ofNullable(animals.get(animalId));
    }

    /** Animals of a zone, in arrival order */
    public List<Animal> animalsIn(int zoneId) {
        List<Animal> out = new ArrayList<>();
        for (Animal animal : animals.values()) {
            if (animal.zoneId() == zoneId) {
                out.add(animal);
            }
        }
        return out;
    }

    // =========================================
    // Food, waste, litter, bins
    // =========================================

    @Override
    public void placeFood(GridPos pos, FoodType type, int amount) {
        requireInBounds(pos);
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        FoodPile pile = new FoodPile(nextFoodId++, pos, type, amount);
        foodPiles.put(pile.id(), pile);
        log.debug("Placed {} {} at {}", amount, type, pos);
    }

    public List<FoodPile> foodPilesIn(int zoneId) {
        Zone zone = zones.get(zoneId);
        if (zone == null) {
            return List.of();
        }
        List<FoodPile> out = new ArrayList<>();
        for (FoodPile pile : foodPiles.values()) {
            if (zone.contains(pile.position())) {
                out.add(pile);
            }
        }
        return out;
    }

    public boolean hasFoodAt(GridPos pos) {
        for (FoodPile pile : foodPiles.values()) {
            if (pile.position().equals(pos)) {
                return true;
            }
        }
        return false;
    }

    public void addWaste(GridPos pos) {
        requireInBounds(pos);
        waste.add(pos);
    }

    public Set<GridPos> wasteTiles() {
        return Set.copyOf(waste);
    }

    /** Waste tiles in the order they appeared */
    public List<GridPos> wasteInOrder() {
        return List.copyOf(waste);
    }

    @Override
    public boolean clearWaste(GridPos pos) {
        return waste.remove(pos);
    }

    public void addLitter(GridPos pos) {
        requireInBounds(pos);
        litter.add(pos);
    }

    public List<GridPos> litterInOrder() {
        return List.copyOf(litter);
    }

    @Override
    public boolean clearLitter(GridPos pos) {
        return litter.remove(pos);
    }

    public Bin addBin(GridPos pos) {
        requireInBounds(pos);
        Bin bin = new Bin(nextBinId++, pos, BIN_FILL_RATE);
        bins.put(bin.id(), bin);
        return bin;
    }

    public Optional<Bin> bin(long binId) {
        return Optional.ofNullable(bins.get(binId));
    }

    public List<Bin> bins() {
        return List.copyOf(bins.values());
    }

    @Override
    public boolean emptyBin(long binId) {
        Bin bin = bins.get(binId);
        if (bin == null) {
            return false;
        }
        bin.empty();
        return true;
    }

    // =========================================
    // Simulation
    // =========================================

    /**
     * Advance the world: animals get hungrier and eat, fences wear, waste,
     * litter and bins accumulate.
     */
    public void tick(double dt) {
        if (dt <= 0) {
            return;
        }
        updateAnimals(dt);
        updateFences(dt);
        updateMess(dt);
    }

    private void updateAnimals(double dt) {
        for (Animal animal : animals.values()) {
            animal.decay(dt);
            FoodPile pile = nearestPile(animal);
            if (pile == null) {
                animal.stopEating();
            } else if (animal.isEating() || animal.hunger() < Animal.HUNGRY_BELOW) {
                animal.moveTo(pile.position());
                animal.eatFrom(pile, dt);
            }
            if (random.nextDouble() < WASTE_RATE * dt) {
                waste.add(animal.position());
            }
        }
        for (Iterator<FoodPile> it = foodPiles.values().iterator(); it.hasNext();) {
            if (it.next().isEmpty()) {
                it.remove();
            }
        }
    }

    private FoodPile nearestPile(Animal animal) {
        Zone zone = zones.get(animal.zoneId());
        if (zone == null) {
            return null;
        }
        FoodPile best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (FoodPile pile : foodPiles.values()) {
            if (pile.isEmpty() || !zone.contains(pile.position())) {
                continue;
            }
            int d = animal.position().manhattanDistance(pile.position());
            if (d < bestDistance) {
                best = pile;
                bestDistance = d;
            }
        }
        return best;
    }

    private void updateFences(double dt) {
        boolean changed = false;
        for (Map.Entry<FenceEdge, FenceWear> entry : fences.entrySet()) {
            FenceWear wear = entry.getValue();
            if (wear.condition == FenceCondition.FAILED) {
                continue;
            }
            wear.degradeTimer -= dt;
            if (wear.degradeTimer <= 0) {
                wear.condition = wear.condition.degrade();
                // Worn fences degrade faster
                double speedUp = switch (wear.condition) {
                    case LIGHT_DAMAGE -> 0.8;
                    case DAMAGED -> 0.6;
                    default -> 1.0;
                };
                wear.degradeTimer = randomDegradeTimer() * speedUp;
                changed = true;
                log.debug("Fence {} degraded to {}", entry.getKey(), wear.condition);
            }
        }
        if (changed) {
            invalidateSnapshot();
        }
    }

    private void updateMess(double dt) {
        for (Bin bin : bins.values()) {
            bin.fillUp(dt);
        }
        if (!paths.isEmpty() && random.nextDouble() < LITTER_RATE * dt) {
            List<GridPos> candidates = new ArrayList<>(paths);
            litter.add(candidates.get(random.nextInt(candidates.size())));
        }
    }

    private double randomDegradeTimer() {
        return FENCE_DEGRADE_BASE + (random.nextDouble() * 2 - 1) * FENCE_DEGRADE_VARIANCE;
    }

    // =========================================
    // Navigation
    // =========================================

    /**
     * Immutable walkability view for the path service. Rebuilt only after
     * terrain, fence or gate changes.
     */
    public NavigationGrid navigationSnapshot() {
        NavigationGrid current = snapshot;
        if (current == null) {
            current = new NavigationGrid(width, height, water, paths, fenceConditions(), gates);
            snapshot = current;
        }
        return current;
    }

    private void invalidateSnapshot() {
        snapshot = null;
    }

    private void requireInBounds(GridPos pos) {
        if (!inBounds(pos)) {
            throw new IllegalArgumentException(pos + " is outside the " + width + "x" + height + " world");
        }
    }
}

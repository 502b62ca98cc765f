package zookeep.staffing.world;

import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;

/**
 * An animal living in a zone. Hunger runs from 100 (full) down to 0.
 */
public final class Animal {

    /** Hunger below which an animal goes looking for food */
    public static final double HUNGRY_BELOW = 50;
    /** Hunger at which an eating animal stops */
    public static final double SATED_AT = 80;

    static final double DEFAULT_HUNGER_DECAY = 0.5;
    static final double EAT_INTERVAL_SECONDS = 2.0;
    static final int BITE = 20;

    private final long id;
    private final int zoneId;
    private final FoodType preferredFood;
    private final double hungerDecay;
    private GridPos position;
    private double hunger = 100;
    private boolean eating;
    private double eatTimer;

    Animal(long id, int zoneId, GridPos position, FoodType preferredFood, double hungerDecay) {
        this.id = id;
        this.zoneId = zoneId;
        this.position = position;
        this.preferredFood = preferredFood;
        this.hungerDecay = hungerDecay;
    }

    public long id() {
        return id;
    }

    public int zoneId() {
        return zoneId;
    }

    public GridPos position() {
        return position;
    }

    public FoodType preferredFood() {
        return preferredFood;
    }

    public double hunger() {
        return hunger;
    }

    public boolean isEating() {
        return eating;
    }

    public void setHunger(double hunger) {
        this.hunger = Math.max(0, Math.min(100, hunger));
    }

    void moveTo(GridPos pos) {
        this.position = pos;
    }

    void decay(double dt) {
        hunger = Math.max(0, hunger - hungerDecay * dt);
    }

    /**
     * Eat from a pile in bites. Returns true while the animal keeps eating.
     */
    boolean eatFrom(FoodPile pile, double dt) {
        if (!eating) {
            if (hunger >= HUNGRY_BELOW) {
                return false;
            }
            eating = true;
            eatTimer = 0;
        }
        eatTimer += dt;
        while (eatTimer >= EAT_INTERVAL_SECONDS && eating) {
            eatTimer -= EAT_INTERVAL_SECONDS;
            int consumed = pile.consume(BITE);
            hunger = Math.min(100, hunger + consumed * 0.5);
            if (hunger >= SATED_AT || pile.isEmpty()) {
                eating = false;
            }
        }
        return eating;
    }

    void stopEating() {
        eating = false;
    }

    @Override
    public String toString() {
        return "Animal{id=" + id + ", zone=" + zoneId + ", hunger=" + Math.round(hunger) + "}";
    }
}

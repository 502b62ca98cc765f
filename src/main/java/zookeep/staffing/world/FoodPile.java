package zookeep.staffing.world;

import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;

/**
 * Food put down by a zookeeper.
 */
public final class FoodPile {

    private final long id;
    private final GridPos position;
    private final FoodType foodType;
    private int amount;

    FoodPile(long id, GridPos position, FoodType foodType, int amount) {
        this.id = id;
        this.position = position;
        this.foodType = foodType;
        this.amount = amount;
    }

    public long id() {
        return id;
    }

    public GridPos position() {
        return position;
    }

    public FoodType foodType() {
        return foodType;
    }

    public int amount() {
        return amount;
    }

    public boolean isEmpty() {
        return amount <= 0;
    }

    int consume(int bite) {
        int consumed = Math.min(amount, bite);
        amount -= consumed;
        return consumed;
    }
}

package zookeep.staffing.world;

import zookeep.staffing.model.FenceCondition;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;

/**
 * World mutations staff perform when they finish a task.
 */
public interface WorldActions {

    /** Size of a freshly placed food pile */
    int DEFAULT_FOOD_AMOUNT = 500;

    void placeFood(GridPos pos, FoodType type, int amount);

    /**
     * @return false if there is no fence on that edge
     */
    boolean setFenceCondition(FenceEdge fence, FenceCondition condition);

    boolean clearWaste(GridPos pos);

    boolean clearLitter(GridPos pos);

    boolean emptyBin(long binId);
}

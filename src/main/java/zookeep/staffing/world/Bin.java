package zookeep.staffing.world;

import zookeep.staffing.model.GridPos;

/**
 * Garbage bin next to a path. Fill runs from 0 to {@link #CAPACITY}.
 */
public final class Bin {

    public static final double CAPACITY = 100;
    /** Fill level at which the bin asks to be emptied */
    public static final double FULL_THRESHOLD = 75;

    private final long id;
    private final GridPos position;
    private final double fillRate;
    private double fill;

    Bin(long id, GridPos position, double fillRate) {
        this.id = id;
        this.position = position;
        this.fillRate = fillRate;
    }

    public long id() {
        return id;
    }

    public GridPos position() {
        return position;
    }

    public double fill() {
        return fill;
    }

    public boolean needsEmptying() {
        return fill >= FULL_THRESHOLD;
    }

    public boolean isCompletelyFull() {
        return fill >= CAPACITY;
    }

    public void setFill(double fill) {
        this.fill = Math.max(0, Math.min(CAPACITY, fill));
    }

    void fillUp(double dt) {
        setFill(fill + fillRate * dt);
    }

    void empty() {
        fill = 0;
    }
}

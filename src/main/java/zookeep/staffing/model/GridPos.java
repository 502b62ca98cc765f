package zookeep.staffing.model;

/**
 * Logical tile coordinate in the world grid.
 */
public record GridPos(int x, int y) {

    public static GridPos of(int x, int y) {
        return new GridPos(x, y);
    }

    /** Manhattan distance to another tile */
    public int manhattanDistance(GridPos other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public GridPos offset(int dx, int dy) {
        return new GridPos(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}

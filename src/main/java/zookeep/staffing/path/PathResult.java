package zookeep.staffing.path;

import zookeep.staffing.model.GridPos;

import java.util.List;

/**
 * Outcome of a route query. {@code cells} excludes the start tile and ends
 * on the destination; it is empty when already there or when no route exists.
 */
public record PathResult(List<GridPos> cells, boolean found) {

    private static final PathResult NOT_FOUND = new PathResult(List.of(), false);

    public PathResult {
        cells = List.copyOf(cells);
    }

    public static PathResult of(List<GridPos> cells) {
        return new PathResult(cells, true);
    }

    public static PathResult notFound() {
        return NOT_FOUND;
    }

    /** A route that actually moves the walker */
    public boolean isUsable() {
        return found && !cells.isEmpty();
    }
}

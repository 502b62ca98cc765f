package zookeep.staffing.path;

import zookeep.staffing.model.EdgeDirection;
import zookeep.staffing.model.FenceCondition;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.GridPos;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable walkability snapshot of the world, safe to read from the
 * path-finding thread while the simulation keeps mutating the live world.
 */
public final class NavigationGrid {

    private final int width;
    private final int height;
    private final Set<GridPos> water;
    private final Set<GridPos> paths;
    private final Map<FenceEdge, FenceCondition> fences;
    private final Set<FenceEdge> gates;

    public NavigationGrid(int width, int height, Collection<GridPos> water, Collection<GridPos> paths,
            Map<FenceEdge, FenceCondition> fences, Collection<FenceEdge> gates) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.water = Set.copyOf(water);
        this.paths = Set.copyOf(paths);
        this.fences = Map.copyOf(fences);
        this.gates = Set.copyOf(gates);
    }

    /** Open field without obstacles */
    public static NavigationGrid open(int width, int height) {
        return new NavigationGrid(width, height, Set.of(), Set.of(), Map.of(), Set.of());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
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

    /** Whether a walker may stand on the tile */
    public boolean isWalkable(GridPos pos, boolean canUsePaths) {
        if (!inBounds(pos) || water.contains(pos)) {
            return false;
        }
        return canUsePaths || !paths.contains(pos);
    }

    /**
     * Whether a fence blocks the single step between two adjacent tiles.
     * FAILED fences are holes; gates open for walkers allowed through them.
     */
    public boolean isBlockedByFence(GridPos from, GridPos to, boolean canPassGates) {
        FenceEdge edge = edgeBetween(from, to);
        if (edge == null) {
            return false;
        }
        FenceCondition condition = fences.get(edge);
        if (condition == null || condition == FenceCondition.FAILED) {
            return false;
        }
        return !(canPassGates && gates.contains(edge));
    }

    /** Walkable neighbours of a tile in N, S, E, W order */
    public List<GridPos> neighbours(GridPos pos, boolean canUsePaths, boolean canPassGates) {
        List<GridPos> out = new ArrayList<>(4);
        for (EdgeDirection dir : EdgeDirection.values()) {
            GridPos next = pos.offset(dir.dx(), dir.dy());
            if (isWalkable(next, canUsePaths) && !isBlockedByFence(pos, next, canPassGates)) {
                out.add(next);
            }
        }
        return out;
    }

    /** Path tiles whose Manhattan distance to the center is at most radius */
    public List<GridPos> pathTilesWithin(GridPos center, int radius) {
        List<GridPos> out = new ArrayList<>();
        for (GridPos p : paths) {
            if (center.manhattanDistance(p) <= radius) {
                out.add(p);
            }
        }
        // Set iteration order is unspecified; keep results reproducible for seeded randomness
        out.sort((a, b) -> a.y() != b.y() ? Integer.compare(a.y(), b.y()) : Integer.compare(a.x(), b.x()));
        return out;
    }

    private static FenceEdge edgeBetween(GridPos from, GridPos to) {
        for (EdgeDirection dir : EdgeDirection.values()) {
            if (from.offset(dir.dx(), dir.dy()).equals(to)) {
                return FenceEdge.of(from, dir);
            }
        }
        return null;
    }
}

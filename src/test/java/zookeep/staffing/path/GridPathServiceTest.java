package zookeep.staffing.path;

import zookeep.staffing.model.EdgeDirection;
import zookeep.staffing.model.FenceCondition;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.GridPos;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class GridPathServiceTest {

    private static PathResult search(NavigationGrid grid, GridPos from, GridPos to) {
        return GridPathService.search(grid, PathRequest.forStaff("w1", from, to));
    }

    private static void assertContiguous(GridPos start, List<GridPos> cells) {
        GridPos prev = start;
        for (GridPos cell : cells) {
            assertEquals(1, prev.manhattanDistance(cell), "jump from " + prev + " to " + cell);
            prev = cell;
        }
    }

    @Test
    void straightLineOnOpenGrid() {
        PathResult result = search(NavigationGrid.open(10, 10), GridPos.of(0, 0), GridPos.of(4, 0));

        assertTrue(result.found());
        assertEquals(4, result.cells().size());
        assertEquals(GridPos.of(4, 0), result.cells().get(3));
        assertContiguous(GridPos.of(0, 0), result.cells());
    }

    @Test
    void alreadyThereIsFoundButNotUsable() {
        PathResult result = search(NavigationGrid.open(5, 5), GridPos.of(2, 2), GridPos.of(2, 2));

        assertTrue(result.found());
        assertTrue(result.cells().isEmpty());
        assertFalse(result.isUsable());
    }

    @Test
    void waterGoalIsUnreachable() {
        NavigationGrid grid = new NavigationGrid(5, 5, Set.of(GridPos.of(3, 3)), Set.of(), Map.of(), Set.of());

        assertFalse(search(grid, GridPos.of(0, 0), GridPos.of(3, 3)).found());
    }

    @Test
    void outOfBoundsGoalIsUnreachable() {
        assertFalse(search(NavigationGrid.open(5, 5), GridPos.of(0, 0), GridPos.of(9, 9)).found());
    }

    @Test
    void routesAroundWater() {
        NavigationGrid grid = new NavigationGrid(5, 3,
                Set.of(GridPos.of(2, 0), GridPos.of(2, 1)), Set.of(), Map.of(), Set.of());

        PathResult result = search(grid, GridPos.of(0, 0), GridPos.of(4, 0));

        assertTrue(result.found());
        assertTrue(result.cells().contains(GridPos.of(2, 2)));
        assertContiguous(GridPos.of(0, 0), result.cells());
    }

    @Test
    @DisplayName("A closed pen is unreachable; its gate lets staff through")
    void fencesAndGates() {
        // 1x1 pen at (2,2) fenced on all four sides
        Map<FenceEdge, FenceCondition> fences = new HashMap<>();
        FenceEdge gate = FenceEdge.of(2, 2, EdgeDirection.SOUTH);
        fences.put(FenceEdge.of(2, 2, EdgeDirection.NORTH), FenceCondition.GOOD);
        fences.put(FenceEdge.of(2, 2, EdgeDirection.EAST), FenceCondition.GOOD);
        fences.put(FenceEdge.of(2, 2, EdgeDirection.WEST), FenceCondition.GOOD);
        fences.put(gate, FenceCondition.GOOD);

        NavigationGrid closed = new NavigationGrid(5, 5, Set.of(), Set.of(), fences, Set.of());
        assertFalse(search(closed, GridPos.of(0, 0), GridPos.of(2, 2)).found());

        NavigationGrid gated = new NavigationGrid(5, 5, Set.of(), Set.of(), fences, Set.of(gate));
        PathResult result = search(gated, GridPos.of(0, 0), GridPos.of(2, 2));
        assertTrue(result.found());
        assertEquals(GridPos.of(2, 3), result.cells().get(result.cells().size() - 2));

        PathResult noGates = GridPathService.search(gated,
                new PathRequest("w1", GridPos.of(0, 0), GridPos.of(2, 2), true, false));
        assertFalse(noGates.found());
    }

    @Test
    void failedFenceIsAHole() {
        Map<FenceEdge, FenceCondition> fences = new HashMap<>();
        fences.put(FenceEdge.of(2, 2, EdgeDirection.NORTH), FenceCondition.GOOD);
        fences.put(FenceEdge.of(2, 2, EdgeDirection.EAST), FenceCondition.GOOD);
        fences.put(FenceEdge.of(2, 2, EdgeDirection.WEST), FenceCondition.FAILED);
        fences.put(FenceEdge.of(2, 2, EdgeDirection.SOUTH), FenceCondition.DAMAGED);

        NavigationGrid grid = new NavigationGrid(5, 5, Set.of(), Set.of(), fences, Set.of());

        assertTrue(search(grid, GridPos.of(0, 2), GridPos.of(2, 2)).found());
    }

    @Test
    void pathTilesOnlyWhenAllowed() {
        NavigationGrid grid = new NavigationGrid(3, 1, Set.of(), Set.of(GridPos.of(1, 0)), Map.of(), Set.of());

        assertTrue(search(grid, GridPos.of(0, 0), GridPos.of(2, 0)).found());
        assertFalse(GridPathService.search(grid,
                new PathRequest("guest", GridPos.of(0, 0), GridPos.of(2, 0), false, true)).found());
    }

    @Test
    void findPathCompletesOnExecutor() {
        try (GridPathService service = new GridPathService(() -> NavigationGrid.open(6, 6), Runnable::run)) {
            CompletableFuture<PathResult> future = service.findPath(
                    PathRequest.forStaff("w1", GridPos.of(0, 0), GridPos.of(5, 5)));

            assertTrue(future.isDone());
            assertEquals(10, future.join().cells().size());
        }
    }

    @Test
    void pathTilesWithinIsSortedAndBounded() {
        NavigationGrid grid = new NavigationGrid(10, 10, Set.of(),
                Set.of(GridPos.of(5, 5), GridPos.of(1, 0), GridPos.of(0, 1)), Map.of(), Set.of());

        assertEquals(List.of(GridPos.of(1, 0), GridPos.of(0, 1)), grid.pathTilesWithin(GridPos.of(0, 0), 2));
    }
}

package zookeep.staffing.path;

import zookeep.staffing.model.GridPos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Breadth-first route finding on a background thread.
 * The grid snapshot is taken on the caller's thread when the request is made,
 * so the search never sees the world change under it.
 */
public class GridPathService implements PathService {

    private static final Logger log = LoggerFactory.getLogger(GridPathService.class);

    /** Upper bound on expanded tiles per search */
    public static final int MAX_SEARCH_NODES = 20_000;

    private final Supplier<NavigationGrid> gridSource;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    /**
     * Service with its own daemon search thread.
     */
    public GridPathService(Supplier<NavigationGrid> gridSource) {
        this.gridSource = Objects.requireNonNull(gridSource, "gridSource");
        this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "zookeep-pathfinder");
            t.setDaemon(true);
            return t;
        });
        this.executor = ownedExecutor;
    }

    /**
     * Service running searches on a caller-supplied executor (tests pass a direct one).
     */
    public GridPathService(Supplier<NavigationGrid> gridSource, Executor executor) {
        this.gridSource = Objects.requireNonNull(gridSource, "gridSource");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = null;
    }

    @Override
    public CompletableFuture<PathResult> findPath(PathRequest request) {
        NavigationGrid grid = gridSource.get();
        return CompletableFuture.supplyAsync(() -> search(grid, request), executor);
    }

    /**
     * Shortest 4-neighbour route from {@code request.from()} to {@code request.to()}.
     */
    static PathResult search(NavigationGrid grid, PathRequest request) {
        GridPos start = request.from();
        GridPos goal = request.to();

        if (start.equals(goal)) {
            return PathResult.of(List.of());
        }
        if (!grid.isWalkable(goal, request.canUsePaths())) {
            return PathResult.notFound();
        }

        Map<GridPos, GridPos> cameFrom = new HashMap<>();
        ArrayDeque<GridPos> open = new ArrayDeque<>();
        cameFrom.put(start, start);
        open.add(start);

        int expanded = 0;
        while (!open.isEmpty()) {
            GridPos current = open.poll();
            if (current.equals(goal)) {
                return PathResult.of(reconstruct(cameFrom, start, goal));
            }
            if (++expanded > MAX_SEARCH_NODES) {
                log.debug("Search for {} gave up after {} tiles ({} -> {})",
                        request.workerId(), expanded, start, goal);
                return PathResult.notFound();
            }
            for (GridPos next : grid.neighbours(current, request.canUsePaths(), request.canPassGates())) {
                if (!cameFrom.containsKey(next)) {
                    cameFrom.put(next, current);
                    open.add(next);
                }
            }
        }
        return PathResult.notFound();
    }

    private static List<GridPos> reconstruct(Map<GridPos, GridPos> cameFrom, GridPos start, GridPos goal) {
        List<GridPos> cells = new ArrayList<>();
        GridPos step = goal;
        while (!step.equals(start)) {
            cells.add(step);
            step = cameFrom.get(step);
        }
        Collections.reverse(cells);
        return cells;
    }

    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

package zookeep.staffing.path;

import zookeep.staffing.model.GridPos;

import java.util.Objects;

/**
 * A route query from a worker.
 *
 * @param canUsePaths  false keeps the walker off visitor path tiles
 * @param canPassGates true lets the walker step through exhibit gates
 */
public record PathRequest(String workerId, GridPos from, GridPos to, boolean canUsePaths, boolean canPassGates) {

    public PathRequest {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
    }

    /** Staff walk on paths and through gates */
    public static PathRequest forStaff(String workerId, GridPos from, GridPos to) {
        return new PathRequest(workerId, from, to, true, true);
    }
}

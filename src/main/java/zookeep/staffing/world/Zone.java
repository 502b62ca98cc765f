package zookeep.staffing.world;

import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.GridPos;

import java.util.Objects;
import java.util.Set;

/**
 * A fenced exhibit. Staff are assigned to zones and zone tasks live in the
 * zone's own queues.
 *
 * @param gate perimeter fence that staff may walk through, or null
 */
public record Zone(int id, String name, Set<GridPos> interior, Set<FenceEdge> perimeter, FenceEdge gate) {

    public Zone {
        Objects.requireNonNull(name, "name is required");
        interior = Set.copyOf(interior);
        perimeter = Set.copyOf(perimeter);
        if (gate != null && !perimeter.contains(gate)) {
            throw new IllegalArgumentException("gate " + gate + " is not on the perimeter of zone " + name);
        }
    }

    public boolean contains(GridPos pos) {
        return interior.contains(pos);
    }

    public boolean hasFence(FenceEdge fence) {
        return perimeter.contains(fence);
    }
}

package zookeep.staffing.model;

import java.util.Objects;

/**
 * A fence segment, identified by a tile and the edge of that tile.
 * The same physical segment can be named from either side, so equality is
 * defined on the normalized form (always the EAST or SOUTH edge).
 */
public final class FenceEdge {
    private final GridPos tile;
    private final EdgeDirection edge;

    private FenceEdge(GridPos tile, EdgeDirection edge) {
        this.tile = Objects.requireNonNull(tile, "tile is required");
        this.edge = Objects.requireNonNull(edge, "edge is required");
    }

    public static FenceEdge of(int x, int y, EdgeDirection edge) {
        return of(GridPos.of(x, y), edge);
    }

    public static FenceEdge of(GridPos tile, EdgeDirection edge) {
        return new FenceEdge(tile, edge);
    }

    /** Tile the fence was named from */
    public GridPos tile() {
        return tile;
    }

    public EdgeDirection edge() {
        return edge;
    }

    /** Tile on the other side of the fence */
    public GridPos across() {
        return tile.offset(edge.dx(), edge.dy());
    }

    /** Whether this fence blocks a single step between two adjacent tiles */
    public boolean separates(GridPos a, GridPos b) {
        return (tile.equals(a) && across().equals(b)) || (tile.equals(b) && across().equals(a));
    }

    private FenceEdge normalized() {
        if (edge == EdgeDirection.WEST || edge == EdgeDirection.NORTH) {
            return new FenceEdge(across(), edge.opposite());
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FenceEdge other))
            return false;
        FenceEdge a = normalized();
        FenceEdge b = other.normalized();
        return a.tile.equals(b.tile) && a.edge == b.edge;
    }

    @Override
    public int hashCode() {
        FenceEdge n = normalized();
        return Objects.hash(n.tile, n.edge);
    }

    @Override
    public String toString() {
        return tile + " " + edge;
    }
}

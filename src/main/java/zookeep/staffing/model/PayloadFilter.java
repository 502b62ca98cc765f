package zookeep.staffing.model;

import java.util.Objects;

/**
 * Partial payload used by producers to look for an existing task.
 * Fields left unset are wildcards. A field that is set but that the payload
 * variant does not carry never matches.
 */
public final class PayloadFilter {

    private static final PayloadFilter ANY = new PayloadFilter(null, null, null, null);

    private final Long animalId;
    private final FenceEdge fence;
    private final GridPos tile;
    private final Long binId;

    private PayloadFilter(Long animalId, FenceEdge fence, GridPos tile, Long binId) {
        this.animalId = animalId;
        this.fence = fence;
        this.tile = tile;
        this.binId = binId;
    }

    /** Matches every payload */
    public static PayloadFilter any() {
        return ANY;
    }

    public static PayloadFilter animal(long animalId) {
        return new PayloadFilter(animalId, null, null, null);
    }

    public static PayloadFilter fence(FenceEdge fence) {
        return new PayloadFilter(null, Objects.requireNonNull(fence, "fence"), null, null);
    }

    /** Waste or litter tile */
    public static PayloadFilter tile(GridPos tile) {
        return new PayloadFilter(null, null, Objects.requireNonNull(tile, "tile"), null);
    }

    public static PayloadFilter bin(long binId) {
        return new PayloadFilter(null, null, null, binId);
    }

    public boolean test(TaskPayload payload) {
        if (payload instanceof TaskPayload.FeedAnimals feed) {
            return fence == null && tile == null && binId == null
                    && (animalId == null || animalId == feed.animalId());
        }
        if (payload instanceof TaskPayload.RepairFence repair) {
            return animalId == null && tile == null && binId == null
                    && (fence == null || fence.equals(repair.fence()));
        }
        if (payload instanceof TaskPayload.CleanWaste waste) {
            return animalId == null && fence == null && binId == null
                    && (tile == null || tile.equals(waste.tile()));
        }
        if (payload instanceof TaskPayload.ClearLitter litter) {
            return animalId == null && fence == null && binId == null
                    && (tile == null || tile.equals(litter.tile()));
        }
        if (payload instanceof TaskPayload.EmptyBin bin) {
            return animalId == null && fence == null && tile == null
                    && (binId == null || binId == bin.binId());
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PayloadFilter{");
        if (animalId != null)
            sb.append("animalId=").append(animalId);
        if (fence != null)
            sb.append("fence=").append(fence);
        if (tile != null)
            sb.append("tile=").append(tile);
        if (binId != null)
            sb.append("binId=").append(binId);
        return sb.append('}').toString();
    }
}

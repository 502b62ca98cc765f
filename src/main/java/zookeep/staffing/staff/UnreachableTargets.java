package zookeep.staffing.staff;

import zookeep.staffing.model.GridPos;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Targets a worker recently failed to reach, with the failure time.
 * Entries expire after the TTL so the worker tries again eventually.
 */
public final class UnreachableTargets {

    private final Duration ttl;
    private final Map<GridPos, Instant> failedAt = new HashMap<>();

    public UnreachableTargets(Duration ttl) {
        this.ttl = ttl;
    }

    public void remember(GridPos target, Instant now) {
        failedAt.put(target, now);
    }

    public boolean contains(GridPos target, Instant now) {
        Instant at = failedAt.get(target);
        return at != null && !isExpired(at, now);
    }

    /** Drop entries older than the TTL */
    public void purge(Instant now) {
        failedAt.values().removeIf(at -> isExpired(at, now));
    }

    /** Unexpired targets */
    public Set<GridPos> targets(Instant now) {
        purge(now);
        return Set.copyOf(failedAt.keySet());
    }

    public int size() {
        return failedAt.size();
    }

    private boolean isExpired(Instant at, Instant now) {
        return !now.isBefore(at.plus(ttl));
    }
}

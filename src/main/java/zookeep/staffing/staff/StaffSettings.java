package zookeep.staffing.staff;

import java.time.Duration;

/**
 * Movement and timing knobs shared by all staff.
 *
 * @param wanderInterval     idle time before a worker starts strolling
 * @param speed              tiles per second
 * @param walkTimeout        longest a walking worker goes without a path result or a step before giving up
 * @param unreachableTtl     how long a failed target stays excluded from this worker's claims
 * @param wanderRadius       how far along the paths a wander goes
 * @param pathSearchRadius   how far an off-path worker looks for a path to wander back to
 */
public record StaffSettings(
        Duration wanderInterval,
        double speed,
        Duration walkTimeout,
        Duration unreachableTtl,
        int wanderRadius,
        int pathSearchRadius) {

    public StaffSettings {
        if (speed <= 0) {
            throw new IllegalArgumentException("speed must be positive");
        }
        if (walkTimeout.isNegative() || walkTimeout.isZero()) {
            throw new IllegalArgumentException("walkTimeout must be positive");
        }
    }

    public static StaffSettings defaults() {
        return new StaffSettings(
                Duration.ofSeconds(3),
                2.5,
                Duration.ofSeconds(30),
                Duration.ofSeconds(30),
                5,
                10);
    }
}

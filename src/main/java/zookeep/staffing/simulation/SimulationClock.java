package zookeep.staffing.simulation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Clock that only moves when the simulation ticks. Scheduler timestamps,
 * worker memory and tests all read simulated time.
 */
public final class SimulationClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    public SimulationClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private SimulationClock(Instant start, ZoneId zone) {
        this.now = Objects.requireNonNull(start, "start");
        this.zone = zone;
    }

    public synchronized void advance(Duration dt) {
        if (dt.isNegative()) {
            throw new IllegalArgumentException("cannot move the clock backwards: " + dt);
        }
        now = now.plus(dt);
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        if (zone.equals(this.zone)) {
            return this;
        }
        return new SimulationClock(now, zone);
    }
}

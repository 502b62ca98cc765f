package zookeep.staffing.scheduler;

import zookeep.staffing.simulation.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the simulation in real time.
 *
 * Uses a single-threaded executor so ticks never overlap; every tick
 * advances the simulation by the same fixed step.
 */
public class TickScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final ScheduledExecutorService executor;
    private final Simulation simulation;
    private final Duration tickInterval;

    private volatile boolean running = false;

    public TickScheduler(Simulation simulation, Duration tickInterval) {
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "zookeep-tick");
            t.setDaemon(true);
            return t;
        });
        this.simulation = simulation;
        this.tickInterval = tickInterval;
    }

    /**
     * Start ticking.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Tick scheduler already running");
            return;
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("Tick scheduler was stopped and cannot be restarted");
        }

        running = true;

        long intervalMs = tickInterval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("simulation-tick", () -> simulation.tick(tickInterval)),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Simulation ticking every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Tick scheduler forcefully stopped");
            } else {
                log.info("Tick scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    /**
     * Wrap a runnable so one failing tick does not cancel the schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}

package biz.kryukov.dev.svcregistry.scheduler;

import biz.kryukov.dev.svcregistry.DiscoveryConfig;
import biz.kryukov.dev.svcregistry.ServiceStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop that checks every registered service once per interval.
 *
 * <p>States: {@code STOPPED -> RUNNING -> STOPPED}. {@link #start()} is a no-op while
 * running; {@link #stop()} interrupts the loop, which cancels the checks of the
 * current cycle, and waits for it to unwind. A stopped monitor can be started again.</p>
 */
public final class HealthMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);
    private static final long STOP_TIMEOUT_SECONDS = 5;

    /** Lifecycle state of the loop. */
    public enum State {
        STOPPED,
        RUNNING
    }

    private final HealthCheckRunner runner;
    private final Duration interval;
    private final Duration errorRecoveryDelay;
    private final Logger logger;
    private final AtomicLong completedCycles = new AtomicLong();

    private ExecutorService loopExecutor;
    private Future<?> loopFuture;
    private volatile State state = State.STOPPED;

    public HealthMonitor(HealthCheckRunner runner, DiscoveryConfig config) {
        this(runner, config, LOG);
    }

    public HealthMonitor(HealthCheckRunner runner, DiscoveryConfig config, Logger logger) {
        this.runner = runner;
        this.interval = config.interval();
        this.errorRecoveryDelay = config.errorRecoveryDelay();
        this.logger = logger;
    }

    /**
     * Starts the loop. Does nothing if it is already running.
     */
    public synchronized void start() {
        if (state == State.RUNNING) {
            return;
        }
        loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "svcregistry-monitor");
            t.setDaemon(true);
            return t;
        });
        loopFuture = loopExecutor.submit(this::runLoop);
        state = State.RUNNING;
        logger.info("svcregistry: health monitoring started, interval {}", interval);
    }

    /**
     * Stops the loop, cancelling in-flight checks, and waits for it to finish.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        loopFuture.cancel(true);
        loopExecutor.shutdownNow();
        try {
            if (!loopExecutor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("svcregistry: health monitor did not stop within {}s",
                        STOP_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        loopExecutor = null;
        loopFuture = null;
        state = State.STOPPED;
        logger.info("svcregistry: health monitoring stopped");
    }

    public State state() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    /** Returns the number of monitor cycles that finished since construction. */
    public long completedCycles() {
        return completedCycles.get();
    }

    private void runLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            Duration pause = interval;
            try {
                Map<String, ServiceStatus> results = runner.checkAll();
                completedCycles.incrementAndGet();
                logger.debug("svcregistry: monitor cycle finished: {}", results);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                logger.error("svcregistry: error in health monitor loop", e);
                pause = errorRecoveryDelay;
            }
            try {
                Thread.sleep(pause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}

package biz.kryukov.dev.svcregistry.scheduler;

import biz.kryukov.dev.svcregistry.DiscoveryConfig;
import biz.kryukov.dev.svcregistry.ServiceStatus;
import biz.kryukov.dev.svcregistry.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Throttles checks against a service that keeps failing.
 *
 * <p>Once a service has failed {@code threshold} times in a row, it is re-probed at most
 * once per {@code interval * multiplier}; in between, the last known status is retained.
 * Skipping never changes status, counters or timestamps.</p>
 */
public final class CircuitBreakerPolicy {

    private final int threshold;
    private final Duration window;

    public CircuitBreakerPolicy(int threshold, Duration interval, int multiplier) {
        Objects.requireNonNull(interval, "interval");
        if (threshold < 1) {
            throw new ValidationException("threshold must be positive, got " + threshold);
        }
        if (multiplier < 1) {
            throw new ValidationException("multiplier must be positive, got " + multiplier);
        }
        this.threshold = threshold;
        this.window = interval.multipliedBy(multiplier);
    }

    /** Creates the policy from the discovery configuration. */
    public static CircuitBreakerPolicy from(DiscoveryConfig config) {
        return new CircuitBreakerPolicy(config.circuitBreakerThreshold(), config.interval(),
                config.circuitBreakerMultiplier());
    }

    /**
     * Decides whether a check should be skipped this time.
     *
     * @param consecutiveFailures failed checks since the last healthy one
     * @param lastCheckAt         last check attempt, or {@code null} if never checked
     * @param currentStatus       status to retain when skipping
     * @param now                 current time
     * @return the status to retain, or empty if the check should run
     */
    public Optional<ServiceStatus> shouldSkip(int consecutiveFailures, Instant lastCheckAt,
                                              ServiceStatus currentStatus, Instant now) {
        if (consecutiveFailures < threshold) {
            return Optional.empty();
        }
        if (lastCheckAt == null) {
            return Optional.empty();
        }
        Duration elapsed = Duration.between(lastCheckAt, now);
        if (elapsed.compareTo(window) < 0) {
            return Optional.of(currentStatus);
        }
        return Optional.empty();
    }

    public int threshold() {
        return threshold;
    }

    /** Returns the period during which a tripped service is not re-checked. */
    public Duration window() {
        return window;
    }
}

package biz.kryukov.dev.svcregistry;

import java.time.Duration;

/**
 * Monitoring, circuit breaker and readiness-wait configuration. Immutable, created via Builder.
 */
public final class DiscoveryConfig {

    /** Default pause between monitor cycles: 30 seconds. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    /** Default pause after a monitor cycle failed unexpectedly: 5 seconds. */
    public static final Duration DEFAULT_ERROR_RECOVERY_DELAY = Duration.ofSeconds(5);
    /** Default consecutive failures before checks are throttled. */
    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 3;
    /** Default multiplier of the interval during which a failing service is not re-checked. */
    public static final int DEFAULT_CIRCUIT_BREAKER_MULTIPLIER = 3;
    /** Default slack added to a check's own timeout before the caller gives up on it. */
    public static final Duration DEFAULT_CHECK_GRACE = Duration.ofSeconds(1);
    /** Default polling interval of {@code waitForService}. */
    public static final Duration DEFAULT_SERVICE_WAIT_INTERVAL = Duration.ofSeconds(1);
    /** Default polling interval of {@code waitForCoreServices}. */
    public static final Duration DEFAULT_CORE_SERVICES_WAIT_INTERVAL = Duration.ofSeconds(2);
    /** Default timeout of {@code waitForService}. */
    public static final Duration DEFAULT_SERVICE_WAIT_TIMEOUT = Duration.ofSeconds(30);
    /** Default timeout of {@code waitForCoreServices}. */
    public static final Duration DEFAULT_CORE_SERVICES_WAIT_TIMEOUT = Duration.ofSeconds(60);

    /** Minimum allowed monitor interval. */
    public static final Duration MIN_INTERVAL = Duration.ofMillis(50);
    /** Maximum allowed monitor interval. */
    public static final Duration MAX_INTERVAL = Duration.ofMinutes(10);
    /** Minimum allowed threshold and multiplier. */
    public static final int MIN_THRESHOLD = 1;
    /** Maximum allowed threshold and multiplier. */
    public static final int MAX_THRESHOLD = 100;

    private final Duration interval;
    private final Duration errorRecoveryDelay;
    private final int circuitBreakerThreshold;
    private final int circuitBreakerMultiplier;
    private final Duration checkGrace;
    private final Duration serviceWaitInterval;
    private final Duration coreServicesWaitInterval;
    private final Duration serviceWaitTimeout;
    private final Duration coreServicesWaitTimeout;

    private DiscoveryConfig(Builder builder) {
        this.interval = builder.interval;
        this.errorRecoveryDelay = builder.errorRecoveryDelay;
        this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
        this.circuitBreakerMultiplier = builder.circuitBreakerMultiplier;
        this.checkGrace = builder.checkGrace;
        this.serviceWaitInterval = builder.serviceWaitInterval;
        this.coreServicesWaitInterval = builder.coreServicesWaitInterval;
        this.serviceWaitTimeout = builder.serviceWaitTimeout;
        this.coreServicesWaitTimeout = builder.coreServicesWaitTimeout;
    }

    /** Returns the pause between monitor cycles. */
    public Duration interval() {
        return interval;
    }

    /** Returns the pause after a failed monitor cycle. */
    public Duration errorRecoveryDelay() {
        return errorRecoveryDelay;
    }

    /** Returns the consecutive failures after which checks are throttled. */
    public int circuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    /** Returns the interval multiplier of the throttle window. */
    public int circuitBreakerMultiplier() {
        return circuitBreakerMultiplier;
    }

    public Duration checkGrace() {
        return checkGrace;
    }

    public Duration serviceWaitInterval() {
        return serviceWaitInterval;
    }

    public Duration coreServicesWaitInterval() {
        return coreServicesWaitInterval;
    }

    public Duration serviceWaitTimeout() {
        return serviceWaitTimeout;
    }

    public Duration coreServicesWaitTimeout() {
        return coreServicesWaitTimeout;
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a configuration with all default values. */
    public static DiscoveryConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link DiscoveryConfig}. */
    public static final class Builder {
        private Duration interval = DEFAULT_INTERVAL;
        private Duration errorRecoveryDelay = DEFAULT_ERROR_RECOVERY_DELAY;
        private int circuitBreakerThreshold = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
        private int circuitBreakerMultiplier = DEFAULT_CIRCUIT_BREAKER_MULTIPLIER;
        private Duration checkGrace = DEFAULT_CHECK_GRACE;
        private Duration serviceWaitInterval = DEFAULT_SERVICE_WAIT_INTERVAL;
        private Duration coreServicesWaitInterval = DEFAULT_CORE_SERVICES_WAIT_INTERVAL;
        private Duration serviceWaitTimeout = DEFAULT_SERVICE_WAIT_TIMEOUT;
        private Duration coreServicesWaitTimeout = DEFAULT_CORE_SERVICES_WAIT_TIMEOUT;

        private Builder() {}

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder errorRecoveryDelay(Duration errorRecoveryDelay) {
            this.errorRecoveryDelay = errorRecoveryDelay;
            return this;
        }

        public Builder circuitBreakerThreshold(int threshold) {
            this.circuitBreakerThreshold = threshold;
            return this;
        }

        public Builder circuitBreakerMultiplier(int multiplier) {
            this.circuitBreakerMultiplier = multiplier;
            return this;
        }

        public Builder checkGrace(Duration checkGrace) {
            this.checkGrace = checkGrace;
            return this;
        }

        public Builder serviceWaitInterval(Duration serviceWaitInterval) {
            this.serviceWaitInterval = serviceWaitInterval;
            return this;
        }

        public Builder coreServicesWaitInterval(Duration coreServicesWaitInterval) {
            this.coreServicesWaitInterval = coreServicesWaitInterval;
            return this;
        }

        public Builder serviceWaitTimeout(Duration serviceWaitTimeout) {
            this.serviceWaitTimeout = serviceWaitTimeout;
            return this;
        }

        public Builder coreServicesWaitTimeout(Duration coreServicesWaitTimeout) {
            this.coreServicesWaitTimeout = coreServicesWaitTimeout;
            return this;
        }

        /** Builds and validates the configuration. */
        public DiscoveryConfig build() {
            validate();
            return new DiscoveryConfig(this);
        }

        private void validate() {
            if (interval == null
                    || interval.compareTo(MIN_INTERVAL) < 0 || interval.compareTo(MAX_INTERVAL) > 0) {
                throw new ValidationException(
                        "interval must be between " + MIN_INTERVAL + " and " + MAX_INTERVAL
                                + ", got " + interval);
            }
            if (circuitBreakerThreshold < MIN_THRESHOLD || circuitBreakerThreshold > MAX_THRESHOLD) {
                throw new ValidationException(
                        "circuitBreakerThreshold must be between " + MIN_THRESHOLD + " and "
                                + MAX_THRESHOLD + ", got " + circuitBreakerThreshold);
            }
            if (circuitBreakerMultiplier < MIN_THRESHOLD || circuitBreakerMultiplier > MAX_THRESHOLD) {
                throw new ValidationException(
                        "circuitBreakerMultiplier must be between " + MIN_THRESHOLD + " and "
                                + MAX_THRESHOLD + ", got " + circuitBreakerMultiplier);
            }
            requirePositive("errorRecoveryDelay", errorRecoveryDelay);
            requirePositive("serviceWaitInterval", serviceWaitInterval);
            requirePositive("coreServicesWaitInterval", coreServicesWaitInterval);
            requirePositive("serviceWaitTimeout", serviceWaitTimeout);
            requirePositive("coreServicesWaitTimeout", coreServicesWaitTimeout);
            if (checkGrace == null || checkGrace.isNegative()) {
                throw new ValidationException("checkGrace must not be negative, got " + checkGrace);
            }
        }

        private static void requirePositive(String field, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ValidationException(field + " must be positive, got " + value);
            }
        }
    }
}

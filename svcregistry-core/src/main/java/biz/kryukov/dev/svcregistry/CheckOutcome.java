package biz.kryukov.dev.svcregistry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of one completed check attempt, applied to the registry as a unit.
 *
 * @param status       resulting status
 * @param responseTime time the check took
 * @param category     failure taxonomy value from {@link StatusCategory}
 * @param errorMessage error text, {@code null} for a healthy result
 * @param version      service version reported in the health body, if any
 * @param capabilities capabilities reported in the health body, {@code null} if absent
 */
public record CheckOutcome(ServiceStatus status, Duration responseTime, String category,
                           String errorMessage, String version, List<String> capabilities) {

    public CheckOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(responseTime, "responseTime");
        Objects.requireNonNull(category, "category");
        capabilities = capabilities == null ? null : List.copyOf(capabilities);
    }

    public static CheckOutcome healthy(Duration responseTime) {
        return new CheckOutcome(ServiceStatus.HEALTHY, responseTime, StatusCategory.OK,
                null, null, null);
    }

    public static CheckOutcome healthy(Duration responseTime, String version,
                                       List<String> capabilities) {
        return new CheckOutcome(ServiceStatus.HEALTHY, responseTime, StatusCategory.OK,
                null, version, capabilities);
    }

    public static CheckOutcome degraded(Duration responseTime, String category, String message,
                                        String version, List<String> capabilities) {
        return new CheckOutcome(ServiceStatus.DEGRADED, responseTime, category,
                message, version, capabilities);
    }

    public static CheckOutcome unhealthy(Duration responseTime, String category, String message) {
        return new CheckOutcome(ServiceStatus.UNHEALTHY, responseTime, category,
                message, null, null);
    }

    /** Converts a check failure into an unhealthy outcome. */
    public static CheckOutcome failure(Throwable error, Duration responseTime) {
        return unhealthy(responseTime, ErrorClassifier.classify(error),
                ErrorClassifier.describe(error));
    }
}

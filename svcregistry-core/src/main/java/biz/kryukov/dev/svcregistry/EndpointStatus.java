package biz.kryukov.dev.svcregistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Detailed state of a single service at the time of the read.
 * Returned by {@link ServiceDiscovery#getServiceStatusSummary()}.
 *
 * @param name                service name
 * @param url                 {@code protocol://host:port}
 * @param protocol            protocol label
 * @param required            whether readiness depends on the service
 * @param status              current status
 * @param category            failure category of the last check ({@code unknown} before the first one)
 * @param lastCheckAt         last check attempt, {@code null} before the first one
 * @param lastHealthyAt       last healthy result, {@code null} if never healthy
 * @param responseTime        duration of the last check, {@code null} before the first one
 * @param consecutiveFailures failed checks since the last healthy one
 * @param error               error text of the last failed check, {@code null} when healthy
 * @param version             version reported by the health body, if any
 * @param capabilities        capabilities reported by the health body
 */
public record EndpointStatus(String name, String url, String protocol, boolean required,
                             ServiceStatus status, String category, Instant lastCheckAt,
                             Instant lastHealthyAt, Duration responseTime,
                             int consecutiveFailures, String error, String version,
                             List<String> capabilities) {

    public EndpointStatus {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(status, "status");
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    /** Whether callers may route requests to the service. */
    public boolean available() {
        return status.isAvailable();
    }
}

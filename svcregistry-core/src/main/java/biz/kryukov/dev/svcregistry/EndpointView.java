package biz.kryukov.dev.svcregistry;

import java.time.Instant;
import java.util.Objects;

/**
 * Value copy of a registered service taken under the registry lock: the immutable
 * definition plus the counters the circuit breaker needs.
 *
 * @param endpoint            service definition
 * @param status              status at the time of the read
 * @param consecutiveFailures failed checks since the last healthy one
 * @param lastCheckAt         time of the last check attempt, or {@code null} if never checked
 */
public record EndpointView(ServiceEndpoint endpoint, ServiceStatus status,
                           int consecutiveFailures, Instant lastCheckAt) {

    public EndpointView {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(status, "status");
    }

    /** View of a service that has never been checked. */
    public static EndpointView initial(ServiceEndpoint endpoint) {
        return new EndpointView(endpoint, ServiceStatus.UNKNOWN, 0, null);
    }

    public String name() {
        return endpoint.name();
    }

    public String host() {
        return endpoint.host();
    }

    public int port() {
        return endpoint.port();
    }

    public Protocol protocol() {
        return endpoint.protocol();
    }
}

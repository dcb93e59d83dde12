package biz.kryukov.dev.svcregistry.registry;

import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.EndpointStatus;
import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.ServiceChecker;
import biz.kryukov.dev.svcregistry.ServiceEndpoint;
import biz.kryukov.dev.svcregistry.ServiceStatus;
import biz.kryukov.dev.svcregistry.StatusCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Mutable health state of one service plus its definition and checker.
 *
 * <p>Not thread-safe on its own: every access goes through {@link ServiceRegistry},
 * which holds its lock for the duration of the call.</p>
 */
final class RegistryEntry {

    private final ServiceEndpoint endpoint;
    private final ServiceChecker checker;

    private ServiceStatus status = ServiceStatus.UNKNOWN;
    private String category = StatusCategory.UNKNOWN;
    private Instant lastCheckAt;
    private Instant lastHealthyAt;
    private int consecutiveFailures;
    private Duration responseTime;
    private String errorMessage;
    private String version;
    private List<String> capabilities = List.of();

    RegistryEntry(ServiceEndpoint endpoint, ServiceChecker checker) {
        this.endpoint = endpoint;
        this.checker = checker;
    }

    ServiceEndpoint endpoint() {
        return endpoint;
    }

    ServiceChecker checker() {
        return checker;
    }

    ServiceStatus status() {
        return status;
    }

    /**
     * Applies a completed check: status, timestamps and counters change together.
     */
    void apply(CheckOutcome outcome, Instant checkedAt) {
        status = outcome.status();
        category = outcome.category();
        lastCheckAt = checkedAt;
        responseTime = outcome.responseTime();
        if (outcome.status() == ServiceStatus.HEALTHY) {
            consecutiveFailures = 0;
            lastHealthyAt = checkedAt;
            errorMessage = null;
        } else {
            consecutiveFailures++;
            errorMessage = outcome.errorMessage();
        }
        if (outcome.version() != null) {
            version = outcome.version();
        }
        if (outcome.capabilities() != null) {
            capabilities = outcome.capabilities();
        }
    }

    EndpointView toView() {
        return new EndpointView(endpoint, status, consecutiveFailures, lastCheckAt);
    }

    EndpointStatus toEndpointStatus() {
        return new EndpointStatus(
                endpoint.name(),
                endpoint.url(),
                endpoint.protocol().label(),
                endpoint.required(),
                status,
                category,
                lastCheckAt,
                lastHealthyAt,
                responseTime,
                consecutiveFailures,
                errorMessage,
                version,
                capabilities
        );
    }
}

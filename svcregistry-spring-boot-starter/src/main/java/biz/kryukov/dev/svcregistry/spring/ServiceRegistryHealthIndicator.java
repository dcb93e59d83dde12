package biz.kryukov.dev.svcregistry.spring;

import biz.kryukov.dev.svcregistry.EndpointStatus;
import biz.kryukov.dev.svcregistry.ServiceDiscovery;
import biz.kryukov.dev.svcregistry.StatusSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Spring Boot Actuator HealthIndicator: DOWN while any required service is not available.
 * Optional services are reported in the details but never affect the overall status.
 */
public class ServiceRegistryHealthIndicator implements HealthIndicator {

    private final ServiceDiscovery serviceDiscovery;

    /**
     * @param serviceDiscovery the ServiceDiscovery instance to report on
     */
    public ServiceRegistryHealthIndicator(ServiceDiscovery serviceDiscovery) {
        this.serviceDiscovery = serviceDiscovery;
    }

    @Override
    public Health health() {
        StatusSummary summary = serviceDiscovery.getServiceStatusSummary();

        boolean requiredAvailable = summary.services().values().stream()
                .filter(EndpointStatus::required)
                .allMatch(EndpointStatus::available);

        Health.Builder builder = requiredAvailable ? Health.up() : Health.down();

        summary.services().forEach((name, status) ->
                builder.withDetail(name, status.status().label()));

        return builder.build();
    }
}

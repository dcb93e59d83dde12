package biz.kryukov.dev.svcregistry.spring;

import biz.kryukov.dev.svcregistry.EndpointStatus;
import biz.kryukov.dev.svcregistry.ServiceDiscovery;
import biz.kryukov.dev.svcregistry.StatusSummary;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

/**
 * Actuator endpoint /actuator/services: status summary and per-service detail.
 */
@Endpoint(id = "services")
public class ServicesEndpoint {

    private final ServiceDiscovery serviceDiscovery;

    public ServicesEndpoint(ServiceDiscovery serviceDiscovery) {
        this.serviceDiscovery = serviceDiscovery;
    }

    @ReadOperation
    public StatusSummary services() {
        return serviceDiscovery.getServiceStatusSummary();
    }

    /** Returns one service's detail; a {@code null} result is rendered as 404. */
    @ReadOperation
    public EndpointStatus service(@Selector String name) {
        return serviceDiscovery.getServiceDetails(name).orElse(null);
    }
}

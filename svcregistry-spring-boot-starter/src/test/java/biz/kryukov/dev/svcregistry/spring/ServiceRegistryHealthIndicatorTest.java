package biz.kryukov.dev.svcregistry.spring;

import biz.kryukov.dev.svcregistry.EndpointStatus;
import biz.kryukov.dev.svcregistry.ServiceDiscovery;
import biz.kryukov.dev.svcregistry.ServiceStatus;
import biz.kryukov.dev.svcregistry.StatusSummary;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ServiceRegistryHealthIndicatorTest {

    private static EndpointStatus status(String name, boolean required, ServiceStatus s) {
        return new EndpointStatus(name, "http://localhost:8080", "http", required, s, "ok",
                null, null, null, 0, null, null, null);
    }

    private static ServiceDiscovery discoveryWith(EndpointStatus... statuses) {
        Map<String, EndpointStatus> services = new LinkedHashMap<>();
        for (EndpointStatus s : statuses) {
            services.put(s.name(), s);
        }
        ServiceDiscovery discovery = mock(ServiceDiscovery.class);
        when(discovery.getServiceStatusSummary())
                .thenReturn(StatusSummary.of(Instant.EPOCH, services));
        return discovery;
    }

    @Test
    void requiredServicesAvailableReturnsUp() {
        ServiceDiscovery discovery = discoveryWith(
                status("backend", true, ServiceStatus.HEALTHY),
                status("frontend", true, ServiceStatus.DEGRADED));

        Health health = new ServiceRegistryHealthIndicator(discovery).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("healthy", health.getDetails().get("backend"));
        assertEquals("degraded", health.getDetails().get("frontend"));
    }

    @Test
    void requiredServiceUnhealthyReturnsDown() {
        ServiceDiscovery discovery = discoveryWith(
                status("backend", true, ServiceStatus.HEALTHY),
                status("redis", true, ServiceStatus.UNHEALTHY));

        Health health = new ServiceRegistryHealthIndicator(discovery).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("unhealthy", health.getDetails().get("redis"));
    }

    @Test
    void requiredServiceNeverCheckedReturnsDown() {
        ServiceDiscovery discovery = discoveryWith(status("backend", true, ServiceStatus.UNKNOWN));

        assertEquals(Status.DOWN, new ServiceRegistryHealthIndicator(discovery).health().getStatus());
    }

    @Test
    void optionalServiceDownKeepsUp() {
        ServiceDiscovery discovery = discoveryWith(
                status("backend", true, ServiceStatus.HEALTHY),
                status("ai-stack", false, ServiceStatus.UNHEALTHY));

        Health health = new ServiceRegistryHealthIndicator(discovery).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("unhealthy", health.getDetails().get("ai-stack"));
    }

    @Test
    void noServicesReturnsUp() {
        ServiceDiscovery discovery = discoveryWith();

        assertEquals(Status.UP, new ServiceRegistryHealthIndicator(discovery).health().getStatus());
    }
}

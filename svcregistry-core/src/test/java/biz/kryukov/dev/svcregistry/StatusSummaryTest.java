package biz.kryukov.dev.svcregistry;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusSummaryTest {

    private static EndpointStatus status(String name, ServiceStatus s) {
        return new EndpointStatus(name, "tcp://localhost:1", "tcp", true, s, "ok",
                null, null, null, 0, null, null, null);
    }

    @Test
    void countsPerBucket() {
        Map<String, EndpointStatus> services = new LinkedHashMap<>();
        services.put("a", status("a", ServiceStatus.HEALTHY));
        services.put("b", status("b", ServiceStatus.HEALTHY));
        services.put("c", status("c", ServiceStatus.DEGRADED));
        services.put("d", status("d", ServiceStatus.UNHEALTHY));
        services.put("e", status("e", ServiceStatus.UNKNOWN));
        services.put("f", status("f", ServiceStatus.STARTING));

        StatusSummary summary = StatusSummary.of(Instant.EPOCH, services);

        assertEquals(6, summary.totalServices());
        assertEquals(2, summary.healthy());
        assertEquals(1, summary.degraded());
        assertEquals(1, summary.unhealthy());
        assertEquals(2, summary.unknown());
        assertEquals(summary.totalServices(), summary.healthy() + summary.degraded()
                + summary.unhealthy() + summary.unknown());
        assertEquals(List.of("a", "b", "c", "d", "e", "f"), List.copyOf(summary.services().keySet()));
    }

    @Test
    void servicesAreUnmodifiable() {
        StatusSummary summary = StatusSummary.of(Instant.EPOCH,
                Map.of("a", status("a", ServiceStatus.HEALTHY)));
        assertThrows(UnsupportedOperationException.class,
                () -> summary.services().put("b", status("b", ServiceStatus.HEALTHY)));
    }

    @Test
    void statusAvailability() {
        assertTrue(ServiceStatus.HEALTHY.isAvailable());
        assertTrue(ServiceStatus.DEGRADED.isAvailable());
        assertFalse(ServiceStatus.UNHEALTHY.isAvailable());
        assertFalse(ServiceStatus.UNKNOWN.isAvailable());
        assertFalse(ServiceStatus.STARTING.isAvailable());
        assertEquals(ServiceStatus.DEGRADED, ServiceStatus.fromLabel("Degraded"));
        assertThrows(IllegalArgumentException.class, () -> ServiceStatus.fromLabel("gone"));
    }
}

package biz.kryukov.dev.svcregistry.metrics;

import biz.kryukov.dev.svcregistry.Protocol;
import biz.kryukov.dev.svcregistry.ServiceEndpoint;
import biz.kryukov.dev.svcregistry.ServiceStatus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MetricsExporter exporter;
    private ServiceEndpoint backend;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MetricsExporter(registry);
        backend = ServiceEndpoint.builder("backend").host("10.0.0.10").port(8001).build();
    }

    private double statusValue(ServiceStatus status) {
        Gauge gauge = registry.find("svcregistry_service_status")
                .tag("service", "backend").tag("status", status.label()).gauge();
        assertNotNull(gauge, "missing status series " + status.label());
        return gauge.value();
    }

    @Test
    void tagsInOrder() {
        ServiceEndpoint redis = ServiceEndpoint.builder("redis").host("10.0.0.13").port(6379)
                .protocol(Protocol.TCP).required(false).build();
        assertEquals(Tags.of("service", "redis", "protocol", "tcp", "host", "10.0.0.13",
                "port", "6379", "required", "no"), exporter.buildTags(redis));
    }

    @Test
    void recordCheckSetsAllMetrics() {
        exporter.recordCheck(backend, ServiceStatus.HEALTHY, Duration.ofMillis(250), 0);

        Gauge healthy = registry.find("svcregistry_service_healthy")
                .tag("service", "backend").tag("required", "yes").gauge();
        assertNotNull(healthy);
        assertEquals(1.0, healthy.value());

        DistributionSummary latency = registry.find("svcregistry_check_latency_seconds")
                .tag("service", "backend").summary();
        assertNotNull(latency);
        assertEquals(1, latency.count());
        assertEquals(0.25, latency.totalAmount(), 1e-9);

        Gauge failures = registry.find("svcregistry_consecutive_failures")
                .tag("service", "backend").gauge();
        assertNotNull(failures);
        assertEquals(0.0, failures.value());
    }

    @Test
    void statusGaugeHasExactlyOneActiveSeries() {
        exporter.recordCheck(backend, ServiceStatus.DEGRADED, Duration.ofMillis(5), 1);

        assertEquals(1.0, statusValue(ServiceStatus.DEGRADED));
        assertEquals(0.0, statusValue(ServiceStatus.HEALTHY));
        assertEquals(0.0, statusValue(ServiceStatus.UNHEALTHY));
        assertEquals(0.0, statusValue(ServiceStatus.UNKNOWN));
        assertEquals(0.0, statusValue(ServiceStatus.STARTING));

        exporter.recordCheck(backend, ServiceStatus.UNHEALTHY, Duration.ofMillis(5), 2);

        assertEquals(0.0, statusValue(ServiceStatus.DEGRADED));
        assertEquals(1.0, statusValue(ServiceStatus.UNHEALTHY));
        assertEquals(2.0, registry.find("svcregistry_consecutive_failures")
                .tag("service", "backend").gauge().value());
        assertEquals(0.0, registry.find("svcregistry_service_healthy")
                .tag("service", "backend").gauge().value());
    }

    @Test
    void skipCounterIncrements() {
        exporter.recordSkip(backend);
        exporter.recordSkip(backend);

        Counter counter = registry.find("svcregistry_checks_skipped_total")
                .tag("service", "backend").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    void metersAreRegisteredOncePerService() {
        exporter.recordCheck(backend, ServiceStatus.HEALTHY, Duration.ofMillis(1), 0);
        exporter.recordCheck(backend, ServiceStatus.HEALTHY, Duration.ofMillis(1), 0);

        assertEquals(1, registry.find("svcregistry_service_healthy").gauges().size());
        assertEquals(ServiceStatus.values().length,
                registry.find("svcregistry_service_status").gauges().size());
    }
}

package biz.kryukov.dev.svcregistry.metrics;

import biz.kryukov.dev.svcregistry.ServiceEndpoint;
import biz.kryukov.dev.svcregistry.ServiceStatus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exports service health metrics to a Micrometer MeterRegistry.
 *
 * <p>Metrics exported:
 * <ul>
 *   <li>{@code svcregistry_service_healthy}: Gauge (0/1)</li>
 *   <li>{@code svcregistry_service_status}: Gauge (enum pattern, one series per status)</li>
 *   <li>{@code svcregistry_check_latency_seconds}: Distribution summary</li>
 *   <li>{@code svcregistry_consecutive_failures}: Gauge</li>
 *   <li>{@code svcregistry_checks_skipped_total}: Counter (circuit breaker skips)</li>
 * </ul>
 */
public final class MetricsExporter {

    private static final String HEALTHY_METRIC = "svcregistry_service_healthy";
    private static final String STATUS_METRIC = "svcregistry_service_status";
    private static final String LATENCY_METRIC = "svcregistry_check_latency_seconds";
    private static final String FAILURES_METRIC = "svcregistry_consecutive_failures";
    private static final String SKIPPED_METRIC = "svcregistry_checks_skipped_total";
    private static final String HEALTHY_DESCRIPTION =
            "Health status of a service (1 = healthy, 0 = not healthy)";
    private static final String STATUS_DESCRIPTION = "Status of the last completed check";
    private static final String LATENCY_DESCRIPTION =
            "Latency of service health checks in seconds";
    private static final String FAILURES_DESCRIPTION =
            "Consecutive failed checks since the last healthy one";
    private static final String SKIPPED_DESCRIPTION =
            "Checks suppressed by the circuit breaker";

    private static final double[] LATENCY_SLOS = {0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0};

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, AtomicReference<Double>> healthyValues =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicReference<Double>[]> statusValues =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> failureValues =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> latencySummaries =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> skipCounters = new ConcurrentHashMap<>();

    /**
     * Creates a metrics exporter.
     *
     * @param registry Micrometer meter registry
     */
    public MetricsExporter(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Exporter backed by a private in-memory registry, for callers without Micrometer setup. */
    public static MetricsExporter noop() {
        return new MetricsExporter(new SimpleMeterRegistry());
    }

    /**
     * Records a completed check: status gauges, healthy gauge, latency and failure count.
     */
    public void recordCheck(ServiceEndpoint ep, ServiceStatus status, Duration latency,
                            int consecutiveFailures) {
        setStatus(ep, status);
        setHealthy(ep, status == ServiceStatus.HEALTHY ? 1.0 : 0.0);
        observeLatency(ep, latency);
        setConsecutiveFailures(ep, consecutiveFailures);
    }

    /** Counts a check suppressed by the circuit breaker. */
    public void recordSkip(ServiceEndpoint ep) {
        skipCounters.computeIfAbsent(ep.name(), k -> Counter.builder(SKIPPED_METRIC)
                .description(SKIPPED_DESCRIPTION)
                .tags(buildTags(ep))
                .register(registry)).increment();
    }

    void setHealthy(ServiceEndpoint ep, double value) {
        AtomicReference<Double> ref = healthyValues.computeIfAbsent(ep.name(), k -> {
            AtomicReference<Double> newRef = new AtomicReference<>(value);
            Gauge.builder(HEALTHY_METRIC, newRef, AtomicReference::get)
                    .description(HEALTHY_DESCRIPTION)
                    .tags(buildTags(ep))
                    .register(registry);
            return newRef;
        });
        ref.set(value);
    }

    /**
     * Sets the status enum gauge: exactly one series = 1, the rest = 0.
     */
    @SuppressWarnings("unchecked")
    void setStatus(ServiceEndpoint ep, ServiceStatus status) {
        ServiceStatus[] all = ServiceStatus.values();
        AtomicReference<Double>[] refs = statusValues.computeIfAbsent(ep.name(), k -> {
            Tags baseTags = buildTags(ep);
            AtomicReference<Double>[] arr = new AtomicReference[all.length];
            for (int i = 0; i < all.length; i++) {
                arr[i] = new AtomicReference<>(0.0);
                Gauge.builder(STATUS_METRIC, arr[i], AtomicReference::get)
                        .description(STATUS_DESCRIPTION)
                        .tags(baseTags.and("status", all[i].label()))
                        .register(registry);
            }
            return arr;
        });
        for (int i = 0; i < all.length; i++) {
            refs[i].set(all[i] == status ? 1.0 : 0.0);
        }
    }

    void observeLatency(ServiceEndpoint ep, Duration duration) {
        DistributionSummary summary = latencySummaries.computeIfAbsent(ep.name(), k ->
                DistributionSummary.builder(LATENCY_METRIC)
                        .description(LATENCY_DESCRIPTION)
                        .tags(buildTags(ep))
                        .serviceLevelObjectives(LATENCY_SLOS)
                        .register(registry));
        summary.record(duration.toNanos() / 1_000_000_000.0);
    }

    void setConsecutiveFailures(ServiceEndpoint ep, int failures) {
        AtomicInteger ref = failureValues.computeIfAbsent(ep.name(), k -> {
            AtomicInteger newRef = new AtomicInteger(failures);
            Gauge.builder(FAILURES_METRIC, newRef, AtomicInteger::get)
                    .description(FAILURES_DESCRIPTION)
                    .tags(buildTags(ep))
                    .register(registry);
            return newRef;
        });
        ref.set(failures);
    }

    /**
     * Builds tags in order: service, protocol, host, port, required.
     */
    Tags buildTags(ServiceEndpoint ep) {
        return Tags.of(
                "service", ep.name(),
                "protocol", ep.protocol().label(),
                "host", ep.host(),
                "port", String.valueOf(ep.port()),
                "required", ep.required() ? "yes" : "no"
        );
    }
}

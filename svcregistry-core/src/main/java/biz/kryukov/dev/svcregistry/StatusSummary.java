package biz.kryukov.dev.svcregistry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status report over all registered services: counts per status bucket plus
 * per-service detail. {@code STARTING} and {@code UNKNOWN} both count as unknown.
 */
public record StatusSummary(Instant timestamp, int totalServices, int healthy, int degraded,
                            int unhealthy, int unknown, Map<String, EndpointStatus> services) {

    public StatusSummary {
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    /** Builds a summary from per-service snapshots, preserving their order. */
    public static StatusSummary of(Instant timestamp, Map<String, EndpointStatus> services) {
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        int unknown = 0;
        for (EndpointStatus s : services.values()) {
            switch (s.status()) {
                case HEALTHY -> healthy++;
                case DEGRADED -> degraded++;
                case UNHEALTHY -> unhealthy++;
                default -> unknown++;
            }
        }
        return new StatusSummary(timestamp, services.size(), healthy, degraded,
                unhealthy, unknown, services);
    }
}

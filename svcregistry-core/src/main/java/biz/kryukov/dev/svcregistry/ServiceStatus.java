package biz.kryukov.dev.svcregistry;

/**
 * Health state of a registered service. There is no terminal state: services are
 * re-checked for as long as monitoring runs.
 */
public enum ServiceStatus {
    UNKNOWN("unknown"),
    STARTING("starting"),
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String label;

    ServiceStatus(String label) {
        this.label = label;
    }

    /** Returns the lower-case wire representation. */
    public String label() {
        return label;
    }

    /** Whether callers may still route requests to the service (healthy or degraded). */
    public boolean isAvailable() {
        return this == HEALTHY || this == DEGRADED;
    }

    /** Finds a status by its label (case-insensitive). */
    public static ServiceStatus fromLabel(String label) {
        for (ServiceStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown service status: " + label);
    }
}

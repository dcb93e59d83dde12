package biz.kryukov.dev.svcregistry;

/**
 * Protocol used to reach a service; its label doubles as the URL scheme.
 */
public enum Protocol {
    HTTP("http", 80),
    HTTPS("https", 443),
    TCP("tcp", -1);

    private final String label;
    private final int defaultPort;

    Protocol(String label, int defaultPort) {
        this.label = label;
        this.defaultPort = defaultPort;
    }

    /** Returns the URL scheme / configuration value. */
    public String label() {
        return label;
    }

    /** Returns the default port, or {@code -1} if the protocol has none. */
    public int defaultPort() {
        return defaultPort;
    }

    /** Whether health is probed with an HTTP GET on the health path. */
    public boolean isHttp() {
        return this == HTTP || this == HTTPS;
    }

    /** Finds a protocol by its label (case-insensitive). */
    public static Protocol fromLabel(String label) {
        for (Protocol p : values()) {
            if (p.label.equalsIgnoreCase(label)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown protocol: " + label);
    }
}

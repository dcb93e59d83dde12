package biz.kryukov.dev.svcregistry;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Service definition: name, connection identity and check policy. Immutable.
 *
 * <p>The mutable health state for a service lives in the registry, never here.</p>
 */
public final class ServiceEndpoint {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_-]*$");
    private static final int MAX_NAME_LENGTH = 63;

    /** Default health path for HTTP services. */
    public static final String DEFAULT_HEALTH_PATH = "/health";
    /** Default per-check timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    /** Minimum allowed check timeout. */
    public static final Duration MIN_TIMEOUT = Duration.ofMillis(100);
    /** Maximum allowed check timeout. */
    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(60);

    private final String name;
    private final String host;
    private final int port;
    private final Protocol protocol;
    private final String healthPath;
    private final Duration timeout;
    private final boolean required;

    private ServiceEndpoint(Builder builder) {
        this.name = builder.name;
        this.host = builder.host;
        this.port = builder.port;
        this.protocol = builder.protocol;
        this.healthPath = builder.healthPath;
        this.timeout = builder.timeout;
        this.required = builder.required;
    }

    public String name() {
        return name;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public Protocol protocol() {
        return protocol;
    }

    /** Path probed by HTTP checks; empty for TCP services. */
    public String healthPath() {
        return healthPath;
    }

    public Duration timeout() {
        return timeout;
    }

    /** Whether readiness ({@code waitForCoreServices}) depends on this service. */
    public boolean required() {
        return required;
    }

    /** Returns {@code protocol://host:port}. */
    public String url() {
        String h = host.contains(":") ? "[" + host + "]" : host;
        return protocol.label() + "://" + h + ":" + port;
    }

    /** Returns the URL probed by the HTTP checker. */
    public String healthUrl() {
        return url() + healthPath;
    }

    /** Returns a builder initialised with this endpoint's values. */
    public Builder toBuilder() {
        return new Builder(name)
                .host(host)
                .port(port)
                .protocol(protocol)
                .healthPath(healthPath)
                .timeout(timeout)
                .required(required);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServiceEndpoint other)) {
            return false;
        }
        return name.equals(other.name) && host.equals(other.host) && port == other.port
                && protocol == other.protocol && healthPath.equals(other.healthPath)
                && timeout.equals(other.timeout) && required == other.required;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, host, port, protocol, healthPath, timeout, required);
    }

    @Override
    public String toString() {
        return name + " [" + url() + "]";
    }

    /** Builder for {@link ServiceEndpoint}. */
    public static final class Builder {
        private final String name;
        private String host;
        private int port;
        private Protocol protocol = Protocol.HTTP;
        private String healthPath;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean required = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        /** Sets the health path (default: {@code /health} for HTTP, empty for TCP). */
        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        /** Builds and validates the endpoint. */
        public ServiceEndpoint build() {
            if (healthPath == null) {
                healthPath = protocol != null && protocol.isHttp() ? DEFAULT_HEALTH_PATH : "";
            }
            if (port == 0 && protocol != null && protocol.defaultPort() > 0) {
                port = protocol.defaultPort();
            }
            validate();
            return new ServiceEndpoint(this);
        }

        private void validate() {
            if (name == null || name.isEmpty()) {
                throw new ValidationException("service name must not be empty");
            }
            if (name.length() > MAX_NAME_LENGTH) {
                throw new ValidationException(
                        "service name must be at most " + MAX_NAME_LENGTH
                                + " characters, got " + name.length());
            }
            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new ValidationException(
                        "service name must match " + NAME_PATTERN.pattern()
                                + ", got '" + name + "'");
            }
            if (host == null || host.isBlank()) {
                throw new ValidationException("host must not be empty for service '" + name + "'");
            }
            if (port < 1 || port > 65535) {
                throw new ValidationException(
                        "port must be between 1 and 65535 for service '" + name + "', got " + port);
            }
            if (protocol == null) {
                throw new ValidationException("protocol must be set for service '" + name + "'");
            }
            if (!healthPath.isEmpty() && !healthPath.startsWith("/")) {
                throw new ValidationException(
                        "health path must start with '/', got '" + healthPath + "'");
            }
            if (timeout == null
                    || timeout.compareTo(MIN_TIMEOUT) < 0 || timeout.compareTo(MAX_TIMEOUT) > 0) {
                throw new ValidationException(
                        "timeout must be between " + MIN_TIMEOUT + " and " + MAX_TIMEOUT
                                + ", got " + timeout);
            }
        }
    }
}

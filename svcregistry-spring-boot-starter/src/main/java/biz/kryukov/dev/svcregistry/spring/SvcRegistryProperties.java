package biz.kryukov.dev.svcregistry.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for svcregistry via application.yml / application.properties.
 *
 * <pre>
 * svcregistry:
 *   interval: 30s
 *   timeout: 5s
 *   circuit-breaker-threshold: 3
 *   circuit-breaker-multiplier: 3
 *   services:
 *     backend:
 *       protocol: http
 *       host: 10.0.0.10
 *       port: 8001
 *       health-path: /api/health
 *     redis:
 *       url: redis://10.0.0.13:6379
 *     ai-stack:
 *       url: http://10.0.0.14:8080/health
 *       required: false
 * </pre>
 */
@ConfigurationProperties(prefix = "svcregistry")
public class SvcRegistryProperties {

    private Duration interval;
    private Duration timeout;
    private Integer circuitBreakerThreshold;
    private Integer circuitBreakerMultiplier;
    private Set<String> dataStores = new LinkedHashSet<>();
    private Map<String, String> httpHeaders = new LinkedHashMap<>();
    private Map<String, ServiceProperties> services = new LinkedHashMap<>();

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Integer getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public void setCircuitBreakerThreshold(Integer circuitBreakerThreshold) {
        this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    public Integer getCircuitBreakerMultiplier() {
        return circuitBreakerMultiplier;
    }

    public void setCircuitBreakerMultiplier(Integer circuitBreakerMultiplier) {
        this.circuitBreakerMultiplier = circuitBreakerMultiplier;
    }

    /** TCP service names probed with a Redis PING instead of a bare connect. */
    public Set<String> getDataStores() {
        return dataStores;
    }

    public void setDataStores(Set<String> dataStores) {
        this.dataStores = dataStores;
    }

    /** Headers sent with every HTTP health check. */
    public Map<String, String> getHttpHeaders() {
        return httpHeaders;
    }

    public void setHttpHeaders(Map<String, String> httpHeaders) {
        this.httpHeaders = httpHeaders;
    }

    public Map<String, ServiceProperties> getServices() {
        return services;
    }

    public void setServices(Map<String, ServiceProperties> services) {
        this.services = services;
    }

    public static class ServiceProperties {
        private String protocol;
        private String url;
        private String host;
        private Integer port;
        private String healthPath;
        private Duration timeout;
        private Boolean required;

        // Redis
        private String redisPassword;

        public String getProtocol() {
            return protocol;
        }

        public void setProtocol(String protocol) {
            this.protocol = protocol;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }

        public String getHealthPath() {
            return healthPath;
        }

        public void setHealthPath(String healthPath) {
            this.healthPath = healthPath;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Boolean getRequired() {
            return required;
        }

        public void setRequired(Boolean required) {
            this.required = required;
        }

        public String getRedisPassword() {
            return redisPassword;
        }

        public void setRedisPassword(String redisPassword) {
            this.redisPassword = redisPassword;
        }
    }
}

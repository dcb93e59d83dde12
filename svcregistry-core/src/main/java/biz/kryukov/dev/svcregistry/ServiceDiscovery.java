package biz.kryukov.dev.svcregistry;

import biz.kryukov.dev.svcregistry.checks.HttpServiceChecker;
import biz.kryukov.dev.svcregistry.checks.RedisPingChecker;
import biz.kryukov.dev.svcregistry.checks.TcpServiceChecker;
import biz.kryukov.dev.svcregistry.metrics.MetricsExporter;
import biz.kryukov.dev.svcregistry.parser.ParsedUrl;
import biz.kryukov.dev.svcregistry.parser.ServiceUrlParser;
import biz.kryukov.dev.svcregistry.registry.ServiceRegistry;
import biz.kryukov.dev.svcregistry.scheduler.CircuitBreakerPolicy;
import biz.kryukov.dev.svcregistry.scheduler.HealthCheckRunner;
import biz.kryukov.dev.svcregistry.scheduler.HealthMonitor;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point of the service registry: resolves service URLs, monitors health and
 * answers readiness questions.
 *
 * <p>Usage:
 * <pre>{@code
 * ServiceDiscovery discovery = ServiceDiscovery.builder(meterRegistry)
 *     .checkInterval(Duration.ofSeconds(30))
 *     .service("backend", Protocol.HTTP, s -> s
 *         .host("10.0.0.10").port(8001)
 *         .healthPath("/api/health"))
 *     .service("redis", Protocol.TCP, s -> s
 *         .host("10.0.0.13").port(6379))
 *     .service("ai-stack", Protocol.HTTP, s -> s
 *         .url("http://10.0.0.14:8080/health")
 *         .required(false))
 *     .build();
 *
 * discovery.startHealthMonitoring();
 * // ...
 * discovery.close();
 * }</pre>
 *
 * <p>One instance is created at startup and handed to every consumer. Nothing starts
 * implicitly: the owner of the application lifecycle calls
 * {@link #startHealthMonitoring()} and {@link #close()}.</p>
 */
public final class ServiceDiscovery implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceDiscovery.class);

    private final ServiceRegistry registry;
    private final DiscoveryConfig config;
    private final HealthCheckRunner runner;
    private final HealthMonitor monitor;
    private final ExecutorService checkExecutor;
    private final CheckerSelector selector;
    private final Clock clock;
    private final Logger logger;

    private ServiceDiscovery(Builder builder, ServiceRegistry registry,
                             CheckerSelector selector, ExecutorService checkExecutor) {
        this.registry = registry;
        this.config = builder.config;
        this.selector = selector;
        this.checkExecutor = checkExecutor;
        this.clock = builder.clock;
        this.logger = builder.logger;

        MetricsExporter metrics = builder.meterRegistry != null
                ? new MetricsExporter(builder.meterRegistry)
                : MetricsExporter.noop();
        this.runner = new HealthCheckRunner(registry, CircuitBreakerPolicy.from(config),
                metrics, checkExecutor, clock, config.checkGrace(), logger);
        this.monitor = new HealthMonitor(runner, config, logger);
    }

    // ---- Registration ----

    /**
     * Registers (or replaces) a service before monitoring starts; the checker is
     * selected from its protocol and name.
     *
     * @throws IllegalStateException if monitoring is running or the registry is busy
     */
    public void register(ServiceEndpoint endpoint) {
        register(endpoint, selector.select(endpoint));
    }

    /**
     * Registers (or replaces) a service with a custom checker before monitoring starts.
     *
     * @throws IllegalStateException if monitoring is running or the registry is busy
     * @throws ConfigurationException if the checker cannot probe the service's protocol
     */
    public void register(ServiceEndpoint endpoint, ServiceChecker checker) {
        if (monitor.isRunning()) {
            throw new IllegalStateException(
                    "Cannot register service '" + endpoint.name() + "' while monitoring is running");
        }
        requireSupported(endpoint, checker);
        registry.register(endpoint, checker);
    }

    // ---- Queries ----

    /**
     * Returns the service URL ({@code protocol://host:port}) regardless of its health.
     * Logs a warning if the service is required and not currently available.
     *
     * @return the URL, or empty for unknown services
     */
    public Optional<String> getServiceUrl(String name) {
        Optional<EndpointStatus> status = registry.details(name);
        if (status.isEmpty()) {
            return Optional.empty();
        }
        EndpointStatus s = status.get();
        if (s.required() && !s.available()) {
            logger.warn("svcregistry: required service {} is not available (status {})",
                    name, s.status().label());
        }
        return Optional.of(s.url());
    }

    /**
     * Runs one on-demand check of a service, subject to the circuit breaker.
     *
     * @return the resulting status; {@link ServiceStatus#UNKNOWN} for unknown services
     */
    public ServiceStatus checkServiceHealth(String name) {
        return runner.checkService(name);
    }

    /**
     * Checks every service concurrently and returns once all checks completed or timed out.
     * If the calling thread is interrupted, pending checks are cancelled and the
     * statuses known at that point are returned with the interrupt flag restored.
     */
    public Map<String, ServiceStatus> checkAllServices() {
        try {
            return runner.checkAll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return registry.statuses();
        }
    }

    /** Returns the current status without running a check; UNKNOWN for unknown services. */
    public ServiceStatus getServiceStatus(String name) {
        return registry.statusOf(name).orElse(ServiceStatus.UNKNOWN);
    }

    /** Returns the names of services whose status is exactly HEALTHY. */
    public List<String> getHealthyServices() {
        return registry.healthyNames();
    }

    /** Returns counts per status and per-service detail. */
    public StatusSummary getServiceStatusSummary() {
        return StatusSummary.of(clock.instant(), registry.details());
    }

    /** Returns the detail of one service. */
    public Optional<EndpointStatus> getServiceDetails(String name) {
        return registry.details(name);
    }

    // ---- Readiness ----

    /** Waits for a service with the configured default timeout. */
    public boolean waitForService(String name) {
        return waitForService(name, config.serviceWaitTimeout());
    }

    /**
     * Polls {@link #checkServiceHealth} until the service is HEALTHY or the timeout
     * elapses. A slow check never extends the wait past the timeout.
     *
     * @return {@code true} if the service became healthy; {@code false} on timeout,
     *         interruption or for unknown services
     */
    public boolean waitForService(String name, Duration timeout) {
        if (!registry.contains(name)) {
            return false;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            AtomicBoolean settled = new AtomicBoolean();
            Future<ServiceStatus> check =
                    checkExecutor.submit(() -> runner.checkService(name, settled));
            try {
                if (check.get(remaining, TimeUnit.NANOSECONDS) == ServiceStatus.HEALTHY) {
                    return true;
                }
            } catch (TimeoutException e) {
                // An abandoned check leaves the registry untouched.
                settled.set(true);
                check.cancel(true);
                return false;
            } catch (ExecutionException e) {
                logger.error("svcregistry: health check failed for {}", name, e.getCause());
            } catch (InterruptedException e) {
                settled.set(true);
                check.cancel(true);
                Thread.currentThread().interrupt();
                return false;
            }
            if (!pause(config.serviceWaitInterval(), deadline)) {
                return false;
            }
        }
    }

    /** Waits for the required services with the configured default timeout. */
    public ReadinessResult waitForCoreServices() {
        return waitForCoreServices(config.coreServicesWaitTimeout());
    }

    /**
     * Runs full sweeps until every required service is HEALTHY or the timeout elapses.
     *
     * @return whether all required services are ready, and which ones are
     */
    public ReadinessResult waitForCoreServices(Duration timeout) {
        List<String> required = registry.requiredNames();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            Future<Map<String, ServiceStatus>> sweep = checkExecutor.submit(runner::checkAll);
            try {
                sweep.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                sweep.cancel(true);
                break;
            } catch (ExecutionException e) {
                logger.error("svcregistry: health sweep failed", e.getCause());
            } catch (InterruptedException e) {
                sweep.cancel(true);
                Thread.currentThread().interrupt();
                break;
            }

            List<String> ready = readyAmong(required);
            if (ready.size() == required.size()) {
                return new ReadinessResult(true, ready);
            }
            List<String> missing = new ArrayList<>(required);
            missing.removeAll(ready);
            logger.info("svcregistry: waiting for services: {}", missing);

            if (!pause(config.coreServicesWaitInterval(), deadline)) {
                break;
            }
        }
        List<String> ready = readyAmong(required);
        return new ReadinessResult(ready.size() == required.size(), ready);
    }

    private List<String> readyAmong(List<String> names) {
        List<String> ready = new ArrayList<>();
        for (String name : names) {
            if (getServiceStatus(name) == ServiceStatus.HEALTHY) {
                ready.add(name);
            }
        }
        return ready;
    }

    /** Sleeps for the interval, capped at the deadline; false if the deadline passed or interrupted. */
    private static boolean pause(Duration interval, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            return false;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(Math.min(interval.toNanos(), remaining));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ---- Lifecycle ----

    /** Starts background monitoring. Does nothing if it is already running. */
    public void startHealthMonitoring() {
        monitor.start();
    }

    /** Stops background monitoring and cancels in-flight checks. */
    public void stopHealthMonitoring() {
        monitor.stop();
    }

    public boolean isMonitoring() {
        return monitor.isRunning();
    }

    /** Stops monitoring and releases the check threads. The instance is unusable afterwards. */
    @Override
    public void close() {
        monitor.stop();
        checkExecutor.shutdownNow();
    }

    /** Returns the underlying registry. */
    public ServiceRegistry registry() {
        return registry;
    }

    /** Returns the monitor loop. */
    public HealthMonitor monitor() {
        return monitor;
    }

    public DiscoveryConfig config() {
        return config;
    }

    private static void requireSupported(ServiceEndpoint endpoint, ServiceChecker checker) {
        Objects.requireNonNull(checker, "checker");
        if (!checker.protocols().contains(endpoint.protocol())) {
            throw new ConfigurationException(
                    "Checker " + checker.getClass().getSimpleName() + " cannot probe "
                            + endpoint.protocol().label() + " service '" + endpoint.name() + "'");
        }
    }

    public static Builder builder() {
        return new Builder(null);
    }

    public static Builder builder(MeterRegistry meterRegistry) {
        return new Builder(meterRegistry);
    }

    /**
     * Picks the checker for a service once, at registration time.
     */
    private static final class CheckerSelector {
        private final ServiceChecker httpChecker;
        private final ServiceChecker tcpChecker;
        private final ServiceChecker dataStoreChecker;
        private final Set<String> dataStores;

        private CheckerSelector(ServiceChecker httpChecker, ServiceChecker tcpChecker,
                                ServiceChecker dataStoreChecker, Set<String> dataStores) {
            this.httpChecker = httpChecker;
            this.tcpChecker = tcpChecker;
            this.dataStoreChecker = dataStoreChecker;
            this.dataStores = Set.copyOf(dataStores);
        }

        ServiceChecker select(ServiceEndpoint endpoint) {
            if (endpoint.protocol().isHttp()) {
                return httpChecker;
            }
            return dataStores.contains(endpoint.name()) ? dataStoreChecker : tcpChecker;
        }
    }

    /**
     * Service configuration in builder pattern.
     */
    public static final class ServiceBuilder {
        private String url;
        private String host;
        private Integer port;
        private String healthPath;
        private Duration timeout;
        private Boolean required;
        private String redisPassword;
        private ServiceChecker checker;

        private ServiceBuilder() {}

        /**
         * Sets host, port, protocol and (for HTTP) health path from a URL. A
         * {@code redis://:password@host} URL also supplies the AUTH password unless
         * {@link #redisPassword(String)} is set.
         */
        public ServiceBuilder url(String url) {
            this.url = url;
            return this;
        }

        public ServiceBuilder host(String host) {
            this.host = host;
            return this;
        }

        public ServiceBuilder port(int port) {
            this.port = port;
            return this;
        }

        public ServiceBuilder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public ServiceBuilder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public ServiceBuilder required(boolean required) {
            this.required = required;
            return this;
        }

        /** Password sent with AUTH before PING; marks the service as a Redis data store. */
        public ServiceBuilder redisPassword(String redisPassword) {
            this.redisPassword = redisPassword;
            return this;
        }

        /** Uses a custom checker for this service. */
        public ServiceBuilder checker(ServiceChecker checker) {
            this.checker = checker;
            return this;
        }
    }

    public static final class Builder {
        private final MeterRegistry meterRegistry;
        private DiscoveryConfig config;
        private final DiscoveryConfig.Builder configBuilder = DiscoveryConfig.builder();
        private Duration globalTimeout;
        private Clock clock = Clock.systemUTC();
        private Logger logger = LOG;
        private HttpServiceChecker httpChecker;
        private final Set<String> dataStores = new HashSet<>(Set.of("redis"));
        private final Map<String, ServiceEntry> entries = new LinkedHashMap<>();

        private Builder(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        /** Sets the pause between monitor cycles (also the base of the breaker window). */
        public Builder checkInterval(Duration interval) {
            configBuilder.interval(interval);
            return this;
        }

        /** Sets the per-check timeout for services that do not set their own. */
        public Builder timeout(Duration timeout) {
            this.globalTimeout = timeout;
            return this;
        }

        /** Sets the circuit breaker threshold and window multiplier. */
        public Builder circuitBreaker(int threshold, int multiplier) {
            configBuilder.circuitBreakerThreshold(threshold).circuitBreakerMultiplier(multiplier);
            return this;
        }

        /** Replaces the whole configuration; overrides checkInterval and circuitBreaker. */
        public Builder config(DiscoveryConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Sets the logger used for health transitions and readiness messages. */
        public Builder logger(Logger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        /** Uses a preconfigured HTTP checker (custom headers, connect timeout). */
        public Builder httpChecker(HttpServiceChecker httpChecker) {
            this.httpChecker = httpChecker;
            return this;
        }

        /** Marks a TCP service name as a Redis-compatible data store probed with PING. */
        public Builder dataStore(String name) {
            dataStores.add(name);
            return this;
        }

        /**
         * Adds a service with configuration through a lambda.
         */
        public Builder service(String name, Protocol protocol, Consumer<ServiceBuilder> configurer) {
            ServiceBuilder sb = new ServiceBuilder();
            configurer.accept(sb);
            addEntry(name, new ServiceEntry(name, protocol, sb, null));
            return this;
        }

        /**
         * Adds a service whose protocol is taken from its URL.
         */
        public Builder service(String name, Consumer<ServiceBuilder> configurer) {
            return service(name, null, configurer);
        }

        /** Adds a ready-made service definition. */
        public Builder service(ServiceEndpoint endpoint) {
            addEntry(endpoint.name(), new ServiceEntry(endpoint.name(), null, null, endpoint));
            return this;
        }

        /** Adds a ready-made service definition with a custom checker. */
        public Builder service(ServiceEndpoint endpoint, ServiceChecker checker) {
            ServiceBuilder sb = new ServiceBuilder().checker(checker);
            addEntry(endpoint.name(), new ServiceEntry(endpoint.name(), null, sb, endpoint));
            return this;
        }

        private void addEntry(String name, ServiceEntry entry) {
            if (entries.containsKey(name)) {
                throw new ConfigurationException("Duplicate service name: " + name);
            }
            entries.put(name, entry);
        }

        public ServiceDiscovery build() {
            if (config == null) {
                config = configBuilder.build();
            }
            if (globalTimeout != null) {
                validateTimeout(globalTimeout);
            }

            HttpServiceChecker http = httpChecker != null ? httpChecker
                    : HttpServiceChecker.builder().build();
            CheckerSelector selector = new CheckerSelector(http, new TcpServiceChecker(),
                    RedisPingChecker.create(), dataStores);

            ServiceRegistry registry = new ServiceRegistry();
            for (ServiceEntry entry : entries.values()) {
                ServiceEndpoint endpoint = entry.endpoint() != null
                        ? entry.endpoint() : resolveEndpoint(entry);
                ServiceChecker checker = resolveChecker(entry, endpoint, selector);
                requireSupported(endpoint, checker);
                registry.register(endpoint, checker);
            }

            ExecutorService checkExecutor = Executors.newCachedThreadPool(new CheckThreadFactory());
            return new ServiceDiscovery(this, registry, selector, checkExecutor);
        }

        private ServiceEndpoint resolveEndpoint(ServiceEntry entry) {
            ServiceBuilder sb = entry.config();
            Protocol protocol = entry.protocol();
            String host = sb.host;
            Integer port = sb.port;
            String healthPath = sb.healthPath;

            if (sb.url != null && !sb.url.isEmpty()) {
                ParsedUrl parsed = ServiceUrlParser.parse(sb.url);
                if (protocol == null) {
                    protocol = parsed.protocol();
                } else if (protocol != parsed.protocol()) {
                    throw new ConfigurationException("Service '" + entry.name() + "' is declared as "
                            + protocol.label() + " but its URL uses " + parsed.protocol().label());
                }
                if (host == null) {
                    host = parsed.host();
                }
                if (port == null) {
                    port = parsed.port();
                }
                if (healthPath == null && protocol.isHttp() && !parsed.path().isEmpty()) {
                    healthPath = parsed.path();
                }
                if (parsed.dataStore()) {
                    dataStores.add(entry.name());
                    if (sb.redisPassword == null && parsed.password() != null) {
                        sb.redisPassword = parsed.password();
                    }
                }
            }
            if (protocol == null) {
                throw new ConfigurationException(
                        "Service '" + entry.name() + "' needs a protocol or a URL");
            }

            ServiceEndpoint.Builder eb = ServiceEndpoint.builder(entry.name())
                    .host(host)
                    .protocol(protocol)
                    .healthPath(healthPath);
            if (port != null) {
                eb.port(port);
            }
            Duration timeout = sb.timeout != null ? sb.timeout : globalTimeout;
            if (timeout != null) {
                eb.timeout(timeout);
            }
            if (sb.required != null) {
                eb.required(sb.required);
            }
            return eb.build();
        }

        private ServiceChecker resolveChecker(ServiceEntry entry, ServiceEndpoint endpoint,
                                              CheckerSelector selector) {
            ServiceBuilder sb = entry.config();
            if (sb != null && sb.checker != null) {
                return sb.checker;
            }
            if (sb != null && sb.redisPassword != null && !sb.redisPassword.isEmpty()) {
                return RedisPingChecker.builder().password(sb.redisPassword).build();
            }
            if (endpoint.protocol() == Protocol.TCP && dataStores.contains(endpoint.name())) {
                return selector.dataStoreChecker;
            }
            return selector.select(endpoint);
        }

        private static void validateTimeout(Duration timeout) {
            if (timeout.compareTo(ServiceEndpoint.MIN_TIMEOUT) < 0
                    || timeout.compareTo(ServiceEndpoint.MAX_TIMEOUT) > 0) {
                throw new ValidationException(
                        "timeout must be between " + ServiceEndpoint.MIN_TIMEOUT + " and "
                                + ServiceEndpoint.MAX_TIMEOUT + ", got " + timeout);
            }
        }
    }

    private record ServiceEntry(String name, Protocol protocol, ServiceBuilder config,
                                ServiceEndpoint endpoint) {}

    private static final class CheckThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "svcregistry-check-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

package biz.kryukov.dev.svcregistry.scheduler;

import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.CheckTimeoutException;
import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.ServiceChecker;
import biz.kryukov.dev.svcregistry.ServiceStatus;
import biz.kryukov.dev.svcregistry.metrics.MetricsExporter;
import biz.kryukov.dev.svcregistry.registry.ServiceRegistry;
import biz.kryukov.dev.svcregistry.registry.StatusTransition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs health checks: circuit breaker gate, checker call, registry update.
 *
 * <p>{@link #checkAll()} fans the checks out over the check executor and waits for
 * each one until its own timeout plus a grace period. Every check attempt is applied
 * to the registry exactly once, whether it completes, times out or fails.</p>
 */
public final class HealthCheckRunner {

    private static final Logger LOG = LoggerFactory.getLogger(HealthCheckRunner.class);

    private final ServiceRegistry registry;
    private final CircuitBreakerPolicy breaker;
    private final MetricsExporter metrics;
    private final ExecutorService executor;
    private final Clock clock;
    private final Duration grace;
    private final Logger logger;

    public HealthCheckRunner(ServiceRegistry registry, CircuitBreakerPolicy breaker,
                             MetricsExporter metrics, ExecutorService executor, Clock clock,
                             Duration grace) {
        this(registry, breaker, metrics, executor, clock, grace, LOG);
    }

    @SuppressWarnings("checkstyle:ParameterNumber")
    public HealthCheckRunner(ServiceRegistry registry, CircuitBreakerPolicy breaker,
                             MetricsExporter metrics, ExecutorService executor, Clock clock,
                             Duration grace, Logger logger) {
        this.registry = registry;
        this.breaker = breaker;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.grace = grace;
        this.logger = logger;
    }

    /**
     * Checks one service in the calling thread.
     *
     * @return the resulting status, the retained status if the breaker skipped the check,
     *         or {@link ServiceStatus#UNKNOWN} for unregistered names
     */
    public ServiceStatus checkService(String name) {
        return checkService(name, new AtomicBoolean());
    }

    /**
     * Checks one service in the calling thread. A caller that gives up on the check sets
     * {@code settled} before cancelling it, so the abandoned result is never applied.
     */
    public ServiceStatus checkService(String name, AtomicBoolean settled) {
        Optional<EndpointView> view = registry.read(name);
        if (view.isEmpty()) {
            logger.warn("svcregistry: unknown service '{}'", name);
            return ServiceStatus.UNKNOWN;
        }
        return runCheck(view.get(), settled);
    }

    /**
     * Checks every registered service concurrently and waits for all of them.
     * A failing or hanging check only affects its own service.
     *
     * @return status per service, in registration order
     * @throws InterruptedException if the calling thread is interrupted; pending checks
     *                              are cancelled first
     */
    public Map<String, ServiceStatus> checkAll() throws InterruptedException {
        List<String> names = registry.snapshot();
        Map<String, PendingCheck> pending = new LinkedHashMap<>();
        long startNs = System.nanoTime();

        for (String name : names) {
            Optional<EndpointView> view = registry.read(name);
            if (view.isEmpty()) {
                continue;
            }
            AtomicBoolean settled = new AtomicBoolean();
            Future<ServiceStatus> future = executor.submit(() -> runCheck(view.get(), settled));
            long deadlineNs = view.get().endpoint().timeout().plus(grace).toNanos();
            pending.put(name, new PendingCheck(view.get(), settled, future, deadlineNs));
        }

        Map<String, ServiceStatus> results = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, PendingCheck> entry : pending.entrySet()) {
                results.put(entry.getKey(), await(entry.getValue(), startNs));
            }
        } catch (InterruptedException e) {
            // Cancelled checks leave the registry untouched.
            pending.values().forEach(p -> {
                p.settled.set(true);
                p.future.cancel(true);
            });
            throw e;
        }
        return results;
    }

    private ServiceStatus await(PendingCheck check, long startNs) throws InterruptedException {
        long remainingNs = check.deadlineNs - (System.nanoTime() - startNs);
        try {
            return check.future.get(Math.max(0, remainingNs), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            check.future.cancel(true);
            Duration limit = check.view.endpoint().timeout();
            return settleFailure(check, new CheckTimeoutException(
                    "health check did not complete within " + limit.toMillis() + "ms"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("svcregistry: health check failed for {}", check.view.name(), cause);
            return settleFailure(check, cause);
        } catch (CancellationException e) {
            return settleFailure(check, e);
        }
    }

    private ServiceStatus settleFailure(PendingCheck check, Throwable error) {
        if (!check.settled.compareAndSet(false, true)) {
            // The check applied its own result just before giving up on it.
            return registry.statusOf(check.view.name()).orElse(ServiceStatus.UNKNOWN);
        }
        Duration elapsed = check.view.endpoint().timeout().plus(grace);
        return apply(check.view, CheckOutcome.failure(error, elapsed));
    }

    private ServiceStatus runCheck(EndpointView view, AtomicBoolean settled) {
        Optional<ServiceStatus> retained = breaker.shouldSkip(view.consecutiveFailures(),
                view.lastCheckAt(), view.status(), clock.instant());
        if (retained.isPresent()) {
            metrics.recordSkip(view.endpoint());
            logger.debug("svcregistry: {} skipped by circuit breaker after {} failures",
                    view.name(), view.consecutiveFailures());
            return retained.get();
        }

        Optional<ServiceChecker> checker = registry.checkerFor(view.name());
        if (checker.isEmpty()) {
            return ServiceStatus.UNKNOWN;
        }

        CheckOutcome outcome = safeCheck(checker.get(), view);
        if (!settled.compareAndSet(false, true)) {
            logger.debug("svcregistry: discarding late result for {}", view.name());
            return outcome.status();
        }
        return apply(view, outcome);
    }

    private CheckOutcome safeCheck(ServiceChecker checker, EndpointView view) {
        long startNs = System.nanoTime();
        try {
            return checker.check(view);
        } catch (Exception e) {
            return CheckOutcome.failure(e, Duration.ofNanos(System.nanoTime() - startNs));
        } catch (Throwable t) {
            logger.error("svcregistry: panic in health checker for {}", view.name(), t);
            return CheckOutcome.failure(t, Duration.ofNanos(System.nanoTime() - startNs));
        }
    }

    private ServiceStatus apply(EndpointView view, CheckOutcome outcome) {
        Optional<StatusTransition> transition =
                registry.applyResult(view.name(), outcome, clock.instant());
        if (transition.isEmpty()) {
            return ServiceStatus.UNKNOWN;
        }
        EndpointView current = transition.get().current();
        metrics.recordCheck(view.endpoint(), outcome.status(), outcome.responseTime(),
                current.consecutiveFailures());
        logTransition(view, transition.get().previous(), outcome);
        return outcome.status();
    }

    private void logTransition(EndpointView view, ServiceStatus previous, CheckOutcome outcome) {
        ServiceStatus status = outcome.status();
        if (status == ServiceStatus.HEALTHY) {
            if (previous == ServiceStatus.DEGRADED || previous == ServiceStatus.UNHEALTHY) {
                logger.info("svcregistry: {} [{}] recovered", view.name(), view.endpoint().url());
            }
            return;
        }
        if (previous == ServiceStatus.UNKNOWN || previous == ServiceStatus.STARTING) {
            logger.warn("svcregistry: {} [{}] is {}: {}", view.name(), view.endpoint().url(),
                    status.label(), describe(outcome));
        } else if (previous == ServiceStatus.HEALTHY) {
            if (status == ServiceStatus.UNHEALTHY) {
                logger.error("svcregistry: {} [{}] became unhealthy: {}", view.name(),
                        view.endpoint().url(), describe(outcome));
            } else {
                logger.warn("svcregistry: {} [{}] is {}: {}", view.name(),
                        view.endpoint().url(), status.label(), describe(outcome));
            }
        }
    }

    private static String describe(CheckOutcome outcome) {
        return outcome.errorMessage() != null ? outcome.errorMessage() : outcome.category();
    }

    private record PendingCheck(EndpointView view, AtomicBoolean settled,
                                Future<ServiceStatus> future, long deadlineNs) {}
}

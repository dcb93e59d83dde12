package biz.kryukov.dev.svcregistry.registry;

import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.EndpointStatus;
import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.ServiceChecker;
import biz.kryukov.dev.svcregistry.ServiceEndpoint;
import biz.kryukov.dev.svcregistry.ServiceStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory map from service name to its definition, checker and health state.
 *
 * <p>A single lock guards the map. It is held only for a map read or a small
 * state mutation, never around network I/O: callers read an {@link EndpointView},
 * release the lock, run the check, then hand the outcome to {@link #applyResult}.</p>
 */
public final class ServiceRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RegistryEntry> entries = new LinkedHashMap<>();

    /**
     * Adds or replaces a service. One-time setup operation: callers must serialize it
     * with respect to updates.
     *
     * @throws IllegalStateException if the registry is locked for an update
     */
    public void register(ServiceEndpoint endpoint, ServiceChecker checker) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(checker, "checker");
        if (!lock.tryLock()) {
            throw new IllegalStateException(
                    "Cannot register service '" + endpoint.name()
                            + "' while the registry is locked for an update");
        }
        try {
            entries.put(endpoint.name(), new RegistryEntry(endpoint, checker));
        } finally {
            lock.unlock();
        }
    }

    /** Returns the registered names in registration order. */
    public List<String> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** Returns a value copy of the service's identity and breaker counters. */
    public Optional<EndpointView> read(String name) {
        lock.lock();
        try {
            RegistryEntry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.toView());
        } finally {
            lock.unlock();
        }
    }

    /** Returns the checker selected for the service at registration time. */
    public Optional<ServiceChecker> checkerFor(String name) {
        lock.lock();
        try {
            RegistryEntry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.checker());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically applies a completed check outcome.
     *
     * @return the status transition, or empty if the service is not registered
     */
    public Optional<StatusTransition> applyResult(String name, CheckOutcome outcome,
                                               Instant checkedAt) {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(checkedAt, "checkedAt");
        lock.lock();
        try {
            RegistryEntry entry = entries.get(name);
            if (entry == null) {
                return Optional.empty();
            }
            ServiceStatus previous = entry.status();
            entry.apply(outcome, checkedAt);
            return Optional.of(new StatusTransition(previous, entry.toView()));
        } finally {
            lock.unlock();
        }
    }

    /** Returns {@code protocol://host:port}, or empty for unknown names. */
    public Optional<String> urlFor(String name) {
        lock.lock();
        try {
            RegistryEntry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.endpoint().url());
        } finally {
            lock.unlock();
        }
    }

    /** Returns the current status of a service, or empty for unknown names. */
    public Optional<ServiceStatus> statusOf(String name) {
        lock.lock();
        try {
            RegistryEntry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.status());
        } finally {
            lock.unlock();
        }
    }

    /** Returns the current status of every service, in registration order. */
    public Map<String, ServiceStatus> statuses() {
        lock.lock();
        try {
            Map<String, ServiceStatus> result = new LinkedHashMap<>();
            entries.forEach((name, entry) -> result.put(name, entry.status()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Returns the names whose status is exactly {@link ServiceStatus#HEALTHY}. */
    public List<String> healthyNames() {
        lock.lock();
        try {
            List<String> result = new ArrayList<>();
            entries.forEach((name, entry) -> {
                if (entry.status() == ServiceStatus.HEALTHY) {
                    result.add(name);
                }
            });
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Returns the names of services marked as required. */
    public List<String> requiredNames() {
        lock.lock();
        try {
            List<String> result = new ArrayList<>();
            entries.forEach((name, entry) -> {
                if (entry.endpoint().required()) {
                    result.add(name);
                }
            });
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Returns a detailed snapshot of every service, in registration order. */
    public Map<String, EndpointStatus> details() {
        lock.lock();
        try {
            Map<String, EndpointStatus> result = new LinkedHashMap<>();
            entries.forEach((name, entry) -> result.put(name, entry.toEndpointStatus()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Returns a detailed snapshot of one service. */
    public Optional<EndpointStatus> details(String name) {
        lock.lock();
        try {
            RegistryEntry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.toEndpointStatus());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String name) {
        lock.lock();
        try {
            return entries.containsKey(name);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}

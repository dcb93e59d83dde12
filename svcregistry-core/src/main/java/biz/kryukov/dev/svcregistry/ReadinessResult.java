package biz.kryukov.dev.svcregistry;

import java.util.List;

/**
 * Outcome of {@link ServiceDiscovery#waitForCoreServices}: whether every required
 * service became healthy, and which ones did (also on partial success).
 */
public record ReadinessResult(boolean ready, List<String> readyServices) {

    public ReadinessResult {
        readyServices = List.copyOf(readyServices);
    }
}

package biz.kryukov.dev.svcregistry.spring;

import biz.kryukov.dev.svcregistry.ServiceDiscovery;
import org.springframework.context.SmartLifecycle;

/**
 * SmartLifecycle: starts health monitoring once the context is up and stops it on shutdown.
 */
public class SvcRegistryLifecycle implements SmartLifecycle {

    private final ServiceDiscovery serviceDiscovery;

    public SvcRegistryLifecycle(ServiceDiscovery serviceDiscovery) {
        this.serviceDiscovery = serviceDiscovery;
    }

    @Override
    public void start() {
        serviceDiscovery.startHealthMonitoring();
    }

    @Override
    public void stop() {
        serviceDiscovery.stopHealthMonitoring();
    }

    @Override
    public boolean isRunning() {
        return serviceDiscovery.isMonitoring();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // start after all beans are initialized
    }
}

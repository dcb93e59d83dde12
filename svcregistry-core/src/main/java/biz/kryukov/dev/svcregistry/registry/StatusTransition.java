package biz.kryukov.dev.svcregistry.registry;

import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.ServiceStatus;

/**
 * Effect of one applied check: the status before it and the state right after it.
 */
public record StatusTransition(ServiceStatus previous, EndpointView current) {

    /** Whether the applied check changed the status. */
    public boolean changed() {
        return previous != current.status();
    }
}

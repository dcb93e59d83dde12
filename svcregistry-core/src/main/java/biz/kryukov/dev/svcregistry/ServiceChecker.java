package biz.kryukov.dev.svcregistry;

import java.util.Set;

/**
 * Health check strategy for one kind of service.
 *
 * <p>Implementations must be thread-safe and must never throw: every failure
 * (timeout, refused connection, protocol error, bug) is returned as an
 * {@link ServiceStatus#UNHEALTHY} outcome carrying the error text.</p>
 */
public interface ServiceChecker {

    /**
     * Performs a health check using the endpoint's own timeout.
     *
     * @param endpoint value copy of the service to check
     * @return the check outcome
     */
    CheckOutcome check(EndpointView endpoint);

    /** Returns the protocols this checker can probe. */
    Set<Protocol> protocols();
}

package biz.kryukov.dev.svcregistry;

/**
 * Base exception for the service registry.
 */
public class ServiceRegistryException extends RuntimeException {

    public ServiceRegistryException(String message) {
        super(message);
    }

    public ServiceRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}

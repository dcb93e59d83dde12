package biz.kryukov.dev.svcregistry;

/**
 * Parameter validation error.
 */
public class ValidationException extends ServiceRegistryException {

    public ValidationException(String message) {
        super(message);
    }
}

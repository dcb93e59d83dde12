package biz.kryukov.dev.svcregistry;

/**
 * Check timed out.
 */
public class CheckTimeoutException extends CheckException {

    public CheckTimeoutException(String message) {
        super(message, StatusCategory.TIMEOUT);
    }

    public CheckTimeoutException(String message, Throwable cause) {
        super(message, cause, StatusCategory.TIMEOUT);
    }
}

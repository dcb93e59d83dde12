package biz.kryukov.dev.svcregistry;

/**
 * Connection error (refused, unreachable).
 */
public class CheckConnectionException extends CheckException {

    public CheckConnectionException(String message) {
        super(message, StatusCategory.CONNECTION_ERROR);
    }

    public CheckConnectionException(String message, Throwable cause) {
        super(message, cause, StatusCategory.CONNECTION_ERROR);
    }
}

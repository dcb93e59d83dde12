package biz.kryukov.dev.svcregistry;

/**
 * The connection was established but the service answered with an error
 * (non-2xx status, unexpected PING reply).
 */
public class CheckProtocolException extends CheckException {

    public CheckProtocolException(String message) {
        super(message, StatusCategory.PROTOCOL_ERROR);
    }

    public CheckProtocolException(String message, Throwable cause) {
        super(message, cause, StatusCategory.PROTOCOL_ERROR);
    }
}

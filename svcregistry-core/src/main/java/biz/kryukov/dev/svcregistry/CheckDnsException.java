package biz.kryukov.dev.svcregistry;

/**
 * Host name could not be resolved.
 */
public class CheckDnsException extends CheckException {

    public CheckDnsException(String message) {
        super(message, StatusCategory.DNS_ERROR);
    }

    public CheckDnsException(String message, Throwable cause) {
        super(message, cause, StatusCategory.DNS_ERROR);
    }
}

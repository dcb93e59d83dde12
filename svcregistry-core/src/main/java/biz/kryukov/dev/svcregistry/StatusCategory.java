package biz.kryukov.dev.svcregistry;

/**
 * Failure taxonomy constants for check outcomes.
 */
public final class StatusCategory {

    public static final String OK = "ok";
    public static final String TIMEOUT = "timeout";
    public static final String CONNECTION_ERROR = "connection_error";
    public static final String DNS_ERROR = "dns_error";
    public static final String PROTOCOL_ERROR = "protocol_error";
    public static final String ERROR = "error";
    /** Category of an endpoint that has not been checked yet. */
    public static final String UNKNOWN = "unknown";

    private StatusCategory() {}
}

package biz.kryukov.dev.svcregistry;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies check exceptions into a {@link StatusCategory} value.
 *
 * <p>Classification chain:
 * <ol>
 *   <li>{@link CheckException} with an explicit category</li>
 *   <li>Platform exception types (timeout, DNS, connection)</li>
 *   <li>Wrapped exception cause (recursive)</li>
 *   <li>Fallback: error</li>
 * </ol>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    /**
     * Classifies an exception.
     *
     * @param err the exception to classify, or null for success
     * @return the status category
     */
    public static String classify(Throwable err) {
        if (err == null) {
            return StatusCategory.OK;
        }

        if (err instanceof CheckException ce) {
            return ce.statusCategory();
        }

        String platform = classifyPlatform(err);
        if (platform != null) {
            return platform;
        }

        Throwable cause = err.getCause();
        if (cause != null && cause != err) {
            String inner = classify(cause);
            if (!StatusCategory.ERROR.equals(inner)) {
                return inner;
            }
        }

        return StatusCategory.ERROR;
    }

    /**
     * Builds the human-readable error text stored in the registry:
     * the exception message (or class name) plus the root cause message when present.
     */
    public static String describe(Throwable err) {
        String msg = err.getMessage() != null ? err.getMessage() : err.getClass().getName();
        Throwable cause = err.getCause();
        if (cause != null && cause != err) {
            msg += " (cause: " + (cause.getMessage() != null
                    ? cause.getMessage() : cause.getClass().getName()) + ")";
        }
        return msg;
    }

    private static String classifyPlatform(Throwable err) {
        if (err instanceof SocketTimeoutException
                || err instanceof TimeoutException
                || err instanceof HttpConnectTimeoutException
                || err instanceof HttpTimeoutException) {
            return StatusCategory.TIMEOUT;
        }
        if (err instanceof UnknownHostException) {
            return StatusCategory.DNS_ERROR;
        }
        if (err instanceof ConnectException || err instanceof NoRouteToHostException) {
            return StatusCategory.CONNECTION_ERROR;
        }
        return null;
    }
}

package biz.kryukov.dev.svcregistry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @Test
    void nullIsOk() {
        assertEquals(StatusCategory.OK, ErrorClassifier.classify(null));
    }

    @Test
    void checkExceptionsCarryTheirCategory() {
        assertEquals(StatusCategory.TIMEOUT,
                ErrorClassifier.classify(new CheckTimeoutException("slow")));
        assertEquals(StatusCategory.CONNECTION_ERROR,
                ErrorClassifier.classify(new CheckConnectionException("refused")));
        assertEquals(StatusCategory.DNS_ERROR,
                ErrorClassifier.classify(new CheckDnsException("no such host")));
        assertEquals(StatusCategory.PROTOCOL_ERROR,
                ErrorClassifier.classify(new CheckProtocolException("HTTP 500")));
    }

    @Test
    void platformExceptions() {
        assertEquals(StatusCategory.TIMEOUT,
                ErrorClassifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(StatusCategory.TIMEOUT,
                ErrorClassifier.classify(new TimeoutException()));
        assertEquals(StatusCategory.TIMEOUT,
                ErrorClassifier.classify(new HttpTimeoutException("request timed out")));
        assertEquals(StatusCategory.DNS_ERROR,
                ErrorClassifier.classify(new UnknownHostException("nope.invalid")));
        assertEquals(StatusCategory.CONNECTION_ERROR,
                ErrorClassifier.classify(new ConnectException("Connection refused")));
        assertEquals(StatusCategory.CONNECTION_ERROR,
                ErrorClassifier.classify(new NoRouteToHostException()));
    }

    @Test
    void wrappedCauseIsClassified() {
        Exception wrapped = new RuntimeException("outer", new IOException("io",
                new ConnectException("Connection refused")));
        assertEquals(StatusCategory.CONNECTION_ERROR, ErrorClassifier.classify(wrapped));
    }

    @Test
    void unknownFallsBackToError() {
        assertEquals(StatusCategory.ERROR,
                ErrorClassifier.classify(new IllegalStateException("boom")));
    }

    @Test
    void describeIncludesCause() {
        assertEquals("outer (cause: inner)",
                ErrorClassifier.describe(new RuntimeException("outer", new IOException("inner"))));
        assertEquals("java.lang.IllegalStateException",
                ErrorClassifier.describe(new IllegalStateException()));
    }
}

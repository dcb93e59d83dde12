package biz.kryukov.dev.svcregistry.checks;

import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.CheckProtocolException;
import biz.kryukov.dev.svcregistry.EndpointView;
import biz.kryukov.dev.svcregistry.Protocol;
import biz.kryukov.dev.svcregistry.ServiceChecker;
import biz.kryukov.dev.svcregistry.StatusCategory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HTTP health checker: GET on the service's health path.
 *
 * <ul>
 *   <li>200 is healthy, unless the JSON body reports {@code "status": "degraded"} or
 *       {@code "warning"}; {@code version} and {@code capabilities} are captured when present.</li>
 *   <li>502, 503 and 504 are degraded (temporary issue).</li>
 *   <li>Any other status, a timeout or a connection error is unhealthy.</li>
 * </ul>
 * A body that is empty or not JSON does not affect a 200 result.
 */
public final class HttpServiceChecker implements ServiceChecker {

    private static final Logger LOG = LoggerFactory.getLogger(HttpServiceChecker.class);

    private static final String USER_AGENT = "svcregistry/0.1.0";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Set<Integer> TEMPORARY_ISSUE_CODES = Set.of(502, 503, 504);
    private static final Set<String> DEGRADED_STATUS_VALUES = Set.of("degraded", "warning");

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> headers;

    private HttpServiceChecker(Builder builder) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.mapper = builder.mapper;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    }

    @Override
    public CheckOutcome check(EndpointView endpoint) {
        long startNs = System.nanoTime();
        try {
            return probe(endpoint, startNs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckOutcome.unhealthy(elapsed(startNs), StatusCategory.ERROR,
                    "check interrupted");
        } catch (Exception e) {
            return CheckOutcome.failure(e, elapsed(startNs));
        }
    }

    private CheckOutcome probe(EndpointView endpoint, long startNs) throws Exception {
        URI uri = URI.create(endpoint.endpoint().healthUrl());

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(endpoint.endpoint().timeout())
                .header("User-Agent", USER_AGENT)
                .GET();

        // Custom headers go after User-Agent so they can override it.
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            requestBuilder.header(entry.getKey(), entry.getValue());
        }

        HttpResponse<String> response = client.send(requestBuilder.build(),
                HttpResponse.BodyHandlers.ofString());
        Duration responseTime = elapsed(startNs);

        int status = response.statusCode();
        if (status == 200) {
            return evaluateBody(endpoint, response.body(), responseTime);
        }
        if (TEMPORARY_ISSUE_CODES.contains(status)) {
            return CheckOutcome.degraded(responseTime, StatusCategory.PROTOCOL_ERROR,
                    "HTTP " + status + " (temporary issue)", null, null);
        }
        throw new CheckProtocolException("HTTP health check failed: status " + status);
    }

    private CheckOutcome evaluateBody(EndpointView endpoint, String body, Duration responseTime) {
        if (body == null || body.isBlank()) {
            return CheckOutcome.healthy(responseTime);
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.debug("svcregistry: {} returned a non-JSON health body", endpoint.name());
            return CheckOutcome.healthy(responseTime);
        }
        if (root == null || !root.isObject()) {
            return CheckOutcome.healthy(responseTime);
        }

        JsonNode versionNode = root.get("version");
        String version = versionNode != null && versionNode.isValueNode()
                ? versionNode.asText() : null;

        List<String> capabilities = new ArrayList<>();
        JsonNode capabilitiesNode = root.get("capabilities");
        if (capabilitiesNode != null && capabilitiesNode.isArray()) {
            capabilitiesNode.forEach(node -> capabilities.add(node.asText()));
        }

        String reported = root.path("status").asText("healthy").toLowerCase(Locale.ROOT);
        if (DEGRADED_STATUS_VALUES.contains(reported)) {
            return CheckOutcome.degraded(responseTime, StatusCategory.OK,
                    "service reports status '" + reported + "'", version, capabilities);
        }
        return CheckOutcome.healthy(responseTime, version, capabilities);
    }

    private static Duration elapsed(long startNs) {
        return Duration.ofNanos(System.nanoTime() - startNs);
    }

    @Override
    public Set<Protocol> protocols() {
        return Set.of(Protocol.HTTP, Protocol.HTTPS);
    }

    /** Returns the custom request headers. */
    public Map<String, String> headers() {
        return headers;
    }

    /** Creates a new builder with default settings. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link HttpServiceChecker}. */
    public static final class Builder {
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private ObjectMapper mapper = new ObjectMapper();
        private Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {}

        /** Sets the TCP connect timeout of the shared client (default: 10s). */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /** Sets the mapper used to read health bodies. */
        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        /** Sets custom HTTP headers sent with every check. */
        public Builder headers(Map<String, String> headers) {
            this.headers = new LinkedHashMap<>(headers);
            return this;
        }

        public HttpServiceChecker build() {
            return new HttpServiceChecker(this);
        }
    }
}

package biz.kryukov.dev.svcregistry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ServiceEndpointTest {

    @Test
    void httpDefaults() {
        ServiceEndpoint ep = ServiceEndpoint.builder("backend").host("10.0.0.10").build();
        assertEquals(Protocol.HTTP, ep.protocol());
        assertEquals(80, ep.port());
        assertEquals("/health", ep.healthPath());
        assertEquals(Duration.ofSeconds(5), ep.timeout());
        assertTrue(ep.required());
        assertEquals("http://10.0.0.10:80", ep.url());
        assertEquals("http://10.0.0.10:80/health", ep.healthUrl());
    }

    @Test
    void tcpHasNoHealthPath() {
        ServiceEndpoint ep = ServiceEndpoint.builder("redis")
                .host("10.0.0.13").port(6379).protocol(Protocol.TCP).build();
        assertEquals("", ep.healthPath());
        assertEquals("tcp://10.0.0.13:6379", ep.url());
    }

    @Test
    void tcpRequiresPort() {
        assertThrows(ValidationException.class, () -> ServiceEndpoint.builder("vnc")
                .host("localhost").protocol(Protocol.TCP).build());
    }

    @Test
    void ipv6HostIsBracketed() {
        ServiceEndpoint ep = ServiceEndpoint.builder("backend").host("::1").port(8001).build();
        assertEquals("http://[::1]:8001", ep.url());
    }

    @Test
    void invalidNames() {
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("").host("h").build());
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("Backend").host("h").build());
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("1st").host("h").build());
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("a".repeat(64)).host("h").build());
        assertDoesNotThrow(() -> ServiceEndpoint.builder("ai-stack_2").host("h").build());
    }

    @Test
    void invalidHostAndPort() {
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("backend").build());
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("backend").host(" ").build());
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("backend").host("h").port(70000).build());
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("backend").host("h").port(-1).build());
    }

    @Test
    void healthPathMustBeAbsolute() {
        assertThrows(ValidationException.class,
                () -> ServiceEndpoint.builder("backend").host("h").healthPath("health").build());
    }

    @Test
    void timeoutBounds() {
        assertThrows(ValidationException.class, () -> ServiceEndpoint.builder("backend")
                .host("h").timeout(Duration.ofMillis(50)).build());
        assertThrows(ValidationException.class, () -> ServiceEndpoint.builder("backend")
                .host("h").timeout(Duration.ofSeconds(61)).build());
        assertDoesNotThrow(() -> ServiceEndpoint.builder("backend")
                .host("h").timeout(Duration.ofMillis(100)).build());
    }

    @Test
    void toBuilderRoundTripsAndEquality() {
        ServiceEndpoint ep = ServiceEndpoint.builder("backend")
                .host("10.0.0.10").port(8001).healthPath("/api/health")
                .timeout(Duration.ofSeconds(2)).required(false).build();
        ServiceEndpoint copy = ep.toBuilder().build();
        assertEquals(ep, copy);
        assertEquals(ep.hashCode(), copy.hashCode());
        assertNotEquals(ep, ep.toBuilder().port(8002).build());
        assertEquals("backend [http://10.0.0.10:8001]", ep.toString());
    }
}

package biz.kryukov.dev.svcregistry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryConfigTest {

    @Test
    void defaults() {
        DiscoveryConfig config = DiscoveryConfig.defaults();
        assertEquals(Duration.ofSeconds(30), config.interval());
        assertEquals(Duration.ofSeconds(5), config.errorRecoveryDelay());
        assertEquals(3, config.circuitBreakerThreshold());
        assertEquals(3, config.circuitBreakerMultiplier());
        assertEquals(Duration.ofSeconds(1), config.checkGrace());
        assertEquals(Duration.ofSeconds(1), config.serviceWaitInterval());
        assertEquals(Duration.ofSeconds(2), config.coreServicesWaitInterval());
        assertEquals(Duration.ofSeconds(30), config.serviceWaitTimeout());
        assertEquals(Duration.ofSeconds(60), config.coreServicesWaitTimeout());
    }

    @Test
    void customValues() {
        DiscoveryConfig config = DiscoveryConfig.builder()
                .interval(Duration.ofSeconds(10))
                .circuitBreakerThreshold(5)
                .circuitBreakerMultiplier(2)
                .checkGrace(Duration.ZERO)
                .build();
        assertEquals(Duration.ofSeconds(10), config.interval());
        assertEquals(5, config.circuitBreakerThreshold());
        assertEquals(2, config.circuitBreakerMultiplier());
        assertEquals(Duration.ZERO, config.checkGrace());
    }

    @Test
    void intervalBounds() {
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .interval(Duration.ofMillis(10)).build());
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .interval(Duration.ofMinutes(11)).build());
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .interval(null).build());
    }

    @Test
    void thresholdBounds() {
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .circuitBreakerThreshold(0).build());
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .circuitBreakerThreshold(101).build());
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .circuitBreakerMultiplier(0).build());
    }

    @Test
    void durationsMustBePositive() {
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .errorRecoveryDelay(Duration.ZERO).build());
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .serviceWaitTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(ValidationException.class, () -> DiscoveryConfig.builder()
                .checkGrace(Duration.ofMillis(-1)).build());
    }
}

package biz.kryukov.dev.svcregistry.scheduler;

import biz.kryukov.dev.svcregistry.CheckOutcome;
import biz.kryukov.dev.svcregistry.DiscoveryConfig;
import biz.kryukov.dev.svcregistry.ServiceEndpoint;
import biz.kryukov.dev.svcregistry.ServiceStatus;
import biz.kryukov.dev.svcregistry.StubChecker;
import biz.kryukov.dev.svcregistry.metrics.MetricsExporter;
import biz.kryukov.dev.svcregistry.registry.ServiceRegistry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HealthMonitorTest {

    private static final DiscoveryConfig FAST_CONFIG = DiscoveryConfig.builder()
            .interval(Duration.ofMillis(50))
            .errorRecoveryDelay(Duration.ofMillis(50))
            .checkGrace(Duration.ofMillis(100))
            .build();

    private ServiceRegistry registry;
    private ExecutorService executor;
    private Logger logger;
    private HealthCheckRunner runner;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        executor = Executors.newCachedThreadPool();
        logger = mock(Logger.class);
        runner = new HealthCheckRunner(registry, CircuitBreakerPolicy.from(FAST_CONFIG),
                MetricsExporter.noop(), executor, Clock.systemUTC(),
                FAST_CONFIG.checkGrace(), logger);
        monitor = new HealthMonitor(runner, FAST_CONFIG, logger);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
        executor.shutdownNow();
    }

    private static ServiceEndpoint endpoint(String name) {
        return ServiceEndpoint.builder(name).host("127.0.0.1").port(8001)
                .timeout(Duration.ofMillis(500)).build();
    }

    private static void awaitCondition(java.util.function.BooleanSupplier condition)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "condition not met within 3s");
            Thread.sleep(10);
        }
    }

    @Test
    void startRunsCyclesAndStopHalts() throws Exception {
        StubChecker checker = StubChecker.healthy();
        registry.register(endpoint("backend"), checker);

        assertEquals(HealthMonitor.State.STOPPED, monitor.state());
        monitor.start();
        assertTrue(monitor.isRunning());

        awaitCondition(() -> monitor.completedCycles() >= 3);
        assertEquals(ServiceStatus.HEALTHY, registry.statusOf("backend").orElseThrow());

        monitor.stop();
        assertEquals(HealthMonitor.State.STOPPED, monitor.state());
        int callsAfterStop = checker.calls();
        Thread.sleep(200);
        assertEquals(callsAfterStop, checker.calls());
    }

    @Test
    void startIsIdempotent() throws Exception {
        registry.register(endpoint("backend"), StubChecker.healthy());

        monitor.start();
        monitor.start();
        monitor.start();

        verify(logger, times(1)).info(eq("svcregistry: health monitoring started, interval {}"),
                any(Object.class));
        assertTrue(monitor.isRunning());
    }

    @Test
    void stopWhenStoppedIsNoop() {
        monitor.stop();
        assertEquals(HealthMonitor.State.STOPPED, monitor.state());
    }

    @Test
    void canRestartAfterStop() throws Exception {
        registry.register(endpoint("backend"), StubChecker.healthy());

        monitor.start();
        awaitCondition(() -> monitor.completedCycles() >= 1);
        monitor.stop();
        long cycles = monitor.completedCycles();

        monitor.start();
        awaitCondition(() -> monitor.completedCycles() > cycles);
        assertTrue(monitor.isRunning());
    }

    @Test
    void stopCancelsInFlightChecks() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        registry.register(ServiceEndpoint.builder("slow").host("127.0.0.1").port(8001)
                .timeout(Duration.ofSeconds(30)).build(), new StubChecker(() -> {
                    started.countDown();
                    try {
                        Thread.sleep(30_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                    }
                    return CheckOutcome.healthy(Duration.ZERO);
                }));

        monitor.start();
        assertTrue(started.await(2, TimeUnit.SECONDS));

        long start = System.nanoTime();
        monitor.stop();
        long stopMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(stopMs < 2000, "stop took " + stopMs + "ms");
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        assertEquals(ServiceStatus.UNKNOWN, registry.statusOf("slow").orElseThrow());
    }

    @Test
    void loopSurvivesUnexpectedErrors() throws Exception {
        HealthCheckRunner failingRunner = mock(HealthCheckRunner.class);
        IllegalStateException boom = new IllegalStateException("boom");
        when(failingRunner.checkAll()).thenThrow(boom).thenReturn(Map.of());
        HealthMonitor failingMonitor = new HealthMonitor(failingRunner, FAST_CONFIG, logger);

        failingMonitor.start();
        try {
            awaitCondition(() -> failingMonitor.completedCycles() >= 1);
            verify(logger).error("svcregistry: error in health monitor loop", boom);
        } finally {
            failingMonitor.stop();
        }
    }

    @Test
    void concurrentOnDemandChecksDuringMonitoring() throws Exception {
        StubChecker checker = StubChecker.healthy();
        registry.register(endpoint("backend"), checker);
        registry.register(endpoint("frontend"), StubChecker.healthy());
        monitor.start();

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<ServiceStatus>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String name = i % 2 == 0 ? "backend" : "frontend";
                futures.add(callers.submit(() -> runner.checkService(name)));
            }
            for (Future<ServiceStatus> f : futures) {
                assertEquals(ServiceStatus.HEALTHY, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(0, registry.read("backend").orElseThrow().consecutiveFailures());
        assertTrue(checker.calls() >= 100);
        verify(logger, atLeastOnce()).info(eq("svcregistry: health monitoring started, interval {}"),
                any(Object.class));
    }
}

package com.streamfleet.controlplane.registry;

import com.streamfleet.controlplane.config.DiscoveryConfig;
import com.streamfleet.controlplane.registry.backend.IDiscoveryBackend;
import com.streamfleet.controlplane.registry.backend.MemoryDiscoveryBackend;
import com.streamfleet.controlplane.support.MutableClock;
import com.streamfleet.core.metrics.MetricsNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceRegistryTest {

    private static final DiscoveryConfig CONFIG = DiscoveryConfig.builder()
        .serviceName("ws")
        .build();

    private final MutableClock clock = new MutableClock();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private FlakyBackend backend;
    private StubProbe probe;
    private ServiceRegistry registry;

    @BeforeEach
    void setUp() {
        backend = new FlakyBackend(new MemoryDiscoveryBackend(clock));
        probe = new StubProbe();
        registry = new ServiceRegistry(CONFIG, backend, probe, meterRegistry, clock);
    }

    private static Set<String> ids(List<ServiceInstance> instances) {
        return instances.stream().map(ServiceInstance::getId).collect(Collectors.toSet());
    }

    private ServiceInstance peer(String host, int port, String healthUrl) {
        return ServiceInstance.builder()
            .id(ServiceInstance.defaultId("ws", host, port))
            .name("ws")
            .host(host)
            .port(port)
            .healthCheckUrl(healthUrl)
            .registeredAt(clock.instant())
            .build();
    }

    @Test
    @DisplayName("Register, discover, deregister round trip")
    void testRegisterDiscoverDeregister() {
        StepVerifier.create(registry.registerService("10.0.0.5", 8080))
            .assertNext(instance -> {
                assertEquals("ws-10.0.0.5-8080", instance.getId());
                assertEquals(ServiceStatus.HEALTHY, instance.getStatus());
            })
            .verifyComplete();

        StepVerifier.create(registry.discoverServices(null))
            .assertNext(instances -> assertEquals(Set.of("ws-10.0.0.5-8080"), ids(instances)))
            .verifyComplete();

        StepVerifier.create(registry.deregisterService("ws-10.0.0.5-8080")).verifyComplete();
        assertEquals(ServiceStatus.STOPPED, registry.getLocalInstance().getStatus());

        StepVerifier.create(registry.discoverServices(null))
            .assertNext(instances -> assertTrue(instances.isEmpty()))
            .verifyComplete();

        // Idempotent
        StepVerifier.create(registry.deregisterService("ws-10.0.0.5-8080")).verifyComplete();
        StepVerifier.create(registry.deregisterService("never-registered")).verifyComplete();
    }

    @Test
    void testRegister_ExplicitIdTagsAndMetadata() {
        ServiceInstance instance = registry.registerService(
            "10.0.0.6", 9000, "pod-7", List.of("blue"), Map.of("weight", "2"), null).block();

        assertEquals("pod-7", instance.getId());
        assertEquals(List.of("blue"), instance.getTags());
        assertEquals("2", instance.getMetadata().get("weight"));
        assertEquals(1, registry.getStats().getDiscoveredInstances());
    }

    @Test
    void testRegister_BackendFailureSignalsRegistrationException() {
        backend.failing = true;

        StepVerifier.create(registry.registerService("10.0.0.5", 8080))
            .expectError(RegistrationException.class)
            .verify();
        assertEquals(null, registry.getLocalInstance());
    }

    @Test
    @DisplayName("Discovery serves the cached snapshot while the backend is down")
    void testDiscovery_ServesCacheDuringOutage() {
        backend.register(peer("10.0.0.1", 1, null)).block();
        backend.register(peer("10.0.0.2", 2, null)).block();
        assertEquals(2, registry.discoverServices(null).block().size());

        backend.failing = true;

        StepVerifier.create(registry.discoverServices(null))
            .assertNext(instances -> assertEquals(2, instances.size()))
            .verifyComplete();
        assertEquals(1.0, meterRegistry.get(MetricsNames.REGISTRY_DISCOVERY_FAILURES_TOTAL).counter().count());

        StepVerifier.create(registry.discoverServices("unknown-service"))
            .assertNext(instances -> assertTrue(instances.isEmpty()))
            .verifyComplete();
    }

    @Test
    void testListeners_NotifiedOnlyWhenMembershipChanges() {
        List<Set<String>> notifications = new ArrayList<>();
        registry.addServiceListener(instances -> notifications.add(ids(instances)));
        registry.addServiceListener(instances -> {
            throw new IllegalStateException("listener bug");
        });

        backend.register(peer("10.0.0.1", 1, null)).block();
        registry.discoverAndNotify().block();
        registry.discoverAndNotify().block();

        backend.register(peer("10.0.0.2", 2, null)).block();
        registry.discoverAndNotify().block();

        backend.deregister("ws", "ws-10.0.0.1-1").block();
        registry.discoverAndNotify().block();

        assertEquals(List.of(
            Set.of("ws-10.0.0.1-1"),
            Set.of("ws-10.0.0.1-1", "ws-10.0.0.2-2"),
            Set.of("ws-10.0.0.2-2")
        ), notifications);
        assertEquals(2, registry.getStats().getListeners());
    }

    @Test
    @DisplayName("Concurrent discovery passes report a membership change once")
    void testListeners_ConcurrentPassesNotifyOnce() throws Exception {
        AtomicInteger notifications = new AtomicInteger();
        registry.addServiceListener(instances -> notifications.incrementAndGet());
        backend.register(peer("10.0.0.1", 1, null)).block();

        int passes = 8;
        CountDownLatch ready = new CountDownLatch(passes);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(passes);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < passes; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    go.await();
                    return registry.discoverAndNotify().block();
                }));
            }
            ready.await();
            go.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, notifications.get());
    }

    @Test
    @DisplayName("Failed probes take an instance out of the healthy set until it recovers")
    void testHealthProbe_FlipsStatus() {
        backend.register(peer("10.0.0.1", 1, "http://10.0.0.1:1/health")).block();
        backend.register(peer("10.0.0.2", 2, null)).block();
        registry.discoverServices(null).block();

        probe.results.put("http://10.0.0.1:1/health", false);
        registry.checkHealthOnce().block();

        StepVerifier.create(registry.getHealthyInstances(null))
            .assertNext(instances -> assertEquals(Set.of("ws-10.0.0.2-2"), ids(instances)))
            .verifyComplete();
        assertEquals(1, registry.getStats().getHealthyInstances());

        probe.results.put("http://10.0.0.1:1/health", true);
        registry.checkHealthOnce().block();

        assertEquals(2, registry.getHealthyInstances(null).block().size());
    }

    @Test
    void testHeartbeat_KeepsLocalInstanceAlive() {
        registry.registerService("10.0.0.5", 8080).block();

        clock.advance(Duration.ofSeconds(20));
        registry.heartbeatOnce().block();
        clock.advance(Duration.ofSeconds(20));

        assertEquals(1, registry.discoverServices(null).block().size());
        assertEquals(clock.instant().minusSeconds(20), registry.getLocalInstance().getLastHeartbeat());

        // No heartbeat for longer than the TTL
        clock.advance(Duration.ofSeconds(31));
        assertTrue(registry.discoverServices(null).block().isEmpty());
    }

    @Test
    void testStop_DeregistersLocalInstance() {
        registry.registerService("10.0.0.5", 8080).block();
        registry.start();

        StepVerifier.create(registry.stop()).verifyComplete();

        assertEquals(ServiceStatus.STOPPED, registry.getLocalInstance().getStatus());
        assertTrue(backend.delegate.discover("ws").block().isEmpty());
    }

    static class StubProbe implements IHealthProbe {
        final Map<String, Boolean> results = new ConcurrentHashMap<>();

        @Override
        public Mono<Boolean> probe(String url) {
            return Mono.just(results.getOrDefault(url, true));
        }
    }

    /**
     * Memory backend that can be switched into an outage.
     */
    static class FlakyBackend implements IDiscoveryBackend {
        final MemoryDiscoveryBackend delegate;
        volatile boolean failing;

        FlakyBackend(MemoryDiscoveryBackend delegate) {
            this.delegate = delegate;
        }

        private <T> Mono<T> guard(Mono<T> call) {
            return Mono.defer(() -> failing
                ? Mono.error(new BackendUnavailableException("backend down"))
                : call);
        }

        @Override
        public String getName() {
            return "flaky";
        }

        @Override
        public Mono<Void> register(ServiceInstance instance) {
            return guard(delegate.register(instance));
        }

        @Override
        public Mono<Void> deregister(String serviceName, String serviceId) {
            return guard(delegate.deregister(serviceName, serviceId));
        }

        @Override
        public Mono<List<ServiceInstance>> discover(String serviceName) {
            return guard(delegate.discover(serviceName));
        }

        @Override
        public Mono<Void> heartbeat(ServiceInstance instance) {
            return guard(delegate.heartbeat(instance));
        }
    }
}

package com.streamfleet.controlplane.registry;

import com.streamfleet.controlplane.config.DiscoveryConfig;
import com.streamfleet.controlplane.registry.backend.IDiscoveryBackend;
import com.streamfleet.core.metrics.MetricsNames;
import com.streamfleet.core.util.BackgroundLoop;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Registers the local instance and discovers remote ones through a pluggable backend.
 * <p>
 * Three background loops run once {@link #start()} is called:
 * <ul>
 *   <li>heartbeat: renews the local instance's TTL/lease;</li>
 *   <li>discovery: re-queries the backend and notifies listeners when the set of ids changed;</li>
 *   <li>health check: probes every known health URL and flips HEALTHY/UNHEALTHY.</li>
 * </ul>
 * </p>
 * <p>
 * The per-service cache is the fallback for discovery: when the backend is unreachable
 * the last good snapshot is served instead of an error. The cache and the local
 * instance are guarded by one lock that is never held across I/O.
 * </p>
 */
public class ServiceRegistry implements IServiceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final DiscoveryConfig config;
    private final IDiscoveryBackend backend;
    private final IHealthProbe healthProbe;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // serviceName -> (serviceId -> instance), guarded by lock
    private final Map<String, Map<String, ServiceInstance>> cache = new HashMap<>();
    private ServiceInstance localInstance;

    private final List<Consumer<List<ServiceInstance>>> listeners = new CopyOnWriteArrayList<>();
    // Guarded by notifyLock; the startup pass can run beside the discovery loop
    private final Object notifyLock = new Object();
    private Set<String> lastNotifiedIds = Collections.emptySet();

    private final Counter discoveryFailures;

    private final BackgroundLoop heartbeatLoop;
    private final BackgroundLoop discoveryLoop;
    private final BackgroundLoop healthCheckLoop;

    public ServiceRegistry(
        DiscoveryConfig config,
        IDiscoveryBackend backend,
        IHealthProbe healthProbe,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        config.validate();
        this.config = config;
        this.backend = backend;
        this.healthProbe = healthProbe;
        this.clock = clock;

        this.heartbeatLoop = new BackgroundLoop("heartbeat", config.getHeartbeatInterval(), this::heartbeatOnce);
        this.discoveryLoop = new BackgroundLoop("discovery", config.getDiscoveryInterval(), this::discoverAndNotify);
        this.healthCheckLoop = new BackgroundLoop("health-check", config.getHealthCheckInterval(), this::checkHealthOnce);

        this.discoveryFailures = Counter.builder(MetricsNames.REGISTRY_DISCOVERY_FAILURES_TOTAL)
            .description("Discovery queries answered from the cached snapshot")
            .register(meterRegistry);
        Gauge.builder(MetricsNames.REGISTRY_DISCOVERED, this, r -> r.countCached(false))
            .register(meterRegistry);

        log.info("Service registry initialized: backend={}, service={}", backend.getName(), config.getServiceName());
    }

    /**
     * Runs one discovery pass right away, then starts the periodic loops.
     */
    public void start() {
        heartbeatLoop.start();
        discoveryLoop.start();
        discoverAndNotify().subscribe();
        healthCheckLoop.start();
        log.info("Service registry started");
    }

    /**
     * Deregisters the local instance (if any), then ends the background loops.
     */
    public Mono<Void> stop() {
        ServiceInstance local = getLocalInstance();
        Mono<Void> deregistration = local != null && local.getStatus().isActive()
            ? deregisterService(local.getId())
                .onErrorResume(err -> {
                    log.warn("Failed to deregister {} during shutdown: {}", local.getId(), err.getMessage());
                    return Mono.empty();
                })
            : Mono.empty();

        return deregistration.then(Mono.fromRunnable(() -> {
            heartbeatLoop.stop();
            discoveryLoop.stop();
            healthCheckLoop.stop();
            backend.close();
            log.info("Service registry stopped");
        }));
    }

    public Mono<ServiceInstance> registerService(String host, int port) {
        return registerService(host, port, null, List.of(), Map.of(), null);
    }

    @Override
    public Mono<ServiceInstance> registerService(
        String host,
        int port,
        String serviceId,
        List<String> tags,
        Map<String, String> metadata,
        String healthCheckUrl
    ) {
        String id = serviceId != null ? serviceId : ServiceInstance.defaultId(config.getServiceName(), host, port);
        Instant now = clock.instant();

        ServiceInstance starting = ServiceInstance.builder()
            .id(id)
            .name(config.getServiceName())
            .host(host)
            .port(port)
            .tags(tags != null ? List.copyOf(tags) : List.of())
            .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
            .healthCheckUrl(healthCheckUrl)
            .status(ServiceStatus.STARTING)
            .registeredAt(now)
            .lastHeartbeat(now)
            .ttl(config.getTtl())
            .build();

        return backend.register(starting)
            .onErrorMap(err -> !(err instanceof RegistrationException),
                err -> new RegistrationException("Failed to register " + id + " with " + backend.getName(), err))
            .doOnError(err -> log.error("Registration of {} failed: {}", id, err.getMessage()))
            .then(Mono.fromCallable(() -> {
                ServiceInstance healthy = starting.transitionTo(ServiceStatus.HEALTHY);
                lock.lock();
                try {
                    localInstance = healthy;
                    cache.computeIfAbsent(healthy.getName(), name -> new LinkedHashMap<>())
                        .put(healthy.getId(), healthy);
                } finally {
                    lock.unlock();
                }
                log.info("Registered service instance {} at {}", id, healthy.getAddress());
                return healthy;
            }));
    }

    /**
     * Removes an instance from the backend and the local cache.
     * <p>
     * Idempotent: an unknown id, or one the backend no longer has, completes normally.
     * </p>
     */
    @Override
    public Mono<Void> deregisterService(String serviceId) {
        return Mono.defer(() -> {
            String serviceName = config.getServiceName();
            boolean local;

            lock.lock();
            try {
                local = localInstance != null && localInstance.getId().equals(serviceId);
                if (local) {
                    serviceName = localInstance.getName();
                    if (localInstance.getStatus().isActive()) {
                        localInstance = localInstance.transitionTo(ServiceStatus.STOPPING);
                    }
                } else {
                    serviceName = findCachedServiceName(serviceId, serviceName);
                }
            } finally {
                lock.unlock();
            }

            String name = serviceName;
            return backend.deregister(name, serviceId)
                .then(Mono.fromRunnable(() -> {
                    lock.lock();
                    try {
                        Map<String, ServiceInstance> instances = cache.get(name);
                        if (instances != null) {
                            instances.remove(serviceId);
                        }
                        if (local && localInstance.getStatus() == ServiceStatus.STOPPING) {
                            localInstance = localInstance.transitionTo(ServiceStatus.STOPPED);
                        }
                    } finally {
                        lock.unlock();
                    }
                    log.info("Deregistered service instance {}", serviceId);
                }));
        });
    }

    /**
     * Health-filtered instances of a service.
     * <p>
     * Never fails: when the backend is unreachable the last good snapshot is returned.
     * </p>
     */
    @Override
    public Mono<List<ServiceInstance>> discoverServices(String serviceName) {
        String name = serviceName != null ? serviceName : config.getServiceName();

        return backend.discover(name)
            .timeout(config.getDiscoveryTimeout())
            .map(instances -> replaceCache(name, instances))
            .onErrorResume(err -> {
                discoveryFailures.increment();
                List<ServiceInstance> cached = cachedSnapshot(name);
                log.warn("Discovery of {} via {} failed, serving {} cached instances: {}",
                    name, backend.getName(), cached.size(), err.getMessage());
                return Mono.just(cached);
            });
    }

    @Override
    public Mono<List<ServiceInstance>> getHealthyInstances(String serviceName) {
        return discoverServices(serviceName)
            .map(instances -> instances.stream()
                .filter(ServiceInstance::isHealthy)
                .collect(Collectors.toList()));
    }

    /**
     * Adds a listener invoked with the full instance list whenever the discovery loop
     * sees the set of instance ids change.
     * <p>
     * Listeners run synchronously on the discovery loop: a slow listener delays the
     * next discovery round, so listeners should only update in-memory state.
     * An exception thrown by one listener is logged and the others still run.
     * </p>
     */
    @Override
    public void addServiceListener(Consumer<List<ServiceInstance>> listener) {
        listeners.add(listener);
    }

    @Override
    public void removeServiceListener(Consumer<List<ServiceInstance>> listener) {
        listeners.remove(listener);
    }

    @Override
    public RegistryStats getStats() {
        lock.lock();
        try {
            Map<String, Integer> byService = new LinkedHashMap<>();
            cache.forEach((name, instances) -> byService.put(name, instances.size()));

            return RegistryStats.builder()
                .backend(backend.getName())
                .serviceName(config.getServiceName())
                .localInstance(localInstance)
                .discoveredInstances(countCached(false))
                .healthyInstances(countCached(true))
                .instancesByService(byService)
                .listeners(listeners.size())
                .build();
        } finally {
            lock.unlock();
        }
    }

    public ServiceInstance getLocalInstance() {
        lock.lock();
        try {
            return localInstance;
        } finally {
            lock.unlock();
        }
    }

    /**
     * One discovery round: refresh the cache and notify listeners if membership changed.
     */
    Mono<Void> discoverAndNotify() {
        return discoverServices(config.getServiceName())
            .doOnNext(this::notifyIfChanged)
            .then();
    }

    /**
     * One heartbeat round for the local instance.
     */
    Mono<Void> heartbeatOnce() {
        ServiceInstance local = getLocalInstance();
        if (local == null || !local.getStatus().isActive()) {
            return Mono.empty();
        }

        return backend.heartbeat(local)
            .timeout(config.getDiscoveryTimeout())
            .then(Mono.fromRunnable(() -> {
                Instant now = clock.instant();
                lock.lock();
                try {
                    if (localInstance != null && localInstance.getId().equals(local.getId())) {
                        localInstance = localInstance.withLastHeartbeat(now);
                    }
                } finally {
                    lock.unlock();
                }
                log.debug("Heartbeat sent for {}", local.getId());
            }));
    }

    /**
     * One health-check round over every cached instance that has a health URL.
     */
    Mono<Void> checkHealthOnce() {
        List<ServiceInstance> targets;
        lock.lock();
        try {
            targets = cache.values().stream()
                .flatMap(instances -> instances.values().stream())
                .filter(instance -> instance.getHealthCheckUrl() != null)
                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }

        return Flux.fromIterable(targets)
            .flatMap(instance -> healthProbe.probe(instance.getHealthCheckUrl())
                .timeout(config.getProbeTimeout())
                .onErrorReturn(false)
                .map(healthy -> Tuples.of(instance, healthy)))
            .doOnNext(result -> applyProbeResult(result.getT1(), result.getT2()))
            .then();
    }

    private void applyProbeResult(ServiceInstance probed, boolean healthy) {
        ServiceStatus next = healthy ? ServiceStatus.HEALTHY : ServiceStatus.UNHEALTHY;

        lock.lock();
        try {
            Map<String, ServiceInstance> instances = cache.get(probed.getName());
            ServiceInstance current = instances != null ? instances.get(probed.getId()) : null;
            if (current == null || current.getStatus() == next || !current.getStatus().canTransitionTo(next)) {
                return;
            }

            instances.put(current.getId(), current.transitionTo(next));
            if (localInstance != null && localInstance.getId().equals(current.getId())
                && localInstance.getStatus().canTransitionTo(next)) {
                localInstance = localInstance.transitionTo(next);
            }
            log.info("Instance {} health changed: {} -> {}", current.getId(), current.getStatus(), next);
        } finally {
            lock.unlock();
        }
    }

    private List<ServiceInstance> replaceCache(String serviceName, List<ServiceInstance> discovered) {
        lock.lock();
        try {
            Map<String, ServiceInstance> previous = cache.getOrDefault(serviceName, Collections.emptyMap());
            Map<String, ServiceInstance> next = new LinkedHashMap<>();

            for (ServiceInstance instance : discovered) {
                ServiceInstance known = previous.get(instance.getId());
                // The backend already filtered on health; only our own probe can say otherwise
                ServiceStatus status = known != null && instance.getHealthCheckUrl() != null
                    ? known.getStatus()
                    : ServiceStatus.HEALTHY;
                next.put(instance.getId(), instance.withStatus(status));
            }

            cache.put(serviceName, next);
            return List.copyOf(next.values());
        } finally {
            lock.unlock();
        }
    }

    private List<ServiceInstance> cachedSnapshot(String serviceName) {
        lock.lock();
        try {
            Map<String, ServiceInstance> instances = cache.get(serviceName);
            return instances != null ? List.copyOf(instances.values()) : List.of();
        } finally {
            lock.unlock();
        }
    }

    private void notifyIfChanged(List<ServiceInstance> instances) {
        Set<String> ids = instances.stream()
            .map(ServiceInstance::getId)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        synchronized (notifyLock) {
            if (ids.equals(lastNotifiedIds)) {
                return;
            }

            Set<String> added = new LinkedHashSet<>(ids);
            added.removeAll(lastNotifiedIds);
            Set<String> removed = new LinkedHashSet<>(lastNotifiedIds);
            removed.removeAll(ids);
            log.info("Service membership changed: +{} -{}", added, removed);

            lastNotifiedIds = ids;
            List<ServiceInstance> snapshot = Collections.unmodifiableList(new ArrayList<>(instances));
            for (Consumer<List<ServiceInstance>> listener : listeners) {
                try {
                    listener.accept(snapshot);
                } catch (RuntimeException e) {
                    log.error("Service listener failed", e);
                }
            }
        }
    }

    private String findCachedServiceName(String serviceId, String fallback) {
        return cache.entrySet().stream()
            .filter(entry -> entry.getValue().containsKey(serviceId))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(fallback);
    }

    private int countCached(boolean healthyOnly) {
        lock.lock();
        try {
            return (int) cache.values().stream()
                .flatMap(instances -> instances.values().stream())
                .filter(instance -> !healthyOnly || instance.isHealthy())
                .count();
        } finally {
            lock.unlock();
        }
    }
}

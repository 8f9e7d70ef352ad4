package com.streamfleet.controlplane.registry.backend;

import com.streamfleet.controlplane.registry.ServiceInstance;
import com.streamfleet.controlplane.registry.ServiceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-process discovery backend for tests and single-node deployments.
 * <p>
 * Instances whose TTL has lapsed since their last heartbeat are dropped on discovery.
 * </p>
 */
public class MemoryDiscoveryBackend implements IDiscoveryBackend {
    private static final Logger log = LoggerFactory.getLogger(MemoryDiscoveryBackend.class);

    // serviceName -> (serviceId -> instance)
    private final Map<String, Map<String, ServiceInstance>> services = new ConcurrentHashMap<>();
    private final Clock clock;

    public MemoryDiscoveryBackend() {
        this(Clock.systemUTC());
    }

    public MemoryDiscoveryBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public Mono<Void> register(ServiceInstance instance) {
        return Mono.fromRunnable(() -> {
            services.computeIfAbsent(instance.getName(), name -> new ConcurrentHashMap<>())
                .put(instance.getId(), instance.withLastHeartbeat(clock.instant()));
            log.debug("Stored instance {} of {}", instance.getId(), instance.getName());
        });
    }

    @Override
    public Mono<Void> deregister(String serviceName, String serviceId) {
        return Mono.fromRunnable(() -> {
            Map<String, ServiceInstance> instances = services.get(serviceName);
            if (instances != null && instances.remove(serviceId) != null) {
                log.debug("Removed instance {} of {}", serviceId, serviceName);
            }
        });
    }

    @Override
    public Mono<List<ServiceInstance>> discover(String serviceName) {
        return Mono.fromCallable(() -> {
            Map<String, ServiceInstance> instances = services.get(serviceName);
            if (instances == null) {
                return List.of();
            }

            Instant now = clock.instant();
            instances.values().removeIf(instance -> isExpired(instance, now));

            return instances.values().stream()
                .filter(instance -> instance.getStatus() != ServiceStatus.STOPPING
                    && instance.getStatus() != ServiceStatus.STOPPED)
                .collect(Collectors.toList());
        });
    }

    @Override
    public Mono<Void> heartbeat(ServiceInstance instance) {
        return Mono.fromRunnable(() -> {
            Map<String, ServiceInstance> instances = services.get(instance.getName());
            if (instances != null) {
                instances.computeIfPresent(instance.getId(),
                    (id, stored) -> stored.withLastHeartbeat(clock.instant()));
            }
        });
    }

    private boolean isExpired(ServiceInstance instance, Instant now) {
        Instant lastSeen = instance.getLastHeartbeat() != null
            ? instance.getLastHeartbeat()
            : instance.getRegisteredAt();
        return lastSeen != null && instance.getTtl() != null
            && lastSeen.plus(instance.getTtl()).isBefore(now);
    }
}

package com.streamfleet.controlplane.registry;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Registry of backend server instances (Dependency Inversion Principle).
 */
public interface IServiceRegistry {

    Mono<ServiceInstance> registerService(
        String host,
        int port,
        String serviceId,
        List<String> tags,
        Map<String, String> metadata,
        String healthCheckUrl
    );

    Mono<Void> deregisterService(String serviceId);

    /**
     * @param serviceName service to look up, or null for the configured one
     */
    Mono<List<ServiceInstance>> discoverServices(String serviceName);

    Mono<List<ServiceInstance>> getHealthyInstances(String serviceName);

    void addServiceListener(Consumer<List<ServiceInstance>> listener);

    void removeServiceListener(Consumer<List<ServiceInstance>> listener);

    RegistryStats getStats();
}

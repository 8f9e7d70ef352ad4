package com.streamfleet.controlplane.registry;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time summary of the service registry.
 */
@Value
@Builder
public class RegistryStats {
    String backend;
    String serviceName;
    ServiceInstance localInstance;
    int discoveredInstances;
    int healthyInstances;
    Map<String, Integer> instancesByService;
    int listeners;
}

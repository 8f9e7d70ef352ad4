package com.streamfleet.controlplane.balancer;

import com.streamfleet.controlplane.config.BalancerConfig;
import com.streamfleet.controlplane.registry.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Keeps the load balancer's node set in line with registry membership.
 * <p>
 * Registered as a service listener: instances that appeared become nodes, nodes whose
 * instance disappeared are removed. Node attributes come from instance metadata keys
 * {@code weight}, {@code max_connections}, {@code region} and {@code zone}.
 * </p>
 */
public class RegistryNodeSync implements Consumer<List<ServiceInstance>> {
    private static final Logger log = LoggerFactory.getLogger(RegistryNodeSync.class);

    public static final String WEIGHT_KEY = "weight";
    public static final String MAX_CONNECTIONS_KEY = "max_connections";
    public static final String REGION_KEY = "region";
    public static final String ZONE_KEY = "zone";

    private final ILoadBalancer loadBalancer;
    private final BalancerConfig config;

    public RegistryNodeSync(ILoadBalancer loadBalancer, BalancerConfig config) {
        this.loadBalancer = loadBalancer;
        this.config = config;
    }

    @Override
    public void accept(List<ServiceInstance> instances) {
        Set<String> known = loadBalancer.getNodes().stream()
            .map(NodeRef::getNodeId)
            .collect(Collectors.toSet());
        Set<String> current = new HashSet<>();

        for (ServiceInstance instance : instances) {
            String nodeId = Node.nodeIdFor(instance.getHost(), instance.getPort());
            current.add(nodeId);
            if (!known.contains(nodeId)) {
                loadBalancer.addNode(toNode(instance));
            }
        }

        for (String nodeId : known) {
            if (!current.contains(nodeId)) {
                loadBalancer.removeNode(nodeId);
            }
        }

        log.debug("Synced {} instances into the load balancer", instances.size());
    }

    Node toNode(ServiceInstance instance) {
        Map<String, String> metadata = instance.getMetadata();
        return Node.builder()
            .host(instance.getHost())
            .port(instance.getPort())
            .weight(intOrDefault(metadata, WEIGHT_KEY, config.getDefaultWeight(), instance))
            .maxConnections(intOrDefault(metadata, MAX_CONNECTIONS_KEY, config.getDefaultMaxConnections(), instance))
            .region(metadata.get(REGION_KEY))
            .zone(metadata.get(ZONE_KEY))
            .build();
    }

    private static int intOrDefault(Map<String, String> metadata, String key, int defaultValue, ServiceInstance instance) {
        String raw = metadata.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value >= 1 ? value : defaultValue;
        } catch (NumberFormatException e) {
            log.warn("Instance {} has invalid {} '{}', using {}", instance.getId(), key, raw, defaultValue);
            return defaultValue;
        }
    }
}

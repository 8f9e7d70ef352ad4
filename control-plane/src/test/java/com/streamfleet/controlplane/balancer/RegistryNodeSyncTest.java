package com.streamfleet.controlplane.balancer;

import com.streamfleet.controlplane.config.BalancerConfig;
import com.streamfleet.controlplane.registry.ServiceInstance;
import com.streamfleet.controlplane.registry.ServiceStatus;
import com.streamfleet.controlplane.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RegistryNodeSyncTest {

    private final BalancerConfig config = BalancerConfig.builder().build();
    private LoadBalancer loadBalancer;
    private RegistryNodeSync sync;

    @BeforeEach
    void setUp() {
        loadBalancer = new LoadBalancer(config, new SimpleMeterRegistry(), new MutableClock());
        sync = new RegistryNodeSync(loadBalancer, config);
    }

    private static ServiceInstance instance(String host, int port, Map<String, String> metadata) {
        return ServiceInstance.builder()
            .id(ServiceInstance.defaultId("ws", host, port))
            .name("ws")
            .host(host)
            .port(port)
            .metadata(metadata)
            .status(ServiceStatus.HEALTHY)
            .build();
    }

    private List<String> nodeIds() {
        return loadBalancer.getNodes().stream().map(NodeRef::getNodeId).sorted().collect(Collectors.toList());
    }

    @Test
    void testAccept_AddsAndRemovesNodes() {
        sync.accept(List.of(instance("a", 1, Map.of()), instance("b", 2, Map.of())));
        assertEquals(List.of("a:1", "b:2"), nodeIds());

        sync.accept(List.of(instance("b", 2, Map.of()), instance("c", 3, Map.of())));
        assertEquals(List.of("b:2", "c:3"), nodeIds());

        sync.accept(List.of());
        assertEquals(List.of(), nodeIds());
    }

    @Test
    void testAccept_KeepsExistingNodeState() {
        sync.accept(List.of(instance("a", 1, Map.of())));
        loadBalancer.getNodeForClient("client");

        sync.accept(List.of(instance("a", 1, Map.of()), instance("b", 2, Map.of())));

        NodeRef a = loadBalancer.getNodes().stream().filter(n -> n.getNodeId().equals("a:1")).findFirst().orElseThrow();
        assertEquals(1, a.getCurrentConnections());
    }

    @Test
    void testToNode_ReadsMetadata() {
        Node node = sync.toNode(instance("a", 1, Map.of(
            RegistryNodeSync.WEIGHT_KEY, "3",
            RegistryNodeSync.MAX_CONNECTIONS_KEY, "250",
            RegistryNodeSync.REGION_KEY, "eu-west",
            RegistryNodeSync.ZONE_KEY, "eu-west-1a")));

        assertEquals(3, node.getWeight());
        assertEquals(250, node.getMaxConnections());
        assertEquals("eu-west", node.getRegion());
        assertEquals("eu-west-1a", node.getZone());
    }

    @Test
    void testToNode_InvalidMetadataFallsBackToDefaults() {
        Node node = sync.toNode(instance("a", 1, Map.of(
            RegistryNodeSync.WEIGHT_KEY, "heavy",
            RegistryNodeSync.MAX_CONNECTIONS_KEY, "0")));

        assertEquals(config.getDefaultWeight(), node.getWeight());
        assertEquals(config.getDefaultMaxConnections(), node.getMaxConnections());
    }
}

package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.LoadBalancingStrategy;
import com.streamfleet.controlplane.balancer.Node;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeSelectorsTest {

    private static Node node(int port, int weight) {
        return Node.builder().host("node").port(port).weight(weight).build();
    }

    private static List<Node> nodes(int count) {
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            nodes.add(node(9000 + i, 1));
        }
        return nodes;
    }

    @Test
    void testForStrategy_MapsEveryStrategy() {
        assertInstanceOf(RoundRobinSelector.class, NodeSelectors.forStrategy(LoadBalancingStrategy.ROUND_ROBIN, 150));
        assertInstanceOf(LeastConnectionsSelector.class, NodeSelectors.forStrategy(LoadBalancingStrategy.LEAST_CONNECTIONS, 150));
        assertInstanceOf(WeightedRoundRobinSelector.class, NodeSelectors.forStrategy(LoadBalancingStrategy.WEIGHTED_ROUND_ROBIN, 150));
        assertInstanceOf(ConsistentHashSelector.class, NodeSelectors.forStrategy(LoadBalancingStrategy.CONSISTENT_HASH, 150));
        assertInstanceOf(ResourceBasedSelector.class, NodeSelectors.forStrategy(LoadBalancingStrategy.RESOURCE_BASED, 150));
    }

    @Test
    void testRoundRobin_Cycles() {
        List<Node> nodes = nodes(3);
        RoundRobinSelector selector = new RoundRobinSelector();

        for (int round = 0; round < 2; round++) {
            for (Node expected : nodes) {
                assertSame(expected, selector.select("any", nodes));
            }
        }
    }

    @Test
    void testWeightedRoundRobin_FollowsWeights() {
        List<Node> nodes = List.of(node(9000, 3), node(9001, 1));
        WeightedRoundRobinSelector selector = new WeightedRoundRobinSelector();
        selector.rebuild(nodes);

        Map<String, Integer> picks = new HashMap<>();
        for (int i = 0; i < 40; i++) {
            picks.merge(selector.select("any", nodes).getNodeId(), 1, Integer::sum);
        }

        assertEquals(30, picks.get("node:9000"));
        assertEquals(10, picks.get("node:9001"));
    }

    @Test
    void testLeastConnections_PicksFirstOnTie() {
        List<Node> nodes = nodes(3);
        assertSame(nodes.get(0), new LeastConnectionsSelector().select("any", nodes));
    }

    @Test
    void testConsistentHash_StableForSameClient() {
        List<Node> nodes = nodes(3);
        ConsistentHashSelector selector = new ConsistentHashSelector(150);
        selector.rebuild(nodes);

        Node first = selector.select("client-42", nodes);
        for (int i = 0; i < 10; i++) {
            assertSame(first, selector.select("client-42", nodes));
        }
        assertEquals(450, selector.getRing().getVnodeCount());
    }

    @Test
    @DisplayName("Removing one of three nodes remaps roughly a third of the clients")
    void testConsistentHash_BoundedReshuffle() {
        List<Node> nodes = nodes(3);
        ConsistentHashSelector selector = new ConsistentHashSelector(150);
        selector.rebuild(nodes);

        Map<String, String> before = new HashMap<>();
        for (int i = 0; i < 1000; i++) {
            before.put("client-" + i, selector.select("client-" + i, nodes).getNodeId());
        }

        List<Node> remaining = List.of(nodes.get(0), nodes.get(1));
        selector.rebuild(remaining);

        int moved = 0;
        for (Map.Entry<String, String> entry : before.entrySet()) {
            String after = selector.select(entry.getKey(), remaining).getNodeId();
            if (!after.equals(entry.getValue())) {
                moved++;
                assertEquals("node:9002", entry.getValue(), "only clients of the removed node may move");
            }
        }

        double fraction = moved / 1000.0;
        System.out.printf("Consistent hash reshuffle: %.3f of clients moved%n", fraction);
        assertTrue(fraction > 0.20 && fraction < 0.47, "moved fraction " + fraction);
    }

    @Test
    void testConsistentHash_FallsBackBeforeRebuild() {
        List<Node> nodes = nodes(2);
        assertSame(nodes.get(0), new ConsistentHashSelector(150).select("client", nodes));
    }

    @Test
    void testResourceBased_PrefersLowestScore() {
        assertEquals(0.0, ResourceBasedSelector.score(node(9000, 1)));

        List<Node> nodes = nodes(2);
        assertSame(nodes.get(0), new ResourceBasedSelector().select("any", nodes));
    }
}

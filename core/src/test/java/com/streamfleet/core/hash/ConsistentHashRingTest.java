package com.streamfleet.core.hash;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConsistentHashRingTest {

    @Test
    @DisplayName("Each physical node gets the configured number of virtual positions")
    void testVirtualNodeCount() {
        ConsistentHashRing ring = ConsistentHashRing.fromNodes(List.of("a:1", "b:1", "c:1"), 150);

        assertEquals(3, ring.getPhysicalNodeCount());
        assertEquals(150, ring.getVirtualNodesPerNode());
        // Murmur3 collisions across 450 positions are practically impossible
        assertEquals(450, ring.getVnodeCount());
    }

    @Test
    @DisplayName("Same key resolves to the same node on rings built from the same members")
    void testDeterministicLookup() {
        ConsistentHashRing first = ConsistentHashRing.fromNodes(List.of("a:1", "b:1", "c:1"), 150);
        ConsistentHashRing second = ConsistentHashRing.fromNodes(List.of("c:1", "a:1", "b:1"), 150);

        for (int i = 0; i < 500; i++) {
            String key = "client-" + i;
            assertEquals(first.successor(key), second.successor(key), "Lookup differs for " + key);
            assertEquals(first.successor(key), first.successor(key));
        }
    }

    @Test
    @DisplayName("Removing one of three nodes remaps roughly a third of the keys")
    void testBoundedReshuffleOnRemoval() {
        ConsistentHashRing before = ConsistentHashRing.fromNodes(List.of("node-1", "node-2", "node-3"), 150);
        ConsistentHashRing after = ConsistentHashRing.fromNodes(List.of("node-1", "node-2"), 150);

        int moved = 0;
        int total = 1000;
        for (int i = 0; i < total; i++) {
            String key = "client-" + i;
            String owner = before.successor(key);
            String newOwner = after.successor(key);

            if (!owner.equals(newOwner)) {
                moved++;
                // Only keys of the removed node may move
                assertEquals("node-3", owner);
            }
        }

        double fraction = moved / (double) total;
        System.out.printf("Remapped %d of %d keys (%.1f%%)%n", moved, total, fraction * 100);
        assertTrue(fraction > 0.20 && fraction < 0.47, "Expected about a third of keys to move, got " + fraction);
    }

    @Test
    @DisplayName("Keys spread across all nodes")
    void testDistribution() {
        ConsistentHashRing ring = ConsistentHashRing.fromNodes(List.of("node-1", "node-2", "node-3", "node-4"), 150);

        Map<String, AtomicInteger> counts = new HashMap<>();
        for (int i = 0; i < 10_000; i++) {
            counts.computeIfAbsent(ring.successor("user-" + i), k -> new AtomicInteger()).incrementAndGet();
        }

        assertEquals(4, counts.size());
        counts.forEach((node, count) ->
                assertTrue(count.get() > 1500, node + " only got " + count.get() + " keys"));
    }

    @Test
    void testEmptyRing() {
        ConsistentHashRing ring = ConsistentHashRing.fromNodes(List.of(), 150);

        assertTrue(ring.isEmpty());
        assertNull(ring.successor("anyone"));
        assertSame(ConsistentHashRing.empty(), ring);
    }

    @Test
    void testInvalidVirtualNodes() {
        assertThrows(IllegalArgumentException.class,
                () -> ConsistentHashRing.fromNodes(List.of("a:1"), 0));
    }
}

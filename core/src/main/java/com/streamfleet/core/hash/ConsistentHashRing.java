package com.streamfleet.core.hash;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable consistent hash ring with virtual nodes.
 * <p>
 * <b>Consistent hashing properties:</b>
 * <ul>
 *   <li>Adding/removing a node reassigns approximately 1/n of keys (minimal disruption).</li>
 *   <li>Each physical node owns a fixed number of virtual positions, which smooths the key split.</li>
 *   <li>Deterministic key → node mapping based on hash function.</li>
 * </ul>
 * </p>
 * <p>
 * <b>Thread-safety:</b> Immutable after construction; safe for concurrent reads.
 * Membership changes build a new ring.
 * </p>
 */
public final class ConsistentHashRing {
    private static final Logger log = LoggerFactory.getLogger(ConsistentHashRing.class);

    private static final ConsistentHashRing EMPTY =
            new ConsistentHashRing(new TreeMap<>(), Collections.emptySet(), 0);

    private final TreeMap<Long, String> ring; // hash → nodeId
    private final Set<String> nodeIds;
    private final int virtualNodes;

    private ConsistentHashRing(TreeMap<Long, String> ring, Set<String> nodeIds, int virtualNodes) {
        this.ring = ring;
        this.nodeIds = nodeIds;
        this.virtualNodes = virtualNodes;
    }

    public static ConsistentHashRing empty() {
        return EMPTY;
    }

    /**
     * Constructs a ring holding {@code virtualNodes} positions for every node id.
     *
     * @param nodeIds      Physical nodes to place on the ring
     * @param virtualNodes Number of virtual positions per physical node
     * @return Immutable ConsistentHashRing instance
     */
    public static ConsistentHashRing fromNodes(Collection<String> nodeIds, int virtualNodes) {
        if (virtualNodes <= 0) {
            throw new IllegalArgumentException("virtualNodes must be positive, got " + virtualNodes);
        }
        if (nodeIds.isEmpty()) {
            return EMPTY;
        }

        TreeMap<Long, String> ring = new TreeMap<>();
        Set<String> members = new LinkedHashSet<>(nodeIds);

        for (String nodeId : members) {
            for (int i = 0; i < virtualNodes; i++) {
                long hash = Hashers.murmur3Hash(nodeId + ":" + i);
                ring.put(hash, nodeId);
            }
        }

        log.debug("Created ring with {} vnodes from {} physical nodes", ring.size(), members.size());

        return new ConsistentHashRing(ring, Collections.unmodifiableSet(members), virtualNodes);
    }

    /**
     * Finds the node owning a key: the first position whose hash is ≥ the key hash,
     * wrapping around to the lowest position.
     *
     * @param key Key (typically a client id)
     * @return owning node id, or null if the ring is empty
     */
    public String successor(String key) {
        if (ring.isEmpty()) {
            return null;
        }

        long hash = Hashers.murmur3Hash(key);
        Map.Entry<Long, String> entry = ring.ceilingEntry(hash);

        if (entry == null) {
            // Wrap around to the first node
            entry = ring.firstEntry();
        }

        return entry.getValue();
    }

    public boolean isEmpty() {
        return ring.isEmpty();
    }

    public int getVnodeCount() {
        return ring.size();
    }

    public int getPhysicalNodeCount() {
        return nodeIds.size();
    }

    public int getVirtualNodesPerNode() {
        return virtualNodes;
    }

    public Set<String> getNodeIds() {
        return nodeIds;
    }
}

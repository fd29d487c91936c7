package org.Aayush.redirects.Utils;

import java.util.BitSet;

/**
 * Compact set of graph node ids seen during one chain walk.
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) membership at ~1 bit per node. Walks unmark only
 * the nodes they touched, so one instance is reused across every walk of a graph.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected node count.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    /**
     * Marks a node as visited.
     *
     * @param nodeId node id.
     * @return {@code true} if the node was not visited before.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        return true;
    }

    /**
     * @param nodeId node id.
     * @return {@code true} if the node is currently marked.
     */
    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    /**
     * Clears a single node mark.
     */
    public void unmark(int nodeId) {
        visited.clear(nodeId);
    }
}

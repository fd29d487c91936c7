package org.Aayush.redirects.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.redirects.core.RedirectException;
import org.Aayush.redirects.core.id.UrlIdMapper;

/**
 * Directed redirect graph over lowercase URL keys with at most one outgoing edge per node.
 * <p>
 * Nodes get dense ids in first-seen order; successors are kept in a primitive list indexed
 * by node id with {@link #NO_EDGE} for terminal nodes.
 * </p>
 * <p>
 * Adding a second edge with a different target from the same source is rejected. Repeating
 * an identical edge is a no-op.
 * </p>
 */
public final class RedirectGraph {
    public static final int NO_EDGE = -1;

    private final UrlIdMapper ids;
    private final IntArrayList successors;
    private final IntArrayList sourcesInOrder;

    public RedirectGraph(int expectedEdges) {
        this.ids = UrlIdMapper.createGrowable(expectedEdges * 2);
        this.successors = new IntArrayList(expectedEdges * 2);
        this.sourcesInOrder = new IntArrayList(expectedEdges);
    }

    /**
     * Adds {@code fromKey -> toKey}.
     *
     * @throws RedirectException with {@link RedirectException#REASON_CONFLICTING_EDGE} when the
     *                           source already redirects elsewhere.
     */
    public void addEdge(String fromKey, String toKey) {
        int from = node(fromKey);
        int to = node(toKey);
        int existing = successors.getInt(from);
        if (existing == NO_EDGE) {
            successors.set(from, to);
            sourcesInOrder.add(from);
            return;
        }
        if (existing != to) {
            throw new RedirectException(RedirectException.REASON_CONFLICTING_EDGE,
                    "redirect source " + fromKey + " already points to " + ids.toExternal(existing)
                            + ", refusing second target " + toKey);
        }
    }

    /**
     * @return successor id, or {@link #NO_EDGE}.
     */
    public int successor(int nodeId) {
        return successors.getInt(nodeId);
    }

    public int nodeCount() {
        return ids.size();
    }

    /**
     * Number of nodes with an outgoing edge.
     */
    public int edgeCount() {
        return sourcesInOrder.size();
    }

    /**
     * Source node id by insertion order of its edge.
     */
    public int sourceAt(int index) {
        return sourcesInOrder.getInt(index);
    }

    public String key(int nodeId) {
        return ids.toExternal(nodeId);
    }

    private int node(String key) {
        int id = ids.intern(key);
        while (successors.size() <= id) {
            successors.add(NO_EDGE);
        }
        return id;
    }
}

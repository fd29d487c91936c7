package org.Aayush.redirects.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.Utils.VisitedSet;
import org.Aayush.redirects.core.RedirectException;
import org.Aayush.redirects.table.RedirectPair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Collapses redirect chains into direct single-hop mappings.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Record the first-seen spelling of every URL, then build a lowercase
 * {@link RedirectGraph} (one outgoing edge per source, conflicting edges rejected).</li>
 * <li>Walk each source's chain iteratively with an on-path {@link VisitedSet}. Reaching a node
 * without an outgoing edge yields a direct edge from every visited node to that node:
 * {@code A→B→C} becomes {@code {A→C, B→C}}.</li>
 * <li>Re-entering the current path is a cycle. The walk contributes no edges; the cycle is
 * logged, or thrown when strict.</li>
 * <li>Restore spelling on both endpoints and sort by {@code (from, to)}.</li>
 * </ul>
 *
 * <p>Chains already collapsed by an earlier walk are reused, so the pass is linear in the
 * number of edges. The output has no multi-hop paths, and flattening it again yields the same
 * list.</p>
 */
@Slf4j
public final class RedirectFlattener {
    private final boolean strictCycles;

    /**
     * @param strictCycles throw {@link RedirectException#REASON_REDIRECT_CYCLE} instead of
     *                     dropping cyclic chains.
     */
    public RedirectFlattener(boolean strictCycles) {
        this.strictCycles = strictCycles;
    }

    /**
     * Flattens the given pairs.
     *
     * @param pairs pairs, possibly with chains and mixed casing.
     * @return flattened pairs in table order and the dropped cycles.
     */
    public FlattenResult flatten(List<RedirectPair> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        CasingMap casing = CasingMap.of(pairs);
        RedirectGraph graph = new RedirectGraph(pairs.size());
        for (RedirectPair pair : pairs) {
            graph.addEdge(pair.fromKey(), pair.toKey());
        }

        int nodeCount = graph.nodeCount();
        int[] flattenedTarget = new int[nodeCount];
        Arrays.fill(flattenedTarget, RedirectGraph.NO_EDGE);
        VisitedSet onPath = new VisitedSet(nodeCount);
        IntArrayList path = new IntArrayList();
        List<ChainWalk> cycles = new ArrayList<>();

        for (int i = 0; i < graph.edgeCount(); i++) {
            int source = graph.sourceAt(i);
            if (flattenedTarget[source] != RedirectGraph.NO_EDGE) {
                continue;
            }
            ChainWalk walk = walk(graph, source, flattenedTarget, onPath, path);
            if (walk.cycle()) {
                if (strictCycles) {
                    throw new RedirectException(RedirectException.REASON_REDIRECT_CYCLE, walk.describeCycle());
                }
                log.warn(walk.describeCycle());
                cycles.add(walk);
            }
        }

        List<RedirectPair> flattened = new ArrayList<>(graph.edgeCount());
        for (int node = 0; node < nodeCount; node++) {
            int target = flattenedTarget[node];
            if (target != RedirectGraph.NO_EDGE) {
                flattened.add(new RedirectPair(
                        casing.restore(graph.key(node)),
                        casing.restore(graph.key(target))));
            }
        }
        flattened.sort(RedirectPair.TABLE_ORDER);
        return new FlattenResult(flattened, cycles);
    }

    /**
     * Follows one chain from {@code source}. On success every node on the path is assigned the
     * ultimate target in {@code flattenedTarget}; on a cycle nothing is assigned.
     */
    private static ChainWalk walk(
            RedirectGraph graph,
            int source,
            int[] flattenedTarget,
            VisitedSet onPath,
            IntArrayList path
    ) {
        path.clear();
        try {
            int node = source;
            int terminal;
            while (true) {
                int collapsed = flattenedTarget[node];
                if (collapsed != RedirectGraph.NO_EDGE) {
                    terminal = collapsed;
                    break;
                }
                int next = graph.successor(node);
                if (next == RedirectGraph.NO_EDGE) {
                    terminal = node;
                    break;
                }
                path.add(node);
                onPath.markVisited(node);
                if (onPath.isVisited(next)) {
                    return ChainWalk.cycle(keys(graph, path), graph.key(next));
                }
                node = next;
            }
            for (int i = 0; i < path.size(); i++) {
                flattenedTarget[path.getInt(i)] = terminal;
            }
            return ChainWalk.flattened(keys(graph, path), graph.key(terminal));
        } finally {
            for (int i = 0; i < path.size(); i++) {
                onPath.unmark(path.getInt(i));
            }
        }
    }

    private static List<String> keys(RedirectGraph graph, IntArrayList path) {
        List<String> keys = new ArrayList<>(path.size());
        for (int i = 0; i < path.size(); i++) {
            keys.add(graph.key(path.getInt(i)));
        }
        return keys;
    }
}

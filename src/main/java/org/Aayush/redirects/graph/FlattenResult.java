package org.Aayush.redirects.graph;

import org.Aayush.redirects.table.RedirectPair;

import java.util.List;

/**
 * Flattened pairs in table order plus the cycles that were dropped.
 */
public record FlattenResult(List<RedirectPair> pairs, List<ChainWalk> cycles) {
    public FlattenResult {
        pairs = List.copyOf(pairs);
        cycles = List.copyOf(cycles);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}

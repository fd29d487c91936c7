package org.Aayush.redirects.table;

import java.util.List;

/**
 * Pairs read from one persisted table.
 *
 * @param pairs surviving pairs in file order.
 * @param droppedRows rows discarded by relaxed loading.
 */
public record LoadedTable(List<RedirectPair> pairs, int droppedRows) {
    public LoadedTable {
        pairs = List.copyOf(pairs);
        if (droppedRows < 0) {
            throw new IllegalArgumentException("droppedRows must be >= 0");
        }
    }

    public static LoadedTable empty() {
        return new LoadedTable(List.of(), 0);
    }
}

package org.Aayush.redirects.core;

import org.Aayush.redirects.table.RedirectPair;

import java.nio.file.Path;
import java.util.List;

/**
 * Table content produced by the write pipeline, before it is persisted.
 *
 * @param table table file the pairs belong to.
 * @param pairs flattened, validated pairs in table order.
 * @param changed whether the pairs differ from what is stored.
 */
public record MergeResult(Path table, List<RedirectPair> pairs, boolean changed) {
    public MergeResult {
        pairs = List.copyOf(pairs);
    }
}

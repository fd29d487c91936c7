package org.Aayush.redirects.graph;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of following one source's redirect chain.
 *
 * @param path node keys visited in order, excluding the terminal.
 * @param target ultimate non-redirecting key for a flattened chain; for a cycle, the key the
 *               walk re-entered.
 * @param cycle whether the chain loops back on itself.
 */
public record ChainWalk(List<String> path, String target, boolean cycle) {
    public ChainWalk {
        path = List.copyOf(path);
        Objects.requireNonNull(target, "target");
    }

    public static ChainWalk flattened(List<String> path, String target) {
        return new ChainWalk(path, target, false);
    }

    public static ChainWalk cycle(List<String> path, String reentry) {
        return new ChainWalk(path, reentry, true);
    }

    /**
     * Log form of a cycle, for example {@code redirect cycle [a, b] → a}.
     */
    public String describeCycle() {
        return "redirect cycle " + path + " → " + target;
    }
}

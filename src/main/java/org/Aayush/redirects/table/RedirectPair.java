package org.Aayush.redirects.table;

import org.Aayush.redirects.Utils.UrlPaths;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * One {@code (from, to)} redirect mapping, in authored casing.
 */
public record RedirectPair(String from, String to) {
    /**
     * Ascending by {@code from}, then {@code to}; the persisted row order.
     */
    public static final Comparator<RedirectPair> TABLE_ORDER =
            Comparator.comparing(RedirectPair::from).thenComparing(RedirectPair::to);

    public RedirectPair {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static RedirectPair of(String from, String to) {
        return new RedirectPair(from, to);
    }

    /**
     * Lowercased source, the graph and uniqueness key.
     */
    public String fromKey() {
        return from.toLowerCase(Locale.ROOT);
    }

    /**
     * Lowercased target.
     */
    public String toKey() {
        return to.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether the target is another document path rather than an external URL.
     */
    public boolean hasInternalTarget() {
        return to.startsWith("/");
    }

    /**
     * Percent-decodes both sides. Internal targets decode per path segment, external targets
     * keep reserved delimiters escaped.
     *
     * @throws IllegalArgumentException on malformed escapes.
     */
    public RedirectPair decoded() {
        String decodedFrom = UrlPaths.decodePath(from);
        String decodedTo = hasInternalTarget() ? UrlPaths.decodePath(to) : UrlPaths.decodeUri(to);
        return new RedirectPair(decodedFrom, decodedTo);
    }

    @Override
    public String toString() {
        return from + "\t" + to;
    }
}

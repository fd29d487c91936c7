package org.Aayush.redirects.graph;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.Aayush.redirects.table.RedirectPair;

import java.util.List;
import java.util.Locale;

/**
 * Lowercase URL key to the first-seen authored spelling.
 *
 * <p>Pairs are scanned in order, source before target, and the first spelling of each key
 * wins. Output edges map both endpoints through the same entry, so every key has exactly
 * one spelling in the result.</p>
 */
final class CasingMap {
    private final Object2ObjectOpenHashMap<String, String> originalByKey;

    private CasingMap(int expectedSize) {
        this.originalByKey = new Object2ObjectOpenHashMap<>(expectedSize);
    }

    static CasingMap of(List<RedirectPair> pairs) {
        CasingMap casing = new CasingMap(pairs.size() * 2);
        for (RedirectPair pair : pairs) {
            casing.remember(pair.from());
            casing.remember(pair.to());
        }
        return casing;
    }

    private void remember(String url) {
        originalByKey.putIfAbsent(url.toLowerCase(Locale.ROOT), url);
    }

    String restore(String key) {
        String original = originalByKey.get(key);
        if (original == null) {
            throw new IllegalStateException("no casing recorded for " + key);
        }
        return original;
    }
}

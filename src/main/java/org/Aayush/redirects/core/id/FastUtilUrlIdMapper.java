package org.Aayush.redirects.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Append-only {@link UrlIdMapper} backed by fastutil collections.
 * <p>
 * Ids are handed out densely from 0 in first-interned order, so graph structures can keep
 * per-node state in plain arrays indexed by id.
 * </p>
 * <p>
 * Not thread-safe. A mapper lives inside one graph build.
 * </p>
 */
public class FastUtilUrlIdMapper implements UrlIdMapper {

    private static final int MISSING = -1;

    // key -> id, no boxing on lookup
    private final Object2IntOpenHashMap<String> forward;
    // id -> key
    private final ObjectArrayList<String> reverse;

    public FastUtilUrlIdMapper(int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must be >= 0");
        }
        this.forward = new Object2IntOpenHashMap<>(expectedSize);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new ObjectArrayList<>(expectedSize);
    }

    @Override
    public int intern(String urlKey) {
        if (urlKey == null) {
            throw new IllegalArgumentException("URL key cannot be null");
        }
        int id = forward.getInt(urlKey);
        if (id != MISSING) {
            return id;
        }
        id = reverse.size();
        forward.put(urlKey, id);
        reverse.add(urlKey);
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.size()) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse.get(internalId);
    }

    @Override
    public int size() {
        return reverse.size();
    }
}

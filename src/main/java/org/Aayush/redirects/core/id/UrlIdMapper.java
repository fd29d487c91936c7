package org.Aayush.redirects.core.id;

/**
 * Bidirectional mapping between normalized URL keys and dense integer node ids.
 */
public interface UrlIdMapper {

    /**
     * Returns the id of a URL key, assigning the next dense id on first sight.
     *
     * @param urlKey normalized URL key.
     * @return the internal node id.
     */
    int intern(String urlKey);

    /**
     * Converts a node id back to its URL key.
     * @param internalId internal node id.
     * @return the URL key.
     * @throws IndexOutOfBoundsException If the id is invalid.
     */
    String toExternal(int internalId);

    /**
     * @return number of interned keys.
     */
    int size();

    /**
     * Factory method for the default growable implementation.
     *
     * @param expectedSize sizing hint.
     * @return an empty mapper.
     */
    static UrlIdMapper createGrowable(int expectedSize) {
        return new FastUtilUrlIdMapper(expectedSize);
    }
}

package org.Aayush.redirects.content;

import java.util.Optional;

/**
 * Maps a decoded documentation URL to the document that serves it.
 */
@FunctionalInterface
public interface DocumentLocator {

    /**
     * @param url decoded URL, for example {@code /en-US/docs/Web/HTML}.
     * @return location of the backing document, or empty when no document exists.
     */
    Optional<String> locate(String url);

    /**
     * Convenience existence check.
     */
    default boolean exists(String url) {
        return locate(url).isPresent();
    }
}

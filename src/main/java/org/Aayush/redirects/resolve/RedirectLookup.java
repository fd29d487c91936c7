package org.Aayush.redirects.resolve;

/**
 * Single-shot URL resolution contract.
 */
@FunctionalInterface
public interface RedirectLookup {

    /**
     * Returns the final destination of a URL, or the URL itself when nothing redirects it.
     * Implementations never throw.
     */
    String resolve(String url);

    /**
     * Lookup that redirects nothing.
     */
    static RedirectLookup identity() {
        return url -> url;
    }
}

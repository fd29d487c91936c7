package org.Aayush.redirects.resolve;

import java.util.Optional;

/**
 * Fixed structural URL rewrites applied before any per-locale lookup.
 */
@FunctionalInterface
public interface FundamentalRedirects {

    /**
     * @param url incoming URL.
     * @return the rewritten URL, or empty when no rule applies.
     */
    Optional<String> rewrite(String url);
}

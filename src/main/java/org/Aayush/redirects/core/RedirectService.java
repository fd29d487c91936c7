package org.Aayush.redirects.core;

import org.Aayush.redirects.table.RedirectPair;

import java.util.Collection;
import java.util.List;

/**
 * Public redirect-table contract.
 *
 * <p>Implementations perform deterministic validation and throw reason-coded
 * {@link RedirectException}s on contract failures, except {@link #resolve(String)} which
 * never throws.</p>
 */
public interface RedirectService {

    /**
     * Merges pairs into a locale's table, optionally dropping orphans, then validates and
     * persists the table.
     *
     * @param locale locale code in any case.
     * @param pairs incoming redirect pairs.
     * @param fix load the stored table relaxed and drop orphaned redirects.
     */
    void add(String locale, List<RedirectPair> pairs, boolean fix);

    /**
     * Returns the final destination of a URL, or the (possibly rewritten) URL on a miss.
     */
    String resolve(String url);

    /**
     * Populates or refreshes the lookup table for the given locales.
     *
     * @return number of pairs read.
     */
    int load(Collection<String> locales);

    /**
     * Throws if the URL cannot be a redirect source.
     */
    void validateFromUrl(String url);

    /**
     * Throws if the URL cannot be a redirect target.
     */
    void validateToUrl(String url);

    /**
     * Throws if the stored table of a locale is not already canonical.
     *
     * @param strict also require the table to be free of orphaned redirects.
     */
    void validateLocale(String locale, boolean strict);
}

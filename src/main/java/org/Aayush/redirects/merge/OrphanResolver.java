package org.Aayush.redirects.merge;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.content.DocumentLocator;
import org.Aayush.redirects.table.RedirectPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Repair-mode cleanup of redirects made moot by the content tree.
 */
@Slf4j
public final class OrphanResolver {
    private final DocumentLocator documentLocator;

    public OrphanResolver(DocumentLocator documentLocator) {
        this.documentLocator = Objects.requireNonNull(documentLocator, "documentLocator");
    }

    /**
     * Drops pairs whose source is now a real document and pairs whose internal target no
     * longer exists.
     */
    public List<RedirectPair> removeOrphanedRedirects(List<RedirectPair> pairs) {
        List<RedirectPair> kept = new ArrayList<>(pairs.size());
        for (RedirectPair pair : pairs) {
            if (documentLocator.exists(pair.from())) {
                log.info("removing orphaned redirect (from exists): {}", pair);
            } else if (pair.hasInternalTarget() && !documentLocator.exists(pair.to())) {
                log.info("removing orphaned redirect (to doesn't exist): {}", pair);
            } else {
                kept.add(pair);
            }
        }
        return kept;
    }
}

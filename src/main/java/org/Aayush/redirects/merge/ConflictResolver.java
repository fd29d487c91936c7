package org.Aayush.redirects.merge;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.table.RedirectPair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops stored redirects that an incoming batch supersedes.
 */
@Slf4j
@UtilityClass
public final class ConflictResolver {

    /**
     * Removes every old pair whose source equals, ignoring case, a target of the update batch.
     * Those URLs are about to become destinations again, so the stale redirect away from them
     * goes.
     *
     * @param oldPairs pairs from the stored table.
     * @param updatePairs incoming batch.
     * @return old pairs without the conflicting ones, in original order.
     */
    public static List<RedirectPair> removeConflictingOldRedirects(
            List<RedirectPair> oldPairs,
            List<RedirectPair> updatePairs
    ) {
        if (oldPairs.isEmpty()) {
            return new ArrayList<>(oldPairs);
        }
        Set<String> newTargets = new HashSet<>();
        for (RedirectPair update : updatePairs) {
            newTargets.add(update.toKey());
        }
        List<RedirectPair> kept = new ArrayList<>(oldPairs.size());
        for (RedirectPair old : oldPairs) {
            if (newTargets.contains(old.fromKey())) {
                log.info("removing conflicting redirect {}", old);
            } else {
                kept.add(old);
            }
        }
        return kept;
    }
}

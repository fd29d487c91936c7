package org.Aayush.redirects.table;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.Utils.UrlPaths;
import org.Aayush.redirects.validation.RedirectValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Integrity checks over whole pair lists: decoding and case-insensitive source uniqueness.
 * <p>
 * The {@code require*} variants fail on the first violation. The {@code drop*} variants log
 * each violation and return the list without the offending entries.
 * </p>
 */
@Slf4j
@UtilityClass
public final class PairChecks {

    /**
     * Throws unless every pair is already fully percent-decoded.
     */
    public static void requireDecoded(List<RedirectPair> pairs) {
        for (RedirectPair pair : pairs) {
            String problem = encodingProblem(pair);
            if (problem != null) {
                throw new RedirectValidationException(
                        RedirectValidationException.REASON_ENCODED_URL, problem, encodingMessage(pair, problem));
            }
        }
    }

    /**
     * Throws when two sources are equal ignoring case.
     */
    public static void requireUniqueSources(List<RedirectPair> pairs) {
        Set<String> seen = new HashSet<>();
        for (RedirectPair pair : pairs) {
            String key = pair.fromKey();
            if (!seen.add(key)) {
                throw new RedirectValidationException(
                        RedirectValidationException.REASON_DUPLICATE_SOURCE, pair.from(), "Duplicated redirect: " + key);
            }
        }
    }

    /**
     * Returns the pairs that are already decoded.
     */
    public static List<RedirectPair> dropEncoded(List<RedirectPair> pairs) {
        List<RedirectPair> kept = new ArrayList<>(pairs.size());
        for (RedirectPair pair : pairs) {
            String problem = encodingProblem(pair);
            if (problem == null) {
                kept.add(pair);
            } else {
                log.warn("dropping redirect: {}", encodingMessage(pair, problem));
            }
        }
        return kept;
    }

    /**
     * Returns the pairs whose source was not seen earlier in the list.
     */
    public static List<RedirectPair> dropDuplicateSources(List<RedirectPair> pairs) {
        Set<String> seen = new HashSet<>();
        List<RedirectPair> kept = new ArrayList<>(pairs.size());
        for (RedirectPair pair : pairs) {
            if (seen.add(pair.fromKey())) {
                kept.add(pair);
            } else {
                log.warn("dropping duplicated redirect: {}", pair);
            }
        }
        return kept;
    }

    /**
     * Returns the first side of the pair that decoding would change, or null.
     */
    private static String encodingProblem(RedirectPair pair) {
        if (!isDecoded(pair.from(), true)) {
            return pair.from();
        }
        if (!isDecoded(pair.to(), pair.hasInternalTarget())) {
            return pair.to();
        }
        return null;
    }

    private static boolean isDecoded(String url, boolean path) {
        try {
            String decoded = path ? UrlPaths.decodePath(url) : UrlPaths.decodeUri(url);
            return decoded.equals(url);
        } catch (IllegalArgumentException ex) {
            // a stray '%' that is not an escape
            return false;
        }
    }

    private static String encodingMessage(RedirectPair pair, String offending) {
        String side = offending.equals(pair.from()) ? "From" : "To";
        return side + " URL must be decoded: " + offending;
    }
}

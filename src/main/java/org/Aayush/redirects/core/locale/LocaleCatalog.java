package org.Aayush.redirects.core.locale;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable catalog of recognized locale codes.
 *
 * <p>Membership checks are case-sensitive against the canonical code ({@code en-US}, not
 * {@code en-us}). A lowercase index maps folder names and sloppy input back to the
 * canonical spelling.</p>
 */
public final class LocaleCatalog {
    public static final String DEFAULT_LOCALE = "en-US";

    private static final List<String> BUILT_IN_LOCALES = List.of(
            "de", "en-US", "es", "fr", "ja", "ko", "pl", "pt-BR", "ru", "zh-CN", "zh-TW"
    );

    private final List<String> orderedCodes;
    private final Set<String> canonicalCodes;
    private final Map<String, String> canonicalByLowercase;
    private final Set<String> vanityUrls;

    /**
     * Creates a catalog with the built-in locale set.
     */
    public LocaleCatalog() {
        this(BUILT_IN_LOCALES);
    }

    /**
     * Creates an explicit catalog from the given canonical codes.
     */
    public LocaleCatalog(Collection<String> codes) {
        LinkedHashMap<String, String> byLowercase = materialize(codes);
        this.canonicalByLowercase = Map.copyOf(byLowercase);
        this.orderedCodes = List.copyOf(byLowercase.values());
        this.canonicalCodes = Set.copyOf(orderedCodes);
        this.vanityUrls = Set.copyOf(byLowercase.values().stream().map(code -> "/" + code + "/").toList());
    }

    /**
     * Returns a new catalog with built-in locales.
     */
    public static LocaleCatalog defaultCatalog() {
        return new LocaleCatalog();
    }

    /**
     * Case-sensitive membership check.
     */
    public boolean contains(String code) {
        return code != null && canonicalCodes.contains(code);
    }

    /**
     * Returns canonical spelling of a locale code in any case, or null when unknown.
     */
    public String canonical(String code) {
        if (code == null) {
            return null;
        }
        return canonicalByLowercase.get(code.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether the URL is a bare locale root such as {@code /en-US/}.
     */
    public boolean isVanityUrl(String url) {
        return url != null && vanityUrls.contains(url);
    }

    /**
     * Returns immutable set of canonical codes.
     */
    public Set<String> codes() {
        return canonicalCodes;
    }

    /**
     * Canonical codes in declaration order.
     */
    public List<String> orderedCodes() {
        return orderedCodes;
    }

    private static LinkedHashMap<String, String> materialize(Collection<String> codes) {
        Objects.requireNonNull(codes, "codes");
        LinkedHashMap<String, String> map = new LinkedHashMap<>();
        for (String code : codes) {
            String normalized = Objects.requireNonNull(code, "code").trim();
            if (normalized.isEmpty() || normalized.contains("/")) {
                throw new IllegalArgumentException("locale code must be a non-blank path segment: '" + code + "'");
            }
            String previous = map.putIfAbsent(normalized.toLowerCase(Locale.ROOT), normalized);
            if (previous != null && !previous.equals(normalized)) {
                throw new IllegalArgumentException(
                        "locale codes differ only by case: " + previous + ", " + normalized);
            }
        }
        if (map.isEmpty()) {
            throw new IllegalArgumentException("locale catalog must not be empty");
        }
        return map;
    }
}

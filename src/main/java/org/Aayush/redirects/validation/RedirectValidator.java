package org.Aayush.redirects.validation;

import org.Aayush.redirects.content.DocumentLocator;
import org.Aayush.redirects.core.locale.LocaleCatalog;
import org.Aayush.redirects.resolve.RedirectLookup;
import org.Aayush.redirects.table.RedirectPair;

import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

import static org.Aayush.redirects.validation.RedirectValidationException.*;

/**
 * Shape and legality checks for redirect source and target URLs.
 *
 * <p>Every check throws a {@link RedirectValidationException} naming the violated rule and
 * the offending URL; a passing check returns silently.</p>
 * <ul>
 * <li>{@code checkResolve}: consult the current resolution table so a URL that is already a
 * redirect source cannot be registered again or be pointed at.</li>
 * <li>{@code checkPath}: consult the {@link DocumentLocator}. Sources must not be live
 * documents, internal targets must be.</li>
 * </ul>
 */
public final class RedirectValidator {
    private static final String DOCS_SEGMENT = "docs";
    private static final String SCHEME_SEPARATOR = "://";
    private static final String REQUIRED_SCHEME = "https";
    private static final char[] FORBIDDEN_URL_SYMBOLS = {'\n', '\t'};
    private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.\\-]*");

    private final LocaleCatalog locales;
    private final DocumentLocator documentLocator;
    private final RedirectLookup lookup;

    /**
     * @param locales recognized locale codes.
     * @param documentLocator document existence capability.
     * @param lookup current resolution table, consulted only by resolve-checks.
     */
    public RedirectValidator(LocaleCatalog locales, DocumentLocator documentLocator, RedirectLookup lookup) {
        this.locales = Objects.requireNonNull(locales, "locales");
        this.documentLocator = Objects.requireNonNull(documentLocator, "documentLocator");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Full source check: shape, characters, locale, document and resolution table.
     */
    public void validateFromUrl(String url) {
        validateFromUrl(url, true, true);
    }

    /**
     * Throws if the URL cannot be a redirect source.
     */
    public void validateFromUrl(String url, boolean checkResolve, boolean checkPath) {
        Objects.requireNonNull(url, "url");
        if (!url.startsWith("/")) {
            throw new RedirectValidationException(REASON_MALFORMED_SOURCE, url,
                    "From-URL must start with a / was " + url);
        }
        if (!url.contains("/" + DOCS_SEGMENT + "/")) {
            throw new RedirectValidationException(REASON_MISSING_DOCS_SEGMENT, url,
                    "From-URL must contain '/docs/' was " + url);
        }
        if (!locales.contains(url.split("/", -1)[1])) {
            throw new RedirectValidationException(REASON_INVALID_LOCALE_PREFIX, url,
                    "The locale prefix is not valid or wrong case was " + url);
        }
        requireNoForbiddenSymbols(url);
        requireLocalePath(url);
        if (checkPath) {
            documentLocator.locate(url).ifPresent(path -> {
                throw new RedirectValidationException(REASON_SOURCE_RESOLVES_TO_DOCUMENT, url,
                        "From-URL resolves to a file (" + path + ")");
            });
        }
        if (checkResolve) {
            requireNotRedirected(url);
        }
    }

    /**
     * Full target check: vanity, external scheme, or internal document with no redirect on it.
     */
    public void validateToUrl(String url) {
        validateToUrl(url, true, true);
    }

    /**
     * Throws if the URL cannot be a redirect target.
     */
    public void validateToUrl(String url, boolean checkResolve, boolean checkPath) {
        Objects.requireNonNull(url, "url");
        if (locales.isVanityUrl(url)) {
            return;
        }
        int schemeEnd = url.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd >= 0) {
            requireHttps(url, schemeEnd);
        } else if (url.startsWith("/")) {
            requireNoForbiddenSymbols(url);
            requireLocalePath(url);
            if (checkResolve) {
                // no redirect-to-a-redirect
                requireNotRedirected(url);
            }
            if (checkPath && !documentLocator.exists(url)) {
                throw new RedirectValidationException(REASON_UNRESOLVABLE_TARGET, url,
                        "To-URL has to resolve to a file (" + url + ")");
            }
        } else {
            throw new RedirectValidationException(REASON_MALFORMED_TARGET, url,
                    "To-URL has to be external or start with / (" + url + ")");
        }
    }

    /**
     * Validates both sides of every pair without consulting the resolution table.
     *
     * @param pairs pairs to check.
     * @param checkPath whether document existence is checked.
     */
    public void validatePairs(Collection<RedirectPair> pairs, boolean checkPath) {
        for (RedirectPair pair : pairs) {
            validateFromUrl(pair.from(), false, checkPath);
            validateToUrl(pair.to(), false, checkPath);
        }
    }

    /**
     * Checks the {@code /{locale}/docs/...} structure and locale membership.
     */
    public void requireLocalePath(String url) {
        String[] segments = url.split("/", -1);
        boolean shaped = segments.length >= 3
                && segments[0].isEmpty()
                && !segments[1].isEmpty()
                && DOCS_SEGMENT.equals(segments[2]);
        if (!shaped) {
            throw new RedirectValidationException(REASON_MALFORMED_LOCALE_PATH, url,
                    "The URL is expected to start with /$locale/docs/: " + url);
        }
        String locale = segments[1];
        if (!locales.contains(locale)) {
            throw new RedirectValidationException(REASON_UNKNOWN_LOCALE, url,
                    "'" + locale + "' not in " + locales.orderedCodes());
        }
    }

    private void requireHttps(String url, int schemeEnd) {
        String scheme = url.substring(0, schemeEnd);
        String rest = url.substring(schemeEnd + SCHEME_SEPARATOR.length());
        if (!SCHEME.matcher(scheme).matches() || rest.isEmpty() || rest.startsWith("/")) {
            throw new RedirectValidationException(REASON_MALFORMED_EXTERNAL_TARGET, url,
                    "To-URL is not a valid absolute URL: " + url);
        }
        if (!REQUIRED_SCHEME.equalsIgnoreCase(scheme)) {
            throw new RedirectValidationException(REASON_NON_HTTPS_TARGET, url,
                    "We only redirect to https:// (was " + url + ")");
        }
    }

    private void requireNotRedirected(String url) {
        String resolved = lookup.resolve(url);
        if (!url.equals(resolved)) {
            throw new RedirectValidationException(REASON_ALREADY_REDIRECTED, url,
                    url + " is already matched as a redirect (to: '" + resolved + "')");
        }
    }

    private static void requireNoForbiddenSymbols(String url) {
        for (char symbol : FORBIDDEN_URL_SYMBOLS) {
            if (url.indexOf(symbol) >= 0) {
                throw new RedirectValidationException(REASON_FORBIDDEN_CHARACTER, url,
                        "URL contains invalid character '" + (symbol == '\n' ? "\\n" : "\\t") + "'");
            }
        }
    }
}

package org.Aayush.redirects.resolve;

import org.Aayush.redirects.core.locale.LocaleCatalog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in, ordered regex rewrite table. The first rule that produces a different URL wins.
 * <ul>
 * <li>{@code /docs/X} gets the default locale: {@code /en-US/docs/X}.</li>
 * <li>A known locale in the wrong case is canonicalized: {@code /en-us/docs/X} to
 * {@code /en-US/docs/X}.</li>
 * <li>{@code /{locale}/docs} with no slug goes to the locale root {@code /{locale}/}.</li>
 * <li>Trailing slashes after a docs slug are removed.</li>
 * </ul>
 */
public final class PatternFundamentalRedirects implements FundamentalRedirects {
    private static final Pattern LOCALE_LESS_DOCS = Pattern.compile("^/docs/(.+)$");
    private static final Pattern LOCALE_PREFIXED = Pattern.compile("^/([^/]+)/(docs(?:/.*)?)$");
    private static final Pattern BARE_DOCS = Pattern.compile("^/([^/]+)/docs/?$");
    private static final Pattern TRAILING_SLASH = Pattern.compile("^(/[^/]+/docs/.*[^/])/+$");

    private final List<Rule> rules;

    public PatternFundamentalRedirects(LocaleCatalog locales) {
        Objects.requireNonNull(locales, "locales");
        this.rules = List.of(
                new Rule(LOCALE_LESS_DOCS,
                        (m, url) -> "/" + LocaleCatalog.DEFAULT_LOCALE + "/docs/" + m.group(1)),
                new Rule(LOCALE_PREFIXED, (m, url) -> {
                    String canonical = locales.canonical(m.group(1));
                    if (canonical == null || canonical.equals(m.group(1))) {
                        return null;
                    }
                    return "/" + canonical + "/" + m.group(2);
                }),
                new Rule(BARE_DOCS, (m, url) -> locales.contains(m.group(1)) ? "/" + m.group(1) + "/" : null),
                new Rule(TRAILING_SLASH, (m, url) -> m.group(1))
        );
    }

    @Override
    public Optional<String> rewrite(String url) {
        if (url == null) {
            return Optional.empty();
        }
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(url);
            if (!matcher.matches()) {
                continue;
            }
            String rewritten = rule.rewrite().apply(matcher, url);
            if (rewritten != null && !rewritten.equals(url)) {
                return Optional.of(rewritten);
            }
        }
        return Optional.empty();
    }

    private record Rule(Pattern pattern, BiFunction<Matcher, String, String> rewrite) {
    }
}

package org.Aayush.redirects.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.content.DocumentLocator;
import org.Aayush.redirects.content.FileSystemDocumentLocator;
import org.Aayush.redirects.core.locale.LocaleCatalog;
import org.Aayush.redirects.graph.RedirectFlattener;
import org.Aayush.redirects.merge.ConflictResolver;
import org.Aayush.redirects.merge.OrphanResolver;
import org.Aayush.redirects.resolve.FundamentalRedirects;
import org.Aayush.redirects.resolve.PatternFundamentalRedirects;
import org.Aayush.redirects.resolve.RedirectResolver;
import org.Aayush.redirects.table.LoadMode;
import org.Aayush.redirects.table.LoadedTable;
import org.Aayush.redirects.table.LocaleTableStore;
import org.Aayush.redirects.table.PairChecks;
import org.Aayush.redirects.table.RedirectPair;
import org.Aayush.redirects.table.RedirectTableReader;
import org.Aayush.redirects.table.RedirectTableWriter;
import org.Aayush.redirects.validation.RedirectValidationException;
import org.Aayush.redirects.validation.RedirectValidator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Main redirect-table entry point.
 *
 * <p>Write path, per locale:</p>
 * <ul>
 * <li>Check the update batch: decoded, unique sources, valid URLs with document checks.</li>
 * <li>Load the stored table (strict, or relaxed when fixing).</li>
 * <li>Drop stored redirects whose source an update now targets, append the updates.</li>
 * <li>Flatten chains and drop cycles.</li>
 * <li>When fixing, drop orphaned redirects.</li>
 * <li>Validate the result and rewrite the whole table.</li>
 * </ul>
 *
 * <p>The read path is the owned {@link RedirectResolver}. It is not refreshed by
 * {@link #add}; call {@link #reload()} after writing when lookups must see the change.</p>
 */
@Slf4j
public final class RedirectCore implements RedirectService {
    private final LocaleCatalog locales;
    private final RedirectValidator validator;
    private final LocaleTableStore tableStore;
    private final RedirectResolver resolver;
    private final RedirectFlattener flattener;
    private final OrphanResolver orphanResolver;

    /**
     * Creates the facade.
     *
     * @param config runtime configuration.
     * @param documentLocator optional locator override; defaults to the on-disk content tree.
     * @param fundamentalRedirects optional rewrite table override; defaults to the built-in rules.
     */
    @Builder
    public RedirectCore(
            RedirectRuntimeConfig config,
            DocumentLocator documentLocator,
            FundamentalRedirects fundamentalRedirects
    ) {
        Objects.requireNonNull(config, "config");
        this.locales = Objects.requireNonNull(config.getLocales(), "config.locales");
        DocumentLocator locator = documentLocator == null ? new FileSystemDocumentLocator(config) : documentLocator;
        FundamentalRedirects rewrites = fundamentalRedirects == null
                ? new PatternFundamentalRedirects(locales)
                : fundamentalRedirects;

        this.validator = new RedirectValidator(locales, locator, this::resolve);
        this.tableStore = new LocaleTableStore(config, new RedirectTableReader(validator), new RedirectTableWriter());
        this.resolver = new RedirectResolver(tableStore, rewrites, locales);
        this.flattener = new RedirectFlattener(config.isStrictCycles());
        this.orphanResolver = new OrphanResolver(locator);
    }

    @Override
    public void add(String locale, List<RedirectPair> pairs, boolean fix) {
        MergeResult result = merge(locale, pairs, fix);
        tableStore.write(result.table(), result.pairs());
    }

    /**
     * Merges without orphan removal.
     */
    public void add(String locale, List<RedirectPair> pairs) {
        add(locale, pairs, false);
    }

    /**
     * Runs the write pipeline without persisting.
     *
     * @param locale locale code in any case.
     * @param updatePairs incoming batch, may be empty.
     * @param fix relaxed load plus orphan removal.
     * @return the table content that {@link #add} would write.
     */
    public MergeResult merge(String locale, List<RedirectPair> updatePairs, boolean fix) {
        Objects.requireNonNull(updatePairs, "updatePairs");
        String canonicalLocale = requireLocale(locale);
        PairChecks.requireDecoded(updatePairs);
        PairChecks.requireUniqueSources(updatePairs);
        validator.validatePairs(updatePairs, true);

        Path table = tableStore.tablePathForWrite(canonicalLocale);
        LoadedTable stored = tableStore.readIfExists(table, fix ? LoadMode.RELAXED : LoadMode.STRICT);

        List<RedirectPair> merged = new ArrayList<>(
                ConflictResolver.removeConflictingOldRedirects(stored.pairs(), updatePairs));
        merged.addAll(updatePairs);

        List<RedirectPair> simplified = flattener.flatten(merged).pairs();
        if (fix) {
            simplified = orphanResolver.removeOrphanedRedirects(simplified);
        }
        validator.validatePairs(simplified, true);

        boolean changed = stored.droppedRows() > 0 || !simplified.equals(stored.pairs());
        return new MergeResult(table, simplified, changed);
    }

    @Override
    public String resolve(String url) {
        return resolver.resolve(url);
    }

    @Override
    public int load(Collection<String> localeCodes) {
        return resolver.load(localeCodes);
    }

    /**
     * Loads every recognized locale.
     */
    public int load() {
        return resolver.load();
    }

    /**
     * Rebuilds the lookup table from every locale's stored table.
     */
    public int reload() {
        return resolver.reload();
    }

    @Override
    public void validateFromUrl(String url) {
        validator.validateFromUrl(url);
    }

    @Override
    public void validateToUrl(String url) {
        validator.validateToUrl(url);
    }

    @Override
    public void validateLocale(String locale, boolean strict) {
        MergeResult result = merge(locale, List.of(), strict);
        if (result.changed()) {
            throw new RedirectException(RedirectException.REASON_TABLE_NOT_CANONICAL,
                    result.table() + " for " + locale + " is flawed");
        }
        log.debug("{} is canonical", result.table());
    }

    /**
     * Non-strict locale validation.
     */
    public void validateLocale(String locale) {
        validateLocale(locale, false);
    }

    private String requireLocale(String locale) {
        String canonical = locales.canonical(Objects.requireNonNull(locale, "locale"));
        if (canonical == null) {
            throw new RedirectValidationException(RedirectValidationException.REASON_UNKNOWN_LOCALE, locale,
                    "'" + locale + "' not in " + locales.orderedCodes());
        }
        return canonical;
    }
}

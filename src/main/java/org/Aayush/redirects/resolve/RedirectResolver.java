package org.Aayush.redirects.resolve;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.Utils.UrlPaths;
import org.Aayush.redirects.core.RedirectException;
import org.Aayush.redirects.core.locale.LocaleCatalog;
import org.Aayush.redirects.table.LoadMode;
import org.Aayush.redirects.table.LoadedTable;
import org.Aayush.redirects.table.LocaleTableStore;
import org.Aayush.redirects.table.RedirectPair;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup table spanning every locale's redirect table.
 *
 * <p>{@link #resolve(String)} applies the fundamental rewrites, decodes the path and performs
 * exactly one lowercase lookup. Stored targets are already flattened, so no chain is walked
 * at read time.</p>
 *
 * <p>The table is built on the first lookup unless {@link #load} or {@link #reload} ran
 * before. Not thread-safe: hosts that resolve from several threads must build the table
 * eagerly and serialize reloads.</p>
 */
@Slf4j
public final class RedirectResolver implements RedirectLookup {
    private final LocaleTableStore tableStore;
    private final FundamentalRedirects fundamentalRedirects;
    private final LocaleCatalog locales;
    private final Object2ObjectOpenHashMap<String, String> targetsBySource = new Object2ObjectOpenHashMap<>();
    private boolean loaded;

    public RedirectResolver(
            LocaleTableStore tableStore,
            FundamentalRedirects fundamentalRedirects,
            LocaleCatalog locales
    ) {
        this.tableStore = Objects.requireNonNull(tableStore, "tableStore");
        this.fundamentalRedirects = Objects.requireNonNull(fundamentalRedirects, "fundamentalRedirects");
        this.locales = Objects.requireNonNull(locales, "locales");
    }

    /**
     * Loads the tables of the given locales into the lookup table, replacing earlier entries for
     * the same sources. Locales without a table are skipped; a broken table fails the call.
     *
     * @return number of pairs read.
     */
    public int load(Collection<String> localeCodes) {
        Objects.requireNonNull(localeCodes, "localeCodes");
        int read = 0;
        for (String locale : localeCodes) {
            read += loadLocale(locale);
        }
        loaded = true;
        return read;
    }

    /**
     * Loads every recognized locale.
     */
    public int load() {
        return load(locales.orderedCodes());
    }

    /**
     * Discards the lookup table and loads every recognized locale again.
     */
    public int reload() {
        targetsBySource.clear();
        loaded = false;
        return load();
    }

    @Override
    public String resolve(String url) {
        if (url == null) {
            return null;
        }
        ensureLoaded();
        String rewritten = fundamentalRedirects.rewrite(url).orElse(url);
        String target = targetsBySource.get(lookupKey(rewritten));
        return target != null ? target : rewritten;
    }

    /**
     * @return number of sources in the lookup table.
     */
    public int size() {
        return targetsBySource.size();
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * Builds the table on first use. A broken locale table is logged and skipped; the other
     * locales still load.
     */
    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        for (String locale : locales.orderedCodes()) {
            try {
                loadLocale(locale);
            } catch (RedirectException ex) {
                log.error("Skipping redirect table of {}, resolving without it", locale, ex);
            }
        }
        loaded = true;
    }

    private int loadLocale(String locale) {
        Optional<Path> table = tableStore.findTable(locale);
        if (table.isEmpty()) {
            return 0;
        }
        LoadedTable loadedTable = tableStore.read(table.get(), LoadMode.RELAXED);
        for (RedirectPair pair : loadedTable.pairs()) {
            targetsBySource.put(pair.fromKey(), pair.to());
        }
        log.info("Loaded {} redirects for {} from {}", loadedTable.pairs().size(), locale, table.get());
        return loadedTable.pairs().size();
    }

    private static String lookupKey(String url) {
        String decoded;
        try {
            decoded = UrlPaths.decodePath(url);
        } catch (IllegalArgumentException ex) {
            decoded = url;
        }
        return decoded.toLowerCase(Locale.ROOT);
    }
}

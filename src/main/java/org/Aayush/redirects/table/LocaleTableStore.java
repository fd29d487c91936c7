package org.Aayush.redirects.table;

import org.Aayush.redirects.core.RedirectException;
import org.Aayush.redirects.core.RedirectRuntimeConfig;
import org.Aayush.redirects.core.locale.LocaleCatalog;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates, reads and rewrites the per-locale {@code _redirects.txt} tables.
 */
public final class LocaleTableStore {
    public static final String TABLE_FILE = "_redirects.txt";

    private final RedirectRuntimeConfig config;
    private final RedirectTableReader reader;
    private final RedirectTableWriter writer;

    public LocaleTableStore(RedirectRuntimeConfig config, RedirectTableReader reader, RedirectTableWriter writer) {
        this.config = Objects.requireNonNull(config, "config");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Finds an existing table, searching the content root before the translated root.
     */
    public Optional<Path> findTable(String locale) {
        for (Path root : new Path[]{config.getContentRoot(), config.getTranslatedContentRoot()}) {
            if (root == null) {
                continue;
            }
            Path candidate = tablePath(root, locale);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns where the table of a locale is written: en-US under the content root, other
     * locales under the translated root.
     *
     * @throws RedirectException when the needed root is not configured.
     */
    public Path tablePathForWrite(String locale) {
        boolean defaultLocale = LocaleCatalog.DEFAULT_LOCALE.equalsIgnoreCase(locale);
        Path root = defaultLocale ? config.getContentRoot() : config.getTranslatedContentRoot();
        if (root == null) {
            String reason = defaultLocale
                    ? RedirectException.REASON_MISSING_CONTENT_ROOT
                    : RedirectException.REASON_MISSING_TRANSLATED_ROOT;
            throw new RedirectException(reason, "trying to add redirects for " + locale + " but "
                    + (defaultLocale ? RedirectRuntimeConfig.ENV_CONTENT_ROOT
                    : RedirectRuntimeConfig.ENV_CONTENT_TRANSLATED_ROOT) + " not set");
        }
        return tablePath(root, locale);
    }

    /**
     * Reads a table, or returns an empty one when the file does not exist.
     */
    public LoadedTable readIfExists(Path table, LoadMode mode) {
        if (!Files.exists(table)) {
            return LoadedTable.empty();
        }
        return reader.read(table, mode);
    }

    public LoadedTable read(Path table, LoadMode mode) {
        return reader.read(table, mode);
    }

    public void write(Path table, List<RedirectPair> pairs) {
        writer.write(table, pairs);
    }

    private static Path tablePath(Path root, String locale) {
        return root.resolve(locale.toLowerCase(Locale.ROOT)).resolve(TABLE_FILE);
    }
}

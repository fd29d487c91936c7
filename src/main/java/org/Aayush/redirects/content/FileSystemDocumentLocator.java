package org.Aayush.redirects.content;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.Utils.UrlPaths;
import org.Aayush.redirects.core.RedirectException;
import org.Aayush.redirects.core.RedirectRuntimeConfig;
import org.Aayush.redirects.core.locale.LocaleCatalog;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DocumentLocator} over the on-disk content trees.
 *
 * <p>A document for {@code /{locale}/docs/{slug}} lives at
 * {@code {root}/{locale}/{slug folder}/index.html}. en-US documents live under the content
 * root, every other locale under the translated root. Looking up an en-US document without a
 * content root fails with {@link RedirectException#REASON_MISSING_CONTENT_ROOT}.</p>
 */
@Slf4j
public final class FileSystemDocumentLocator implements DocumentLocator {
    static final String DOCUMENT_FILE = "index.html";
    static final String UNCHECKED_TRANSLATED_PREFIX = "$TRANSLATED/";

    private static final String DEFAULT_LOCALE_FOLDER = LocaleCatalog.DEFAULT_LOCALE.toLowerCase(Locale.ROOT);

    private final Path contentRoot;
    private final Path translatedContentRoot;
    private final LocaleCatalog locales;

    public FileSystemDocumentLocator(RedirectRuntimeConfig config) {
        Objects.requireNonNull(config, "config");
        this.contentRoot = config.getContentRoot();
        this.translatedContentRoot = config.getTranslatedContentRoot();
        this.locales = Objects.requireNonNull(config.getLocales(), "config.locales");
    }

    @Override
    public Optional<String> locate(String url) {
        if (locales.isVanityUrl(url)) {
            return Optional.of(url);
        }
        String bareUrl = url.split("#", 2)[0];
        String[] parts = bareUrl.toLowerCase(Locale.ROOT).split("/", -1);
        String locale = parts.length > 1 ? parts[1] : "";
        String slug = parts.length > 3 ? String.join("/", Arrays.copyOfRange(parts, 3, parts.length)) : "";
        String relativePath = locale + "/" + UrlPaths.slugToFolder(slug) + "/" + DOCUMENT_FILE;

        boolean defaultLocale = DEFAULT_LOCALE_FOLDER.equals(locale);
        if (defaultLocale && contentRoot == null) {
            throw new RedirectException(RedirectException.REASON_MISSING_CONTENT_ROOT,
                    "cannot look up " + url + ": " + RedirectRuntimeConfig.ENV_CONTENT_ROOT + " not set");
        }
        Path root = defaultLocale ? contentRoot : translatedContentRoot;
        if (root == null) {
            // translated tree not checked out: cannot tell, so treat as present
            log.info("Resolving non-en-US path {} without a translated content root", url);
            return Optional.of(UNCHECKED_TRANSLATED_PREFIX + relativePath);
        }
        Path filePath = root.resolve(relativePath).normalize();
        if (Files.exists(filePath)) {
            return Optional.of(filePath.toString());
        }
        return Optional.empty();
    }
}

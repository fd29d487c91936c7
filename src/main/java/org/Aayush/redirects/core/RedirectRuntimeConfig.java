package org.Aayush.redirects.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.redirects.core.locale.LocaleCatalog;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runtime configuration bound once when the redirect engine is constructed.
 */
@Value
@Builder
public class RedirectRuntimeConfig {
    public static final String ENV_CONTENT_ROOT = "CONTENT_ROOT";
    public static final String ENV_CONTENT_TRANSLATED_ROOT = "CONTENT_TRANSLATED_ROOT";

    /**
     * Root of the en-US content tree. Holds {@code en-us/_redirects.txt}.
     */
    Path contentRoot;

    /**
     * Optional root of the translated content tree.
     */
    Path translatedContentRoot;

    /**
     * Recognized locales.
     */
    @Builder.Default
    LocaleCatalog locales = LocaleCatalog.defaultCatalog();

    /**
     * Escalates cycles found while flattening into failures instead of log-and-drop.
     */
    boolean strictCycles;

    /**
     * Returns config read from the process environment.
     */
    public static RedirectRuntimeConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Returns config read from the given environment map.
     */
    public static RedirectRuntimeConfig fromEnvironment(Map<String, String> environment) {
        return RedirectRuntimeConfig.builder()
                .contentRoot(pathOrNull(environment.get(ENV_CONTENT_ROOT)))
                .translatedContentRoot(pathOrNull(environment.get(ENV_CONTENT_TRANSLATED_ROOT)))
                .build();
    }

    private static Path pathOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Path.of(value.trim());
    }
}

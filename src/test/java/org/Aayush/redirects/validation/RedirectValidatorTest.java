package org.Aayush.redirects.validation;

import org.Aayush.redirects.core.locale.LocaleCatalog;
import org.Aayush.redirects.testutil.InMemoryDocumentLocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.Aayush.redirects.testutil.RedirectFixtures.en;
import static org.Aayush.redirects.testutil.RedirectFixtures.pair;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RedirectValidator Contract Tests")
class RedirectValidatorTest {

    private static final Map<String, String> EXISTING_REDIRECTS = Map.of(en("Old"), en("Web/HTML"));

    private final RedirectValidator validator = new RedirectValidator(
            LocaleCatalog.defaultCatalog(),
            InMemoryDocumentLocator.of(en("Web/HTML"), en("Web/CSS")),
            url -> EXISTING_REDIRECTS.getOrDefault(url, url)
    );

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "en-US/docs/A              | MALFORMED_SOURCE",
            "/en-US/A                  | MISSING_DOCS_SEGMENT",
            "/en-us/docs/A             | INVALID_LOCALE_PREFIX",
            "/xx/docs/A                | INVALID_LOCALE_PREFIX",
            "/en-US/guide/docs/A       | MALFORMED_LOCALE_PATH",
            "/en-US/docs/Web/HTML      | SOURCE_RESOLVES_TO_DOCUMENT",
            "/en-US/docs/web/html#Tags | SOURCE_RESOLVES_TO_DOCUMENT",
            "/en-US/docs/Old           | ALREADY_REDIRECTED"
    })
    @DisplayName("Source rule violations carry distinct reason codes")
    void testSourceViolations(String url, String reasonCode) {
        RedirectValidationException ex = assertThrows(
                RedirectValidationException.class, () -> validator.validateFromUrl(url));
        assertEquals(reasonCode, ex.reasonCode());
        assertEquals(url, ex.url());
    }

    @Test
    @DisplayName("Control characters in a source are rejected")
    void testSourceForbiddenCharacters() {
        RedirectValidationException tab = assertThrows(
                RedirectValidationException.class, () -> validator.validateFromUrl(en("A\tB")));
        assertEquals(RedirectValidationException.REASON_FORBIDDEN_CHARACTER, tab.reasonCode());
        RedirectValidationException newline = assertThrows(
                RedirectValidationException.class, () -> validator.validateFromUrl(en("A\nB")));
        assertEquals(RedirectValidationException.REASON_FORBIDDEN_CHARACTER, newline.reasonCode());
    }

    @Test
    @DisplayName("Fresh source passes; resolve and path checks can be switched off")
    void testSourcePassesAndChecksAreOptional() {
        assertDoesNotThrow(() -> validator.validateFromUrl(en("Brand/New")));
        assertDoesNotThrow(() -> validator.validateFromUrl("/fr/docs/Nouveau"));
        assertDoesNotThrow(() -> validator.validateFromUrl(en("Old"), false, true));
        assertDoesNotThrow(() -> validator.validateFromUrl(en("Web/HTML"), false, false));
    }

    @Test
    @DisplayName("Only https external targets are allowed")
    void testExternalSchemes() {
        RedirectValidationException ex = assertThrows(
                RedirectValidationException.class, () -> validator.validateToUrl("http://example.com/x"));
        assertEquals(RedirectValidationException.REASON_NON_HTTPS_TARGET, ex.reasonCode());
        assertDoesNotThrow(() -> validator.validateToUrl("https://example.com/x"));
        assertDoesNotThrow(() -> validator.validateToUrl("HTTPS://example.com/x"));

        assertEquals(RedirectValidationException.REASON_NON_HTTPS_TARGET, assertThrows(
                RedirectValidationException.class, () -> validator.validateToUrl("ftp://example.com/x")).reasonCode());
        assertEquals(RedirectValidationException.REASON_MALFORMED_EXTERNAL_TARGET, assertThrows(
                RedirectValidationException.class, () -> validator.validateToUrl("https://")).reasonCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"/en-US/", "/fr/", "/zh-CN/"})
    @DisplayName("Locale-root vanity targets pass unconditionally")
    void testVanityTargets(String url) {
        assertDoesNotThrow(() -> validator.validateToUrl(url));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "example.com/x        | MALFORMED_TARGET",
            "/en-us/              | MALFORMED_LOCALE_PATH",
            "/xx/docs/A           | UNKNOWN_LOCALE",
            "/en-US/docs/Missing  | UNRESOLVABLE_TARGET",
            "/de/docs/Web/HTML    | UNRESOLVABLE_TARGET",
            "/en-US/docs/Old      | ALREADY_REDIRECTED"
    })
    @DisplayName("Target rule violations carry distinct reason codes")
    void testTargetViolations(String url, String reasonCode) {
        RedirectValidationException ex = assertThrows(
                RedirectValidationException.class, () -> validator.validateToUrl(url));
        assertEquals(reasonCode, ex.reasonCode());
    }

    @Test
    @DisplayName("Internal target that exists passes; path check can be switched off")
    void testInternalTargets() {
        assertDoesNotThrow(() -> validator.validateToUrl(en("Web/HTML")));
        assertDoesNotThrow(() -> validator.validateToUrl(en("Web/HTML#Elements")));
        assertDoesNotThrow(() -> validator.validateToUrl(en("Missing"), true, false));
    }

    @Test
    @DisplayName("Unknown locale message lists the recognized codes")
    void testUnknownLocaleMessage() {
        RedirectValidationException ex = assertThrows(
                RedirectValidationException.class, () -> validator.requireLocalePath("/xx/docs/A"));
        assertTrue(ex.getMessage().startsWith("[UNKNOWN_LOCALE] 'xx' not in [de, en-US"));
    }

    @Test
    @DisplayName("validatePairs checks both sides without consulting the resolution table")
    void testValidatePairs() {
        assertDoesNotThrow(() -> validator.validatePairs(List.of(pair(en("Old"), en("Web/CSS"))), true));
        assertThrows(RedirectValidationException.class,
                () -> validator.validatePairs(List.of(pair(en("Gone"), en("Missing"))), true));
        assertDoesNotThrow(() -> validator.validatePairs(List.of(pair(en("Gone"), en("Missing"))), false));
    }
}

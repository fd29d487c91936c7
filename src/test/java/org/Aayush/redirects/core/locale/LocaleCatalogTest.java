package org.Aayush.redirects.core.locale;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocaleCatalogTest {

    @Test
    @DisplayName("Built-in catalog is case-sensitive on membership")
    void testBuiltInMembership() {
        LocaleCatalog catalog = LocaleCatalog.defaultCatalog();

        assertTrue(catalog.contains("en-US"));
        assertTrue(catalog.contains("zh-TW"));
        assertFalse(catalog.contains("en-us"));
        assertFalse(catalog.contains(null));
        assertEquals(11, catalog.codes().size());
        assertEquals("de", catalog.orderedCodes().get(0));
    }

    @Test
    @DisplayName("Any casing maps back to the canonical code")
    void testCanonical() {
        LocaleCatalog catalog = LocaleCatalog.defaultCatalog();

        assertEquals("en-US", catalog.canonical("EN-us"));
        assertEquals("pt-BR", catalog.canonical("pt-br"));
        assertNull(catalog.canonical("xx"));
        assertNull(catalog.canonical(null));
    }

    @Test
    @DisplayName("Vanity URLs are bare locale roots in canonical case")
    void testVanityUrls() {
        LocaleCatalog catalog = LocaleCatalog.defaultCatalog();

        assertTrue(catalog.isVanityUrl("/fr/"));
        assertTrue(catalog.isVanityUrl("/en-US/"));
        assertFalse(catalog.isVanityUrl("/en-us/"));
        assertFalse(catalog.isVanityUrl("/fr"));
        assertFalse(catalog.isVanityUrl("/fr/docs/"));
    }

    @Test
    @DisplayName("Explicit catalogs keep declaration order")
    void testExplicitCatalog() {
        LocaleCatalog catalog = new LocaleCatalog(List.of("fr", "en-US", "fr"));

        assertEquals(List.of("fr", "en-US"), catalog.orderedCodes());
        assertFalse(catalog.contains("de"));
    }

    @Test
    @DisplayName("Invalid catalogs are rejected")
    void testInvalidCatalogs() {
        assertThrows(IllegalArgumentException.class, () -> new LocaleCatalog(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new LocaleCatalog(List.of(" ")));
        assertThrows(IllegalArgumentException.class, () -> new LocaleCatalog(List.of("en/US")));
        assertThrows(IllegalArgumentException.class, () -> new LocaleCatalog(List.of("en-US", "en-us")));
    }
}

package org.Aayush.redirects.testutil;

import org.Aayush.redirects.table.RedirectPair;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Helpers for building redirect tables on disk.
 */
public final class RedirectFixtures {
    public static final String HEADER = "# FROM-URL\tTO-URL";

    private RedirectFixtures() {
    }

    public static String docs(String locale, String slug) {
        return "/" + locale + "/docs/" + slug;
    }

    public static String en(String slug) {
        return docs("en-US", slug);
    }

    public static RedirectPair pair(String from, String to) {
        return RedirectPair.of(from, to);
    }

    public static Path writeTable(Path root, String localeFolder, String... rows) {
        StringBuilder content = new StringBuilder(HEADER).append('\n');
        for (String row : rows) {
            content.append(row).append('\n');
        }
        Path table = root.resolve(localeFolder).resolve("_redirects.txt");
        try {
            Files.createDirectories(table.getParent());
            Files.writeString(table, content.toString(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return table;
    }

    public static String readTable(Path root, String localeFolder) {
        try {
            return Files.readString(root.resolve(localeFolder).resolve("_redirects.txt"), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}

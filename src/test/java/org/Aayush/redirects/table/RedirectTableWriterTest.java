package org.Aayush.redirects.table;

import org.Aayush.redirects.testutil.RedirectFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;

import static org.Aayush.redirects.testutil.RedirectFixtures.en;
import static org.Aayush.redirects.testutil.RedirectFixtures.pair;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("RedirectTableWriter Contract Tests")
class RedirectTableWriterTest {

    private final RedirectTableWriter writer = new RedirectTableWriter();

    @Test
    @DisplayName("Render emits the header and one tab-separated row per pair")
    void testRender() {
        String text = RedirectTableWriter.render(List.of(
                pair(en("A"), en("C")),
                pair(en("B"), "https://example.com/")
        ));
        assertEquals("# FROM-URL\tTO-URL\n"
                + "/en-US/docs/A\t/en-US/docs/C\n"
                + "/en-US/docs/B\thttps://example.com/\n", text);
    }

    @Test
    @DisplayName("Written tables parse back to the same pairs")
    void testRoundTrip() {
        List<RedirectPair> pairs = List.of(
                pair(en("A"), en("C")),
                pair(en("Café"), "/fr/"),
                pair(en("Z"), "https://example.com/a b")
        );
        assertEquals(pairs, RedirectTableReader.parseRows(null, RedirectTableWriter.render(pairs)));
    }

    @Test
    @DisplayName("Write creates folders, replaces old content and leaves no temp files")
    void testWriteReplaces(@TempDir Path root) throws IOException {
        Path table = RedirectFixtures.writeTable(root, "en-us", en("Old") + "\t" + en("Stale"));

        writer.write(table, List.of(pair(en("A"), en("B"))));
        assertEquals("# FROM-URL\tTO-URL\n/en-US/docs/A\t/en-US/docs/B\n", Files.readString(table));

        Path fresh = root.resolve("fr").resolve(LocaleTableStore.TABLE_FILE);
        writer.write(fresh, List.of());
        assertEquals("# FROM-URL\tTO-URL\n", Files.readString(fresh));

        try (Stream<Path> files = Files.list(table.getParent())) {
            assertEquals(List.of(table.getFileName().toString()),
                    files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    @DisplayName("Rewrites keep the permissions of the replaced table")
    void testPermissionsSurviveRewrite(@TempDir Path root) throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path shared = RedirectFixtures.writeTable(root, "en-us", en("Old") + "\t" + en("Stale"));
        Path groupWritable = RedirectFixtures.writeTable(root, "fr", "/fr/docs/Old\t/fr/docs/Stale");
        Files.setPosixFilePermissions(shared, PosixFilePermissions.fromString("rw-r--r--"));
        Files.setPosixFilePermissions(groupWritable, PosixFilePermissions.fromString("rw-rw-r--"));

        writer.write(shared, List.of(pair(en("A"), en("B"))));
        writer.write(groupWritable, List.of(pair("/fr/docs/A", "/fr/docs/B")));

        assertEquals("rw-r--r--", permissions(shared));
        assertEquals("rw-rw-r--", permissions(groupWritable));
    }

    @Test
    @DisplayName("New tables are readable by everyone")
    void testNewTablePermissions(@TempDir Path root) throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path fresh = root.resolve("de").resolve(LocaleTableStore.TABLE_FILE);

        writer.write(fresh, List.of());

        assertEquals("rw-r--r--", permissions(fresh));
    }

    private static String permissions(Path file) throws IOException {
        return PosixFilePermissions.toString(Files.getPosixFilePermissions(file));
    }
}

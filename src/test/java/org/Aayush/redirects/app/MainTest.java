package org.Aayush.redirects.app;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.Aayush.redirects.testutil.RedirectFixtures.HEADER;
import static org.Aayush.redirects.testutil.RedirectFixtures.en;
import static org.Aayush.redirects.testutil.RedirectFixtures.readTable;
import static org.Aayush.redirects.testutil.RedirectFixtures.writeTable;
import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path contentRoot;

    @TempDir
    Path translatedRoot;

    @TempDir
    Path work;

    private StringWriter buffer;

    @BeforeEach
    void setUp() throws IOException {
        buffer = new StringWriter();
        Path html = contentRoot.resolve("en-us").resolve("web").resolve("html");
        Files.createDirectories(html);
        Files.writeString(html.resolve("index.html"), "<html></html>");
    }

    private int run(String... args) {
        String[] full = new String[args.length + 4];
        full[0] = "--content-root";
        full[1] = contentRoot.toString();
        full[2] = "--translated-root";
        full[3] = translatedRoot.toString();
        System.arraycopy(args, 0, full, 4, args.length);
        return Main.run(new PrintWriter(buffer, true), full);
    }

    @Test
    void testAddThenResolve() throws IOException {
        Path pairs = work.resolve("pairs.txt");
        Files.writeString(pairs, HEADER + "\n/en-US/docs/Old%20HTML\t/en-US/docs/Web/HTML\n");

        assertEquals(0, run("add", "en-US", pairs.toString()));
        assertTrue(buffer.toString().contains("Added 1 redirects to en-US"));
        assertEquals(HEADER + "\n" + en("Old HTML") + "\t" + en("Web/HTML") + "\n", readTable(contentRoot, "en-us"));

        assertEquals(0, run("resolve", "/en-us/docs/old html", "/docs/Web"));
        String output = buffer.toString();
        assertTrue(output.contains("/en-us/docs/old html\t" + en("Web/HTML")));
        assertTrue(output.contains("/docs/Web\t/en-US/docs/Web"));
    }

    @Test
    void testValidateAndLoad() {
        writeTable(contentRoot, "en-us", en("A") + "\t" + en("Web/HTML"));

        assertEquals(0, run("validate", "en-US", "--strict"));
        assertTrue(buffer.toString().contains("en-US OK"));

        assertEquals(0, run("load"));
        assertTrue(buffer.toString().contains("Loaded 1 redirects"));
    }

    @Test
    void testValidateFailsOnFlawedTable() {
        writeTable(contentRoot, "en-us", en("Z") + "\t" + en("Web/HTML"), en("A") + "\t" + en("Web/HTML"));

        assertNotEquals(0, run("validate", "en-US"));
        assertFalse(buffer.toString().contains("en-US OK"));
    }

    @Test
    void testUsageWithoutSubcommand() {
        assertEquals(0, run());
        assertTrue(buffer.toString().contains("Use subcommands"));
    }
}

package org.Aayush.redirects.app;

import org.Aayush.redirects.core.RedirectCore;
import org.Aayush.redirects.core.RedirectRuntimeConfig;
import org.Aayush.redirects.table.RedirectPair;
import org.Aayush.redirects.table.RedirectTableReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "redirects",
        mixinStandardHelpOptions = true,
        description = "Maintain and query per-locale redirect tables",
        subcommands = {
                RedirectsCommand.ResolveCommand.class,
                RedirectsCommand.AddCommand.class,
                RedirectsCommand.ValidateCommand.class,
                RedirectsCommand.LoadCommand.class
        }
)
public final class RedirectsCommand implements Runnable {

    @Option(names = {"--content-root"}, description = "en-US content root (default: $CONTENT_ROOT)")
    Path contentRoot;

    @Option(names = {"--translated-root"}, description = "Translated content root (default: $CONTENT_TRANSLATED_ROOT)")
    Path translatedRoot;

    @Option(names = {"--strict-cycles"}, defaultValue = "false", description = "Fail on redirect cycles")
    boolean strictCycles;

    private final PrintWriter out;

    public RedirectsCommand(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void run() {
        out.println("Use subcommands: resolve | add | validate | load");
        out.flush();
    }

    RedirectCore core() {
        RedirectRuntimeConfig environment = RedirectRuntimeConfig.fromEnvironment();
        RedirectRuntimeConfig config = RedirectRuntimeConfig.builder()
                .contentRoot(contentRoot != null ? contentRoot : environment.getContentRoot())
                .translatedContentRoot(translatedRoot != null ? translatedRoot : environment.getTranslatedContentRoot())
                .strictCycles(strictCycles)
                .build();
        return RedirectCore.builder().config(config).build();
    }

    void print(String line) {
        out.println(line);
        out.flush();
    }

    @Command(name = "resolve", description = "Print the final destination of each URL")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        RedirectsCommand parent;

        @Parameters(arity = "1..*", description = "URLs to resolve")
        List<String> urls;

        @Override
        public Integer call() {
            RedirectCore core = parent.core();
            for (String url : urls) {
                parent.print(url + "\t" + core.resolve(url));
            }
            return 0;
        }
    }

    @Command(name = "add", description = "Merge redirect pairs from a table-format file into a locale")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        RedirectsCommand parent;

        @Parameters(index = "0", description = "Locale code")
        String locale;

        @Parameters(index = "1", description = "File with a header line and 'from<TAB>to' rows")
        Path pairsFile;

        @Option(names = {"--fix"}, defaultValue = "false", description = "Repair the stored table and drop orphans")
        boolean fix;

        @Override
        public Integer call() throws Exception {
            String content = Files.readString(pairsFile, StandardCharsets.UTF_8);
            List<RedirectPair> pairs = new ArrayList<>();
            for (RedirectPair row : RedirectTableReader.parseRows(pairsFile, content)) {
                pairs.add(row.decoded());
            }
            parent.core().add(locale, pairs, fix);
            parent.print("Added " + pairs.size() + " redirects to " + locale);
            return 0;
        }
    }

    @Command(name = "validate", description = "Check that a locale's table is canonical")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        RedirectsCommand parent;

        @Parameters(arity = "1..*", description = "Locale codes")
        List<String> locales;

        @Option(names = {"--strict"}, defaultValue = "false", description = "Also require no orphaned redirects")
        boolean strict;

        @Override
        public Integer call() {
            RedirectCore core = parent.core();
            for (String locale : locales) {
                core.validateLocale(locale, strict);
                parent.print(locale + " OK");
            }
            return 0;
        }
    }

    @Command(name = "load", description = "Load locale tables and print the number of redirects")
    static final class LoadCommand implements Callable<Integer> {
        @ParentCommand
        RedirectsCommand parent;

        @Parameters(arity = "0..*", description = "Locale codes (default: all)")
        List<String> locales;

        @Override
        public Integer call() {
            RedirectCore core = parent.core();
            int read = locales == null || locales.isEmpty() ? core.load() : core.load(locales);
            parent.print("Loaded " + read + " redirects");
            return 0;
        }
    }
}

package org.Aayush.redirects.table;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.redirects.core.RedirectException;
import org.Aayush.redirects.validation.RedirectValidator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parser for persisted redirect tables.
 *
 * <p>Format: UTF-8 text, a header line (discarded), then one {@code from<TAB+>to} row per
 * line. See {@link LoadMode} for what each mode enforces; every surviving pair passes the
 * {@link RedirectValidator} without resolve-checking in both modes.</p>
 */
@Slf4j
public final class RedirectTableReader {
    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\t+");
    private static final Pattern LINE_SEPARATOR = Pattern.compile("\r?\n");

    private final RedirectValidator validator;

    public RedirectTableReader(RedirectValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Reads and checks one table file.
     */
    public LoadedTable read(Path file, LoadMode mode) {
        Objects.requireNonNull(file, "file");
        log.debug("Checking {}", file);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new RedirectException(RedirectException.REASON_TABLE_READ_FAILED,
                    "cannot read redirect table " + file, ex);
        }
        return parse(file, content, mode);
    }

    /**
     * Parses and checks table content.
     *
     * @param source origin used in messages, may be null.
     * @param content full table text including header.
     * @param mode strictness.
     */
    public LoadedTable parse(Path source, String content, LoadMode mode) {
        Objects.requireNonNull(mode, "mode");
        List<RedirectPair> rows = parseRows(source, content);
        List<RedirectPair> pairs = rows;
        if (mode == LoadMode.STRICT) {
            PairChecks.requireDecoded(rows);
            PairChecks.requireUniqueSources(rows);
        } else {
            pairs = PairChecks.dropDuplicateSources(PairChecks.dropEncoded(rows));
        }
        validator.validatePairs(pairs, mode == LoadMode.STRICT);
        return new LoadedTable(pairs, rows.size() - pairs.size());
    }

    /**
     * Splits table text into raw pairs without any checks.
     */
    public static List<RedirectPair> parseRows(Path source, String content) {
        Objects.requireNonNull(content, "content");
        String trimmed = content.strip();
        List<RedirectPair> rows = new ArrayList<>();
        if (trimmed.isEmpty()) {
            return rows;
        }
        String[] lines = LINE_SEPARATOR.split(trimmed, -1);
        // line 0 is the header
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            String[] fields = FIELD_SEPARATOR.split(line);
            if (fields.length != 2 || fields[0].isEmpty()) {
                throw new RedirectException(RedirectException.REASON_MALFORMED_ROW,
                        "expected 'from<TAB>to' at line " + (i + 1)
                                + (source == null ? "" : " of " + source) + ": '" + line + "'");
            }
            rows.add(new RedirectPair(fields[0], fields[1]));
        }
        return rows;
    }
}

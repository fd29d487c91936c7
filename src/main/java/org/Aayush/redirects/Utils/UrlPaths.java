package org.Aayush.redirects.Utils;

import lombok.experimental.UtilityClass;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Percent-decoding and slug helpers for documentation URLs.
 */
@UtilityClass
public final class UrlPaths {

    /**
     * Characters that URI-style decoding leaves escaped.
     */
    private static final String URI_RESERVED = ";/?:@&=+$,#";

    private static final Pattern ILLEGAL_FILENAME_CHARS = Pattern.compile("[<>\\\\|\"\\p{Cntrl}]");
    private static final Pattern TRAILING_DOTS_AND_SPACES = Pattern.compile("[. ]+$");

    /**
     * Decodes every {@code /}-separated segment of a path independently.
     * <p>
     * Escaped slashes inside one segment become literal {@code /}; {@code +} is kept as is.
     * </p>
     *
     * @param path URL path, possibly percent-encoded.
     * @return decoded path; invalid UTF-8 sequences decode to U+FFFD.
     * @throws IllegalArgumentException on malformed escapes.
     */
    public static String decodePath(String path) {
        if (path.indexOf('%') < 0) {
            return path;
        }
        String[] segments = path.split("/", -1);
        StringBuilder decoded = new StringBuilder(path.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                decoded.append('/');
            }
            decoded.append(decodeSegment(segments[i]));
        }
        return decoded.toString();
    }

    /**
     * Decodes a full URI, keeping escapes of reserved delimiters intact.
     *
     * @param uri absolute URI.
     * @return decoded URI.
     * @throws IllegalArgumentException on malformed escapes or invalid UTF-8.
     */
    public static String decodeUri(String uri) {
        return percentDecode(uri, URI_RESERVED);
    }

    /**
     * Maps a docs slug to its folder path relative to the locale folder.
     * <p>
     * Characters some file systems reject are spelled out, then the slug is lowercased and
     * each segment is sanitized.
     * </p>
     */
    public static String slugToFolder(String slug) {
        String spelled = slug
                .replace("*", "_star_")
                .replace("::", "_doublecolon_")
                .replace(":", "_colon_")
                .replace("?", "_question_")
                .toLowerCase(Locale.ROOT);
        String[] segments = spelled.split("/", -1);
        StringBuilder folder = new StringBuilder(spelled.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                folder.append('/');
            }
            folder.append(sanitizeFilename(segments[i]));
        }
        return folder.toString();
    }

    private static String sanitizeFilename(String segment) {
        String cleaned = ILLEGAL_FILENAME_CHARS.matcher(segment).replaceAll("");
        return TRAILING_DOTS_AND_SPACES.matcher(cleaned).replaceAll("");
    }

    private static String decodeSegment(String segment) {
        if (segment.indexOf('%') < 0) {
            return segment;
        }
        // URLDecoder reads '+' as a space; in a path it is literal
        return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static String percentDecode(String value, String keepEscaped) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        int length = value.length();
        while (i < length) {
            char c = value.charAt(i);
            if (c != '%') {
                flush(pending, out, value);
                out.append(c);
                i++;
                continue;
            }
            if (i + 2 >= length) {
                throw new IllegalArgumentException("malformed escape at index " + i + " in " + value);
            }
            int hi = Character.digit(value.charAt(i + 1), 16);
            int lo = Character.digit(value.charAt(i + 2), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("malformed escape at index " + i + " in " + value);
            }
            int b = (hi << 4) | lo;
            if (b < 0x80 && keepEscaped.indexOf((char) b) >= 0) {
                flush(pending, out, value);
                out.append(value, i, i + 3);
            } else {
                pending.write(b);
            }
            i += 3;
        }
        flush(pending, out, value);
        return out.toString();
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder out, String value) {
        if (pending.size() == 0) {
            return;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            out.append(decoder.decode(ByteBuffer.wrap(pending.toByteArray())));
        } catch (CharacterCodingException ex) {
            throw new IllegalArgumentException("escaped bytes are not valid UTF-8 in " + value, ex);
        }
        pending.reset();
    }
}

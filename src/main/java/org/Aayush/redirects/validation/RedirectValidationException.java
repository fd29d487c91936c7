package org.Aayush.redirects.validation;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.redirects.core.RedirectException;

/**
 * Thrown when a redirect source or target URL breaks one of the URL rules.
 *
 * <p>The offending URL is kept separately from the message so callers can report it
 * without parsing the reason-coded text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RedirectValidationException extends RedirectException {
    public static final String REASON_MALFORMED_SOURCE = "MALFORMED_SOURCE";
    public static final String REASON_MISSING_DOCS_SEGMENT = "MISSING_DOCS_SEGMENT";
    public static final String REASON_INVALID_LOCALE_PREFIX = "INVALID_LOCALE_PREFIX";
    public static final String REASON_FORBIDDEN_CHARACTER = "FORBIDDEN_CHARACTER";
    public static final String REASON_MALFORMED_LOCALE_PATH = "MALFORMED_LOCALE_PATH";
    public static final String REASON_UNKNOWN_LOCALE = "UNKNOWN_LOCALE";
    public static final String REASON_SOURCE_RESOLVES_TO_DOCUMENT = "SOURCE_RESOLVES_TO_DOCUMENT";
    public static final String REASON_ALREADY_REDIRECTED = "ALREADY_REDIRECTED";
    public static final String REASON_NON_HTTPS_TARGET = "NON_HTTPS_TARGET";
    public static final String REASON_MALFORMED_EXTERNAL_TARGET = "MALFORMED_EXTERNAL_TARGET";
    public static final String REASON_UNRESOLVABLE_TARGET = "UNRESOLVABLE_TARGET";
    public static final String REASON_MALFORMED_TARGET = "MALFORMED_TARGET";
    public static final String REASON_ENCODED_URL = "ENCODED_URL";
    public static final String REASON_DUPLICATE_SOURCE = "DUPLICATE_SOURCE";

    private final String url;

    /**
     * @param reasonCode violated rule.
     * @param url offending URL.
     * @param message descriptive message.
     */
    public RedirectValidationException(String reasonCode, String url, String message) {
        super(reasonCode, message);
        this.url = url;
    }

    /**
     * @param reasonCode violated rule.
     * @param url offending URL.
     * @param message descriptive message.
     * @param cause underlying failure.
     */
    public RedirectValidationException(String reasonCode, String url, String message, Throwable cause) {
        super(reasonCode, message, cause);
        this.url = url;
    }
}

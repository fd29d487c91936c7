package org.Aayush.redirects.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Redirect-engine contract exception with deterministic reason codes.
 */
@Getter
@Accessors(fluent = true)
public class RedirectException extends RuntimeException {
    public static final String REASON_REDIRECT_CYCLE = "REDIRECT_CYCLE";
    public static final String REASON_CONFLICTING_EDGE = "CONFLICTING_EDGE";
    public static final String REASON_MISSING_TRANSLATED_ROOT = "MISSING_TRANSLATED_ROOT";
    public static final String REASON_MISSING_CONTENT_ROOT = "MISSING_CONTENT_ROOT";
    public static final String REASON_TABLE_READ_FAILED = "TABLE_READ_FAILED";
    public static final String REASON_TABLE_WRITE_FAILED = "TABLE_WRITE_FAILED";
    public static final String REASON_MALFORMED_ROW = "MALFORMED_ROW";
    public static final String REASON_TABLE_NOT_CANONICAL = "TABLE_NOT_CANONICAL";

    private final String reasonCode;

    /**
     * Creates a reason-coded redirect failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RedirectException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded redirect failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RedirectException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

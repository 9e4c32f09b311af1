package org.selene.habitat.model;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a layout or one of its parts violates the structural model contract.
 *
 * <p>This is distinct from a failed mission rule: a rule failure is reported as data through
 * a validation result, while this exception marks input that is not a layout at all.
 * Messages are prefixed with the reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class LayoutContractException extends RuntimeException {
    public static final String REASON_FIELD_OUT_OF_RANGE = "CONTRACT_FIELD_OUT_OF_RANGE";
    public static final String REASON_FIELD_REQUIRED = "CONTRACT_FIELD_REQUIRED";
    public static final String REASON_METADATA_MISSING = "CONTRACT_METADATA_MISSING";
    public static final String REASON_UNKNOWN_LABEL = "CONTRACT_UNKNOWN_LABEL";
    public static final String REASON_MALFORMED_DOCUMENT = "CONTRACT_MALFORMED_DOCUMENT";

    private final String reasonCode;

    /**
     * Creates a reason-coded contract failure.
     *
     * @param reasonCode stable reason code.
     * @param message descriptive message.
     */
    public LayoutContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded contract failure with a cause.
     *
     * @param reasonCode stable reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public LayoutContractException(String reasonCode, String message, Throwable cause) {
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

package org.selene.habitat.model;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when caller-supplied configuration cannot be honored (crew or duration out of range,
 * invalid target volume, invalid iteration count, unusable score weights).
 *
 * <p>Configuration errors are fatal for the call that raised them and are never retried.</p>
 */
@Getter
@Accessors(fluent = true)
public final class LayoutConfigurationException extends RuntimeException {
    public static final String REASON_CREW_OUT_OF_RANGE = "CONFIG_CREW_OUT_OF_RANGE";
    public static final String REASON_DURATION_OUT_OF_RANGE = "CONFIG_DURATION_OUT_OF_RANGE";
    public static final String REASON_VOLUME_INVALID = "CONFIG_VOLUME_INVALID";
    public static final String REASON_ITERATIONS_INVALID = "CONFIG_ITERATIONS_INVALID";
    public static final String REASON_WEIGHTS_INVALID = "CONFIG_WEIGHTS_INVALID";
    public static final String REASON_MALFORMED = "CONFIG_MALFORMED";

    private final String reasonCode;

    public LayoutConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public LayoutConfigurationException(String reasonCode, String message, Throwable cause) {
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

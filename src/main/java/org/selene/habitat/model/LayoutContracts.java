package org.selene.habitat.model;

import lombok.experimental.UtilityClass;

/**
 * Shared field-level contract checks used by model constructors and the interchange codec.
 *
 * <p>Every failure is reported as a {@link LayoutContractException} whose message names the
 * offending field in interchange spelling.</p>
 */
@UtilityClass
public final class LayoutContracts {

    public static double requirePositive(double value, String field) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw outOfRange(field + " must be finite and > 0, got " + value);
        }
        return value;
    }

    public static double requireNonNegative(double value, String field) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw outOfRange(field + " must be finite and >= 0, got " + value);
        }
        return value;
    }

    public static int requireNonNegative(int value, String field) {
        if (value < 0) {
            throw outOfRange(field + " must be >= 0, got " + value);
        }
        return value;
    }

    public static int requireAtLeast(int value, int minimum, String field) {
        if (value < minimum) {
            throw outOfRange(field + " must be >= " + minimum + ", got " + value);
        }
        return value;
    }

    /**
     * Requires {@code value} in the closed unit interval {@code [0, 1]}.
     */
    public static double requireUnitInterval(double value, String field) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw outOfRange(field + " must be in [0, 1], got " + value);
        }
        return value;
    }

    /**
     * Requires {@code value} in the half-open interval {@code (0, 1]}.
     */
    public static double requireFraction(double value, String field) {
        if (!Double.isFinite(value) || value <= 0.0d || value > 1.0d) {
            throw outOfRange(field + " must be in (0, 1], got " + value);
        }
        return value;
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_FIELD_REQUIRED,
                    field + " is required"
            );
        }
        return value;
    }

    private static LayoutContractException outOfRange(String message) {
        return new LayoutContractException(LayoutContractException.REASON_FIELD_OUT_OF_RANGE, message);
    }
}

package org.selene.habitat.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of running every hard constraint against a layout.
 *
 * <p>{@code messages} holds one human-readable line per evaluated rule, success or failure.
 * {@code failedRules} holds stable rule ids in evaluation order.</p>
 */
@Value
public class ValidationResult {
    boolean passed;
    List<String> messages;
    List<String> failedRules;

    private ValidationResult(List<String> messages, List<String> failedRules) {
        this.messages = List.copyOf(messages);
        this.failedRules = List.copyOf(failedRules);
        this.passed = this.failedRules.isEmpty();
    }

    /**
     * Creates a result; it passes exactly when no rule id is listed as failed.
     */
    public static ValidationResult of(List<String> messages, List<String> failedRules) {
        return new ValidationResult(messages, failedRules);
    }

    public boolean hasFailed(String ruleId) {
        return failedRules.contains(ruleId);
    }
}

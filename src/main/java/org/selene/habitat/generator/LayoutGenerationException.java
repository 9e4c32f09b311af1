package org.selene.habitat.generator;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when the generator cannot reach a feasible layout after its single repair pass.
 *
 * <p>Carries the rule ids that were still failing. Fatal; the generator never retries.</p>
 */
@Getter
@Accessors(fluent = true)
public final class LayoutGenerationException extends RuntimeException {
    public static final String REASON_GENERATION_INFEASIBLE = "GENERATION_INFEASIBLE";

    private final String reasonCode;
    private final List<String> failedRules;

    public LayoutGenerationException(List<String> failedRules) {
        super("[" + REASON_GENERATION_INFEASIBLE + "] Initial layout generation failed: "
                + Objects.requireNonNull(failedRules, "failedRules"));
        this.reasonCode = REASON_GENERATION_INFEASIBLE;
        this.failedRules = List.copyOf(failedRules);
    }
}

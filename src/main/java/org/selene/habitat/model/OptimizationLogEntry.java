package org.selene.habitat.model;

import lombok.Value;

/**
 * One optimizer iteration as recorded in the run history.
 *
 * <p>{@code score} is the current accepted score after the iteration.</p>
 */
@Value
public class OptimizationLogEntry {
    int iteration;
    double score;
    boolean accepted;
    String reason;

    public static OptimizationLogEntry accepted(int iteration, double score, String reason) {
        return new OptimizationLogEntry(iteration, score, true, reason);
    }

    public static OptimizationLogEntry rejected(int iteration, double score, String reason) {
        return new OptimizationLogEntry(iteration, score, false, reason);
    }
}

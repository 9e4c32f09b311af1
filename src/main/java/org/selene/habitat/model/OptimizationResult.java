package org.selene.habitat.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Optimizer output: the best accepted layout, its metrics and score, and the full history.
 */
@Value
@Builder
public class OptimizationResult {
    Layout layout;
    Metrics metrics;
    double score;
    @Singular("historyEntry")
    List<OptimizationLogEntry> history;

    public long acceptedCount() {
        return history.stream().filter(OptimizationLogEntry::isAccepted).count();
    }

    public long rejectedCount() {
        return history.size() - acceptedCount();
    }
}

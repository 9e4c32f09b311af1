package org.selene.habitat.scoring;

import lombok.Value;
import lombok.experimental.Accessors;
import org.selene.habitat.model.Metrics;

/**
 * Metrics of one layout together with its weighted scalar score.
 */
@Value
@Accessors(fluent = true)
public class Evaluation {
    Metrics metrics;
    double score;

    public static Evaluation of(Metrics metrics, double score) {
        return new Evaluation(metrics, score);
    }
}

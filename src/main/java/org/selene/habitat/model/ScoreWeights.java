package org.selene.habitat.model;

import lombok.Builder;
import lombok.Value;

/**
 * Relative importance of the six scoring objectives.
 *
 * <p>Weights must be non-negative with a positive total; the scorer always works on the
 * {@link #normalized()} form whose weights sum to {@code 1.0}.</p>
 */
@Value
@Builder(toBuilder = true)
public class ScoreWeights {
    @Builder.Default
    double volumeEfficiency = 0.20d;
    @Builder.Default
    double privacy = 0.15d;
    @Builder.Default
    double transit = 0.15d;
    @Builder.Default
    double safety = 0.20d;
    @Builder.Default
    double sustainability = 0.15d;
    @Builder.Default
    double energy = 0.15d;

    public static ScoreWeights defaults() {
        return ScoreWeights.builder().build();
    }

    public double total() {
        return volumeEfficiency + privacy + transit + safety + sustainability + energy;
    }

    /**
     * Returns a copy scaled so that the six weights sum to one.
     *
     * @throws LayoutConfigurationException when a weight is negative or not finite, or the
     *                                      total is not positive.
     */
    public ScoreWeights normalized() {
        requireWeight(volumeEfficiency, "volume_efficiency");
        requireWeight(privacy, "privacy");
        requireWeight(transit, "transit");
        requireWeight(safety, "safety");
        requireWeight(sustainability, "sustainability");
        requireWeight(energy, "energy");
        double total = total();
        if (!(total > 0.0d)) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_WEIGHTS_INVALID,
                    "score weights must sum to more than zero"
            );
        }
        return ScoreWeights.builder()
                .volumeEfficiency(volumeEfficiency / total)
                .privacy(privacy / total)
                .transit(transit / total)
                .safety(safety / total)
                .sustainability(sustainability / total)
                .energy(energy / total)
                .build();
    }

    private static void requireWeight(double weight, String name) {
        if (!Double.isFinite(weight) || weight < 0.0d) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_WEIGHTS_INVALID,
                    "weight " + name + " must be finite and >= 0, got " + weight
            );
        }
    }
}

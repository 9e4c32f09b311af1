package org.selene.habitat.optimizer;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.SplittableRandom;

/**
 * Geometric cooling schedule {@code T(step) = T0 * (Tend / T0)^(step / iterations)}.
 *
 * <p>Temperature depends only on the iteration index, never on how many moves were accepted.</p>
 */
@Value
@Accessors(fluent = true)
public class AnnealingSchedule {
    static final double MIN_TEMPERATURE = 1e-6d;

    double startTemperature;
    double endTemperature;

    public static AnnealingSchedule defaults() {
        return new AnnealingSchedule(1.0d, 0.05d);
    }

    public double temperature(int step, int iterations) {
        return startTemperature * Math.pow(endTemperature / startTemperature, (double) step / iterations);
    }

    /**
     * Metropolis criterion on a maximization objective: improvements are always accepted,
     * a loss of {@code delta} with probability {@code exp(delta / T)}.
     *
     * @param delta candidate score minus current score.
     * @param temperature current temperature.
     * @param random random source; one uniform draw is taken only when {@code delta < 0}.
     */
    public boolean accept(double delta, double temperature, SplittableRandom random) {
        if (delta >= 0.0d) {
            return true;
        }
        return random.nextDouble() < Math.exp(delta / Math.max(temperature, MIN_TEMPERATURE));
    }
}

package org.selene.habitat.core;

import org.selene.habitat.generator.GeneratorConfig;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.OptimizationResult;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.scoring.Evaluation;

/**
 * Public generate / validate / evaluate / optimize contract exposed to collaborators.
 *
 * <p>Implementations report rule violations as data and throw reason-coded runtime exceptions
 * only for unusable configuration or unrecoverable generation failure.</p>
 */
public interface HabitatDesignService {
    /**
     * Builds an initial feasible layout.
     */
    Layout generate(GeneratorConfig config, ConstraintSettings settings);

    /**
     * Checks a layout against every hard constraint.
     */
    ValidationResult validate(Layout layout, ConstraintSettings settings);

    /**
     * Computes metrics and the weighted scalar score.
     */
    Evaluation evaluate(Layout layout, ConstraintSettings settings, ScoreWeights weights);

    /**
     * Runs a seeded simulated-annealing search from {@code layout}.
     */
    OptimizationResult optimize(
            Layout layout,
            int iterations,
            ConstraintSettings settings,
            ScoreWeights weights,
            long seed
    );
}

package org.selene.habitat.core;

import lombok.Builder;
import org.selene.habitat.generator.GeneratorConfig;
import org.selene.habitat.generator.LayoutGenerator;
import org.selene.habitat.generator.ZoneCatalog;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.OptimizationResult;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.optimizer.AnnealingSchedule;
import org.selene.habitat.optimizer.LayoutOptimizer;
import org.selene.habitat.scoring.Evaluation;
import org.selene.habitat.scoring.LayoutScorer;
import org.selene.habitat.validation.ConstraintValidator;

/**
 * Default {@link HabitatDesignService} wiring generator, validator, scorer and optimizer
 * around one shared stateless validator.
 *
 * <p>Holds no mutable state; concurrent calls are independent as long as each caller owns its
 * inputs.</p>
 */
public final class HabitatCore implements HabitatDesignService {
    private final ConstraintValidator validator;
    private final LayoutGenerator generator;
    private final LayoutScorer scorer;
    private final LayoutOptimizer optimizer;

    /**
     * @param zoneCatalog optional generator zone table; defaults to {@link ZoneCatalog#defaults()}.
     * @param schedule optional annealing schedule; defaults to {@link AnnealingSchedule#defaults()}.
     */
    @Builder
    public HabitatCore(ZoneCatalog zoneCatalog, AnnealingSchedule schedule) {
        this.validator = new ConstraintValidator();
        this.generator = new LayoutGenerator(zoneCatalog == null ? ZoneCatalog.defaults() : zoneCatalog, validator);
        this.scorer = new LayoutScorer(validator);
        this.optimizer = new LayoutOptimizer(validator, schedule == null ? AnnealingSchedule.defaults() : schedule);
    }

    public static HabitatCore defaults() {
        return HabitatCore.builder().build();
    }

    @Override
    public Layout generate(GeneratorConfig config, ConstraintSettings settings) {
        return generator.generate(config, settings);
    }

    @Override
    public ValidationResult validate(Layout layout, ConstraintSettings settings) {
        return validator.validate(layout, settings);
    }

    @Override
    public Evaluation evaluate(Layout layout, ConstraintSettings settings, ScoreWeights weights) {
        return scorer.evaluate(layout, settings, weights);
    }

    @Override
    public OptimizationResult optimize(
            Layout layout,
            int iterations,
            ConstraintSettings settings,
            ScoreWeights weights,
            long seed
    ) {
        return optimizer.optimize(layout, iterations, settings, weights, seed);
    }
}

package org.selene.habitat.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.LayoutConfigurationException;
import org.selene.habitat.model.OptimizationLogEntry;
import org.selene.habitat.model.OptimizationResult;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.scoring.Evaluation;
import org.selene.habitat.scoring.LayoutScorer;
import org.selene.habitat.validation.ConstraintValidator;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Simulated-annealing layout optimizer that never leaves the feasible region.
 *
 * <p>Per iteration:</p>
 * <ul>
 * <li>Draw one {@link NeighborOperator} uniformly and apply it to the current layout.</li>
 * <li>Reject infeasible candidates outright ({@code constraint_fail:<rule ids>}).</li>
 * <li>Score feasible candidates and accept by the Metropolis criterion of the
 * {@link AnnealingSchedule}; otherwise record {@code anneal_reject}.</li>
 * <li>Replace the best layout whenever an accepted candidate beats it.</li>
 * </ul>
 *
 * <p>The run always consumes its full iteration budget. Layouts are immutable, so current and
 * best never share mutable state and a rejected candidate is simply dropped. Given the same
 * inputs and random stream the history is reproduced exactly.</p>
 */
@Slf4j
public final class LayoutOptimizer {
    static final String REASON_INITIAL = "initial";
    static final String REASON_ANNEAL_REJECT = "anneal_reject";
    static final String REASON_CONSTRAINT_FAIL_PREFIX = "constraint_fail:";

    private final ConstraintValidator validator;
    private final LayoutScorer scorer;
    private final AnnealingSchedule schedule;

    public LayoutOptimizer() {
        this(new ConstraintValidator(), AnnealingSchedule.defaults());
    }

    public LayoutOptimizer(ConstraintValidator validator, AnnealingSchedule schedule) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.scorer = new LayoutScorer(validator);
        this.schedule = Objects.requireNonNull(schedule, "schedule");
    }

    /**
     * Optimizes with a random stream seeded from the layout's {@code metadata.seed}, or the
     * configured default seed when the layout records none.
     */
    public OptimizationResult optimize(Layout layout, int iterations, ConstraintSettings settings, ScoreWeights weights) {
        Objects.requireNonNull(layout, "layout");
        long seed = layout.seed().orElse(OptimizerDefaults.seed());
        return optimize(layout, iterations, settings, weights, seed);
    }

    public OptimizationResult optimize(
            Layout layout,
            int iterations,
            ConstraintSettings settings,
            ScoreWeights weights,
            long seed
    ) {
        return optimize(layout, iterations, settings, weights, new SplittableRandom(seed));
    }

    /**
     * Runs the annealing loop.
     *
     * @param layout starting layout; not modified.
     * @param iterations number of moves to attempt, {@code >= 0}.
     * @param settings hard-constraint thresholds.
     * @param weights objective weights.
     * @param random explicit random source consumed by operator choice, moves and acceptance.
     * @return best accepted layout, its metrics and score, and one history entry per iteration
     * including the initial one.
     * @throws LayoutConfigurationException when {@code iterations < 0} or weights are unusable.
     */
    public OptimizationResult optimize(
            Layout layout,
            int iterations,
            ConstraintSettings settings,
            ScoreWeights weights,
            SplittableRandom random
    ) {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(random, "random");
        if (iterations < 0) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_ITERATIONS_INVALID,
                    "iterations must be >= 0, got " + iterations
            );
        }

        Layout current = layout;
        Evaluation currentEval = scorer.evaluate(current, settings, weights);
        Layout best = current;
        Evaluation bestEval = currentEval;

        log.info("Optimizing {}: iterations={}, initial score={}",
                layout.getHabitatName(), iterations, currentEval.score());

        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder()
                .historyEntry(OptimizationLogEntry.accepted(0, currentEval.score(), REASON_INITIAL));

        for (int step = 1; step <= iterations; step++) {
            NeighborOperator operator = NeighborOperator.pick(random);
            Layout candidate = operator.apply(current, random);

            ValidationResult validation = validator.validate(candidate, settings);
            if (!validation.isPassed()) {
                result.historyEntry(OptimizationLogEntry.rejected(
                        step,
                        currentEval.score(),
                        REASON_CONSTRAINT_FAIL_PREFIX + String.join(",", validation.getFailedRules())
                ));
                continue;
            }

            Evaluation candidateEval = scorer.evaluate(candidate, settings, weights);
            double temperature = schedule.temperature(step, iterations);
            double delta = candidateEval.score() - currentEval.score();
            if (!schedule.accept(delta, temperature, random)) {
                result.historyEntry(OptimizationLogEntry.rejected(step, currentEval.score(), REASON_ANNEAL_REJECT));
                continue;
            }

            current = candidate;
            currentEval = candidateEval;
            result.historyEntry(OptimizationLogEntry.accepted(step, currentEval.score(), operator.reason()));
            if (candidateEval.score() > bestEval.score()) {
                best = candidate;
                bestEval = candidateEval;
                log.debug("New best at iteration {}: score={} via {}", step, bestEval.score(), operator.reason());
            }
        }

        OptimizationResult finished = result
                .layout(best)
                .metrics(bestEval.metrics())
                .score(bestEval.score())
                .build();
        log.info("Optimization of {} finished: best score={}, accepted={}, rejected={}",
                layout.getHabitatName(), finished.getScore(), finished.acceptedCount(), finished.rejectedCount());
        return finished;
    }
}

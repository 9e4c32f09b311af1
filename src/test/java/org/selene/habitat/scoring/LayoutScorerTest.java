package org.selene.habitat.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.LayoutConfigurationException;
import org.selene.habitat.model.Metrics;
import org.selene.habitat.model.PowerSystem;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.ZoneKind;
import org.selene.habitat.testutil.LayoutFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.selene.habitat.testutil.LayoutFixtures.editZone;
import static org.selene.habitat.testutil.LayoutFixtures.withConnections;

class LayoutScorerTest {

    private LayoutScorer scorer;
    private ConstraintSettings settings;
    private Layout baseline;

    @BeforeEach
    void setUp() {
        scorer = new LayoutScorer();
        settings = ConstraintSettings.defaults();
        baseline = LayoutFixtures.generatedBaseline();
    }

    @Test
    @DisplayName("Metrics: sub-scores of the generated baseline")
    void testBaselineMetrics() {
        Metrics metrics = scorer.evaluate(baseline, settings, ScoreWeights.defaults()).metrics();

        assertTrue(metrics.isFeasibility());
        assertEquals(baseline.netHabitableVolume(), metrics.getNhvM3(), 1e-12);
        assertEquals(baseline.nhvEfficiency(), metrics.getNhvEfficiency(), 1e-12);
        assertEquals(1.0d, metrics.getTransitDistanceScore(), 1e-12);
        assertEquals(1.0d, metrics.getSafetyRedundancyScore(), 1e-12);
        assertEquals(1.0d, metrics.getSustainabilityScore(), 1e-12);
        assertEquals(160.0d / 56.0d, metrics.getEnergyUseKwhPerPersonDay(), 1e-12);

        // Low .3, Work .65, Hygiene 1, Galley .6, Quarters 1 (capped), Exercise .65, Maintenance .3,
        // Shelter 1, Agriculture .6.
        assertEquals(6.1d / 9.0d, metrics.getPrivacyScore(), 1e-9);
    }

    @Test
    @DisplayName("Score: weighted sum of sub-scores with the volume term capped at 1.2")
    void testScoreFormula() {
        Evaluation evaluation = scorer.evaluate(baseline, settings, ScoreWeights.defaults());
        Metrics m = evaluation.metrics();

        double expected = 0.20d * Math.min(m.getNhvEfficiency() / 0.70d, 1.2d)
                + 0.15d * m.getPrivacyScore()
                + 0.15d * m.getTransitDistanceScore()
                + 0.20d * m.getSafetyRedundancyScore()
                + 0.15d * m.getSustainabilityScore()
                + 0.15d * LayoutScorer.energyFactor(m.getEnergyUseKwhPerPersonDay());
        assertEquals(expected, evaluation.score(), 1e-9);
        assertEquals(0.7d, LayoutScorer.energyFactor(m.getEnergyUseKwhPerPersonDay()), 1e-12);
    }

    @Test
    @DisplayName("Score: infeasible layouts keep their metrics but score half")
    void testInfeasiblePenalty() {
        ConstraintSettings narrow = settings.toBuilder().maxCrew(3).build();

        Evaluation feasible = scorer.evaluate(baseline, settings, ScoreWeights.defaults());
        Evaluation infeasible = scorer.evaluate(baseline, narrow, ScoreWeights.defaults());

        assertFalse(infeasible.metrics().isFeasibility());
        assertEquals(feasible.metrics().getPrivacyScore(), infeasible.metrics().getPrivacyScore());
        assertEquals(feasible.score() * 0.5d, infeasible.score(), 1e-12);
    }

    @Test
    @DisplayName("Weights: scaling all weights leaves the score unchanged")
    void testWeightsNormalized() {
        ScoreWeights doubled = ScoreWeights.builder()
                .volumeEfficiency(0.40d)
                .privacy(0.30d)
                .transit(0.30d)
                .safety(0.40d)
                .sustainability(0.30d)
                .energy(0.30d)
                .build();

        assertEquals(
                scorer.evaluate(baseline, settings, ScoreWeights.defaults()).score(),
                scorer.evaluate(baseline, settings, doubled).score(),
                1e-12
        );

        assertThrows(LayoutConfigurationException.class, () -> scorer.evaluate(
                baseline, settings, ScoreWeights.defaults().toBuilder().transit(-1.0d).build()));
    }

    @Test
    @DisplayName("Energy: default figure when autonomy is zero; factor clamps to [0, 1]")
    void testEnergyDefault() {
        Layout noAutonomy = baseline.toBuilder()
                .systems(baseline.getSystems().toBuilder().power(PowerSystem.of("Solar", 0, 160.0d)).build())
                .build();

        assertEquals(10.0d, LayoutScorer.energyPerPersonDay(noAutonomy));
        assertEquals(0.2d, LayoutScorer.energyFactor(10.0d), 1e-12);
        assertEquals(1.0d, LayoutScorer.energyFactor(0.5d));
        assertEquals(1.0d, LayoutScorer.energyFactor(0.0d));
    }

    @Test
    @DisplayName("Transit: fraction of required adjacencies with a direct edge")
    void testTransitScore() {
        Layout layout = editZone(baseline, ZoneKind.CREW_QUARTERS,
                zone -> withConnections(zone, "GalleyDining", "Exercise"));
        layout = editZone(layout, ZoneKind.HYGIENE_MEDICAL, zone -> withConnections(zone, "StormShelter"));

        assertEquals(2.0d / 3.0d, LayoutScorer.transitScore(layout, settings), 1e-12);
        assertEquals(1.0d, LayoutScorer.transitScore(layout, settings.toBuilder().adjacencyPairs(List.of()).build()));
    }

    @Test
    @DisplayName("Sustainability and safety: capped ratios")
    void testSustainabilityAndSafety() {
        Layout lean = baseline.toBuilder()
                .isruRatio(0.25d)
                .systems(baseline.getSystems().toBuilder().waterRecyclingRate(0.45d).eclssRedundancyLoops(1).build())
                .build();

        // (0.5 + 0.5) / 2
        assertEquals(0.5d, LayoutScorer.sustainabilityScore(lean, settings), 1e-12);
        // (0.5 + 1 + 1) / 3
        assertEquals(2.5d / 3.0d, LayoutScorer.safetyScore(lean, settings), 1e-12);

        Layout noShelter = LayoutFixtures.withoutZone(baseline, ZoneKind.STORM_SHELTER);
        // (1 + 0.5 + 0) / 3
        assertEquals(0.5d, LayoutScorer.safetyScore(noShelter, settings), 1e-12);
    }

    @Test
    @DisplayName("Privacy: empty layout scores zero")
    void testEmptyPrivacy() {
        assertEquals(0.0d, LayoutScorer.privacyScore(LayoutFixtures.layout()));
    }
}

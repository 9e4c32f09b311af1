package org.selene.habitat.scoring;

import org.selene.habitat.graph.ZoneGraph;
import org.selene.habitat.model.AdjacencyPair;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.Metrics;
import org.selene.habitat.model.PrivacyLevel;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;
import org.selene.habitat.validation.ConstraintValidator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-objective scorer.
 *
 * <p>Computes the metric bundle of a layout and folds it into one scalar using normalized
 * {@link ScoreWeights}. Feasibility comes from the {@link ConstraintValidator}; infeasible
 * layouts are still scored but their scalar is halved.</p>
 */
public final class LayoutScorer {
    static final double INFEASIBLE_PENALTY = 0.5d;
    static final double DEFAULT_ENERGY_KWH = 10.0d;
    static final double ENERGY_REFERENCE_KWH = 2.0d;
    static final double ISRU_REFERENCE = 0.5d;

    private static final Map<PrivacyLevel, Double> PRIVACY_WEIGHTS = new EnumMap<>(Map.of(
            PrivacyLevel.LOW, 0.3d,
            PrivacyLevel.MEDIUM, 0.6d,
            PrivacyLevel.HIGH, 1.0d
    ));
    private static final Map<ZoneKind, Double> ACOUSTIC_TARGETS = new EnumMap<>(Map.of(
            ZoneKind.CREW_QUARTERS, 0.7d,
            ZoneKind.EXERCISE, 0.6d,
            ZoneKind.WORK, 0.5d
    ));

    private final ConstraintValidator validator;

    public LayoutScorer() {
        this(new ConstraintValidator());
    }

    public LayoutScorer(ConstraintValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Computes metrics and weighted score.
     *
     * @param layout layout to score; not modified.
     * @param settings thresholds used for ratios and feasibility.
     * @param weights objective weights; normalized before use.
     * @return metrics and scalar score.
     */
    public Evaluation evaluate(Layout layout, ConstraintSettings settings, ScoreWeights weights) {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(settings, "settings");
        ScoreWeights normalized = Objects.requireNonNull(weights, "weights").normalized();

        double nhv = layout.netHabitableVolume();
        double nhvEfficiency = layout.nhvEfficiency();
        double transit = transitScore(layout, settings);
        double privacy = privacyScore(layout);
        double sustainability = sustainabilityScore(layout, settings);
        double energy = energyPerPersonDay(layout);
        double safety = safetyScore(layout, settings);
        boolean feasible = validator.validate(layout, settings).isPassed();

        Metrics metrics = Metrics.builder()
                .nhvM3(nhv)
                .nhvEfficiency(nhvEfficiency)
                .transitDistanceScore(transit)
                .privacyScore(privacy)
                .sustainabilityScore(sustainability)
                .energyUseKwhPerPersonDay(energy)
                .safetyRedundancyScore(safety)
                .feasibility(feasible)
                .build();

        double score = normalized.getVolumeEfficiency() * Math.min(nhvEfficiency / settings.getMinNhvEfficiency(), 1.2d)
                + normalized.getPrivacy() * privacy
                + normalized.getTransit() * transit
                + normalized.getSafety() * safety
                + normalized.getSustainability() * sustainability
                + normalized.getEnergy() * energyFactor(energy);
        if (!feasible) {
            score *= INFEASIBLE_PENALTY;
        }
        return Evaluation.of(metrics, score);
    }

    /**
     * Fraction of required adjacency pairs that share a direct edge; 1.0 when none are required.
     */
    static double transitScore(Layout layout, ConstraintSettings settings) {
        List<AdjacencyPair> pairs = settings.getAdjacencyPairs();
        if (pairs.isEmpty()) {
            return 1.0d;
        }
        ZoneGraph graph = ZoneGraph.of(layout);
        int satisfied = 0;
        for (AdjacencyPair pair : pairs) {
            if (graph.hasEdge(pair.first().label(), pair.second().label())) {
                satisfied++;
            }
        }
        return (double) satisfied / pairs.size();
    }

    /**
     * Mean over zones of privacy weight plus acoustic bonus, each term clamped to [0, 1].
     */
    static double privacyScore(Layout layout) {
        List<Zone> zones = layout.getZones();
        if (zones.isEmpty()) {
            return 0.0d;
        }
        double total = 0.0d;
        for (Zone zone : zones) {
            double weight = PRIVACY_WEIGHTS.get(zone.getPrivacy());
            double bonus = 0.0d;
            Double target = ACOUSTIC_TARGETS.get(zone.getKind());
            if (target != null) {
                bonus = clamp(zone.getAcousticIsolation() - target, 0.0d, 0.3d);
            }
            total += clamp(weight + bonus, 0.0d, 1.0d);
        }
        return total / zones.size();
    }

    static double sustainabilityScore(Layout layout, ConstraintSettings settings) {
        double water = Math.min(layout.getSystems().getWaterRecyclingRate() / settings.getMinWaterRecycling(), 1.2d);
        double isru = Math.min(layout.getIsruRatio() / ISRU_REFERENCE, 1.2d);
        return Math.min((water + isru) / 2.0d, 1.0d);
    }

    /**
     * Stored kWh per person-day of autonomy; {@value #DEFAULT_ENERGY_KWH} when crew or autonomy is
     * not positive.
     */
    static double energyPerPersonDay(Layout layout) {
        int crew = layout.crew();
        int autonomyDays = layout.getSystems().getPower().autonomyDays();
        if (crew <= 0 || autonomyDays <= 0) {
            return DEFAULT_ENERGY_KWH;
        }
        return layout.getSystems().getPower().storageKwh() / (crew * (double) autonomyDays);
    }

    static double energyFactor(double energyPerPersonDay) {
        return clamp(ENERGY_REFERENCE_KWH / Math.max(energyPerPersonDay, 1e-6d), 0.0d, 1.0d);
    }

    static double safetyScore(Layout layout, ConstraintSettings settings) {
        double loops = Math.min(
                (double) layout.getSystems().getEclssRedundancyLoops() / settings.getMinEclssLoops(),
                1.5d
        );
        double egress = Math.min(layout.egressZoneCount() / 2.0d, 1.0d);
        double shelter = layout.hasZone(ZoneKind.STORM_SHELTER) ? 1.0d : 0.0d;
        return Math.min((loops + egress + shelter) / 3.0d, 1.0d);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }
}

package org.selene.habitat.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreWeightsTest {

    @Test
    @DisplayName("Defaults sum to one and normalize to themselves")
    void testDefaults() {
        ScoreWeights weights = ScoreWeights.defaults();
        assertEquals(1.0d, weights.total(), 1e-12);

        ScoreWeights normalized = weights.normalized();
        assertEquals(0.20d, normalized.getVolumeEfficiency(), 1e-12);
        assertEquals(0.15d, normalized.getEnergy(), 1e-12);
    }

    @Test
    @DisplayName("Normalization rescales arbitrary positive weights to a unit total")
    void testNormalization() {
        ScoreWeights weights = ScoreWeights.builder()
                .volumeEfficiency(2.0d)
                .privacy(1.0d)
                .transit(1.0d)
                .safety(0.0d)
                .sustainability(0.0d)
                .energy(0.0d)
                .build();

        ScoreWeights normalized = weights.normalized();
        assertEquals(1.0d, normalized.total(), 1e-12);
        assertEquals(0.5d, normalized.getVolumeEfficiency(), 1e-12);
        assertEquals(0.25d, normalized.getPrivacy(), 1e-12);
        assertEquals(0.0d, normalized.getSafety());
    }

    @Test
    @DisplayName("Negative, non-finite or all-zero weights are configuration errors")
    void testInvalidWeights() {
        LayoutConfigurationException negative = assertThrows(LayoutConfigurationException.class,
                () -> ScoreWeights.defaults().toBuilder().privacy(-0.1d).build().normalized());
        assertEquals(LayoutConfigurationException.REASON_WEIGHTS_INVALID, negative.reasonCode());

        assertThrows(LayoutConfigurationException.class,
                () -> ScoreWeights.defaults().toBuilder().energy(Double.POSITIVE_INFINITY).build().normalized());

        ScoreWeights zero = ScoreWeights.builder()
                .volumeEfficiency(0.0d)
                .privacy(0.0d)
                .transit(0.0d)
                .safety(0.0d)
                .sustainability(0.0d)
                .energy(0.0d)
                .build();
        LayoutConfigurationException allZero = assertThrows(LayoutConfigurationException.class, zero::normalized);
        assertEquals(LayoutConfigurationException.REASON_WEIGHTS_INVALID, allZero.reasonCode());
    }

    @Test
    @DisplayName("Constraint settings defaults carry the baseline mission thresholds")
    void testConstraintDefaults() {
        ConstraintSettings settings = ConstraintSettings.defaults();

        assertEquals(2, settings.getMinCrew());
        assertEquals(4, settings.getMaxCrew());
        assertEquals(25.0d, settings.getMinNhvPerPerson());
        assertEquals(8, settings.getRequiredZones().size());
        assertFalse(settings.getRequiredZones().contains(ZoneKind.AGRICULTURE));
        assertEquals(3, settings.getAdjacencyPairs().size());
        assertEquals(3, settings.getMaxStormShelterHops());
    }
}

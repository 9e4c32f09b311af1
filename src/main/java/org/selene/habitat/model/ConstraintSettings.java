package org.selene.habitat.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Mission thresholds consumed by the constraint validator, scorer and generator.
 *
 * <p>Pure configuration; {@link #defaults()} carries the baseline four-person mission limits.</p>
 */
@Value
@Builder(toBuilder = true)
public class ConstraintSettings {
    @Builder.Default
    int minCrew = 2;
    @Builder.Default
    int maxCrew = 4;
    @Builder.Default
    int minDurationDays = 30;
    @Builder.Default
    int maxDurationDays = 180;
    /** Minimum net habitable volume per crew member, m³. */
    @Builder.Default
    double minNhvPerPerson = 25.0d;
    @Builder.Default
    double minNhvEfficiency = 0.70d;
    @Builder.Default
    double minShieldGCm2 = 5.0d;
    @Builder.Default
    int minEclssLoops = 2;
    @Builder.Default
    double minWaterRecycling = 0.90d;
    @Builder.Default
    int minPowerAutonomyDays = 14;
    /** Minimum acoustic isolation for crew quarters. */
    @Builder.Default
    double minPrivacyQuarters = 0.7d;
    @Builder.Default
    List<ZoneKind> requiredZones = List.of(
            ZoneKind.AIRLOCK,
            ZoneKind.WORK,
            ZoneKind.HYGIENE_MEDICAL,
            ZoneKind.GALLEY_DINING,
            ZoneKind.CREW_QUARTERS,
            ZoneKind.EXERCISE,
            ZoneKind.MAINTENANCE_STORAGE,
            ZoneKind.STORM_SHELTER
    );
    @Builder.Default
    List<AdjacencyPair> adjacencyPairs = List.of(
            AdjacencyPair.of(ZoneKind.AIRLOCK, ZoneKind.WORK),
            AdjacencyPair.of(ZoneKind.CREW_QUARTERS, ZoneKind.HYGIENE_MEDICAL),
            AdjacencyPair.of(ZoneKind.CREW_QUARTERS, ZoneKind.GALLEY_DINING)
    );
    @Builder.Default
    int maxStormShelterHops = 3;

    /**
     * Returns the baseline mission thresholds.
     */
    public static ConstraintSettings defaults() {
        return ConstraintSettings.builder().build();
    }
}

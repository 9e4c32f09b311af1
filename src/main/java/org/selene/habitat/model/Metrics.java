package org.selene.habitat.model;

import lombok.Builder;
import lombok.Value;

/**
 * Computed performance indicators for one layout.
 */
@Value
@Builder
public class Metrics {
    /** Net habitable volume, m³. */
    double nhvM3;
    double nhvEfficiency;
    /** Fraction of required adjacencies satisfied by a direct connection. */
    double transitDistanceScore;
    double privacyScore;
    double sustainabilityScore;
    /** Stored energy per person-day of autonomy, kWh; lower is better. */
    double energyUseKwhPerPersonDay;
    double safetyRedundancyScore;
    /** Whether every hard constraint passed. */
    boolean feasibility;
}

package org.selene.habitat.model;

import lombok.Builder;
import lombok.Value;

/**
 * Habitat-wide subsystem summary.
 */
@Value
public class Systems {
    /** Independent parallel life-support loops, always {@code >= 1}. */
    int eclssRedundancyLoops;
    /** Fraction of water recovered, in {@code [0, 1]}. */
    double waterRecyclingRate;
    PowerSystem power;
    ThermalSystem thermal;
    CommsSystem comms;
    DustMitigation dustMitigation;

    @Builder(toBuilder = true)
    private Systems(
            int eclssRedundancyLoops,
            double waterRecyclingRate,
            PowerSystem power,
            ThermalSystem thermal,
            CommsSystem comms,
            DustMitigation dustMitigation
    ) {
        this.eclssRedundancyLoops = LayoutContracts.requireAtLeast(
                eclssRedundancyLoops,
                1,
                "systems.eclss_redundancy_loops"
        );
        this.waterRecyclingRate = LayoutContracts.requireUnitInterval(
                waterRecyclingRate,
                "systems.water_recycling_rate"
        );
        this.power = LayoutContracts.requirePresent(power, "systems.power");
        this.thermal = LayoutContracts.requirePresent(thermal, "systems.thermal");
        this.comms = LayoutContracts.requirePresent(comms, "systems.comms");
        this.dustMitigation = LayoutContracts.requirePresent(dustMitigation, "systems.dust_mitigation");
    }
}

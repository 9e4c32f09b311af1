package org.selene.habitat.generator;

import lombok.Builder;
import lombok.Value;
import org.selene.habitat.model.HabitatType;

/**
 * Input parameters for initial layout generation.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {
    @Builder.Default
    String habitatName = "Helios-Init";
    @Builder.Default
    int crew = 4;
    @Builder.Default
    int durationDays = 90;
    @Builder.Default
    HabitatType habitatType = HabitatType.INFLATABLE;
    /** Target total pressurized volume, m³. */
    @Builder.Default
    double pressurizedVolumeM3 = 160.0d;
    /** Requested ISRU ratio; the generator clamps it into {@code [0.5, 1.0]}. */
    @Builder.Default
    double targetIsruRatio = 0.6d;
    @Builder.Default
    int dockingPorts = 2;
    /** Seed of the jitter stream. */
    @Builder.Default
    long seed = 42L;

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}

package org.selene.habitat.model;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thermal control summary with the external temperature envelope it is rated for.
 */
@Value
@Accessors(fluent = true)
public class ThermalSystem {
    String control;
    double minTemperatureC;
    double maxTemperatureC;

    private ThermalSystem(String control, double minTemperatureC, double maxTemperatureC) {
        if (minTemperatureC > maxTemperatureC) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_FIELD_OUT_OF_RANGE,
                    "thermal.range_c lower bound " + minTemperatureC + " exceeds upper bound " + maxTemperatureC
            );
        }
        this.control = Objects.requireNonNull(control, "control");
        this.minTemperatureC = minTemperatureC;
        this.maxTemperatureC = maxTemperatureC;
    }

    public static ThermalSystem of(String control, double minTemperatureC, double maxTemperatureC) {
        return new ThermalSystem(control, minTemperatureC, maxTemperatureC);
    }
}

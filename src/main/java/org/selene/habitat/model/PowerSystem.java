package org.selene.habitat.model;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Habitat power subsystem: generation source, storage capacity and lunar-night autonomy.
 */
@Value
@Accessors(fluent = true)
public class PowerSystem {
    /** Generation source description, for example {@code Solar+Battery}. */
    String source;
    /** Days the habitat can run on storage alone. */
    int autonomyDays;
    /** Usable energy storage in kWh. */
    double storageKwh;

    private PowerSystem(String source, int autonomyDays, double storageKwh) {
        if (autonomyDays < 0) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_FIELD_OUT_OF_RANGE,
                    "power.autonomy_days must be >= 0, got " + autonomyDays
            );
        }
        if (!Double.isFinite(storageKwh) || storageKwh < 0.0d) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_FIELD_OUT_OF_RANGE,
                    "power.storage_kwh must be finite and >= 0, got " + storageKwh
            );
        }
        this.source = Objects.requireNonNull(source, "source");
        this.autonomyDays = autonomyDays;
        this.storageKwh = storageKwh;
    }

    public static PowerSystem of(String source, int autonomyDays, double storageKwh) {
        return new PowerSystem(source, autonomyDays, storageKwh);
    }

    public PowerSystem withAutonomyDays(int days) {
        return new PowerSystem(source, days, storageKwh);
    }

    public PowerSystem withStorageKwh(double kwh) {
        return new PowerSystem(source, autonomyDays, kwh);
    }
}

package org.selene.habitat.optimizer;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.PowerSystem;
import org.selene.habitat.model.Systems;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;

/**
 * Small randomized moves the optimizer applies to a layout.
 *
 * <p>Every operator returns a new layout and leaves its input untouched. An operator that has
 * nothing to act on (too few eligible zones) returns the input unchanged.</p>
 */
@Getter
@Accessors(fluent = true)
public enum NeighborOperator {
    /**
     * Moves 2-6% of one zone's volume to another, never touching Airlock or StormShelter.
     * The pressurized volume is recomputed from the new zone sum.
     */
    ADJUST_ZONE_VOLUME("adjust_zone_volume") {
        @Override
        public Layout apply(Layout layout, SplittableRandom random) {
            List<Zone> zones = layout.getZones();
            List<Integer> adjustable = new ArrayList<>(zones.size());
            for (int i = 0; i < zones.size(); i++) {
                if (!FIXED_VOLUME_ZONES.contains(zones.get(i).getKind())) {
                    adjustable.add(i);
                }
            }
            if (adjustable.size() < 2) {
                return layout;
            }
            int donorSlot = random.nextInt(adjustable.size());
            int receiverSlot = random.nextInt(adjustable.size() - 1);
            if (receiverSlot >= donorSlot) {
                receiverSlot++;
            }
            int donorIndex = adjustable.get(donorSlot);
            int receiverIndex = adjustable.get(receiverSlot);

            Zone donor = zones.get(donorIndex);
            Zone receiver = zones.get(receiverIndex);
            double transfer = donor.getVolumeM3() * random.nextDouble(0.02d, 0.06d);

            List<Zone> updated = new ArrayList<>(zones);
            updated.set(donorIndex, donor.withVolumeM3(Math.max(donor.getVolumeM3() - transfer, MIN_ZONE_VOLUME_M3)));
            updated.set(receiverIndex, receiver.withVolumeM3(receiver.getVolumeM3() + transfer));
            return layout.withZonesResummed(updated);
        }
    },

    /**
     * Nudges water recycling, power autonomy and energy storage within their operating bands.
     */
    TUNE_SYSTEMS("tune_systems") {
        @Override
        public Layout apply(Layout layout, SplittableRandom random) {
            Systems systems = layout.getSystems();
            double water = clamp(systems.getWaterRecyclingRate() + random.nextDouble(-0.02d, 0.03d), 0.90d, 0.99d);
            PowerSystem power = systems.getPower();
            int autonomy = Math.max(MIN_AUTONOMY_DAYS, power.autonomyDays() + random.nextInt(-1, 3));
            double storage = Math.max(MIN_STORAGE_KWH, power.storageKwh() + random.nextDouble(-10.0d, 15.0d));
            return layout.toBuilder()
                    .systems(systems.toBuilder()
                            .waterRecyclingRate(water)
                            .power(power.withAutonomyDays(autonomy).withStorageKwh(storage))
                            .build())
                    .build();
        }
    },

    ADJUST_ISRU("adjust_isru") {
        @Override
        public Layout apply(Layout layout, SplittableRandom random) {
            double isru = clamp(layout.getIsruRatio() + random.nextDouble(-0.05d, 0.08d), 0.4d, 1.0d);
            return layout.toBuilder().isruRatio(isru).build();
        }
    },

    /**
     * Retunes the acoustic isolation of one shared-use zone (Work, Exercise or GalleyDining).
     */
    ADJUST_PRIVACY("adjust_privacy") {
        @Override
        public Layout apply(Layout layout, SplittableRandom random) {
            List<Zone> zones = layout.getZones();
            List<Integer> targets = new ArrayList<>(3);
            for (int i = 0; i < zones.size(); i++) {
                if (ACOUSTIC_TUNABLE_ZONES.contains(zones.get(i).getKind())) {
                    targets.add(i);
                }
            }
            if (targets.isEmpty()) {
                return layout;
            }
            int index = targets.get(random.nextInt(targets.size()));
            Zone zone = zones.get(index);
            double isolation = clamp(zone.getAcousticIsolation() + random.nextDouble(-0.05d, 0.1d), 0.3d, 1.0d);

            List<Zone> updated = new ArrayList<>(zones);
            updated.set(index, zone.withAcousticIsolation(isolation));
            return layout.toBuilder().clearZones().zones(updated).build();
        }
    };

    static final double MIN_ZONE_VOLUME_M3 = 5.0d;
    static final int MIN_AUTONOMY_DAYS = 14;
    static final double MIN_STORAGE_KWH = 120.0d;

    private static final Set<ZoneKind> FIXED_VOLUME_ZONES = EnumSet.of(ZoneKind.AIRLOCK, ZoneKind.STORM_SHELTER);
    private static final Set<ZoneKind> ACOUSTIC_TUNABLE_ZONES =
            EnumSet.of(ZoneKind.WORK, ZoneKind.EXERCISE, ZoneKind.GALLEY_DINING);

    /** Name recorded as the reason of an accepted move. */
    private final String reason;

    NeighborOperator(String reason) {
        this.reason = reason;
    }

    /**
     * Applies the move.
     *
     * @param layout current layout; not modified.
     * @param random explicit random source.
     * @return candidate layout.
     */
    public abstract Layout apply(Layout layout, SplittableRandom random);

    /**
     * Draws one operator uniformly.
     */
    public static NeighborOperator pick(SplittableRandom random) {
        NeighborOperator[] operators = values();
        return operators[random.nextInt(operators.length)];
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }
}

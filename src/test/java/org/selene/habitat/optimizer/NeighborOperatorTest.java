package org.selene.habitat.optimizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.Systems;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;
import org.selene.habitat.testutil.LayoutFixtures;

import java.util.EnumSet;
import java.util.Set;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class NeighborOperatorTest {

    private static final int ROUNDS = 200;

    @Test
    @DisplayName("Volume move: keeps airlock and shelter fixed and the zone sum equal to the pressurized volume")
    void testAdjustZoneVolume() {
        Layout layout = LayoutFixtures.generatedBaseline();
        SplittableRandom random = new SplittableRandom(11L);
        double airlock = layout.zone(ZoneKind.AIRLOCK).orElseThrow().getVolumeM3();
        double shelter = layout.zone(ZoneKind.STORM_SHELTER).orElseThrow().getVolumeM3();

        for (int i = 0; i < ROUNDS; i++) {
            Layout next = NeighborOperator.ADJUST_ZONE_VOLUME.apply(layout, random);
            assertNotSame(layout, next);
            assertEquals(next.zoneVolumeSum(), next.getPressurizedVolumeM3(), 1e-9);
            assertEquals(airlock, next.zone(ZoneKind.AIRLOCK).orElseThrow().getVolumeM3());
            assertEquals(shelter, next.zone(ZoneKind.STORM_SHELTER).orElseThrow().getVolumeM3());
            for (Zone zone : next.getZones()) {
                assertTrue(zone.getVolumeM3() >= 5.0d, zone.getName());
            }
            layout = next;
        }
    }

    @Test
    @DisplayName("Volume move: too few adjustable zones returns the input")
    void testAdjustZoneVolumeNoop() {
        Layout layout = LayoutFixtures.layout(
                LayoutFixtures.zone(ZoneKind.AIRLOCK, 10.0d, "Work"),
                LayoutFixtures.zone(ZoneKind.WORK, 20.0d),
                LayoutFixtures.zone(ZoneKind.STORM_SHELTER, 10.0d, "Work")
        );
        assertSame(layout, NeighborOperator.ADJUST_ZONE_VOLUME.apply(layout, new SplittableRandom(1L)));
    }

    @Test
    @DisplayName("Systems move: water, autonomy and storage stay inside their bands")
    void testTuneSystems() {
        Layout layout = LayoutFixtures.generatedBaseline();
        SplittableRandom random = new SplittableRandom(5L);

        for (int i = 0; i < ROUNDS; i++) {
            layout = NeighborOperator.TUNE_SYSTEMS.apply(layout, random);
            Systems systems = layout.getSystems();
            assertTrue(systems.getWaterRecyclingRate() >= 0.90d && systems.getWaterRecyclingRate() <= 0.99d);
            assertTrue(systems.getPower().autonomyDays() >= 14);
            assertTrue(systems.getPower().storageKwh() >= 120.0d);
        }
    }

    @Test
    @DisplayName("ISRU move: ratio stays in [0.4, 1.0]")
    void testAdjustIsru() {
        Layout layout = LayoutFixtures.generatedBaseline();
        SplittableRandom random = new SplittableRandom(8L);

        for (int i = 0; i < ROUNDS; i++) {
            layout = NeighborOperator.ADJUST_ISRU.apply(layout, random);
            assertTrue(layout.getIsruRatio() >= 0.4d && layout.getIsruRatio() <= 1.0d);
        }
    }

    @Test
    @DisplayName("Privacy move: only shared-use zones change, within [0.3, 1.0]")
    void testAdjustPrivacy() {
        Layout original = LayoutFixtures.generatedBaseline();
        Layout layout = original;
        SplittableRandom random = new SplittableRandom(13L);
        Set<ZoneKind> tunable = EnumSet.of(ZoneKind.WORK, ZoneKind.EXERCISE, ZoneKind.GALLEY_DINING);

        for (int i = 0; i < ROUNDS; i++) {
            layout = NeighborOperator.ADJUST_PRIVACY.apply(layout, random);
        }
        for (Zone zone : layout.getZones()) {
            Zone before = original.zone(zone.getKind()).orElseThrow();
            if (tunable.contains(zone.getKind())) {
                assertTrue(zone.getAcousticIsolation() >= 0.3d && zone.getAcousticIsolation() <= 1.0d);
            } else {
                assertEquals(before, zone);
            }
        }
        assertEquals(original.getPressurizedVolumeM3(), layout.getPressurizedVolumeM3());
    }

    @Test
    @DisplayName("Reasons: history names of the four moves")
    void testReasons() {
        assertEquals("adjust_zone_volume", NeighborOperator.ADJUST_ZONE_VOLUME.reason());
        assertEquals("tune_systems", NeighborOperator.TUNE_SYSTEMS.reason());
        assertEquals("adjust_isru", NeighborOperator.ADJUST_ISRU.reason());
        assertEquals("adjust_privacy", NeighborOperator.ADJUST_PRIVACY.reason());
    }

    @Test
    @DisplayName("Schedule: geometric cooling from 1.0 to 0.05")
    void testAnnealingTemperature() {
        AnnealingSchedule schedule = AnnealingSchedule.defaults();
        assertEquals(1.0d, schedule.temperature(0, 100), 1e-12);
        assertEquals(0.05d, schedule.temperature(100, 100), 1e-12);
        assertEquals(Math.sqrt(0.05d), schedule.temperature(50, 100), 1e-12);
    }

    @Test
    @DisplayName("Schedule: improvements accepted without a draw; steep losses rejected")
    void testAnnealingAcceptance() {
        AnnealingSchedule schedule = AnnealingSchedule.defaults();
        SplittableRandom used = new SplittableRandom(4L);
        SplittableRandom untouched = new SplittableRandom(4L);

        assertTrue(schedule.accept(0.1d, 0.5d, used));
        assertTrue(schedule.accept(0.0d, 0.5d, used));
        assertEquals(untouched.nextLong(), used.nextLong());

        assertFalse(schedule.accept(-1000.0d, 0.05d, new SplittableRandom(4L)));
        assertFalse(schedule.accept(-1.0d, 0.0d, new SplittableRandom(4L)));
    }
}

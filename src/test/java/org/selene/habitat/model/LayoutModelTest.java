package org.selene.habitat.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.selene.habitat.testutil.LayoutFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutModelTest {

    @Test
    @DisplayName("Labels: every zone kind resolves from its interchange label")
    void testZoneKindLabels() {
        for (ZoneKind kind : ZoneKind.values()) {
            assertSame(kind, ZoneKind.fromLabel(kind.label()));
        }
        assertEquals("HygieneMedical", ZoneKind.HYGIENE_MEDICAL.label());
        assertEquals("RegolithHybrid", HabitatType.REGOLITH_HYBRID.toString());
        assertSame(PrivacyLevel.HIGH, PrivacyLevel.fromLabel("High"));
        assertSame(LightingProfile.ADAPTIVE, LightingProfile.fromLabel("Adaptive"));
    }

    @Test
    @DisplayName("Labels: unknown label is a contract failure")
    void testUnknownLabel() {
        LayoutContractException ex = assertThrows(LayoutContractException.class, () -> ZoneKind.fromLabel("Bridge"));
        assertEquals(LayoutContractException.REASON_UNKNOWN_LABEL, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + LayoutContractException.REASON_UNKNOWN_LABEL + "]"));

        // Labels are case-sensitive.
        assertThrows(LayoutContractException.class, () -> ZoneKind.fromLabel("airlock"));
    }

    @Test
    @DisplayName("Zone contract: volume, usable ratio and acoustic isolation bounds")
    void testZoneContract() {
        Zone valid = LayoutFixtures.zone(ZoneKind.WORK, 20.0d);

        LayoutContractException volume = assertThrows(LayoutContractException.class,
                () -> valid.toBuilder().volumeM3(0.0d).build());
        assertEquals(LayoutContractException.REASON_FIELD_OUT_OF_RANGE, volume.reasonCode());
        assertTrue(volume.getMessage().contains("Work.volume_m3"));

        assertThrows(LayoutContractException.class, () -> valid.toBuilder().usableRatio(0.0d).build());
        assertThrows(LayoutContractException.class, () -> valid.toBuilder().usableRatio(1.01d).build());
        assertThrows(LayoutContractException.class, () -> valid.toBuilder().acousticIsolation(-0.1d).build());
        assertThrows(LayoutContractException.class, () -> valid.toBuilder().volumeM3(Double.NaN).build());

        LayoutContractException privacy = assertThrows(LayoutContractException.class,
                () -> valid.toBuilder().privacy(null).build());
        assertEquals(LayoutContractException.REASON_FIELD_REQUIRED, privacy.reasonCode());

        // Upper bound of the usable ratio is inclusive.
        assertEquals(1.0d, valid.toBuilder().usableRatio(1.0d).build().getUsableRatio());
    }

    @Test
    @DisplayName("Zone: net habitable volume counts pressurized zones only")
    void testZoneNetHabitableVolume() {
        Zone zone = LayoutFixtures.zone(ZoneKind.WORK, 20.0d);
        assertEquals(16.0d, zone.netHabitableVolume(), 1e-12);
        assertEquals(0.0d, zone.toBuilder().pressurized(false).build().netHabitableVolume());
        assertEquals("Work", zone.getName());
    }

    @Test
    @DisplayName("Systems contract: loops, recycling rate and subsystem invariants")
    void testSystemsContract() {
        Systems systems = LayoutFixtures.baselineSystems();

        assertThrows(LayoutContractException.class, () -> systems.toBuilder().eclssRedundancyLoops(0).build());
        assertThrows(LayoutContractException.class, () -> systems.toBuilder().waterRecyclingRate(1.2d).build());
        assertThrows(LayoutContractException.class, () -> systems.toBuilder().power(null).build());
        assertThrows(LayoutContractException.class, () -> PowerSystem.of("Solar", -1, 10.0d));
        assertThrows(LayoutContractException.class, () -> PowerSystem.of("Solar", 14, -5.0d));
        assertThrows(LayoutContractException.class, () -> ThermalSystem.of("heat-pump", 50.0d, -50.0d));

        assertTrue(DustMitigation.of(true, true, false).isComplete());
        assertFalse(DustMitigation.of(true, false, true).isComplete());
        assertFalse(DustMitigation.of(false, true, true).isComplete());

        PowerSystem power = PowerSystem.of("Solar+Battery", 14, 160.0d);
        assertEquals(16, power.withAutonomyDays(16).autonomyDays());
        assertEquals(14, power.autonomyDays());
        assertEquals(130.0d, power.withStorageKwh(130.0d).storageKwh());
    }

    @Test
    @DisplayName("Layout contract: metadata must carry numeric crew and duration")
    void testLayoutMetadataContract() {
        Layout layout = LayoutFixtures.fiveZoneTree();

        LayoutContractException missing = assertThrows(LayoutContractException.class, () -> Layout.builder()
                .habitatName("NoCrew")
                .habitatType(HabitatType.RIGID)
                .pressurizedVolumeM3(100.0d)
                .systems(LayoutFixtures.baselineSystems())
                .shieldEquivalentGCm2(6.0d)
                .isruRatio(0.5d)
                .metadataEntry(Layout.META_DURATION_DAYS, 90)
                .build());
        assertEquals(LayoutContractException.REASON_METADATA_MISSING, missing.reasonCode());

        LayoutContractException textual = assertThrows(LayoutContractException.class,
                () -> layout.toBuilder().metadataEntry(Layout.META_CREW, "four").build());
        assertEquals(LayoutContractException.REASON_METADATA_MISSING, textual.reasonCode());

        assertThrows(LayoutContractException.class,
                () -> layout.toBuilder().metadataEntry("tags", List.of("a")).build());
    }

    @Test
    @DisplayName("Layout contract: scalar bounds on volume, shielding, ISRU and docking ports")
    void testLayoutScalarContract() {
        Layout layout = LayoutFixtures.fiveZoneTree();

        assertThrows(LayoutContractException.class, () -> layout.toBuilder().pressurizedVolumeM3(0.0d).build());
        assertThrows(LayoutContractException.class, () -> layout.toBuilder().shieldEquivalentGCm2(-1.0d).build());
        assertThrows(LayoutContractException.class, () -> layout.toBuilder().isruRatio(1.5d).build());
        assertThrows(LayoutContractException.class, () -> layout.toBuilder().dockingPorts(-1).build());
        assertThrows(LayoutContractException.class, () -> layout.toBuilder().habitatName(null).build());
    }

    @Test
    @DisplayName("Layout metadata: integral numbers become Long, fractional become Double")
    void testMetadataNormalization() {
        Layout layout = LayoutFixtures.fiveZoneTree().toBuilder()
                .metadataEntry("seed", 7)
                .metadataEntry("margin", 1.5f)
                .metadataEntry("note", "fixture")
                .build();

        assertEquals(7L, layout.getMetadata().get("seed"));
        assertEquals(1.5d, layout.getMetadata().get("margin"));
        assertEquals("fixture", layout.getMetadata().get("note"));
        assertEquals(4, layout.crew());
        assertEquals(90, layout.durationDays());
        assertEquals(7L, layout.seed().getAsLong());
        assertTrue(LayoutFixtures.fiveZoneTree().seed().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> layout.getMetadata().put("x", 1L));
    }

    @Test
    @DisplayName("Layout: derived volumes and zone lookups")
    void testDerivedVolumes() {
        Layout layout = LayoutFixtures.fiveZoneTree();

        assertEquals(107.0d, layout.zoneVolumeSum(), 1e-9);
        assertEquals(107.0d, layout.getPressurizedVolumeM3(), 1e-9);
        assertEquals(85.6d, layout.netHabitableVolume(), 1e-9);
        assertEquals(0.8d, layout.nhvEfficiency(), 1e-9);
        assertEquals(2, layout.egressZoneCount());
        assertTrue(layout.hasZone(ZoneKind.STORM_SHELTER));
        assertFalse(layout.hasZone(ZoneKind.AGRICULTURE));
        assertEquals(40.0d, layout.zone(ZoneKind.CREW_QUARTERS).orElseThrow().getVolumeM3());
    }

    @Test
    @DisplayName("Layout: zone replacement recomputes pressurized volume and leaves the source intact")
    void testWithZonesResummed() {
        Layout layout = LayoutFixtures.fiveZoneTree();
        Layout shrunk = LayoutFixtures.withoutZone(layout, ZoneKind.HYGIENE_MEDICAL);

        assertEquals(4, shrunk.getZones().size());
        assertEquals(92.0d, shrunk.getPressurizedVolumeM3(), 1e-9);
        assertEquals(5, layout.getZones().size());
        assertEquals(107.0d, layout.getPressurizedVolumeM3(), 1e-9);
        assertThrows(UnsupportedOperationException.class, () -> layout.getZones().clear());
    }

    @Test
    @DisplayName("ValidationResult: passes exactly when no rule failed")
    void testValidationResult() {
        ValidationResult passed = ValidationResult.of(List.of("ok"), List.of());
        ValidationResult failed = ValidationResult.of(List.of("bad"), List.of("crew_range"));

        assertTrue(passed.isPassed());
        assertFalse(failed.isPassed());
        assertTrue(failed.hasFailed("crew_range"));
        assertFalse(failed.hasFailed("duration_range"));
    }

    @Test
    @DisplayName("AdjacencyPair: rule id template uses both labels")
    void testAdjacencyRuleId() {
        assertEquals("adjacency_Airlock_Work", AdjacencyPair.of(ZoneKind.AIRLOCK, ZoneKind.WORK).ruleId());
        assertEquals("adjacency_CrewQuarters_GalleyDining",
                AdjacencyPair.of(ZoneKind.CREW_QUARTERS, ZoneKind.GALLEY_DINING).ruleId());
        assertTrue(AdjacencyPair.of(ZoneKind.WORK, ZoneKind.EXERCISE).ruleId().startsWith(AdjacencyPair.RULE_ID_PREFIX));
    }

    @Test
    @DisplayName("Zone contract: connection names are trimmed at construction")
    void testConnectionsTrimmed() {
        Zone work = LayoutFixtures.zone(ZoneKind.WORK, 20.0d).toBuilder()
                .clearConnections()
                .connection(" Airlock")
                .connection("GalleyDining ")
                .build();

        assertEquals(List.of("Airlock", "GalleyDining"), work.getConnections());
        assertThrows(UnsupportedOperationException.class, () -> work.getConnections().add("Exercise"));

        Layout layout = LayoutFixtures.editZone(LayoutFixtures.generatedBaseline(), ZoneKind.WORK,
                zone -> LayoutFixtures.withConnections(zone, " Airlock", "GalleyDining", "Exercise", "MaintenanceStorage"));
        assertEquals("Airlock", layout.zone(ZoneKind.WORK).orElseThrow().getConnections().get(0));
    }
}

package org.selene.habitat.testutil;

import org.selene.habitat.generator.GeneratorConfig;
import org.selene.habitat.generator.LayoutGenerator;
import org.selene.habitat.model.CommsSystem;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.DustMitigation;
import org.selene.habitat.model.HabitatType;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.LightingProfile;
import org.selene.habitat.model.PowerSystem;
import org.selene.habitat.model.PrivacyLevel;
import org.selene.habitat.model.Systems;
import org.selene.habitat.model.ThermalSystem;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Shared test fixture factory for layout tests.
 */
public final class LayoutFixtures {

    private LayoutFixtures() {
    }

    /**
     * Feasible nine-zone layout from the default generator config.
     */
    public static Layout generatedBaseline() {
        return new LayoutGenerator().generate(GeneratorConfig.defaults(), ConstraintSettings.defaults());
    }

    public static Systems baselineSystems() {
        return Systems.builder()
                .eclssRedundancyLoops(2)
                .waterRecyclingRate(0.92d)
                .power(PowerSystem.of("Solar+Battery", 14, 160.0d))
                .thermal(ThermalSystem.of("heat-pump", -173.0d, 127.0d))
                .comms(CommsSystem.of(true, "HALO-link"))
                .dustMitigation(DustMitigation.of(true, true, true))
                .build();
    }

    public static Zone zone(ZoneKind kind, double volumeM3, String... connections) {
        return Zone.builder()
                .kind(kind)
                .volumeM3(volumeM3)
                .usableRatio(0.8d)
                .privacy(kind == ZoneKind.CREW_QUARTERS ? PrivacyLevel.HIGH : PrivacyLevel.MEDIUM)
                .connections(List.of(connections))
                .acousticIsolation(kind == ZoneKind.CREW_QUARTERS ? 0.8d : 0.5d)
                .lighting(LightingProfile.NEUTRAL_4000K)
                .pressurized(true)
                .egress(kind == ZoneKind.AIRLOCK || kind == ZoneKind.STORM_SHELTER)
                .build();
    }

    /**
     * Layout over the given zones with baseline systems, crew 4 and 90 days.
     */
    public static Layout layout(Zone... zones) {
        double total = 0.0d;
        for (Zone zone : zones) {
            total += zone.getVolumeM3();
        }
        return Layout.builder()
                .habitatName("Fixture")
                .habitatType(HabitatType.RIGID)
                .pressurizedVolumeM3(total > 0.0d ? total : 1.0d)
                .zones(List.of(zones))
                .systems(baselineSystems())
                .shieldEquivalentGCm2(6.0d)
                .isruRatio(0.6d)
                .dockingPorts(1)
                .metadataEntry(Layout.META_CREW, 4)
                .metadataEntry(Layout.META_DURATION_DAYS, 90)
                .build();
    }

    /**
     * Five zones connected as a tree: Airlock - Work - CrewQuarters, with HygieneMedical and
     * StormShelter hanging off CrewQuarters.
     */
    public static Layout fiveZoneTree() {
        return layout(
                zone(ZoneKind.AIRLOCK, 10.0d, "Work"),
                zone(ZoneKind.WORK, 30.0d, "CrewQuarters"),
                zone(ZoneKind.CREW_QUARTERS, 40.0d, "HygieneMedical", "StormShelter"),
                zone(ZoneKind.HYGIENE_MEDICAL, 15.0d),
                zone(ZoneKind.STORM_SHELTER, 12.0d)
        );
    }

    /**
     * Replaces the zone of {@code kind} with {@code edit(zone)}, leaving the rest untouched.
     */
    public static Layout editZone(Layout layout, ZoneKind kind, UnaryOperator<Zone> edit) {
        List<Zone> zones = new ArrayList<>(layout.getZones().size());
        for (Zone zone : layout.getZones()) {
            zones.add(zone.getKind() == kind ? edit.apply(zone) : zone);
        }
        return layout.toBuilder().clearZones().zones(zones).build();
    }

    /**
     * Returns {@code zone} with its declared connections replaced.
     */
    public static Zone withConnections(Zone zone, String... connections) {
        return zone.toBuilder().clearConnections().connections(List.of(connections)).build();
    }

    /**
     * Removes every zone of {@code kind} and recomputes the pressurized volume.
     */
    public static Layout withoutZone(Layout layout, ZoneKind kind) {
        List<Zone> zones = new ArrayList<>(layout.getZones());
        zones.removeIf(zone -> zone.getKind() == kind);
        return layout.withZonesResummed(zones);
    }
}

package org.selene.habitat.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One functional compartment of the habitat.
 *
 * <p>Neighbor names are declared one-directionally and may name zones that do not exist in
 * the layout; graph consumers symmetrize them and create stub nodes as needed.</p>
 */
@Value
public class Zone {
    /** Functional kind; also the zone's identity inside a layout. */
    ZoneKind kind;
    /** Gross volume in m³, always {@code > 0}. */
    double volumeM3;
    /** Fraction of the volume that is livable, in {@code (0, 1]}. */
    double usableRatio;
    PrivacyLevel privacy;
    /** Declared neighbor zone names, trimmed, in declaration order. */
    List<String> connections;
    /** Acoustic isolation score in {@code [0, 1]}. */
    double acousticIsolation;
    LightingProfile lighting;
    boolean pressurized;
    boolean egress;
    List<String> equipment;

    @Builder(toBuilder = true)
    private Zone(
            ZoneKind kind,
            double volumeM3,
            double usableRatio,
            PrivacyLevel privacy,
            @Singular List<String> connections,
            double acousticIsolation,
            LightingProfile lighting,
            boolean pressurized,
            boolean egress,
            @Singular("equipmentItem") List<String> equipment
    ) {
        this.kind = LayoutContracts.requirePresent(kind, "zone.name");
        this.volumeM3 = LayoutContracts.requirePositive(volumeM3, kind.label() + ".volume_m3");
        this.usableRatio = LayoutContracts.requireFraction(usableRatio, kind.label() + ".usable_ratio");
        this.privacy = LayoutContracts.requirePresent(privacy, kind.label() + ".privacy");
        this.connections = trimmed(connections);
        this.acousticIsolation = LayoutContracts.requireUnitInterval(
                acousticIsolation,
                kind.label() + ".acoustic_isolation"
        );
        this.lighting = LayoutContracts.requirePresent(lighting, kind.label() + ".lighting");
        this.pressurized = pressurized;
        this.egress = egress;
        this.equipment = List.copyOf(equipment);
    }

    private static List<String> trimmed(List<String> names) {
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(LayoutContracts.requirePresent(name, "zone.connections").trim());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the zone's interchange name, for example {@code "CrewQuarters"}.
     */
    public String getName() {
        return kind.label();
    }

    /**
     * Returns this zone's contribution to net habitable volume: volume times usable ratio for
     * pressurized zones, zero otherwise.
     */
    public double netHabitableVolume() {
        return pressurized ? volumeM3 * usableRatio : 0.0d;
    }

    public Zone withVolumeM3(double volume) {
        return toBuilder().volumeM3(volume).build();
    }

    public Zone withAcousticIsolation(double isolation) {
        return toBuilder().acousticIsolation(isolation).build();
    }
}

package org.selene.habitat.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Aggregate root of a habitat design.
 *
 * <p>Instances are immutable: every transformation (an optimizer move, a generator repair)
 * produces a new layout through {@link #toBuilder()}, so an earlier layout can never observe a
 * later edit and rejected candidates are simply dropped.</p>
 *
 * <p>Metadata must carry {@code crew} and {@code duration_days}. Integral metadata numbers are
 * held as {@link Long} and fractional ones as {@link Double}, at any depth of nested lists and
 * maps, so that a layout survives an interchange round trip with equal field values.</p>
 */
@Value
public class Layout {
    public static final String META_CREW = "crew";
    public static final String META_DURATION_DAYS = "duration_days";
    public static final String META_SEED = "seed";

    String habitatName;
    HabitatType habitatType;
    /** Total pressurized volume in m³. */
    double pressurizedVolumeM3;
    List<Zone> zones;
    Systems systems;
    /** Radiation shielding in g/cm² of aluminium equivalent. */
    double shieldEquivalentGCm2;
    /** Fraction of consumables produced in situ, in {@code [0, 1]}. */
    double isruRatio;
    int dockingPorts;
    Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private Layout(
            String habitatName,
            HabitatType habitatType,
            double pressurizedVolumeM3,
            @Singular List<Zone> zones,
            Systems systems,
            double shieldEquivalentGCm2,
            double isruRatio,
            int dockingPorts,
            @Singular("metadataEntry") Map<String, Object> metadata
    ) {
        this.habitatName = LayoutContracts.requirePresent(habitatName, "habitat_name");
        this.habitatType = LayoutContracts.requirePresent(habitatType, "habitat_type");
        this.pressurizedVolumeM3 = LayoutContracts.requirePositive(pressurizedVolumeM3, "pressurized_volume_m3");
        this.zones = List.copyOf(zones);
        this.systems = LayoutContracts.requirePresent(systems, "systems");
        this.shieldEquivalentGCm2 = LayoutContracts.requireNonNegative(shieldEquivalentGCm2, "shield_equivalent_g_cm2");
        this.isruRatio = LayoutContracts.requireUnitInterval(isruRatio, "isru_ratio");
        this.dockingPorts = LayoutContracts.requireNonNegative(dockingPorts, "docking_ports");
        this.metadata = normalizeMetadata(metadata);
    }

    /**
     * Returns the crew size recorded in metadata.
     */
    public int crew() {
        return ((Number) metadata.get(META_CREW)).intValue();
    }

    /**
     * Returns the mission duration in days recorded in metadata.
     */
    public int durationDays() {
        return ((Number) metadata.get(META_DURATION_DAYS)).intValue();
    }

    /**
     * Returns the generation seed when metadata records one.
     */
    public OptionalLong seed() {
        Object raw = metadata.get(META_SEED);
        if (raw instanceof Number) {
            return OptionalLong.of(((Number) raw).longValue());
        }
        return OptionalLong.empty();
    }

    /**
     * Finds the zone of the given kind, first match in zone order.
     */
    public Optional<Zone> zone(ZoneKind kind) {
        for (Zone zone : zones) {
            if (zone.getKind() == kind) {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    public boolean hasZone(ZoneKind kind) {
        return zone(kind).isPresent();
    }

    /**
     * Net habitable volume: sum of volume times usable ratio over pressurized zones.
     */
    public double netHabitableVolume() {
        double total = 0.0d;
        for (Zone zone : zones) {
            total += zone.netHabitableVolume();
        }
        return total;
    }

    /**
     * Net habitable volume divided by total pressurized volume.
     */
    public double nhvEfficiency() {
        return netHabitableVolume() / pressurizedVolumeM3;
    }

    /**
     * Sum of all zone volumes, which generator and optimizer keep equal to the pressurized volume.
     */
    public double zoneVolumeSum() {
        double total = 0.0d;
        for (Zone zone : zones) {
            total += zone.getVolumeM3();
        }
        return total;
    }

    public int egressZoneCount() {
        int count = 0;
        for (Zone zone : zones) {
            if (zone.isEgress()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a copy with the zone list replaced and the pressurized volume recomputed from it.
     */
    public Layout withZonesResummed(List<Zone> replacementZones) {
        double total = 0.0d;
        for (Zone zone : replacementZones) {
            total += zone.getVolumeM3();
        }
        return toBuilder()
                .clearZones()
                .zones(replacementZones)
                .pressurizedVolumeM3(total)
                .build();
    }

    private static Map<String, Object> normalizeMetadata(Map<String, Object> raw) {
        if (!raw.containsKey(META_CREW) || !raw.containsKey(META_DURATION_DAYS)) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_METADATA_MISSING,
                    "metadata missing required keys: crew, duration_days"
            );
        }
        Map<String, Object> normalized = new LinkedHashMap<>(raw.size());
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            normalized.put(entry.getKey(), normalizeValue(entry.getKey(), entry.getValue()));
        }
        requireNumber(normalized, META_CREW);
        requireNumber(normalized, META_DURATION_DAYS);
        return Collections.unmodifiableMap(normalized);
    }

    private static Object normalizeValue(String path, Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof List) {
            List<?> raw = (List<?>) value;
            List<Object> normalized = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                normalized.add(normalizeValue(path + "[" + i + "]", raw.get(i)));
            }
            return Collections.unmodifiableList(normalized);
        }
        if (value instanceof Map) {
            Map<?, ?> raw = (Map<?, ?>) value;
            Map<String, Object> normalized = new LinkedHashMap<>(raw.size());
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new LayoutContractException(
                            LayoutContractException.REASON_FIELD_OUT_OF_RANGE,
                            "metadata." + path + " keys must be strings"
                    );
                }
                String key = (String) entry.getKey();
                normalized.put(key, normalizeValue(path + "." + key, entry.getValue()));
            }
            return Collections.unmodifiableMap(normalized);
        }
        throw new LayoutContractException(
                LayoutContractException.REASON_FIELD_OUT_OF_RANGE,
                "metadata." + path + " must be a number, string, boolean, null, list or map"
        );
    }

    private static void requireNumber(Map<String, Object> metadata, String key) {
        if (!(metadata.get(key) instanceof Number)) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_METADATA_MISSING,
                    "metadata." + key + " must be numeric"
            );
        }
    }
}

package org.selene.habitat.generator;

import org.selene.habitat.model.LightingProfile;
import org.selene.habitat.model.PrivacyLevel;
import org.selene.habitat.model.ZoneKind;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered table of zone templates injected into the {@link LayoutGenerator}.
 *
 * <p>Zone order in generated layouts follows catalog order.</p>
 */
public final class ZoneCatalog {
    private final List<ZoneTemplate> templates;

    private ZoneCatalog(List<ZoneTemplate> templates) {
        this.templates = List.copyOf(templates);
    }

    /**
     * Creates a catalog from explicit templates.
     *
     * @throws IllegalArgumentException when the catalog is empty, lists a kind twice, or has a
     * non-positive volume fraction.
     */
    public static ZoneCatalog of(List<ZoneTemplate> templates) {
        Objects.requireNonNull(templates, "templates");
        if (templates.isEmpty()) {
            throw new IllegalArgumentException("zone catalog must contain at least one template");
        }
        boolean[] seen = new boolean[ZoneKind.values().length];
        for (ZoneTemplate template : templates) {
            int ordinal = template.getKind().ordinal();
            if (seen[ordinal]) {
                throw new IllegalArgumentException("duplicate zone template: " + template.getKind());
            }
            seen[ordinal] = true;
            if (!(template.getVolumeFraction() > 0.0d)) {
                throw new IllegalArgumentException("volume fraction must be > 0 for " + template.getKind());
            }
        }
        return new ZoneCatalog(templates);
    }

    public List<ZoneTemplate> templates() {
        return templates;
    }

    public double fractionTotal() {
        double total = 0.0d;
        for (ZoneTemplate template : templates) {
            total += template.getVolumeFraction();
        }
        return total;
    }

    /**
     * Standard nine-zone catalog. The connection table forms a connected graph with cycles that
     * keeps every zone within three hops of the storm shelter.
     */
    public static ZoneCatalog defaults() {
        return of(List.of(
                template(ZoneKind.AIRLOCK, 0.07, 0.60, PrivacyLevel.LOW, 0.40, false, true)
                        .connection("MaintenanceStorage").connection("Work")
                        .equipmentItem("dual-door").equipmentItem("suit-lock").equipmentItem("dust-scrubber")
                        .build(),
                template(ZoneKind.WORK, 0.18, 0.85, PrivacyLevel.MEDIUM, 0.55, false, false)
                        .connection("Airlock").connection("GalleyDining").connection("Exercise")
                        .connection("MaintenanceStorage")
                        .equipmentItem("lab-bench").equipmentItem("fab-station")
                        .build(),
                template(ZoneKind.HYGIENE_MEDICAL, 0.09, 0.80, PrivacyLevel.HIGH, 0.75, true, false)
                        .connection("CrewQuarters").connection("StormShelter")
                        .equipmentItem("med-kit").equipmentItem("hygiene-module")
                        .build(),
                template(ZoneKind.GALLEY_DINING, 0.11, 0.85, PrivacyLevel.MEDIUM, 0.60, true, false)
                        .lighting(LightingProfile.ADAPTIVE)
                        .connection("Work").connection("CrewQuarters").connection("Agriculture")
                        .equipmentItem("galley").equipmentItem("table")
                        .build(),
                template(ZoneKind.CREW_QUARTERS, 0.20, 0.90, PrivacyLevel.HIGH, 0.80, true, false)
                        .lighting(LightingProfile.ADAPTIVE)
                        .connection("GalleyDining").connection("HygieneMedical").connection("Exercise")
                        .equipmentItem("pods").equipmentItem("privacy-panels")
                        .build(),
                template(ZoneKind.EXERCISE, 0.10, 0.80, PrivacyLevel.MEDIUM, 0.65, true, false)
                        .connection("CrewQuarters").connection("Work")
                        .equipmentItem("treadmill").equipmentItem("flywheel")
                        .build(),
                template(ZoneKind.MAINTENANCE_STORAGE, 0.10, 0.75, PrivacyLevel.LOW, 0.50, false, false)
                        .connection("Airlock").connection("Work").connection("StormShelter")
                        .connection("Agriculture")
                        .equipmentItem("tool-racks").equipmentItem("spares")
                        .build(),
                template(ZoneKind.STORM_SHELTER, 0.07, 0.70, PrivacyLevel.HIGH, 0.85, false, true)
                        .connection("HygieneMedical").connection("MaintenanceStorage")
                        .equipmentItem("shielded-bunks").equipmentItem("backup-comms")
                        .build(),
                template(ZoneKind.AGRICULTURE, 0.08, 0.85, PrivacyLevel.MEDIUM, 0.60, true, false)
                        .connection("GalleyDining").connection("MaintenanceStorage")
                        .equipmentItem("hydroponics").equipmentItem("algae")
                        .build()
        ));
    }

    private static ZoneTemplate.ZoneTemplateBuilder template(
            ZoneKind kind,
            double fraction,
            double usable,
            PrivacyLevel privacy,
            double acoustic,
            boolean crewScaled,
            boolean egress
    ) {
        return ZoneTemplate.builder()
                .kind(kind)
                .volumeFraction(fraction)
                .usableRatio(usable)
                .privacy(privacy)
                .acousticIsolation(acoustic)
                .lighting(LightingProfile.NEUTRAL_4000K)
                .crewScaled(crewScaled)
                .egress(egress);
    }
}

package org.selene.habitat.model;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Closed set of functional zone kinds a habitat layout may contain.
 *
 * <p>Each kind carries the stable label used in zone neighbor lists, rule ids and
 * the interchange format.</p>
 */
@Getter
@Accessors(fluent = true)
public enum ZoneKind {
    AIRLOCK("Airlock"),
    WORK("Work"),
    HYGIENE_MEDICAL("HygieneMedical"),
    GALLEY_DINING("GalleyDining"),
    CREW_QUARTERS("CrewQuarters"),
    EXERCISE("Exercise"),
    MAINTENANCE_STORAGE("MaintenanceStorage"),
    STORM_SHELTER("StormShelter"),
    AGRICULTURE("Agriculture");

    private final String label;

    ZoneKind(String label) {
        this.label = label;
    }

    /**
     * Resolves a zone kind from its interchange label.
     *
     * @param label exact, case-sensitive label such as {@code "CrewQuarters"}.
     * @return matching zone kind.
     * @throws LayoutContractException when the label is unknown.
     */
    public static ZoneKind fromLabel(String label) {
        for (ZoneKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new LayoutContractException(
                LayoutContractException.REASON_UNKNOWN_LABEL,
                "unknown zone name: " + label
        );
    }

    @Override
    public String toString() {
        return label;
    }
}

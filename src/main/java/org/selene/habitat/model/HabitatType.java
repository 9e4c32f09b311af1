package org.selene.habitat.model;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Structural habitat family.
 */
@Getter
@Accessors(fluent = true)
public enum HabitatType {
    INFLATABLE("Inflatable"),
    RIGID("Rigid"),
    REGOLITH_HYBRID("RegolithHybrid");

    private final String label;

    HabitatType(String label) {
        this.label = label;
    }

    public static HabitatType fromLabel(String label) {
        for (HabitatType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new LayoutContractException(
                LayoutContractException.REASON_UNKNOWN_LABEL,
                "unknown habitat type: " + label
        );
    }

    @Override
    public String toString() {
        return label;
    }
}

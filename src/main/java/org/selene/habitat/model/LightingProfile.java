package org.selene.habitat.model;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Lighting profile installed in a zone.
 */
@Getter
@Accessors(fluent = true)
public enum LightingProfile {
    WARM_3000K("Warm3000K"),
    NEUTRAL_4000K("Neutral4000K"),
    COOL_6500K("Cool6500K"),
    ADAPTIVE("Adaptive");

    private final String label;

    LightingProfile(String label) {
        this.label = label;
    }

    public static LightingProfile fromLabel(String label) {
        for (LightingProfile profile : values()) {
            if (profile.label.equals(label)) {
                return profile;
            }
        }
        throw new LayoutContractException(
                LayoutContractException.REASON_UNKNOWN_LABEL,
                "unknown lighting profile: " + label
        );
    }

    @Override
    public String toString() {
        return label;
    }
}

package org.selene.habitat.model;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Privacy classification of a zone.
 */
@Getter
@Accessors(fluent = true)
public enum PrivacyLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    PrivacyLevel(String label) {
        this.label = label;
    }

    public static PrivacyLevel fromLabel(String label) {
        for (PrivacyLevel level : values()) {
            if (level.label.equals(label)) {
                return level;
            }
        }
        throw new LayoutContractException(
                LayoutContractException.REASON_UNKNOWN_LABEL,
                "unknown privacy level: " + label
        );
    }

    @Override
    public String toString() {
        return label;
    }
}

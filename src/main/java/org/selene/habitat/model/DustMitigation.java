package org.selene.habitat.model;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Regolith dust countermeasures at the habitat entry.
 *
 * <p>The validator requires both {@code dualDoor} and {@code suitStorage}.</p>
 */
@Value
@Accessors(fluent = true)
public class DustMitigation {
    boolean dualDoor;
    boolean suitStorage;
    boolean electrostatic;

    public static DustMitigation of(boolean dualDoor, boolean suitStorage, boolean electrostatic) {
        return new DustMitigation(dualDoor, suitStorage, electrostatic);
    }

    /**
     * Returns whether the entry satisfies the dual-door plus suit-storage requirement.
     */
    public boolean isComplete() {
        return dualDoor && suitStorage;
    }
}

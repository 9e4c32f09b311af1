package org.selene.habitat.generator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.selene.habitat.model.LightingProfile;
import org.selene.habitat.model.PrivacyLevel;
import org.selene.habitat.model.ZoneKind;

import java.util.List;

/**
 * Default attributes the generator assigns to one zone kind.
 */
@Value
@Builder
public class ZoneTemplate {
    ZoneKind kind;
    /** Relative share of the pressurized volume before normalization. */
    double volumeFraction;
    double usableRatio;
    PrivacyLevel privacy;
    double acousticIsolation;
    LightingProfile lighting;
    /** Whether the zone grows with crew size beyond the four-person baseline. */
    boolean crewScaled;
    boolean egress;
    @Singular
    List<String> connections;
    @Singular("equipmentItem")
    List<String> equipment;
}

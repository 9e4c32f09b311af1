package org.selene.habitat.validation;

import lombok.experimental.UtilityClass;

/**
 * Stable identifiers of the hard constraint rules, as reported in
 * {@link org.selene.habitat.model.ValidationResult#getFailedRules()}.
 *
 * <p>Adjacency rules are templated per pair, see
 * {@link org.selene.habitat.model.AdjacencyPair#ruleId()}.</p>
 */
@UtilityClass
public final class ConstraintRules {
    public static final String CREW_RANGE = "crew_range";
    public static final String DURATION_RANGE = "duration_range";
    public static final String REQUIRED_ZONES = "required_zones";
    public static final String NHV_PER_CREW = "nhv_per_crew";
    public static final String NHV_EFFICIENCY = "nhv_efficiency";
    public static final String RADIATION_SHIELD = "radiation_shield";
    public static final String ECLSS_REDUNDANCY = "eclss_redundancy";
    public static final String WATER_RECYCLING = "water_recycling";
    public static final String POWER_AUTONOMY = "power_autonomy";
    public static final String DUST_MITIGATION = "dust_mitigation";
    public static final String CONNECTIVITY = "connectivity";
    public static final String REDUNDANT_PATHS = "redundant_paths";
    public static final String EGRESS_PATHS = "egress_paths";
    public static final String STORM_SHELTER_ACCESS = "storm_shelter_access";
    public static final String CREW_PRIVACY = "crew_privacy";

    /**
     * Whether a rule id concerns net habitable volume, the only shortfall the generator repairs.
     */
    public static boolean isNhvRule(String ruleId) {
        return NHV_PER_CREW.equals(ruleId) || NHV_EFFICIENCY.equals(ruleId);
    }
}

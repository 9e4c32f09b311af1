package org.selene.habitat.validation;

import lombok.extern.slf4j.Slf4j;
import org.selene.habitat.graph.ZoneGraph;
import org.selene.habitat.model.AdjacencyPair;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.PrivacyLevel;
import org.selene.habitat.model.Systems;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Hard-constraint checker for habitat layouts.
 *
 * <p>Every rule is evaluated independently and contributes exactly one message; a failing rule
 * also contributes its stable id. Rule violations are returned as data and never thrown.
 * Evaluation order:</p>
 * <ol>
 * <li>crew and mission duration ranges</li>
 * <li>required zones present</li>
 * <li>net habitable volume per crew member and NHV efficiency</li>
 * <li>shielding, ECLSS loops, water recycling, power autonomy, dust mitigation</li>
 * <li>graph connectivity, then redundant paths (only on a connected graph)</li>
 * <li>required adjacencies, egress count, storm-shelter reachability, crew-quarters privacy</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.</p>
 */
@Slf4j
public final class ConstraintValidator {

    /**
     * Validates a layout against mission thresholds.
     *
     * @param layout layout to check; not modified.
     * @param settings thresholds.
     * @return verdict with one message per rule and the failed rule ids in evaluation order.
     */
    public ValidationResult validate(Layout layout, ConstraintSettings settings) {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(settings, "settings");

        RuleLog rules = new RuleLog();
        ZoneGraph graph = ZoneGraph.of(layout);

        checkMissionEnvelope(layout, settings, rules);
        checkRequiredZones(layout, settings, rules);
        checkHabitableVolume(layout, settings, rules);
        checkShielding(layout, settings, rules);
        checkSystems(layout.getSystems(), settings, rules);
        checkGraphTopology(graph, rules);
        checkAdjacencyPairs(graph, settings, rules);
        checkEgress(layout, rules);
        checkStormShelter(layout, graph, settings, rules);
        checkCrewPrivacy(layout, settings, rules);

        ValidationResult result = ValidationResult.of(rules.messages, rules.failed);
        if (!result.isPassed()) {
            log.debug("Layout {} failed rules {}", layout.getHabitatName(), result.getFailedRules());
        }
        return result;
    }

    private static void checkMissionEnvelope(Layout layout, ConstraintSettings settings, RuleLog rules) {
        int crew = layout.crew();
        if (crew < settings.getMinCrew() || crew > settings.getMaxCrew()) {
            rules.fail(ConstraintRules.CREW_RANGE, format(
                    "Crew size %d outside supported range %d-%d.",
                    crew, settings.getMinCrew(), settings.getMaxCrew()));
        } else {
            rules.pass(format("Crew size %d within supported range.", crew));
        }

        int duration = layout.durationDays();
        if (duration < settings.getMinDurationDays() || duration > settings.getMaxDurationDays()) {
            rules.fail(ConstraintRules.DURATION_RANGE, format(
                    "Duration %d days outside supported range %d-%d.",
                    duration, settings.getMinDurationDays(), settings.getMaxDurationDays()));
        } else {
            rules.pass(format("Mission duration %d days within supported range.", duration));
        }
    }

    private static void checkRequiredZones(Layout layout, ConstraintSettings settings, RuleLog rules) {
        List<String> missing = new ArrayList<>();
        for (ZoneKind kind : settings.getRequiredZones()) {
            if (!layout.hasZone(kind)) {
                missing.add(kind.label());
            }
        }
        if (missing.isEmpty()) {
            rules.pass("All mandatory zones present.");
        } else {
            rules.fail(ConstraintRules.REQUIRED_ZONES, "Missing mandatory zones: " + String.join(", ", missing) + ".");
        }
    }

    private static void checkHabitableVolume(Layout layout, ConstraintSettings settings, RuleLog rules) {
        double nhv = layout.netHabitableVolume();
        double required = layout.crew() * settings.getMinNhvPerPerson();
        if (nhv < required) {
            rules.fail(ConstraintRules.NHV_PER_CREW, format(
                    "NHV %.1f m³ below required %.1f m³ (add %.1f m³ usable).",
                    nhv, required, required - nhv));
        } else {
            rules.pass(format("NHV %.1f m³ meets per-crew requirement.", nhv));
        }

        double efficiency = layout.nhvEfficiency();
        if (efficiency < settings.getMinNhvEfficiency()) {
            rules.fail(ConstraintRules.NHV_EFFICIENCY, format(
                    "NHV efficiency %.2f < %.2f; consider more usable volume.",
                    efficiency, settings.getMinNhvEfficiency()));
        } else {
            rules.pass(format("NHV efficiency %.2f meets minimum.", efficiency));
        }
    }

    private static void checkShielding(Layout layout, ConstraintSettings settings, RuleLog rules) {
        if (layout.getShieldEquivalentGCm2() < settings.getMinShieldGCm2()) {
            rules.fail(ConstraintRules.RADIATION_SHIELD, format(
                    "Shielding %.1f g/cm² < %.1f g/cm².",
                    layout.getShieldEquivalentGCm2(), settings.getMinShieldGCm2()));
        } else {
            rules.pass("Radiation shielding meets requirement.");
        }
    }

    private static void checkSystems(Systems systems, ConstraintSettings settings, RuleLog rules) {
        if (systems.getEclssRedundancyLoops() < settings.getMinEclssLoops()) {
            rules.fail(ConstraintRules.ECLSS_REDUNDANCY, format(
                    "ECLSS redundancy %d below requirement; need >= %d full loops.",
                    systems.getEclssRedundancyLoops(), settings.getMinEclssLoops()));
        } else {
            rules.pass("ECLSS redundancy satisfied.");
        }

        if (systems.getWaterRecyclingRate() < settings.getMinWaterRecycling()) {
            rules.fail(ConstraintRules.WATER_RECYCLING, format(
                    "Water recycling %.2f < %.2f.",
                    systems.getWaterRecyclingRate(), settings.getMinWaterRecycling()));
        } else {
            rules.pass("Water recycling meets specification.");
        }

        int autonomy = systems.getPower().autonomyDays();
        if (autonomy < settings.getMinPowerAutonomyDays()) {
            rules.fail(ConstraintRules.POWER_AUTONOMY, format(
                    "Power autonomy %d days < %d days target.",
                    autonomy, settings.getMinPowerAutonomyDays()));
        } else {
            rules.pass("Power autonomy meets lunar night requirement.");
        }

        if (systems.getDustMitigation().isComplete()) {
            rules.pass("Dust mitigation features verified.");
        } else {
            rules.fail(ConstraintRules.DUST_MITIGATION, "Dust mitigation must include dual-door vestibule and suit storage.");
        }
    }

    /**
     * Connectivity, then redundant paths. The cycle check only runs on a connected graph and
     * accepts a single cycle anywhere in it.
     */
    private static void checkGraphTopology(ZoneGraph graph, RuleLog rules) {
        if (graph.isEmpty()) {
            rules.fail(ConstraintRules.CONNECTIVITY, "No connectivity graph defined across zones.");
            return;
        }
        if (!graph.isConnected()) {
            rules.fail(ConstraintRules.CONNECTIVITY, "Zone adjacency graph is disconnected.");
            return;
        }
        rules.pass("Zone adjacency graph is connected.");

        if (graph.hasCycle()) {
            rules.pass("Redundant paths present in adjacency graph.");
        } else {
            rules.fail(ConstraintRules.REDUNDANT_PATHS, "Adjacency graph lacks alternate routes; add redundant connections.");
        }
    }

    private static void checkAdjacencyPairs(ZoneGraph graph, ConstraintSettings settings, RuleLog rules) {
        boolean allPresent = true;
        for (AdjacencyPair pair : settings.getAdjacencyPairs()) {
            String a = pair.first().label();
            String b = pair.second().label();
            if (!graph.hasEdge(a, b)) {
                rules.fail(pair.ruleId(), "Critical adjacency missing between " + a + " and " + b + ".");
                allPresent = false;
            }
        }
        if (allPresent) {
            rules.pass("Critical adjacencies present.");
        }
    }

    private static void checkEgress(Layout layout, RuleLog rules) {
        if (layout.egressZoneCount() < 2) {
            rules.fail(ConstraintRules.EGRESS_PATHS,
                    "At least two egress-capable zones required (e.g., airlock and shelter exit).");
        } else {
            rules.pass("Multiple egress-capable zones confirmed.");
        }
    }

    private static void checkStormShelter(Layout layout, ZoneGraph graph, ConstraintSettings settings, RuleLog rules) {
        String shelter = ZoneKind.STORM_SHELTER.label();
        if (!layout.hasZone(ZoneKind.STORM_SHELTER) || graph.isEmpty()) {
            rules.fail(ConstraintRules.STORM_SHELTER_ACCESS, "Storm shelter zone missing or disconnected.");
            return;
        }
        for (Zone zone : layout.getZones()) {
            int distance = graph.hops(zone.getName(), shelter);
            if (distance == ZoneGraph.UNREACHABLE || distance > settings.getMaxStormShelterHops()) {
                rules.fail(ConstraintRules.STORM_SHELTER_ACCESS, format(
                        "Storm shelter too far from %s (distance %d).", zone.getName(), distance));
                return;
            }
        }
        rules.pass("Storm shelter reachable within required hops.");
    }

    private static void checkCrewPrivacy(Layout layout, ConstraintSettings settings, RuleLog rules) {
        Optional<Zone> quarters = layout.zone(ZoneKind.CREW_QUARTERS);
        if (quarters.isEmpty()) {
            rules.pass("Crew quarters zone not defined.");
            return;
        }
        Zone zone = quarters.get();
        if (zone.getPrivacy() != PrivacyLevel.HIGH || zone.getAcousticIsolation() < settings.getMinPrivacyQuarters()) {
            rules.fail(ConstraintRules.CREW_PRIVACY, format(
                    "Crew quarters must have High privacy and acoustic isolation >= %.2f.",
                    settings.getMinPrivacyQuarters()));
        } else {
            rules.pass("Crew quarters privacy targets satisfied.");
        }
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }

    /**
     * Accumulates messages and failed rule ids in evaluation order.
     */
    private static final class RuleLog {
        private final List<String> messages = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();

        void pass(String message) {
            messages.add(message);
        }

        void fail(String ruleId, String message) {
            failed.add(ruleId);
            messages.add(message);
        }
    }
}

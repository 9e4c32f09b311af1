package org.selene.habitat.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.selene.habitat.generator.GeneratorConfig;
import org.selene.habitat.model.CommsSystem;
import org.selene.habitat.model.DustMitigation;
import org.selene.habitat.model.HabitatType;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.LayoutConfigurationException;
import org.selene.habitat.model.LayoutContractException;
import org.selene.habitat.model.LightingProfile;
import org.selene.habitat.model.Metrics;
import org.selene.habitat.model.OptimizationLogEntry;
import org.selene.habitat.model.OptimizationResult;
import org.selene.habitat.model.PowerSystem;
import org.selene.habitat.model.PrivacyLevel;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.Systems;
import org.selene.habitat.model.ThermalSystem;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON interchange codec for layouts and the core's result types.
 *
 * <p>Field names follow the interchange spelling ({@code habitat_name}, {@code volume_m3},
 * {@code shield_equivalent_g_cm2}, ...). Documents are read through the Jackson tree model and
 * every field is type-checked; parsed layouts pass the model constructors' contract checks, so a
 * malformed document surfaces as a {@link LayoutContractException} before any core call sees it.
 * Writing then reading a value yields an equal value.</p>
 *
 * <p>Thread-safe after construction.</p>
 */
public final class LayoutCodec {
    private final ObjectMapper mapper;

    public LayoutCodec() {
        this(new ObjectMapper());
    }

    public LayoutCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ------------------------------------------------------------------------
    // Layout
    // ------------------------------------------------------------------------

    public String writeLayout(Layout layout) {
        return write(toJson(layout));
    }

    public Layout readLayout(String json) {
        return layoutFrom(parse(json));
    }

    public ObjectNode toJson(Layout layout) {
        ObjectNode node = mapper.createObjectNode();
        node.put("habitat_name", layout.getHabitatName());
        node.put("habitat_type", layout.getHabitatType().label());
        node.put("pressurized_volume_m3", layout.getPressurizedVolumeM3());
        ArrayNode zones = node.putArray("zones");
        for (Zone zone : layout.getZones()) {
            zones.add(toJson(zone));
        }
        node.set("systems", toJson(layout.getSystems()));
        node.put("shield_equivalent_g_cm2", layout.getShieldEquivalentGCm2());
        node.put("isru_ratio", layout.getIsruRatio());
        node.put("docking_ports", layout.getDockingPorts());
        ObjectNode metadata = node.putObject("metadata");
        for (Map.Entry<String, Object> entry : layout.getMetadata().entrySet()) {
            metadata.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
        }
        return node;
    }

    public Layout layoutFrom(JsonNode node) {
        requireObject(node, "layout");
        Layout.LayoutBuilder builder = Layout.builder()
                .habitatName(text(node, "habitat_name"))
                .habitatType(HabitatType.fromLabel(text(node, "habitat_type")))
                .pressurizedVolumeM3(number(node, "pressurized_volume_m3"))
                .systems(systemsFrom(field(node, "systems")))
                .shieldEquivalentGCm2(number(node, "shield_equivalent_g_cm2"))
                .isruRatio(number(node, "isru_ratio"))
                .dockingPorts(integer(node, "docking_ports"));
        for (JsonNode zone : array(node, "zones")) {
            builder.zone(zoneFrom(zone));
        }
        JsonNode metadata = field(node, "metadata");
        requireObject(metadata, "metadata");
        Iterator<Map.Entry<String, JsonNode>> entries = metadata.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            builder.metadataEntry(entry.getKey(), metadataValueFrom(entry.getValue(), "metadata." + entry.getKey()));
        }
        return builder.build();
    }

    private ObjectNode toJson(Zone zone) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", zone.getName());
        node.put("volume_m3", zone.getVolumeM3());
        node.put("usable_ratio", zone.getUsableRatio());
        node.put("privacy", zone.getPrivacy().label());
        ArrayNode connections = node.putArray("connections");
        zone.getConnections().forEach(connections::add);
        node.put("acoustic_isolation", zone.getAcousticIsolation());
        node.put("lighting", zone.getLighting().label());
        node.put("is_pressurized", zone.isPressurized());
        node.put("is_egress", zone.isEgress());
        ArrayNode equipment = node.putArray("equipment");
        zone.getEquipment().forEach(equipment::add);
        return node;
    }

    private Zone zoneFrom(JsonNode node) {
        requireObject(node, "zone");
        Zone.ZoneBuilder builder = Zone.builder()
                .kind(ZoneKind.fromLabel(text(node, "name")))
                .volumeM3(number(node, "volume_m3"))
                .usableRatio(number(node, "usable_ratio"))
                .privacy(PrivacyLevel.fromLabel(text(node, "privacy")))
                .acousticIsolation(number(node, "acoustic_isolation"))
                .lighting(LightingProfile.fromLabel(text(node, "lighting")))
                .pressurized(optionalBoolean(node, "is_pressurized", true))
                .egress(optionalBoolean(node, "is_egress", false));
        for (String connection : optionalTexts(node, "connections")) {
            builder.connection(connection);
        }
        for (String item : optionalTexts(node, "equipment")) {
            builder.equipmentItem(item);
        }
        return builder.build();
    }

    private ObjectNode toJson(Systems systems) {
        ObjectNode node = mapper.createObjectNode();
        node.put("eclss_redundancy_loops", systems.getEclssRedundancyLoops());
        node.put("water_recycling_rate", systems.getWaterRecyclingRate());

        PowerSystem power = systems.getPower();
        ObjectNode powerNode = node.putObject("power");
        powerNode.put("source", power.source());
        powerNode.put("autonomy_days", power.autonomyDays());
        powerNode.put("storage_kwh", power.storageKwh());

        ThermalSystem thermal = systems.getThermal();
        ObjectNode thermalNode = node.putObject("thermal");
        thermalNode.put("control", thermal.control());
        thermalNode.putArray("range_c").add(thermal.minTemperatureC()).add(thermal.maxTemperatureC());

        CommsSystem comms = systems.getComms();
        ObjectNode commsNode = node.putObject("comms");
        commsNode.put("local", comms.local());
        commsNode.put("gateway", comms.gateway());

        DustMitigation dust = systems.getDustMitigation();
        ObjectNode dustNode = node.putObject("dust_mitigation");
        dustNode.put("dual_door", dust.dualDoor());
        dustNode.put("suit_storage", dust.suitStorage());
        dustNode.put("electrostatic", dust.electrostatic());
        return node;
    }

    private Systems systemsFrom(JsonNode node) {
        requireObject(node, "systems");
        JsonNode power = field(node, "power");
        requireObject(power, "systems.power");
        JsonNode thermal = field(node, "thermal");
        requireObject(thermal, "systems.thermal");
        JsonNode range = field(thermal, "range_c");
        if (!range.isArray() || range.size() != 2 || !range.get(0).isNumber() || !range.get(1).isNumber()) {
            throw malformed("systems.thermal.range_c must be a two-element numeric array");
        }
        JsonNode comms = field(node, "comms");
        requireObject(comms, "systems.comms");
        JsonNode dust = field(node, "dust_mitigation");
        requireObject(dust, "systems.dust_mitigation");

        return Systems.builder()
                .eclssRedundancyLoops(integer(node, "eclss_redundancy_loops"))
                .waterRecyclingRate(number(node, "water_recycling_rate"))
                .power(PowerSystem.of(
                        text(power, "source"),
                        integer(power, "autonomy_days"),
                        number(power, "storage_kwh")
                ))
                .thermal(ThermalSystem.of(
                        text(thermal, "control"),
                        range.get(0).doubleValue(),
                        range.get(1).doubleValue()
                ))
                .comms(CommsSystem.of(bool(comms, "local"), text(comms, "gateway")))
                .dustMitigation(DustMitigation.of(
                        bool(dust, "dual_door"),
                        bool(dust, "suit_storage"),
                        optionalBoolean(dust, "electrostatic", false)
                ))
                .build();
    }

    // ------------------------------------------------------------------------
    // Metrics, validation and optimization results
    // ------------------------------------------------------------------------

    public ObjectNode toJson(Metrics metrics) {
        ObjectNode node = mapper.createObjectNode();
        node.put("nhv_m3", metrics.getNhvM3());
        node.put("nhv_efficiency", metrics.getNhvEfficiency());
        node.put("transit_distance_score", metrics.getTransitDistanceScore());
        node.put("privacy_score", metrics.getPrivacyScore());
        node.put("sustainability_score", metrics.getSustainabilityScore());
        node.put("energy_use_kwh_per_person_day", metrics.getEnergyUseKwhPerPersonDay());
        node.put("safety_redundancy_score", metrics.getSafetyRedundancyScore());
        node.put("feasibility", metrics.isFeasibility());
        return node;
    }

    public Metrics metricsFrom(JsonNode node) {
        requireObject(node, "metrics");
        return Metrics.builder()
                .nhvM3(number(node, "nhv_m3"))
                .nhvEfficiency(number(node, "nhv_efficiency"))
                .transitDistanceScore(number(node, "transit_distance_score"))
                .privacyScore(number(node, "privacy_score"))
                .sustainabilityScore(number(node, "sustainability_score"))
                .energyUseKwhPerPersonDay(number(node, "energy_use_kwh_per_person_day"))
                .safetyRedundancyScore(number(node, "safety_redundancy_score"))
                .feasibility(bool(node, "feasibility"))
                .build();
    }

    public ObjectNode toJson(ValidationResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("passed", result.isPassed());
        ArrayNode messages = node.putArray("messages");
        result.getMessages().forEach(messages::add);
        ArrayNode failed = node.putArray("failed_rules");
        result.getFailedRules().forEach(failed::add);
        return node;
    }

    public ValidationResult validationResultFrom(JsonNode node) {
        requireObject(node, "validation result");
        ValidationResult result = ValidationResult.of(optionalTexts(node, "messages"), optionalTexts(node, "failed_rules"));
        if (result.isPassed() != bool(node, "passed")) {
            throw malformed("passed must be true exactly when failed_rules is empty");
        }
        return result;
    }

    public String writeOptimizationResult(OptimizationResult result) {
        return write(toJson(result));
    }

    public OptimizationResult readOptimizationResult(String json) {
        return optimizationResultFrom(parse(json));
    }

    public ObjectNode toJson(OptimizationResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.set("layout", toJson(result.getLayout()));
        node.set("metrics", toJson(result.getMetrics()));
        node.put("score", result.getScore());
        ArrayNode history = node.putArray("history");
        for (OptimizationLogEntry entry : result.getHistory()) {
            ObjectNode item = history.addObject();
            item.put("iteration", entry.getIteration());
            item.put("score", entry.getScore());
            item.put("accepted", entry.isAccepted());
            item.put("reason", entry.getReason());
        }
        return node;
    }

    public OptimizationResult optimizationResultFrom(JsonNode node) {
        requireObject(node, "optimization result");
        OptimizationResult.OptimizationResultBuilder builder = OptimizationResult.builder()
                .layout(layoutFrom(field(node, "layout")))
                .metrics(metricsFrom(field(node, "metrics")))
                .score(number(node, "score"));
        for (JsonNode item : array(node, "history")) {
            requireObject(item, "history entry");
            builder.historyEntry(new OptimizationLogEntry(
                    integer(item, "iteration"),
                    number(item, "score"),
                    bool(item, "accepted"),
                    text(item, "reason")
            ));
        }
        return builder.build();
    }

    // ------------------------------------------------------------------------
    // Weights and generator config
    // ------------------------------------------------------------------------

    public ObjectNode toJson(ScoreWeights weights) {
        ObjectNode node = mapper.createObjectNode();
        node.put("w_volume_eff", weights.getVolumeEfficiency());
        node.put("w_privacy", weights.getPrivacy());
        node.put("w_transit", weights.getTransit());
        node.put("w_safety", weights.getSafety());
        node.put("w_sustain", weights.getSustainability());
        node.put("w_energy", weights.getEnergy());
        return node;
    }

    /**
     * Reads score weights; absent keys keep their default weight.
     */
    public ScoreWeights readWeights(String json) {
        JsonNode node = parseConfig(json);
        ScoreWeights defaults = ScoreWeights.defaults();
        return ScoreWeights.builder()
                .volumeEfficiency(configNumber(node, "w_volume_eff", defaults.getVolumeEfficiency()))
                .privacy(configNumber(node, "w_privacy", defaults.getPrivacy()))
                .transit(configNumber(node, "w_transit", defaults.getTransit()))
                .safety(configNumber(node, "w_safety", defaults.getSafety()))
                .sustainability(configNumber(node, "w_sustain", defaults.getSustainability()))
                .energy(configNumber(node, "w_energy", defaults.getEnergy()))
                .build();
    }

    public String writeConfig(GeneratorConfig config) {
        ObjectNode node = mapper.createObjectNode();
        node.put("habitat_name", config.getHabitatName());
        node.put("crew", config.getCrew());
        node.put("duration_days", config.getDurationDays());
        node.put("habitat_type", config.getHabitatType().label());
        node.put("pressurized_volume_m3", config.getPressurizedVolumeM3());
        node.put("target_isru_ratio", config.getTargetIsruRatio());
        node.put("docking_ports", config.getDockingPorts());
        node.put("seed", config.getSeed());
        return write(node);
    }

    /**
     * Reads a generator config; absent keys keep {@link GeneratorConfig#defaults()} values.
     *
     * @throws LayoutConfigurationException on malformed JSON or mistyped fields.
     */
    public GeneratorConfig readConfig(String json) {
        JsonNode node = parseConfig(json);
        GeneratorConfig defaults = GeneratorConfig.defaults();
        HabitatType habitatType;
        try {
            habitatType = HabitatType.fromLabel(configText(node, "habitat_type", defaults.getHabitatType().label()));
        } catch (LayoutContractException ex) {
            throw new LayoutConfigurationException(LayoutConfigurationException.REASON_MALFORMED, ex.getMessage(), ex);
        }
        return GeneratorConfig.builder()
                .habitatName(configText(node, "habitat_name", defaults.getHabitatName()))
                .crew(configInt(node, "crew", defaults.getCrew()))
                .durationDays(configInt(node, "duration_days", defaults.getDurationDays()))
                .habitatType(habitatType)
                .pressurizedVolumeM3(configNumber(node, "pressurized_volume_m3", defaults.getPressurizedVolumeM3()))
                .targetIsruRatio(configNumber(node, "target_isru_ratio", defaults.getTargetIsruRatio()))
                .dockingPorts(configInt(node, "docking_ports", defaults.getDockingPorts()))
                .seed(configLong(node, "seed", defaults.getSeed()))
                .build();
    }

    // ------------------------------------------------------------------------
    // Tree helpers
    // ------------------------------------------------------------------------

    private String write(JsonNode node) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize JSON tree", ex);
        }
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(Objects.requireNonNull(json, "json"));
        } catch (JsonProcessingException ex) {
            throw new LayoutContractException(
                    LayoutContractException.REASON_MALFORMED_DOCUMENT,
                    "document is not valid JSON: " + ex.getOriginalMessage(),
                    ex
            );
        }
    }

    private JsonNode parseConfig(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(Objects.requireNonNull(json, "json"));
        } catch (JsonProcessingException ex) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_MALFORMED,
                    "config is not valid JSON: " + ex.getOriginalMessage(),
                    ex
            );
        }
        if (node == null || !node.isObject()) {
            throw new LayoutConfigurationException(LayoutConfigurationException.REASON_MALFORMED, "config must be a JSON object");
        }
        return node;
    }

    private static double configNumber(JsonNode node, String name, double fallback) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isNumber()) {
            throw new LayoutConfigurationException(LayoutConfigurationException.REASON_MALFORMED, name + " must be numeric");
        }
        return value.doubleValue();
    }

    private static int configInt(JsonNode node, String name, int fallback) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new LayoutConfigurationException(LayoutConfigurationException.REASON_MALFORMED, name + " must be an integer");
        }
        return value.intValue();
    }

    private static long configLong(JsonNode node, String name, long fallback) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new LayoutConfigurationException(LayoutConfigurationException.REASON_MALFORMED, name + " must be an integer");
        }
        return value.longValue();
    }

    private static String configText(JsonNode node, String name, String fallback) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isTextual()) {
            throw new LayoutConfigurationException(LayoutConfigurationException.REASON_MALFORMED, name + " must be a string");
        }
        return value.textValue();
    }

    private static JsonNode field(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            throw new LayoutContractException(LayoutContractException.REASON_FIELD_REQUIRED, name + " is required");
        }
        return value;
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw malformed(what + " must be a JSON object");
        }
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if (!value.isTextual()) {
            throw malformed(name + " must be a string");
        }
        return value.textValue();
    }

    private static double number(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if (!value.isNumber()) {
            throw malformed(name + " must be numeric");
        }
        return value.doubleValue();
    }

    private static int integer(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw malformed(name + " must be an integer");
        }
        return value.intValue();
    }

    private static boolean bool(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if (!value.isBoolean()) {
            throw malformed(name + " must be a boolean");
        }
        return value.booleanValue();
    }

    private static boolean optionalBoolean(JsonNode node, String name, boolean fallback) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw malformed(name + " must be a boolean");
        }
        return value.booleanValue();
    }

    private static JsonNode array(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if (!value.isArray()) {
            throw malformed(name + " must be an array");
        }
        return value;
    }

    private static List<String> optionalTexts(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw malformed(name + " must be an array of strings");
        }
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw malformed(name + " must contain only strings");
            }
            result.add(item.textValue());
        }
        return result;
    }

    private static Object metadataValueFrom(JsonNode value, String path) {
        if (value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw malformed(path + " is out of range");
            }
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isArray()) {
            List<Object> items = new ArrayList<>(value.size());
            for (int i = 0; i < value.size(); i++) {
                items.add(metadataValueFrom(value.get(i), path + "[" + i + "]"));
            }
            return items;
        }
        if (value.isObject()) {
            Map<String, Object> fields = new LinkedHashMap<>(value.size());
            Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                fields.put(entry.getKey(), metadataValueFrom(entry.getValue(), path + "." + entry.getKey()));
            }
            return fields;
        }
        throw malformed(path + " has an unsupported JSON type");
    }

    private static LayoutContractException malformed(String message) {
        return new LayoutContractException(LayoutContractException.REASON_MALFORMED_DOCUMENT, message);
    }
}

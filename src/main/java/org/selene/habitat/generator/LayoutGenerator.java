package org.selene.habitat.generator;

import lombok.extern.slf4j.Slf4j;
import org.selene.habitat.model.CommsSystem;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.DustMitigation;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.LayoutConfigurationException;
import org.selene.habitat.model.PowerSystem;
import org.selene.habitat.model.Systems;
import org.selene.habitat.model.ThermalSystem;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.model.Zone;
import org.selene.habitat.model.ZoneKind;
import org.selene.habitat.validation.ConstraintRules;
import org.selene.habitat.validation.ConstraintValidator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;

/**
 * Builds an initial, feasible layout from a {@link GeneratorConfig}.
 *
 * <p>Generation flow:</p>
 * <ul>
 * <li>Check crew and duration against the configured mission envelope.</li>
 * <li>Split the target volume across catalog zones by volume fraction.</li>
 * <li>Scale crew-sensitive zones by {@code max(1, crew / 4)}.</li>
 * <li>Jitter each zone by up to ±5%, floor at 5 m³, then rescale so zone volumes sum to the target.</li>
 * <li>Attach the fixed systems template, shielding and ISRU ratio.</li>
 * <li>Validate; when the only failures are NHV rules, grow the living zones once and re-validate.</li>
 * </ul>
 *
 * <p>All randomness comes from the caller's {@link SplittableRandom}; the generator holds no
 * random state of its own.</p>
 */
@Slf4j
public final class LayoutGenerator {
    static final double MIN_ZONE_VOLUME_M3 = 5.0d;
    static final double JITTER = 0.05d;
    static final double BASELINE_CREW = 4.0d;
    static final double DEFAULT_STORAGE_KWH = 160.0d;
    static final int BASELINE_AUTONOMY_DAYS = 14;
    static final double MIN_ISRU_RATIO = 0.5d;

    private static final Set<ZoneKind> HEALED_ZONES = EnumSet.of(
            ZoneKind.CREW_QUARTERS,
            ZoneKind.GALLEY_DINING,
            ZoneKind.HYGIENE_MEDICAL,
            ZoneKind.STORM_SHELTER
    );

    private final ZoneCatalog catalog;
    private final ConstraintValidator validator;

    public LayoutGenerator() {
        this(ZoneCatalog.defaults(), new ConstraintValidator());
    }

    public LayoutGenerator(ZoneCatalog catalog, ConstraintValidator validator) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Generates a layout using a random stream seeded from {@code config.seed}.
     */
    public Layout generate(GeneratorConfig config, ConstraintSettings settings) {
        Objects.requireNonNull(config, "config");
        return generate(config, settings, new SplittableRandom(config.getSeed()));
    }

    /**
     * Generates a layout drawing jitter from the supplied random stream.
     *
     * @param config generation parameters.
     * @param settings mission thresholds the result must satisfy.
     * @param random explicit random source; advanced by one draw per zone.
     * @return feasible layout.
     * @throws LayoutConfigurationException when crew, duration or volume are out of bounds.
     * @throws LayoutGenerationException when the single repair pass cannot reach feasibility.
     */
    public Layout generate(GeneratorConfig config, ConstraintSettings settings, SplittableRandom random) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(random, "random");
        checkConfig(config, settings);

        Layout layout = assemble(config, settings, allocateVolumes(config, random));
        ValidationResult result = validator.validate(layout, settings);
        if (!result.isPassed() && onlyNhvFailures(result)) {
            log.warn("Layout {} short on habitable volume ({}); applying one repair pass",
                    layout.getHabitatName(), result.getFailedRules());
            layout = growLivingZones(layout, settings);
            result = validator.validate(layout, settings);
        }
        if (!result.isPassed()) {
            throw new LayoutGenerationException(result.getFailedRules());
        }

        log.info("Generated layout {}: crew={}, zones={}, volume={} m³",
                layout.getHabitatName(), config.getCrew(), layout.getZones().size(),
                String.format(Locale.ROOT, "%.1f", layout.getPressurizedVolumeM3()));
        return layout;
    }

    private static void checkConfig(GeneratorConfig config, ConstraintSettings settings) {
        if (config.getCrew() < settings.getMinCrew() || config.getCrew() > settings.getMaxCrew()) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_CREW_OUT_OF_RANGE,
                    "Config crew " + config.getCrew() + " outside supported range "
                            + settings.getMinCrew() + "-" + settings.getMaxCrew()
            );
        }
        if (config.getDurationDays() < settings.getMinDurationDays()
                || config.getDurationDays() > settings.getMaxDurationDays()) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_DURATION_OUT_OF_RANGE,
                    "Config duration " + config.getDurationDays() + " days outside supported range "
                            + settings.getMinDurationDays() + "-" + settings.getMaxDurationDays()
            );
        }
        double volume = config.getPressurizedVolumeM3();
        if (!Double.isFinite(volume) || volume <= 0.0d) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_VOLUME_INVALID,
                    "pressurized volume must be finite and > 0, got " + volume
            );
        }
        if (config.getHabitatType() == null) {
            throw new LayoutConfigurationException(
                    LayoutConfigurationException.REASON_MALFORMED,
                    "habitat type is required"
            );
        }
    }

    /**
     * Returns zone volumes in catalog order, summing to the configured pressurized volume.
     */
    private double[] allocateVolumes(GeneratorConfig config, SplittableRandom random) {
        List<ZoneTemplate> templates = catalog.templates();
        double target = config.getPressurizedVolumeM3();
        double fractionTotal = catalog.fractionTotal();
        double crewScale = Math.max(1.0d, config.getCrew() / BASELINE_CREW);

        double[] volumes = new double[templates.size()];
        for (int i = 0; i < volumes.length; i++) {
            ZoneTemplate template = templates.get(i);
            double volume = target * template.getVolumeFraction() / fractionTotal;
            if (template.isCrewScaled()) {
                volume *= crewScale;
            }
            volumes[i] = volume;
        }

        double sum = 0.0d;
        for (int i = 0; i < volumes.length; i++) {
            double jitter = random.nextDouble(-JITTER, JITTER);
            volumes[i] = Math.max(volumes[i] * (1.0d + jitter), MIN_ZONE_VOLUME_M3);
            sum += volumes[i];
        }

        double scaling = sum > 0.0d ? target / sum : 1.0d;
        for (int i = 0; i < volumes.length; i++) {
            volumes[i] *= scaling;
        }
        return volumes;
    }

    private Layout assemble(GeneratorConfig config, ConstraintSettings settings, double[] volumes) {
        List<ZoneTemplate> templates = catalog.templates();
        List<Zone> zones = new ArrayList<>(templates.size());
        for (int i = 0; i < templates.size(); i++) {
            ZoneTemplate template = templates.get(i);
            zones.add(Zone.builder()
                    .kind(template.getKind())
                    .volumeM3(volumes[i])
                    .usableRatio(template.getUsableRatio())
                    .privacy(template.getPrivacy())
                    .connections(template.getConnections())
                    .acousticIsolation(template.getAcousticIsolation())
                    .lighting(template.getLighting())
                    .pressurized(true)
                    .egress(template.isEgress())
                    .equipment(template.getEquipment())
                    .build());
        }

        return Layout.builder()
                .habitatName(config.getHabitatName())
                .habitatType(config.getHabitatType())
                .pressurizedVolumeM3(config.getPressurizedVolumeM3())
                .zones(zones)
                .systems(systemsTemplate(settings))
                .shieldEquivalentGCm2(Math.max(5.5d, 5.0d + 0.2d * config.getCrew()))
                .isruRatio(Math.min(1.0d, Math.max(MIN_ISRU_RATIO, config.getTargetIsruRatio())))
                .dockingPorts(config.getDockingPorts())
                .metadataEntry(Layout.META_CREW, config.getCrew())
                .metadataEntry(Layout.META_DURATION_DAYS, config.getDurationDays())
                .metadataEntry(Layout.META_SEED, config.getSeed())
                .build();
    }

    private static Systems systemsTemplate(ConstraintSettings settings) {
        return Systems.builder()
                .eclssRedundancyLoops(2)
                .waterRecyclingRate(0.92d)
                .power(PowerSystem.of(
                        "Solar+Battery",
                        Math.max(settings.getMinPowerAutonomyDays(), BASELINE_AUTONOMY_DAYS),
                        DEFAULT_STORAGE_KWH
                ))
                .thermal(ThermalSystem.of("heat-pump", -173.0d, 127.0d))
                .comms(CommsSystem.of(true, "HALO-link"))
                .dustMitigation(DustMitigation.of(true, true, true))
                .build();
    }

    private static boolean onlyNhvFailures(ValidationResult result) {
        for (String rule : result.getFailedRules()) {
            if (!ConstraintRules.isNhvRule(rule)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Scales the living zones by {@code sqrt(requiredNhv / currentNhv)} and recomputes the
     * pressurized volume from the new zone sum.
     */
    private static Layout growLivingZones(Layout layout, ConstraintSettings settings) {
        double needed = layout.crew() * settings.getMinNhvPerPerson();
        double current = layout.netHabitableVolume();
        double boost = current > 0.0d ? Math.sqrt(needed / current) : 1.1d;

        List<Zone> grown = new ArrayList<>(layout.getZones().size());
        for (Zone zone : layout.getZones()) {
            grown.add(HEALED_ZONES.contains(zone.getKind()) ? zone.withVolumeM3(zone.getVolumeM3() * boost) : zone);
        }
        return layout.withZonesResummed(grown);
    }
}

package org.selene.habitat.io;

import lombok.experimental.UtilityClass;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.Metrics;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.model.Zone;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable exports of a scored layout.
 */
@UtilityClass
public final class LayoutReport {

    /**
     * Renders a Markdown summary: mission header, zone table, systems, metrics and the
     * validation messages.
     */
    public String markdown(Layout layout, Metrics metrics, ValidationResult validation) {
        List<String> lines = new ArrayList<>();
        lines.add("# " + layout.getHabitatName() + " Summary");
        lines.add("");
        lines.add("- Crew: " + layout.crew());
        lines.add("- Duration: " + layout.durationDays() + " days");
        lines.add("- Habitat Type: " + layout.getHabitatType().label());
        lines.add("- ISRU Ratio: " + fmt("%.2f", layout.getIsruRatio()));
        lines.add("- Power Autonomy: " + layout.getSystems().getPower().autonomyDays() + " days");
        lines.add("");

        lines.add("## Zones");
        lines.add("| Zone | Volume (m³) | Usable | Privacy | Connections | Equipment |");
        lines.add("| --- | --- | --- | --- | --- | --- |");
        for (Zone zone : layout.getZones()) {
            lines.add("| " + zone.getName()
                    + " | " + fmt("%.1f", zone.getVolumeM3())
                    + " | " + fmt("%.2f", zone.getUsableRatio())
                    + " | " + zone.getPrivacy().label()
                    + " | " + String.join(", ", zone.getConnections())
                    + " | " + String.join(", ", zone.getEquipment())
                    + " |");
        }
        lines.add("");

        lines.add("## Systems");
        lines.add("- ECLSS loops: " + layout.getSystems().getEclssRedundancyLoops());
        lines.add("- Water recycling: " + fmt("%.2f", layout.getSystems().getWaterRecyclingRate()));
        lines.add("- Power storage: " + fmt("%.1f", layout.getSystems().getPower().storageKwh()) + " kWh");
        lines.add("- Shielding: " + fmt("%.1f", layout.getShieldEquivalentGCm2()) + " g/cm²");
        lines.add("");

        lines.add("## Metrics");
        lines.add("- NHV: " + fmt("%.1f", metrics.getNhvM3()) + " m³");
        lines.add("- NHV Efficiency: " + fmt("%.2f", metrics.getNhvEfficiency()));
        lines.add("- Privacy Score: " + fmt("%.2f", metrics.getPrivacyScore()));
        lines.add("- Transit Score: " + fmt("%.2f", metrics.getTransitDistanceScore()));
        lines.add("- Sustainability Score: " + fmt("%.2f", metrics.getSustainabilityScore()));
        lines.add("- Energy Use (kWh/person-day): " + fmt("%.2f", metrics.getEnergyUseKwhPerPersonDay()));
        lines.add("- Safety Score: " + fmt("%.2f", metrics.getSafetyRedundancyScore()));
        lines.add("");

        lines.add("## Validation");
        lines.add("- Status: " + (validation.isPassed() ? "PASSED" : "FAILED"));
        if (!validation.isPassed()) {
            lines.add("- Failed rules: " + String.join(", ", validation.getFailedRules()));
        }
        for (String message : validation.getMessages()) {
            lines.add("- " + message);
        }
        return String.join("\n", lines) + "\n";
    }

    /**
     * Renders the metrics as a two-column CSV table with a {@code Metric,Value} header.
     */
    public String csv(Metrics metrics) {
        StringBuilder out = new StringBuilder("Metric,Value\n");
        row(out, "nhv_m3", Double.toString(metrics.getNhvM3()));
        row(out, "nhv_efficiency", Double.toString(metrics.getNhvEfficiency()));
        row(out, "transit_distance_score", Double.toString(metrics.getTransitDistanceScore()));
        row(out, "privacy_score", Double.toString(metrics.getPrivacyScore()));
        row(out, "sustainability_score", Double.toString(metrics.getSustainabilityScore()));
        row(out, "energy_use_kwh_per_person_day", Double.toString(metrics.getEnergyUseKwhPerPersonDay()));
        row(out, "safety_redundancy_score", Double.toString(metrics.getSafetyRedundancyScore()));
        row(out, "feasibility", Boolean.toString(metrics.isFeasibility()));
        return out.toString();
    }

    private void row(StringBuilder out, String metric, String value) {
        out.append(metric).append(',').append(value).append('\n');
    }

    private String fmt(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}

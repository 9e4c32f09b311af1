package org.selene.app;

import lombok.extern.slf4j.Slf4j;
import org.selene.habitat.core.HabitatCore;
import org.selene.habitat.generator.GeneratorConfig;
import org.selene.habitat.io.LayoutCodec;
import org.selene.habitat.io.LayoutReport;
import org.selene.habitat.model.ConstraintSettings;
import org.selene.habitat.model.Layout;
import org.selene.habitat.model.OptimizationResult;
import org.selene.habitat.model.ScoreWeights;
import org.selene.habitat.model.ValidationResult;
import org.selene.habitat.optimizer.OptimizerDefaults;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Minimal application entry point used for local smoke runs.
 */
@Slf4j
public class Main {
    /**
     * Generates, validates and optimizes one habitat and logs the Markdown summary.
     *
     * @param args optional path to a JSON generator config; built-in defaults otherwise.
     * @throws IOException when the config file cannot be read.
     */
    public static void main(String[] args) throws IOException {
        LayoutCodec codec = new LayoutCodec();
        GeneratorConfig config = args.length > 0
                ? codec.readConfig(Files.readString(Path.of(args[0]), StandardCharsets.UTF_8))
                : GeneratorConfig.defaults();
        ConstraintSettings settings = ConstraintSettings.defaults();
        ScoreWeights weights = ScoreWeights.defaults();
        HabitatCore core = HabitatCore.defaults();

        Layout initial = core.generate(config, settings);
        ValidationResult initialCheck = core.validate(initial, settings);
        log.info("initial layout {} passed={} failed={}",
                initial.getHabitatName(), initialCheck.isPassed(), initialCheck.getFailedRules());

        OptimizationResult result = core.optimize(
                initial,
                OptimizerDefaults.iterations(),
                settings,
                weights,
                OptimizerDefaults.seed()
        );
        ValidationResult finalCheck = core.validate(result.getLayout(), settings);
        log.info("optimized score={} accepted={} rejected={}",
                result.getScore(), result.acceptedCount(), result.rejectedCount());
        log.info("\n{}", LayoutReport.markdown(result.getLayout(), result.getMetrics(), finalCheck));
    }
}

/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.xnatworks.mrestats.config.AnalysisConfig;
import io.xnatworks.mrestats.core.AnalysisLogger;
import io.xnatworks.mrestats.core.Slf4jAnalysisLogger;
import io.xnatworks.mrestats.model.LocationMetadata;
import io.xnatworks.mrestats.model.MeasurementResult;
import io.xnatworks.mrestats.resolve.PathSpec;
import io.xnatworks.mrestats.resolve.ResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * MRE Contrast Statistics - command line entry point.
 *
 * Measures mmdi3d contrasts (storage, loss, attenuation, damping ratio) inside the
 * Hepatogram Plus liver ROIs of one series and prints the result as JSON.
 */
@Command(name = "mre-stats",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Measure MRE contrast statistics inside Hepatogram Plus ROIs",
        subcommands = {
                MreStats.MeasureCommand.class,
                MreStats.SlicesCommand.class
        })
public class MreStats implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(MreStats.class);

    @Option(names = {"-c", "--config"}, description = "Config file path (built-in defaults when omitted)")
    protected File configFile;

    @Spec
    private Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MreStats()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    AnalysisConfig loadConfig() throws IOException {
        return configFile != null ? AnalysisConfig.load(configFile) : new AnalysisConfig();
    }

    static ObjectMapper jsonMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Options shared by the commands that resolve a series from its digest.
     */
    static class SeriesOptions {
        @Parameters(index = "0", description = "Hepatogram Plus digest (.alc2)")
        Path digest;

        @Option(names = {"--temp-dir"}, defaultValue = PathSpec.AUTO_KEYWORD,
                description = "Folder holding the ROI files (default: the digest's folder)")
        String tempDir;

        @Option(names = {"--inversion-dir"}, defaultValue = PathSpec.AUTO_KEYWORD,
                description = "mmdi3d output folder (default: located from the digest)")
        String inversionDir;
    }

    // ========================================================================
    // MEASURE COMMAND - Contrast statistics per region
    // ========================================================================

    @Command(name = "measure", description = "Compute contrast statistics inside the ROIs of a series")
    static class MeasureCommand implements Callable<Integer> {

        @ParentCommand
        private MreStats parent;

        @Spec
        private Model.CommandSpec spec;

        @Mixin
        private SeriesOptions series;

        @Option(names = {"--exclude-negative-pixels"},
                description = "Drop negative contrast values before computing statistics")
        private boolean excludeNegativePixels;

        @Override
        public Integer call() throws Exception {
            PrintWriter err = spec.commandLine().getErr();
            AnalysisConfig config;
            try {
                config = parent.loadConfig();
            } catch (IOException e) {
                err.println("Cannot load configuration: " + e.getMessage());
                return 1;
            }

            boolean exclude = excludeNegativePixels || config.isExcludeNegativePixels();
            AnalysisLogger logger = Slf4jAnalysisLogger.forClass(Mmdi3dContrastMeasurement.class);
            try {
                MeasurementResult result = new Mmdi3dContrastMeasurement(config).measureContrastsInRois(
                        series.digest, PathSpec.parse(series.tempDir), PathSpec.parse(series.inversionDir),
                        exclude, logger);
                PrintWriter out = spec.commandLine().getOut();
                out.println(jsonMapper().writeValueAsString(result));
                out.flush();
                return 0;
            } catch (ResolutionException e) {
                log.error("Measurement failed for {}: {}", series.digest, e.getMessage());
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    // ========================================================================
    // SLICES COMMAND - Slice binding only
    // ========================================================================

    @Command(name = "slices", description = "Show how the ROI slices of a series match the contrast slices")
    static class SlicesCommand implements Callable<Integer> {

        @ParentCommand
        private MreStats parent;

        @Spec
        private Model.CommandSpec spec;

        @Mixin
        private SeriesOptions series;

        @Override
        public Integer call() throws Exception {
            PrintWriter err = spec.commandLine().getErr();
            AnalysisConfig config;
            try {
                config = parent.loadConfig();
            } catch (IOException e) {
                err.println("Cannot load configuration: " + e.getMessage());
                return 1;
            }

            AnalysisLogger logger = Slf4jAnalysisLogger.forClass(Mmdi3dContrastMeasurement.class);
            try {
                LocationMetadata metadata = new Mmdi3dContrastMeasurement(config).locateSlices(
                        series.digest, PathSpec.parse(series.tempDir), PathSpec.parse(series.inversionDir), logger);
                PrintWriter out = spec.commandLine().getOut();
                out.println(jsonMapper().writeValueAsString(metadata));
                out.flush();
                return 0;
            } catch (ResolutionException e) {
                log.error("Slice lookup failed for {}: {}", series.digest, e.getMessage());
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }
}

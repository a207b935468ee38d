/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.mrestats.config;

import io.xnatworks.mrestats.config.AnalysisConfig.DirectContrast;
import io.xnatworks.mrestats.config.AnalysisConfig.RatioContrast;
import io.xnatworks.mrestats.core.Statistic;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AnalysisConfig.
 */
@DisplayName("AnalysisConfig Tests")
class AnalysisConfigTest {

    @TempDir
    Path tempDir;

    private File write(String yaml) throws IOException {
        File configFile = tempDir.resolve("config.yaml").toFile();
        Files.writeString(configFile.toPath(), yaml);
        return configFile;
    }

    @Nested
    @DisplayName("Default Values Tests")
    class DefaultValuesTests {

        @Test
        @DisplayName("Should have correct default measurement settings")
        void shouldHaveDefaultSettings() {
            AnalysisConfig config = new AnalysisConfig();

            assertEquals(0.01, config.getSliceLocationTolerance());
            assertEquals(2, config.getDecimalPlaces());
            assertEquals("N/A", config.getEmptyValue());
            assertFalse(config.isExcludeNegativePixels());
            assertEquals("3dmmdi", config.getInversionDirName());
            assertEquals(List.of(Statistic.MEAN, Statistic.STDDEV, Statistic.MEDIAN, Statistic.RANGE),
                    config.getStatisticList());
        }

        @Test
        @DisplayName("Should have the mmdi3d contrasts by default")
        void shouldHaveDefaultContrasts() {
            AnalysisConfig config = new AnalysisConfig();

            assertEquals(4, config.getContrasts().size());
            assertEquals(3, config.getDirectContrasts().size());
            DirectContrast storage = config.getDirectContrasts().get(0);
            assertEquals("storage", storage.getName());
            assertEquals("26", storage.getSeriesSuffix());
            assertEquals(1e-3, storage.getScale());
            RatioContrast damping = (RatioContrast) config.getContrasts().get(3);
            assertEquals("loss", damping.getNumerator());
            assertEquals("storage", damping.getDenominator());
            assertEquals(0.5, damping.getFactor());
        }

        @Test
        @DisplayName("Default configuration should be valid")
        void defaultsAreValid() {
            assertDoesNotThrow(() -> new AnalysisConfig().validate());
            assertEquals(List.of("liver"), new AnalysisConfig().getRegionNames());
        }
    }

    @Nested
    @DisplayName("YAML Loading Tests")
    class YamlLoadingTests {

        @Test
        @DisplayName("Should load settings from YAML file")
        void shouldLoadSettings() throws IOException {
            File configFile = write("""
                    slice_location_tolerance: 0.5
                    decimal_places: 3
                    empty_value: "-"
                    exclude_negative_pixels: true
                    inversion_dir_name: mmdi3d_out
                    statistics: [mean, count]
                    """);

            AnalysisConfig config = AnalysisConfig.load(configFile);

            assertEquals(0.5, config.getSliceLocationTolerance());
            assertEquals(3, config.getDecimalPlaces());
            assertEquals("-", config.getEmptyValue());
            assertTrue(config.isExcludeNegativePixels());
            assertEquals("mmdi3d_out", config.getInversionDirName());
            assertEquals(List.of(Statistic.MEAN, Statistic.COUNT), config.getStatisticList());
            assertEquals(configFile, config.getConfigFile());
            assertEquals(4, config.getContrasts().size());
        }

        @Test
        @DisplayName("Should load typed contrasts and labelled regions")
        void shouldLoadContrastsAndRegions() throws IOException {
            File configFile = write("""
                    contrasts:
                      - name: storage
                        series_suffix: "26"
                        scale: 0.001
                        unit: kPa
                      - type: direct
                        name: loss
                        series_suffix: "27"
                      - type: ratio
                        name: damping_ratio
                        numerator: loss
                        denominator: storage
                        factor: 0.5
                    regions:
                      - name: right_lobe
                        label: 1
                      - name: left_lobe
                        label: 2
                    """);

            AnalysisConfig config = AnalysisConfig.load(configFile);

            assertEquals(3, config.getContrasts().size());
            assertTrue(config.getContrasts().get(0) instanceof DirectContrast);
            assertEquals(1.0, ((DirectContrast) config.getContrasts().get(1)).getScale());
            assertTrue(config.getContrasts().get(2) instanceof RatioContrast);
            assertEquals(List.of("right_lobe", "left_lobe"), config.getRegionNames());
            assertTrue(config.getRegions().get(1).contains(2));
            assertFalse(config.getRegions().get(1).contains(1));
        }

        @Test
        @DisplayName("Empty file should give defaults")
        void emptyFileGivesDefaults() throws IOException {
            AnalysisConfig config = AnalysisConfig.load(write(""));

            assertEquals(0.01, config.getSliceLocationTolerance());
            assertEquals(4, config.getContrasts().size());
        }

        @Test
        @DisplayName("Should ignore unknown keys")
        void shouldIgnoreUnknownKeys() throws IOException {
            AnalysisConfig config = AnalysisConfig.load(write("decimal_places: 1\nfuture_option: yes\n"));

            assertEquals(1, config.getDecimalPlaces());
        }

        @Test
        @DisplayName("Missing file should throw")
        void missingFileThrows() {
            assertThrows(FileNotFoundException.class,
                    () -> AnalysisConfig.load(tempDir.resolve("absent.yaml").toString()));
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should reject negative tolerance")
        void rejectsNegativeTolerance() {
            IOException e = assertThrows(IOException.class,
                    () -> AnalysisConfig.load(write("slice_location_tolerance: -1\n")));
            assertTrue(e.getMessage().contains("slice_location_tolerance"));
        }

        @Test
        @DisplayName("Should reject unknown statistics")
        void rejectsUnknownStatistic() {
            AnalysisConfig config = new AnalysisConfig();
            config.setStatistics(List.of("mean", "mode"));

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("Should reject duplicate regions")
        void rejectsDuplicateRegions() {
            AnalysisConfig config = new AnalysisConfig();
            config.setRegions(List.of(AnalysisConfig.RegionDefinition.of("liver", null),
                    AnalysisConfig.RegionDefinition.of("liver", 1)));

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("Should reject direct contrast without suffix")
        void rejectsMissingSuffix() {
            AnalysisConfig config = new AnalysisConfig();
            config.setContrasts(List.of(DirectContrast.of("storage", null, 1.0, "kPa")));

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("Should reject ratio of unknown contrasts")
        void rejectsDanglingRatio() {
            AnalysisConfig config = new AnalysisConfig();
            config.setContrasts(List.of(DirectContrast.of("storage", "26", 1.0, "kPa"),
                    RatioContrast.of("damping_ratio", "loss", "storage", 0.5)));

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
            assertTrue(e.getMessage().contains("damping_ratio"));
        }
    }
}

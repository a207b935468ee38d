/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.mrestats.core.Statistic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Measurement configuration.
 *
 * Every field has a default, so an empty YAML file (or no file at all) gives the
 * standard mmdi3d liver measurement:
 * - contrasts storage, loss, attenuation and damping_ratio
 * - one region, liver, covering every positive ROI pixel
 * - mean, stddev, median and interquartile range with two decimals
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisConfig {
    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    /**
     * Maximum SliceLocation difference (mm) for an ROI slice to match a contrast slice.
     * Must stay below half the slice spacing of the inversion output.
     */
    @JsonProperty("slice_location_tolerance")
    private double sliceLocationTolerance = 0.01;

    /**
     * Digits after the decimal point in formatted statistics.
     */
    @JsonProperty("decimal_places")
    private int decimalPlaces = 2;

    /**
     * Value reported for a statistic with no contributing pixels.
     */
    @JsonProperty("empty_value")
    private String emptyValue = "N/A";

    /**
     * Drop negative contrast pixels (inversion artifacts) before computing statistics.
     */
    @JsonProperty("exclude_negative_pixels")
    private boolean excludeNegativePixels = false;

    /**
     * Name of the inversion output folder looked up next to the case when none is given.
     */
    @JsonProperty("inversion_dir_name")
    private String inversionDirName = "3dmmdi";

    /**
     * Statistic names, in report order. See {@link Statistic} for the available names.
     */
    private List<String> statistics = new ArrayList<>(Arrays.asList("mean", "stddev", "median", "range"));

    private List<ContrastDefinition> contrasts = defaultContrasts();

    private List<RegionDefinition> regions = defaultRegions();

    /**
     * Path to the config file (set when loaded).
     */
    private transient File configFile;

    public static AnalysisConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        if (!configFile.isFile()) {
            throw new FileNotFoundException("Config file not found: " + configFile.getAbsolutePath());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AnalysisConfig config = configFile.length() > 0 ? mapper.readValue(configFile, AnalysisConfig.class) : null;
        if (config == null) {
            // empty document
            config = new AnalysisConfig();
        }
        config.configFile = configFile;
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid configuration " + configFile + ": " + e.getMessage(), e);
        }
        return config;
    }

    public static AnalysisConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Check cross-field constraints.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (!(sliceLocationTolerance >= 0) || Double.isInfinite(sliceLocationTolerance)) {
            throw new IllegalArgumentException("slice_location_tolerance must be a finite value >= 0, got "
                    + sliceLocationTolerance);
        }
        if (decimalPlaces < 0 || decimalPlaces > 10) {
            throw new IllegalArgumentException("decimal_places must be between 0 and 10, got " + decimalPlaces);
        }
        if (statistics == null || statistics.isEmpty()) {
            throw new IllegalArgumentException("At least one statistic must be configured");
        }
        getStatisticList();
        if (regions == null || regions.isEmpty()) {
            throw new IllegalArgumentException("At least one region must be configured");
        }
        Set<String> regionNames = new HashSet<>();
        for (RegionDefinition region : regions) {
            if (region.getName() == null || region.getName().isBlank()) {
                throw new IllegalArgumentException("Region without a name");
            }
            if (!regionNames.add(region.getName())) {
                throw new IllegalArgumentException("Duplicate region: " + region.getName());
            }
        }
        if (contrasts == null || contrasts.isEmpty()) {
            throw new IllegalArgumentException("At least one contrast must be configured");
        }
        Set<String> directNames = new HashSet<>();
        Set<String> allNames = new HashSet<>();
        for (ContrastDefinition contrast : contrasts) {
            if (contrast.getName() == null || contrast.getName().isBlank()) {
                throw new IllegalArgumentException("Contrast without a name");
            }
            if (!allNames.add(contrast.getName())) {
                throw new IllegalArgumentException("Duplicate contrast: " + contrast.getName());
            }
            if (contrast instanceof DirectContrast) {
                DirectContrast direct = (DirectContrast) contrast;
                if (direct.getSeriesSuffix() == null || direct.getSeriesSuffix().isEmpty()) {
                    throw new IllegalArgumentException("Contrast " + contrast.getName() + " has no series_suffix");
                }
                directNames.add(contrast.getName());
            }
        }
        for (ContrastDefinition contrast : contrasts) {
            if (contrast instanceof RatioContrast) {
                RatioContrast ratio = (RatioContrast) contrast;
                if (!directNames.contains(ratio.getNumerator()) || !directNames.contains(ratio.getDenominator())) {
                    throw new IllegalArgumentException("Ratio contrast " + ratio.getName()
                            + " must reference two direct contrasts, got " + ratio.getNumerator()
                            + "/" + ratio.getDenominator());
                }
            }
        }
    }

    /**
     * @throws IllegalArgumentException if a configured name is unknown
     */
    @JsonIgnore
    public List<Statistic> getStatisticList() {
        List<Statistic> result = new ArrayList<>();
        for (String name : statistics) {
            result.add(Statistic.fromName(name));
        }
        return result;
    }

    @JsonIgnore
    public List<DirectContrast> getDirectContrasts() {
        List<DirectContrast> result = new ArrayList<>();
        for (ContrastDefinition contrast : contrasts) {
            if (contrast instanceof DirectContrast) {
                result.add((DirectContrast) contrast);
            }
        }
        return result;
    }

    @JsonIgnore
    public List<String> getRegionNames() {
        List<String> names = new ArrayList<>();
        for (RegionDefinition region : regions) {
            names.add(region.getName());
        }
        return names;
    }

    public static List<ContrastDefinition> defaultContrasts() {
        List<ContrastDefinition> list = new ArrayList<>();
        list.add(DirectContrast.of("storage", "26", 1e-3, "kPa"));
        list.add(DirectContrast.of("loss", "27", 1e-3, "kPa"));
        list.add(DirectContrast.of("attenuation", "28", 1e-4, "1/mm"));
        list.add(RatioContrast.of("damping_ratio", "loss", "storage", 0.5));
        return list;
    }

    public static List<RegionDefinition> defaultRegions() {
        List<RegionDefinition> list = new ArrayList<>();
        list.add(RegionDefinition.of("liver", null));
        return list;
    }

    // Getters and setters

    public double getSliceLocationTolerance() { return sliceLocationTolerance; }
    public void setSliceLocationTolerance(double sliceLocationTolerance) { this.sliceLocationTolerance = sliceLocationTolerance; }

    public int getDecimalPlaces() { return decimalPlaces; }
    public void setDecimalPlaces(int decimalPlaces) { this.decimalPlaces = decimalPlaces; }

    public String getEmptyValue() { return emptyValue; }
    public void setEmptyValue(String emptyValue) { this.emptyValue = emptyValue; }

    public boolean isExcludeNegativePixels() { return excludeNegativePixels; }
    public void setExcludeNegativePixels(boolean excludeNegativePixels) { this.excludeNegativePixels = excludeNegativePixels; }

    public String getInversionDirName() { return inversionDirName; }
    public void setInversionDirName(String inversionDirName) { this.inversionDirName = inversionDirName; }

    public List<String> getStatistics() { return statistics; }
    public void setStatistics(List<String> statistics) { this.statistics = statistics; }

    public List<ContrastDefinition> getContrasts() { return contrasts; }
    public void setContrasts(List<ContrastDefinition> contrasts) { this.contrasts = contrasts; }

    public List<RegionDefinition> getRegions() { return regions; }
    public void setRegions(List<RegionDefinition> regions) { this.regions = regions; }

    public File getConfigFile() { return configFile; }

    /**
     * A contrast to report. Either read directly from an inversion series or derived from two of them.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = DirectContrast.class)
    @JsonSubTypes({
            @JsonSubTypes.Type(value = DirectContrast.class, name = "direct"),
            @JsonSubTypes.Type(value = RatioContrast.class, name = "ratio")
    })
    @JsonIgnoreProperties(ignoreUnknown = true)
    public abstract static class ContrastDefinition {
        private String name;
        private String unit;

        public abstract String getType();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUnit() { return unit; }
        public void setUnit(String unit) { this.unit = unit; }

        @Override
        public String toString() {
            return getType() + ":" + name;
        }
    }

    /**
     * Contrast stored by mmdi3d in its own series folder, {@code s<series><suffix>}.
     * Stored pixel values are multiplied by {@code scale} to give physical units.
     */
    public static class DirectContrast extends ContrastDefinition {
        @JsonProperty("series_suffix")
        private String seriesSuffix;

        private double scale = 1.0;

        public static DirectContrast of(String name, String seriesSuffix, double scale, String unit) {
            DirectContrast contrast = new DirectContrast();
            contrast.setName(name);
            contrast.setSeriesSuffix(seriesSuffix);
            contrast.setScale(scale);
            contrast.setUnit(unit);
            return contrast;
        }

        @Override
        public String getType() { return "direct"; }

        public String getSeriesSuffix() { return seriesSuffix; }
        public void setSeriesSuffix(String seriesSuffix) { this.seriesSuffix = seriesSuffix; }

        public double getScale() { return scale; }
        public void setScale(double scale) { this.scale = scale; }
    }

    /**
     * Pixel-wise {@code factor * numerator / denominator} of two direct contrasts on the same slice.
     * Damping ratio is {@code 0.5 * loss / storage}.
     */
    public static class RatioContrast extends ContrastDefinition {
        private String numerator;
        private String denominator;
        private double factor = 1.0;

        public static RatioContrast of(String name, String numerator, String denominator, double factor) {
            RatioContrast contrast = new RatioContrast();
            contrast.setName(name);
            contrast.setNumerator(numerator);
            contrast.setDenominator(denominator);
            contrast.setFactor(factor);
            return contrast;
        }

        @Override
        public String getType() { return "ratio"; }

        public String getNumerator() { return numerator; }
        public void setNumerator(String numerator) { this.numerator = numerator; }

        public String getDenominator() { return denominator; }
        public void setDenominator(String denominator) { this.denominator = denominator; }

        public double getFactor() { return factor; }
        public void setFactor(double factor) { this.factor = factor; }
    }

    /**
     * An ROI region. With no label, every positive ROI pixel belongs to the region;
     * otherwise only pixels equal to the label.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegionDefinition {
        private String name;
        private Integer label;

        public static RegionDefinition of(String name, Integer label) {
            RegionDefinition region = new RegionDefinition();
            region.setName(name);
            region.setLabel(label);
            return region;
        }

        public boolean contains(double roiValue) {
            return label == null ? roiValue > 0 : roiValue == label;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public Integer getLabel() { return label; }
        public void setLabel(Integer label) { this.label = label; }
    }
}

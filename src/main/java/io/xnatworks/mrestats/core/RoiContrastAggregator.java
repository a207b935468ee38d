/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.core;

import io.xnatworks.mrestats.config.AnalysisConfig;
import io.xnatworks.mrestats.config.AnalysisConfig.ContrastDefinition;
import io.xnatworks.mrestats.config.AnalysisConfig.DirectContrast;
import io.xnatworks.mrestats.config.AnalysisConfig.RatioContrast;
import io.xnatworks.mrestats.model.ContrastVolume;
import io.xnatworks.mrestats.model.RoiMask;
import io.xnatworks.mrestats.model.RoiMaskSet;
import io.xnatworks.mrestats.model.SliceBinding;
import io.xnatworks.mrestats.model.StatisticsRecord;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies ROI masks to contrast volumes and summarises the pooled pixels.
 *
 * For every (region, contrast) pair the in-ROI pixels of all bound slices are pooled into one set
 * and the configured statistics are computed over it. Every pair appears in the output; a pair
 * with no pixels gets the empty value for each statistic.
 */
public class RoiContrastAggregator {

    private final List<String> regions;
    private final List<ContrastDefinition> contrasts;
    private final List<Statistic> statistics;
    private final ValueFormatter formatter;
    private final String emptyValue;

    public RoiContrastAggregator(List<String> regions, List<ContrastDefinition> contrasts,
                                 List<Statistic> statistics, ValueFormatter formatter, String emptyValue) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.contrasts = Collections.unmodifiableList(new ArrayList<>(contrasts));
        this.statistics = Collections.unmodifiableList(new ArrayList<>(statistics));
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.emptyValue = Objects.requireNonNull(emptyValue, "emptyValue");
        if (this.statistics.isEmpty()) {
            throw new IllegalArgumentException("At least one statistic is required");
        }
    }

    public static RoiContrastAggregator fromConfig(AnalysisConfig config) {
        return new RoiContrastAggregator(config.getRegionNames(), config.getContrasts(),
                config.getStatisticList(), new ValueFormatter(config.getDecimalPlaces()), config.getEmptyValue());
    }

    /**
     * @param bindings              bound slices; order does not affect the result
     * @param masks                 ROI masks by region and slice number
     * @param volumes               contrast volumes by direct contrast name
     * @param excludeNegativePixels drop contrast values below zero before computing statistics
     * @param logger                receives warnings on missing data and empty pixel sets
     * @return one record per configured region, in configuration order
     */
    public Map<String, StatisticsRecord> aggregate(List<SliceBinding> bindings, RoiMaskSet masks,
                                                   Map<String, ContrastVolume> volumes,
                                                   boolean excludeNegativePixels, AnalysisLogger logger) {
        Map<String, StatisticsRecord> records = new LinkedHashMap<>();

        for (String region : regions) {
            StatisticsRecord record = new StatisticsRecord(region);
            for (ContrastDefinition contrast : contrasts) {
                DescriptiveStatistics pooled = pool(region, contrast, bindings, masks, volumes,
                        excludeNegativePixels, logger);
                if (pooled.getN() == 0) {
                    logger.warning("No valid pixels for " + contrast.getName() + " in region " + region
                            + ", reporting " + emptyValue);
                    for (Statistic statistic : statistics) {
                        record.put(contrast.getName(), statistic.getKey(), emptyValue);
                    }
                } else {
                    for (Statistic statistic : statistics) {
                        record.put(contrast.getName(), statistic.getKey(), statistic.compute(pooled, formatter));
                    }
                }
            }
            records.put(region, record);
        }

        return records;
    }

    private DescriptiveStatistics pool(String region, ContrastDefinition contrast, List<SliceBinding> bindings,
                                       RoiMaskSet masks, Map<String, ContrastVolume> volumes,
                                       boolean excludeNegativePixels, AnalysisLogger logger) {
        DescriptiveStatistics pooled = Statistic.newAccumulator();

        if (contrast instanceof DirectContrast) {
            poolDirect(region, (DirectContrast) contrast, bindings, masks, volumes, excludeNegativePixels, logger, pooled);
        } else if (contrast instanceof RatioContrast) {
            poolRatio(region, (RatioContrast) contrast, bindings, masks, volumes, excludeNegativePixels, logger, pooled);
        } else {
            logger.warning("Unsupported contrast type " + contrast.getType() + " for " + contrast.getName());
        }

        int contributing = 0;
        for (SliceBinding binding : bindings) {
            if (masks.get(region, binding.getSliceNumber()) != null) {
                contributing++;
            }
        }
        logger.info(region + "/" + contrast.getName() + ": " + pooled.getN() + " pixel(s) pooled from "
                + contributing + " masked slice(s)");
        return pooled;
    }

    private void poolDirect(String region, DirectContrast contrast, List<SliceBinding> bindings,
                            RoiMaskSet masks, Map<String, ContrastVolume> volumes,
                            boolean excludeNegativePixels, AnalysisLogger logger, DescriptiveStatistics pooled) {
        String name = contrast.getName();
        ContrastVolume volume = volumes.get(name);
        if (volume == null || volume.isEmpty()) {
            logger.warning("No " + name + " volume available");
            return;
        }

        for (SliceBinding binding : bindings) {
            if (!binding.hasContrast(name)) {
                logger.warning("Slice " + binding.getSliceNumber() + " has no " + name + " file, excluded for " + name);
                continue;
            }
            RoiMask mask = maskFor(region, binding, masks, volume, logger);
            if (mask == null) {
                continue;
            }

            double[] samples = volume.getSlice(binding.getContrastSliceIndex(name));
            for (int i = 0; i < samples.length; i++) {
                if (!mask.isInRoi(i)) {
                    continue;
                }
                double value = samples[i];
                if (excludeNegativePixels && value < 0) {
                    continue;
                }
                pooled.addValue(value * contrast.getScale());
            }
        }
    }

    private void poolRatio(String region, RatioContrast contrast, List<SliceBinding> bindings,
                           RoiMaskSet masks, Map<String, ContrastVolume> volumes,
                           boolean excludeNegativePixels, AnalysisLogger logger, DescriptiveStatistics pooled) {
        String numeratorName = contrast.getNumerator();
        String denominatorName = contrast.getDenominator();
        ContrastVolume numerator = volumes.get(numeratorName);
        ContrastVolume denominator = volumes.get(denominatorName);
        if (numerator == null || numerator.isEmpty() || denominator == null || denominator.isEmpty()) {
            logger.warning("No " + numeratorName + " and " + denominatorName + " volumes available for "
                    + contrast.getName());
            return;
        }
        if (numerator.getRows() != denominator.getRows() || numerator.getColumns() != denominator.getColumns()) {
            logger.warning(numeratorName + " and " + denominatorName + " volumes differ in size, "
                    + contrast.getName() + " not computed");
            return;
        }

        for (SliceBinding binding : bindings) {
            if (!binding.hasContrast(numeratorName) || !binding.hasContrast(denominatorName)) {
                logger.warning("Slice " + binding.getSliceNumber() + " lacks " + numeratorName + " or "
                        + denominatorName + " file, excluded for " + contrast.getName());
                continue;
            }
            RoiMask mask = maskFor(region, binding, masks, numerator, logger);
            if (mask == null) {
                continue;
            }

            double[] top = numerator.getSlice(binding.getContrastSliceIndex(numeratorName));
            double[] bottom = denominator.getSlice(binding.getContrastSliceIndex(denominatorName));
            for (int i = 0; i < top.length; i++) {
                if (!mask.isInRoi(i)) {
                    continue;
                }
                if (excludeNegativePixels && (top[i] < 0 || bottom[i] < 0)) {
                    continue;
                }
                if (bottom[i] == 0) {
                    continue;
                }
                double ratio = contrast.getFactor() * top[i] / bottom[i];
                if (Double.isNaN(ratio) || Double.isInfinite(ratio)) {
                    continue;
                }
                if (excludeNegativePixels && ratio < 0) {
                    continue;
                }
                pooled.addValue(ratio);
            }
        }
    }

    private RoiMask maskFor(String region, SliceBinding binding, RoiMaskSet masks, ContrastVolume volume,
                            AnalysisLogger logger) {
        RoiMask mask = masks.get(region, binding.getSliceNumber());
        if (mask == null) {
            // unreadable ROI file, already reported by the loader
            return null;
        }
        if (!mask.hasSameShape(volume.getRows(), volume.getColumns())) {
            logger.warning("ROI mask of slice " + binding.getSliceNumber() + " is " + mask.getRows() + "x"
                    + mask.getColumns() + " but " + volume.getContrastName() + " is " + volume.getRows() + "x"
                    + volume.getColumns() + ", slice excluded for " + volume.getContrastName());
            return null;
        }
        return mask;
    }
}

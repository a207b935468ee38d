/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.core;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Statistics that can be requested by name in the configuration.
 *
 * Percentiles use linear interpolation between order statistics, so the median of
 * an even-sized set is the mean of its two middle values.
 */
public enum Statistic {

    MEAN("mean") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return formatter.format(stats.getMean());
        }
    },

    /** Population standard deviation. */
    STDDEV("stddev") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return formatter.format(Math.sqrt(stats.getPopulationVariance()));
        }
    },

    MEDIAN("median") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return formatter.format(stats.getPercentile(50));
        }
    },

    /** Interquartile range, rendered as {@code "q1 - q3"}. */
    RANGE("range") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return formatter.format(stats.getPercentile(25)) + " - " + formatter.format(stats.getPercentile(75));
        }
    },

    MIN("min") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return formatter.format(stats.getMin());
        }
    },

    MAX("max") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return formatter.format(stats.getMax());
        }
    },

    /** Number of pooled pixels, as an integer. */
    COUNT("count") {
        @Override
        public String compute(DescriptiveStatistics stats, ValueFormatter formatter) {
            return Long.toString(stats.getN());
        }
    };

    private final String key;

    Statistic(String key) {
        this.key = key;
    }

    /**
     * Name used in configuration and as the key in statistics records.
     */
    public String getKey() {
        return key;
    }

    /**
     * Compute and format this statistic. {@code stats} must hold at least one value.
     */
    public abstract String compute(DescriptiveStatistics stats, ValueFormatter formatter);

    /**
     * Statistics container whose percentiles match the interpolation documented above.
     */
    public static DescriptiveStatistics newAccumulator() {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        return stats;
    }

    public static Statistic fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Statistic statistic : values()) {
                if (statistic.key.equals(normalized)) {
                    return statistic;
                }
            }
        }
        throw new IllegalArgumentException("Unknown statistic '" + name + "', expected one of " + keys());
    }

    public static List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (Statistic statistic : values()) {
            keys.add(statistic.key);
        }
        return keys;
    }
}

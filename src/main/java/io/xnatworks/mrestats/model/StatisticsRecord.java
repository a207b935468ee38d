/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Formatted statistics of one ROI region, keyed by contrast then statistic name.
 * Values are report text, not numbers.
 */
public final class StatisticsRecord {

    private final String region;
    private final Map<String, Map<String, String>> contrasts = new LinkedHashMap<>();

    public StatisticsRecord(String region) {
        this.region = Objects.requireNonNull(region, "region");
    }

    public void put(String contrast, String statistic, String value) {
        contrasts.computeIfAbsent(contrast, c -> new LinkedHashMap<>()).put(statistic, value);
    }

    /**
     * @return the formatted value, or null if the pair was never recorded
     */
    public String get(String contrast, String statistic) {
        Map<String, String> values = contrasts.get(contrast);
        return values != null ? values.get(statistic) : null;
    }

    @JsonProperty("region")
    public String getRegion() {
        return region;
    }

    @JsonProperty("contrasts")
    public Map<String, Map<String, String>> getContrasts() {
        Map<String, Map<String, String>> view = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> e : contrasts.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    public Map<String, String> getContrast(String contrast) {
        Map<String, String> values = contrasts.get(contrast);
        return values != null ? Collections.unmodifiableMap(values) : Collections.emptyMap();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatisticsRecord)) return false;
        StatisticsRecord that = (StatisticsRecord) o;
        return region.equals(that.region) && contrasts.equals(that.contrasts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, contrasts);
    }

    @Override
    public String toString() {
        return "StatisticsRecord{" + region + "=" + contrasts + "}";
    }
}

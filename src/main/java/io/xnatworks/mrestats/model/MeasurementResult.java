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
 * Outcome of measuring one series: where the data came from, and the statistics per ROI region.
 */
public final class MeasurementResult {

    private final LocationMetadata locationMetadata;
    private final Map<String, StatisticsRecord> statistics;

    public MeasurementResult(LocationMetadata locationMetadata, Map<String, StatisticsRecord> statistics) {
        this.locationMetadata = Objects.requireNonNull(locationMetadata, "locationMetadata");
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    @JsonProperty("location_metadata")
    public LocationMetadata getLocationMetadata() {
        return locationMetadata;
    }

    @JsonProperty("statistics")
    public Map<String, StatisticsRecord> getStatistics() {
        return statistics;
    }

    public StatisticsRecord getStatistics(String region) {
        return statistics.get(region);
    }
}

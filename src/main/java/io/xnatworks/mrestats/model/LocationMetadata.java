/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Audit trail of a measurement: for every ROI slice in the digest, the ROI file, the bound contrast
 * files and the SliceLocation, plus the slices that were skipped.
 */
public final class LocationMetadata {

    private final SortedMap<Integer, SliceLocationEntry> slices;
    private final List<SkippedSlice> skipped;

    public LocationMetadata(Map<Integer, SliceLocationEntry> slices, List<SkippedSlice> skipped) {
        this.slices = Collections.unmodifiableSortedMap(new TreeMap<>(slices));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
    }

    /**
     * Builds the metadata from the resolved ROI slices and the bindings made for them.
     * Slices without a binding keep their ROI path and location with no contrast paths.
     */
    public static LocationMetadata of(List<RoiSlice> roiSlices, List<SliceBinding> bindings, List<SkippedSlice> skipped) {
        Map<Integer, SliceBinding> bound = new HashMap<>();
        for (SliceBinding binding : bindings) {
            bound.put(binding.getSliceNumber(), binding);
        }

        Map<Integer, SliceLocationEntry> entries = new TreeMap<>();
        for (RoiSlice roiSlice : roiSlices) {
            Map<String, String> contrastPaths = new LinkedHashMap<>();
            SliceBinding binding = bound.get(roiSlice.getSliceNumber());
            if (binding != null) {
                for (Map.Entry<String, Path> e : binding.getContrastFilePaths().entrySet()) {
                    contrastPaths.put(e.getKey(), e.getValue().toString());
                }
            }
            entries.put(roiSlice.getSliceNumber(), new SliceLocationEntry(
                    roiSlice.getRoiFilePath().toString(), contrastPaths, roiSlice.getSliceLocation()));
        }
        return new LocationMetadata(entries, skipped);
    }

    @JsonProperty("slices")
    public SortedMap<Integer, SliceLocationEntry> getSlices() {
        return slices;
    }

    @JsonProperty("skipped")
    public List<SkippedSlice> getSkipped() {
        return skipped;
    }

    public SliceLocationEntry getSlice(int sliceNumber) {
        return slices.get(sliceNumber);
    }
}

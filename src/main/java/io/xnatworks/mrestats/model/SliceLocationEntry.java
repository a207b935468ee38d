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

/**
 * Files and SliceLocation that contributed for one slice number.
 */
public final class SliceLocationEntry {

    private final String roiFilePath;
    private final Map<String, String> contrastFilePaths;
    private final Double sliceLocation;

    public SliceLocationEntry(String roiFilePath, Map<String, String> contrastFilePaths, Double sliceLocation) {
        this.roiFilePath = roiFilePath;
        this.contrastFilePaths = Collections.unmodifiableMap(new LinkedHashMap<>(contrastFilePaths));
        this.sliceLocation = sliceLocation;
    }

    @JsonProperty("roi_file_path")
    public String getRoiFilePath() {
        return roiFilePath;
    }

    @JsonProperty("contrast_file_paths")
    public Map<String, String> getContrastFilePaths() {
        return contrastFilePaths;
    }

    @JsonProperty("slice_location")
    public Double getSliceLocation() {
        return sliceLocation;
    }
}

/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.resolve;

import io.xnatworks.mrestats.model.RoiSlice;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Files of one series: the ROI slices listed in the digest and the folder of each direct contrast
 * that was found.
 */
public final class SeriesFiles {

    private final ResolvedPaths paths;
    private final String magnitudeSeriesNumber;
    private final List<RoiSlice> roiSlices;
    private final Map<String, Path> contrastDirectories;

    public SeriesFiles(ResolvedPaths paths, String magnitudeSeriesNumber,
                       List<RoiSlice> roiSlices, Map<String, Path> contrastDirectories) {
        this.paths = paths;
        this.magnitudeSeriesNumber = magnitudeSeriesNumber;
        this.roiSlices = Collections.unmodifiableList(new ArrayList<>(roiSlices));
        this.contrastDirectories = Collections.unmodifiableMap(new LinkedHashMap<>(contrastDirectories));
    }

    public ResolvedPaths getPaths() {
        return paths;
    }

    public String getMagnitudeSeriesNumber() {
        return magnitudeSeriesNumber;
    }

    public List<RoiSlice> getRoiSlices() {
        return roiSlices;
    }

    /**
     * Contrast folders by contrast name. Contrasts whose folder was not found are absent.
     */
    public Map<String, Path> getContrastDirectories() {
        return contrastDirectories;
    }
}

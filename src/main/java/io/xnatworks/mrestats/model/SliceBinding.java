/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable link between one ROI slice and the contrast-volume slices that share its SliceLocation.
 *
 * A contrast is present only when exactly one of its volume slices matched within tolerance.
 */
public final class SliceBinding {

    private final int sliceNumber;
    private final Path roiFilePath;
    private final double sliceLocation;
    private final Map<String, Path> contrastFilePaths;
    private final Map<String, Integer> contrastSliceIndices;

    public SliceBinding(int sliceNumber, Path roiFilePath, double sliceLocation,
                        Map<String, Path> contrastFilePaths, Map<String, Integer> contrastSliceIndices) {
        this.sliceNumber = sliceNumber;
        this.roiFilePath = Objects.requireNonNull(roiFilePath, "roiFilePath");
        this.sliceLocation = sliceLocation;
        this.contrastFilePaths = Collections.unmodifiableMap(new LinkedHashMap<>(contrastFilePaths));
        this.contrastSliceIndices = Collections.unmodifiableMap(new LinkedHashMap<>(contrastSliceIndices));
        if (!this.contrastFilePaths.keySet().equals(this.contrastSliceIndices.keySet())) {
            throw new IllegalArgumentException("Contrast paths and slice indices must cover the same contrasts");
        }
    }

    public int getSliceNumber() {
        return sliceNumber;
    }

    public Path getRoiFilePath() {
        return roiFilePath;
    }

    public double getSliceLocation() {
        return sliceLocation;
    }

    public Map<String, Path> getContrastFilePaths() {
        return contrastFilePaths;
    }

    public Map<String, Integer> getContrastSliceIndices() {
        return contrastSliceIndices;
    }

    public boolean hasContrast(String contrastName) {
        return contrastSliceIndices.containsKey(contrastName);
    }

    public Path getContrastFilePath(String contrastName) {
        return contrastFilePaths.get(contrastName);
    }

    /**
     * @return index of the matched slice in the contrast volume, or -1 if the contrast is not bound
     */
    public int getContrastSliceIndex(String contrastName) {
        Integer index = contrastSliceIndices.get(contrastName);
        return index != null ? index : -1;
    }

    @Override
    public String toString() {
        return "SliceBinding{" + sliceNumber + " @ " + sliceLocation + "mm, contrasts=" + contrastSliceIndices.keySet() + "}";
    }
}

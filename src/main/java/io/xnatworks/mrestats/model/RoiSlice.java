/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An ROI slice listed in the digest, with the SliceLocation read from its magnitude image.
 * The location is null when no magnitude image could be read.
 */
public final class RoiSlice {

    private final int sliceNumber;
    private final Path roiFilePath;
    private final Double sliceLocation;

    public RoiSlice(int sliceNumber, Path roiFilePath, Double sliceLocation) {
        this.sliceNumber = sliceNumber;
        this.roiFilePath = Objects.requireNonNull(roiFilePath, "roiFilePath");
        this.sliceLocation = sliceLocation;
    }

    public int getSliceNumber() {
        return sliceNumber;
    }

    public Path getRoiFilePath() {
        return roiFilePath;
    }

    public Double getSliceLocation() {
        return sliceLocation;
    }

    public boolean hasSliceLocation() {
        return sliceLocation != null;
    }

    @Override
    public String toString() {
        return "RoiSlice{" + sliceNumber + ", " + roiFilePath + ", location=" + sliceLocation + "}";
    }
}

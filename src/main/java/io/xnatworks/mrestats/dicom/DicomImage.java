/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.dicom;

/**
 * First frame of a single-sample DICOM image as stored values, row-major, plus its SliceLocation.
 */
public final class DicomImage {

    private final int rows;
    private final int columns;
    private final double[] pixels;
    private final Double sliceLocation;

    public DicomImage(int rows, int columns, double[] pixels, Double sliceLocation) {
        if (pixels.length != rows * columns) {
            throw new IllegalArgumentException("Expected " + rows + "x" + columns + " pixels, got " + pixels.length);
        }
        this.rows = rows;
        this.columns = columns;
        this.pixels = pixels;
        this.sliceLocation = sliceLocation;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double[] getPixels() {
        return pixels;
    }

    public Double getSliceLocation() {
        return sliceLocation;
    }
}

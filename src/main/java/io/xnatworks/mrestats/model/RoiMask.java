/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import java.util.Objects;

/**
 * Binary mask of one ROI region on one slice, row-major.
 */
public final class RoiMask {

    private final String region;
    private final int sliceNumber;
    private final int rows;
    private final int columns;
    private final boolean[] mask;

    public RoiMask(String region, int sliceNumber, int rows, int columns, boolean[] mask) {
        this.region = Objects.requireNonNull(region, "region");
        this.sliceNumber = sliceNumber;
        this.rows = rows;
        this.columns = columns;
        if (mask.length != rows * columns) {
            throw new IllegalArgumentException("Mask has " + mask.length + " pixels, expected " + rows + "x" + columns);
        }
        this.mask = mask.clone();
    }

    public String getRegion() {
        return region;
    }

    public int getSliceNumber() {
        return sliceNumber;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getPixelCount() {
        return mask.length;
    }

    public boolean isInRoi(int index) {
        return mask[index];
    }

    public boolean hasSameShape(int otherRows, int otherColumns) {
        return rows == otherRows && columns == otherColumns;
    }

    public int countInRoi() {
        int count = 0;
        for (boolean b : mask) {
            if (b) {
                count++;
            }
        }
        return count;
    }
}

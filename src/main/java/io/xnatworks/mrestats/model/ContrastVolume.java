/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stack of contrast slices for one contrast type.
 *
 * Each slice is stored row-major as {@code rows * columns} samples. The slice axis is aligned with
 * {@link #getSliceLocations()} and {@link #getSourcePaths()}; its order is file order, not spatial order.
 */
public final class ContrastVolume {

    private final String contrastName;
    private final int rows;
    private final int columns;
    private final List<double[]> slices;
    private final List<Double> sliceLocations;
    private final List<Path> sourcePaths;

    public ContrastVolume(String contrastName, int rows, int columns,
                          List<double[]> slices, List<Double> sliceLocations, List<Path> sourcePaths) {
        this.contrastName = Objects.requireNonNull(contrastName, "contrastName");
        this.rows = rows;
        this.columns = columns;
        if (slices.size() != sliceLocations.size() || slices.size() != sourcePaths.size()) {
            throw new IllegalArgumentException("Slices, locations and source paths differ in length for " + contrastName);
        }
        for (double[] slice : slices) {
            if (slice.length != rows * columns) {
                throw new IllegalArgumentException("Slice of " + contrastName + " has " + slice.length
                        + " samples, expected " + rows + "x" + columns);
            }
        }
        this.slices = Collections.unmodifiableList(new ArrayList<>(slices));
        this.sliceLocations = Collections.unmodifiableList(new ArrayList<>(sliceLocations));
        this.sourcePaths = Collections.unmodifiableList(new ArrayList<>(sourcePaths));
    }

    public static ContrastVolume empty(String contrastName) {
        return new ContrastVolume(contrastName, 0, 0, List.of(), List.of(), List.of());
    }

    public String getContrastName() {
        return contrastName;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getSliceCount() {
        return slices.size();
    }

    public boolean isEmpty() {
        return slices.isEmpty();
    }

    /**
     * Samples of one slice. The returned array is shared; callers must not modify it.
     */
    public double[] getSlice(int index) {
        return slices.get(index);
    }

    public double getSliceLocation(int index) {
        return sliceLocations.get(index);
    }

    public List<Double> getSliceLocations() {
        return sliceLocations;
    }

    public Path getSourcePath(int index) {
        return sourcePaths.get(index);
    }

    public List<Path> getSourcePaths() {
        return sourcePaths;
    }

    /**
     * Smallest distance between two distinct slice locations, or {@link Double#POSITIVE_INFINITY}
     * when fewer than two distinct locations exist.
     */
    public double getMinimumSliceSpacing() {
        List<Double> sorted = new ArrayList<>(sliceLocations);
        Collections.sort(sorted);
        double min = Double.POSITIVE_INFINITY;
        for (int i = 1; i < sorted.size(); i++) {
            double spacing = sorted.get(i) - sorted.get(i - 1);
            if (spacing > 0 && spacing < min) {
                min = spacing;
            }
        }
        return min;
    }
}

/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.core;

import io.xnatworks.mrestats.model.ContrastVolume;
import io.xnatworks.mrestats.model.RoiSlice;
import io.xnatworks.mrestats.model.SkippedSlice;
import io.xnatworks.mrestats.model.SliceBinding;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Binds ROI slices to contrast-volume slices by SliceLocation.
 *
 * ROI files and contrast files are written by different pipeline stages, so locations are
 * compared with a tolerance instead of exactly. A contrast slice is accepted only when it is the
 * single volume slice within tolerance of the ROI slice; none or several is reported and that
 * contrast is left out of the binding. An ROI slice with no accepted contrast at all is skipped.
 */
public class SliceIndex {

    public static final double DEFAULT_TOLERANCE_MM = 0.01;

    private final double tolerance;

    public SliceIndex() {
        this(DEFAULT_TOLERANCE_MM);
    }

    public SliceIndex(double tolerance) {
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a finite value >= 0, got " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public double getTolerance() {
        return tolerance;
    }

    public boolean matches(double roiLocation, double contrastLocation) {
        return Math.abs(roiLocation - contrastLocation) <= tolerance;
    }

    /**
     * Build the bindings for one series.
     *
     * @param roiSlices ROI slices in any order
     * @param volumes   contrast volumes by contrast name; iteration order is kept in each binding
     * @param logger    receives match counts and per-slice warnings
     * @return bindings and skipped slices, both ordered by slice number
     */
    public Result build(List<RoiSlice> roiSlices, Map<String, ContrastVolume> volumes, AnalysisLogger logger) {
        for (ContrastVolume volume : volumes.values()) {
            if (volume.isEmpty()) {
                logger.warning("No slices loaded for contrast " + volume.getContrastName()
                        + ", it cannot be bound to any ROI slice");
                continue;
            }
            double spacing = volume.getMinimumSliceSpacing();
            if (tolerance > spacing / 2) {
                logger.warning(String.format(Locale.ROOT,
                        "Slice location tolerance %.4f mm exceeds half the minimum slice spacing %.4f mm of %s; matches may be ambiguous",
                        tolerance, spacing, volume.getContrastName()));
            }
        }

        List<RoiSlice> ordered = new ArrayList<>(roiSlices);
        ordered.sort(Comparator.comparingInt(RoiSlice::getSliceNumber));

        List<SliceBinding> bindings = new ArrayList<>();
        List<SkippedSlice> skipped = new ArrayList<>();

        for (RoiSlice roiSlice : ordered) {
            if (!roiSlice.hasSliceLocation()) {
                logger.warning("Skipping ROI slice " + roiSlice.getSliceNumber() + ": no SliceLocation available");
                skipped.add(new SkippedSlice(roiSlice.getSliceNumber(), null, "no slice location"));
                continue;
            }

            double location = roiSlice.getSliceLocation();
            Map<String, Path> paths = new LinkedHashMap<>();
            Map<String, Integer> indices = new LinkedHashMap<>();

            for (Map.Entry<String, ContrastVolume> entry : volumes.entrySet()) {
                ContrastVolume volume = entry.getValue();
                if (volume.isEmpty()) {
                    continue;
                }
                int index = findMatch(roiSlice, volume, logger);
                if (index >= 0) {
                    paths.put(entry.getKey(), volume.getSourcePath(index));
                    indices.put(entry.getKey(), index);
                }
            }

            if (indices.isEmpty()) {
                logger.warning("Skipping ROI slice " + roiSlice.getSliceNumber() + " at " + location
                        + " mm: no contrast slice within " + tolerance + " mm");
                skipped.add(new SkippedSlice(roiSlice.getSliceNumber(), location,
                        "no contrast slice within tolerance"));
            } else {
                bindings.add(new SliceBinding(roiSlice.getSliceNumber(), roiSlice.getRoiFilePath(),
                        location, paths, indices));
            }
        }

        logger.info("Slice index: " + bindings.size() + " ROI slice(s) matched, " + skipped.size() + " skipped");
        return new Result(bindings, skipped);
    }

    /**
     * @return index of the single volume slice within tolerance, or -1
     */
    private int findMatch(RoiSlice roiSlice, ContrastVolume volume, AnalysisLogger logger) {
        double location = roiSlice.getSliceLocation();
        int nearest = -1;
        double nearestDistance = Double.POSITIVE_INFINITY;
        int withinTolerance = 0;

        for (int i = 0; i < volume.getSliceCount(); i++) {
            double distance = Math.abs(location - volume.getSliceLocation(i));
            if (distance < nearestDistance) {
                nearestDistance = distance;
                nearest = i;
            }
            if (distance <= tolerance) {
                withinTolerance++;
            }
        }

        if (withinTolerance == 1) {
            return nearest;
        }
        if (withinTolerance > 1) {
            logger.warning("ROI slice " + roiSlice.getSliceNumber() + " at " + location + " mm matches "
                    + withinTolerance + " slices of " + volume.getContrastName() + "; contrast left out for this slice");
        } else {
            logger.warning("ROI slice " + roiSlice.getSliceNumber() + " at " + location + " mm has no "
                    + volume.getContrastName() + " slice within " + tolerance + " mm (nearest "
                    + String.format(Locale.ROOT, "%.3f", nearestDistance) + " mm away)");
        }
        return -1;
    }

    /**
     * Bindings and skipped slices of one {@link #build} call.
     */
    public static class Result {
        private final List<SliceBinding> bindings;
        private final List<SkippedSlice> skipped;

        public Result(List<SliceBinding> bindings, List<SkippedSlice> skipped) {
            this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
            this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
        }

        public List<SliceBinding> getBindings() {
            return bindings;
        }

        public List<SkippedSlice> getSkipped() {
            return skipped;
        }
    }
}

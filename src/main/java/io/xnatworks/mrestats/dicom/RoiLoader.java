/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.dicom;

import io.xnatworks.mrestats.config.AnalysisConfig.RegionDefinition;
import io.xnatworks.mrestats.core.AnalysisLogger;
import io.xnatworks.mrestats.model.RoiMask;
import io.xnatworks.mrestats.model.RoiMaskSet;
import io.xnatworks.mrestats.model.RoiSlice;

import java.io.IOException;
import java.util.List;

/**
 * Turns ROI label images into one binary mask per configured region and slice.
 */
public class RoiLoader {

    private final DicomSliceReader reader;

    public RoiLoader(DicomSliceReader reader) {
        this.reader = reader;
    }

    public RoiMaskSet load(List<RoiSlice> roiSlices, List<RegionDefinition> regions, AnalysisLogger logger) {
        RoiMaskSet masks = new RoiMaskSet();

        for (RoiSlice roiSlice : roiSlices) {
            DicomImage image;
            try {
                image = reader.readImage(roiSlice.getRoiFilePath());
            } catch (IOException e) {
                logger.warning("Cannot read ROI of slice " + roiSlice.getSliceNumber() + " from "
                        + roiSlice.getRoiFilePath() + ": " + e.getMessage());
                continue;
            }

            double[] labels = image.getPixels();
            for (RegionDefinition region : regions) {
                boolean[] mask = new boolean[labels.length];
                for (int i = 0; i < labels.length; i++) {
                    mask[i] = region.contains(labels[i]);
                }
                masks.add(new RoiMask(region.getName(), roiSlice.getSliceNumber(),
                        image.getRows(), image.getColumns(), mask));
            }
        }

        logger.info("Loaded " + masks.size() + " ROI mask(s) from " + roiSlices.size() + " ROI file(s)");
        return masks;
    }
}

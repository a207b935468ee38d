/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.dicom;

import io.xnatworks.mrestats.core.AnalysisLogger;
import io.xnatworks.mrestats.model.ContrastVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stacks the DICOM slices of one mmdi3d contrast series folder into a {@link ContrastVolume}.
 *
 * Files are read in name order. Files that are not DICOM are skipped silently; slices without a
 * SliceLocation or with a different size than the first slice are skipped with a warning.
 */
public class ContrastVolumeLoader {
    private static final Logger log = LoggerFactory.getLogger(ContrastVolumeLoader.class);

    private final DicomSliceReader reader;

    public ContrastVolumeLoader(DicomSliceReader reader) {
        this.reader = reader;
    }

    /**
     * @return the volume; empty if the folder cannot be listed or holds no usable slice
     */
    public ContrastVolume load(String contrastName, Path directory, AnalysisLogger logger) {
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            logger.warning("Cannot list " + contrastName + " folder " + directory + ": " + e.getMessage());
            return ContrastVolume.empty(contrastName);
        }

        int rows = -1;
        int columns = -1;
        List<double[]> slices = new ArrayList<>();
        List<Double> locations = new ArrayList<>();
        List<Path> sources = new ArrayList<>();

        for (Path file : files) {
            DicomImage image;
            try {
                image = reader.readImage(file);
            } catch (IOException e) {
                log.debug("Skipping {} in {} folder: {}", file.getFileName(), contrastName, e.getMessage());
                continue;
            }

            if (image.getSliceLocation() == null) {
                logger.warning("Skipping " + contrastName + " file " + file + ": no SliceLocation");
                continue;
            }
            if (rows < 0) {
                rows = image.getRows();
                columns = image.getColumns();
            } else if (image.getRows() != rows || image.getColumns() != columns) {
                logger.warning("Skipping " + contrastName + " file " + file + ": " + image.getRows() + "x"
                        + image.getColumns() + " differs from " + rows + "x" + columns);
                continue;
            }

            slices.add(image.getPixels());
            locations.add(image.getSliceLocation());
            sources.add(file);
        }

        if (slices.isEmpty()) {
            logger.warning("No usable " + contrastName + " slices in " + directory);
            return ContrastVolume.empty(contrastName);
        }

        logger.info("Loaded " + slices.size() + " " + contrastName + " slice(s) of " + rows + "x" + columns
                + " from " + directory);
        return new ContrastVolume(contrastName, rows, columns, slices, locations, sources);
    }
}

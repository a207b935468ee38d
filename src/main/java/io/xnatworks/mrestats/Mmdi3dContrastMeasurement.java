/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats;

import io.xnatworks.mrestats.config.AnalysisConfig;
import io.xnatworks.mrestats.core.AnalysisLogger;
import io.xnatworks.mrestats.core.RoiContrastAggregator;
import io.xnatworks.mrestats.core.SliceIndex;
import io.xnatworks.mrestats.dicom.ContrastVolumeLoader;
import io.xnatworks.mrestats.dicom.DicomSliceReader;
import io.xnatworks.mrestats.dicom.RoiLoader;
import io.xnatworks.mrestats.model.ContrastVolume;
import io.xnatworks.mrestats.model.LocationMetadata;
import io.xnatworks.mrestats.model.MeasurementResult;
import io.xnatworks.mrestats.model.RoiMaskSet;
import io.xnatworks.mrestats.model.StatisticsRecord;
import io.xnatworks.mrestats.resolve.PathResolver;
import io.xnatworks.mrestats.resolve.PathSpec;
import io.xnatworks.mrestats.resolve.ResolutionException;
import io.xnatworks.mrestats.resolve.SeriesFileResolver;
import io.xnatworks.mrestats.resolve.SeriesFiles;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Measures mmdi3d contrasts inside the Hepatogram Plus ROIs of one series.
 *
 * Pipeline: resolve the digest's files, load ROI masks and contrast volumes, bind ROI slices to
 * contrast slices by SliceLocation, then pool and summarise the in-ROI pixels. Instances hold no
 * per-call state and can be reused across series.
 */
public class Mmdi3dContrastMeasurement {

    private final SeriesFileResolver fileResolver;
    private final RoiLoader roiLoader;
    private final ContrastVolumeLoader volumeLoader;
    private final SliceIndex sliceIndex;
    private final RoiContrastAggregator aggregator;
    private final AnalysisConfig config;

    public Mmdi3dContrastMeasurement() {
        this(new AnalysisConfig());
    }

    /**
     * @throws IllegalArgumentException if the configuration is inconsistent
     */
    public Mmdi3dContrastMeasurement(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        DicomSliceReader reader = new DicomSliceReader();
        this.fileResolver = new SeriesFileResolver(new PathResolver(config.getInversionDirName()), reader,
                config.getDirectContrasts());
        this.roiLoader = new RoiLoader(reader);
        this.volumeLoader = new ContrastVolumeLoader(reader);
        this.sliceIndex = new SliceIndex(config.getSliceLocationTolerance());
        this.aggregator = RoiContrastAggregator.fromConfig(config);
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    /**
     * Measure with directories located from the digest, negative pixels kept and no logging.
     */
    public MeasurementResult measureContrastsInRois(Path alc2Digest) throws ResolutionException {
        return measureContrastsInRois(alc2Digest, PathSpec.auto(), PathSpec.auto(), false, AnalysisLogger.NOOP);
    }

    public MeasurementResult measureContrastsInRois(Path alc2Digest, PathSpec tempDir, PathSpec inversion3dDir,
                                                    boolean excludeNegativePixels) throws ResolutionException {
        return measureContrastsInRois(alc2Digest, tempDir, inversion3dDir, excludeNegativePixels, AnalysisLogger.NOOP);
    }

    /**
     * @param alc2Digest            Hepatogram Plus digest of the series
     * @param tempDir               folder holding the ROI files; auto = the digest's folder
     * @param inversion3dDir        mmdi3d output folder; auto = the {@code 3dmmdi} folder of the case
     * @param excludeNegativePixels drop negative contrast values before computing statistics
     * @param logger                receives progress and degradation messages
     * @return location metadata of every ROI slice and statistics per region
     * @throws ResolutionException if the digest, a directory or an ROI file cannot be located
     */
    public MeasurementResult measureContrastsInRois(Path alc2Digest, PathSpec tempDir, PathSpec inversion3dDir,
                                                    boolean excludeNegativePixels, AnalysisLogger logger)
            throws ResolutionException {
        AnalysisLogger log = logger != null ? logger : AnalysisLogger.NOOP;

        SeriesFiles files = fileResolver.resolve(alc2Digest, tempDir, inversion3dDir, log);
        RoiMaskSet masks = roiLoader.load(files.getRoiSlices(), config.getRegions(), log);
        Map<String, ContrastVolume> volumes = loadVolumes(files, log);

        SliceIndex.Result index = sliceIndex.build(files.getRoiSlices(), volumes, log);
        Map<String, StatisticsRecord> statistics = aggregator.aggregate(index.getBindings(), masks, volumes,
                excludeNegativePixels, log);

        LocationMetadata metadata = LocationMetadata.of(files.getRoiSlices(), index.getBindings(), index.getSkipped());
        return new MeasurementResult(metadata, statistics);
    }

    /**
     * Resolve and bind the slices of a series without computing statistics.
     */
    public LocationMetadata locateSlices(Path alc2Digest, PathSpec tempDir, PathSpec inversion3dDir,
                                         AnalysisLogger logger) throws ResolutionException {
        AnalysisLogger log = logger != null ? logger : AnalysisLogger.NOOP;

        SeriesFiles files = fileResolver.resolve(alc2Digest, tempDir, inversion3dDir, log);
        SliceIndex.Result index = sliceIndex.build(files.getRoiSlices(), loadVolumes(files, log), log);
        return LocationMetadata.of(files.getRoiSlices(), index.getBindings(), index.getSkipped());
    }

    private Map<String, ContrastVolume> loadVolumes(SeriesFiles files, AnalysisLogger log) {
        Map<String, ContrastVolume> volumes = new LinkedHashMap<>();
        for (Map.Entry<String, Path> entry : files.getContrastDirectories().entrySet()) {
            volumes.put(entry.getKey(), volumeLoader.load(entry.getKey(), entry.getValue(), log));
        }
        return volumes;
    }
}

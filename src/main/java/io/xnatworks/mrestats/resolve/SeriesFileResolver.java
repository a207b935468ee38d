/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.resolve;

import io.xnatworks.mrestats.config.AnalysisConfig.DirectContrast;
import io.xnatworks.mrestats.core.AnalysisLogger;
import io.xnatworks.mrestats.dicom.DicomSliceReader;
import io.xnatworks.mrestats.digest.Alc2Digest;
import io.xnatworks.mrestats.digest.DigestParser;
import io.xnatworks.mrestats.model.RoiSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps a digest to the ROI slices and mmdi3d contrast folders of its series.
 *
 * Digest paths were written on the acquisition workstation, so only their trailing elements are
 * trusted and re-rooted under the resolved directories.
 */
public class SeriesFileResolver {
    private static final Logger log = LoggerFactory.getLogger(SeriesFileResolver.class);

    private final PathResolver pathResolver;
    private final DicomSliceReader reader;
    private final List<DirectContrast> contrasts;

    public SeriesFileResolver(PathResolver pathResolver, DicomSliceReader reader, List<DirectContrast> contrasts) {
        this.pathResolver = pathResolver;
        this.reader = reader;
        this.contrasts = new ArrayList<>(contrasts);
    }

    public SeriesFiles resolve(Path digestPath, PathSpec tempDir, PathSpec inversion3dDir, AnalysisLogger logger)
            throws ResolutionException {
        ResolvedPaths paths = pathResolver.resolve(digestPath, tempDir, inversion3dDir);

        Alc2Digest digest;
        try {
            digest = DigestParser.parse(paths.getDigest());
        } catch (IOException e) {
            throw new ResolutionException("Digest cannot be read: " + e.getMessage(), paths.getDigest(), e);
        }

        List<RoiSlice> roiSlices = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : digest.getRoiSliceFiles().entrySet()) {
            int sliceNumber = entry.getKey();
            Path roiFile = paths.getTempDir().resolve(fileName(entry.getValue()));
            if (!Files.isRegularFile(roiFile)) {
                throw new ResolutionException("ROI file of slice " + sliceNumber + " not found", List.of(roiFile));
            }
            Double location = findSliceLocation(digest, sliceNumber, paths, logger);
            roiSlices.add(new RoiSlice(sliceNumber, roiFile, location));
        }
        if (roiSlices.isEmpty()) {
            logger.warning("Digest " + paths.getDigest() + " lists no ROI slices");
        }

        String magSeries = digest.getMagnitudeSeriesNumber();
        Map<String, Path> contrastDirs = new LinkedHashMap<>();
        if (magSeries == null) {
            logger.warning("Digest " + paths.getDigest() + " has no " + Alc2Digest.MAG_SERIES_NUMBER
                    + ", contrast folders cannot be located");
        } else {
            Path parent = findContrastParent(paths.getInversion3dDir(), magSeries);
            for (DirectContrast contrast : contrasts) {
                Path dir = findContrastDirectory(parent, magSeries, contrast.getSeriesSuffix());
                if (dir != null) {
                    contrastDirs.put(contrast.getName(), dir);
                } else {
                    logger.warning("No " + contrast.getName() + " folder (suffix " + contrast.getSeriesSuffix()
                            + ") for series " + magSeries + " in " + parent);
                }
            }
        }

        logger.info("Resolved " + roiSlices.size() + " ROI slice(s) and " + contrastDirs.size()
                + " contrast folder(s) from " + paths.getDigest());
        return new SeriesFiles(paths, magSeries, roiSlices, contrastDirs);
    }

    /**
     * Reads the SliceLocation of the slice's magnitude image, trying
     * {@code inversion_3d_dir/<last 3 elements>}, {@code inversion_3d_dir/<last 2>} and
     * {@code temp_dir/../../<last 2>} for each magnitude reference.
     */
    private Double findSliceLocation(Alc2Digest digest, int sliceNumber, ResolvedPaths paths, AnalysisLogger logger) {
        Path inputDir = PathResolver.ancestor(paths.getTempDir(), 2);
        for (String reference : digest.getMagnitudeSliceFiles(sliceNumber)) {
            List<Path> candidates = new ArrayList<>();
            candidates.add(resolveTail(paths.getInversion3dDir(), reference, 3));
            candidates.add(resolveTail(paths.getInversion3dDir(), reference, 2));
            if (inputDir != null) {
                candidates.add(resolveTail(inputDir, reference, 2));
            }
            for (Path candidate : candidates) {
                if (!Files.isRegularFile(candidate)) {
                    continue;
                }
                try {
                    Double location = reader.readSliceLocation(candidate);
                    if (location != null) {
                        return location;
                    }
                } catch (IOException e) {
                    log.debug("Magnitude candidate {} not readable: {}", candidate, e.getMessage());
                }
            }
        }
        logger.warning("No SliceLocation found for slice " + sliceNumber + " in digest " + paths.getDigest());
        return null;
    }

    /**
     * Subfolder of the inversion directory named by a prefix of the series number, else the directory itself.
     */
    private Path findContrastParent(Path inversion3dDir, String magSeries) {
        for (Path folder : listFolders(inversion3dDir)) {
            if (magSeries.startsWith(folder.getFileName().toString())) {
                return folder;
            }
        }
        return inversion3dDir;
    }

    /**
     * Folder {@code s<prefix><suffix>} where {@code <prefix>} is a non-empty prefix of the series number.
     */
    private Path findContrastDirectory(Path parent, String magSeries, String suffix) {
        for (Path folder : listFolders(parent)) {
            String name = folder.getFileName().toString();
            if (!name.startsWith("s") || !name.endsWith(suffix) || name.length() <= suffix.length() + 1) {
                continue;
            }
            String prefix = name.substring(1, name.length() - suffix.length());
            if (magSeries.startsWith(prefix)) {
                return folder;
            }
        }
        return null;
    }

    private List<Path> listFolders(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    /**
     * Path elements of a digest reference, accepting both '/' and '\' separators.
     */
    static List<String> pathElements(String reference) {
        List<String> elements = new ArrayList<>();
        for (String part : reference.replace('\\', '/').split("/")) {
            if (!part.isEmpty() && !part.equals(".")) {
                elements.add(part);
            }
        }
        return elements;
    }

    static String fileName(String reference) {
        List<String> elements = pathElements(reference);
        return elements.isEmpty() ? reference : elements.get(elements.size() - 1);
    }

    /**
     * Re-root the last {@code count} elements of a digest reference under {@code base}.
     */
    static Path resolveTail(Path base, String reference, int count) {
        List<String> elements = pathElements(reference);
        List<String> tail = elements.subList(Math.max(0, elements.size() - count), elements.size());
        Path result = base;
        for (String element : tail) {
            result = result.resolve(element);
        }
        return result;
    }
}

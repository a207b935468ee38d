/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validates the digest and turns the temp and inversion directory specs into existing directories.
 *
 * Layout assumed for automatic resolution:
 * <pre>
 * input_dir/
 *   3dmmdi/                  inversion output (current layout)
 *   hepplus/
 *     3dmmdi/                inversion output (older hepplus-3d layout)
 *     case/
 *       series.alc2          digest, ROI files next to it
 * </pre>
 */
public class PathResolver {
    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    public static final String DIGEST_EXTENSION = ".alc2";
    public static final String DEFAULT_INVERSION_DIR_NAME = "3dmmdi";

    private final String inversionDirName;

    public PathResolver() {
        this(DEFAULT_INVERSION_DIR_NAME);
    }

    public PathResolver(String inversionDirName) {
        this.inversionDirName = inversionDirName;
    }

    public ResolvedPaths resolve(Path digest, PathSpec tempDir, PathSpec inversion3dDir) throws ResolutionException {
        Path validDigest = validateDigest(digest);
        Path resolvedTemp = resolveTempDir(validDigest, tempDir);
        Path resolvedInversion = resolveInversionDir(validDigest, inversion3dDir);
        log.debug("Resolved temp_dir={} inversion_3d_dir={}", resolvedTemp, resolvedInversion);
        return new ResolvedPaths(validDigest, resolvedTemp, resolvedInversion);
    }

    public Path validateDigest(Path digest) throws ResolutionException {
        Path absolute = digest.toAbsolutePath().normalize();
        String name = absolute.getFileName() != null ? absolute.getFileName().toString() : "";
        if (!name.toLowerCase(Locale.ROOT).endsWith(DIGEST_EXTENSION)) {
            throw new ResolutionException("Digest does not have the " + DIGEST_EXTENSION + " extension", List.of(absolute));
        }
        if (!Files.exists(absolute)) {
            throw new ResolutionException("Digest does not exist", List.of(absolute));
        }
        if (!Files.isRegularFile(absolute)) {
            throw new ResolutionException("Digest is not a regular file", List.of(absolute));
        }
        return absolute;
    }

    /**
     * The ROI files live next to the digest unless a directory is given.
     */
    public Path resolveTempDir(Path digest, PathSpec spec) throws ResolutionException {
        if (spec.isAutoResolve()) {
            return digest.toAbsolutePath().normalize().getParent();
        }
        return requireDirectory("temp_dir", spec.getPath());
    }

    /**
     * Tries {@code <digest>/../../../3dmmdi}, then {@code <digest>/../../3dmmdi}, unless a directory is given.
     */
    public Path resolveInversionDir(Path digest, PathSpec spec) throws ResolutionException {
        if (!spec.isAutoResolve()) {
            return requireDirectory("inversion_3d_dir", spec.getPath());
        }

        List<Path> candidates = new ArrayList<>();
        Path absolute = digest.toAbsolutePath().normalize();
        for (int levels : new int[]{3, 2}) {
            Path base = ancestor(absolute, levels);
            if (base != null) {
                candidates.add(base.resolve(inversionDirName));
            }
        }
        for (Path candidate : candidates) {
            if (Files.isDirectory(candidate)) {
                return candidate;
            }
        }
        throw new ResolutionException("No default inversion_3d_dir found for " + absolute, candidates);
    }

    /**
     * Strip {@code levels} trailing elements from {@code path}.
     *
     * @return the remaining path, or null if {@code path} is not deep enough
     */
    static Path ancestor(Path path, int levels) {
        Path result = path;
        for (int i = 0; i < levels && result != null; i++) {
            result = result.getParent();
        }
        return result;
    }

    private static Path requireDirectory(String label, Path path) throws ResolutionException {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new ResolutionException(label + " does not exist", List.of(absolute));
        }
        if (!Files.isDirectory(absolute)) {
            throw new ResolutionException(label + " is not a directory", List.of(absolute));
        }
        return absolute;
    }
}

/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.resolve;

import java.nio.file.Path;

/**
 * Concrete digest, ROI (temp) directory and inversion output directory of one series.
 */
public final class ResolvedPaths {

    private final Path digest;
    private final Path tempDir;
    private final Path inversion3dDir;

    public ResolvedPaths(Path digest, Path tempDir, Path inversion3dDir) {
        this.digest = digest;
        this.tempDir = tempDir;
        this.inversion3dDir = inversion3dDir;
    }

    public Path getDigest() {
        return digest;
    }

    public Path getTempDir() {
        return tempDir;
    }

    public Path getInversion3dDir() {
        return inversion3dDir;
    }

    @Override
    public String toString() {
        return "ResolvedPaths{digest=" + digest + ", tempDir=" + tempDir + ", inversion3dDir=" + inversion3dDir + "}";
    }
}

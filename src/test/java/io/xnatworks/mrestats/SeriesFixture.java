/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.mrestats;

import io.xnatworks.mrestats.dicom.DicomTestFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds a two-slice Hepatogram Plus case with its mmdi3d output:
 * <pre>
 * input/
 *   3dmmdi/7/mag_1.dcm          magnitude of slice 1 (10 mm)
 *   3dmmdi/7/s726, s727, s728   storage, loss, attenuation at 10 mm and 20 mm
 *   7/mag_2.dcm                 magnitude of slice 2 (20 mm)
 *   hepplus/case/series.alc2    digest, roi_1.dcm and roi_2.dcm
 * </pre>
 * Each image is 2x2. Slice 1's ROI covers the top row, slice 2's the whole image.
 */
public class SeriesFixture {

    public static final String DIGEST_TEXT = String.join("\n",
            "% Hepatogram Plus 3D digest",
            "mre.mag.seriesNumber = 7",
            "mre.roi.slice.1 = C:\\hepplus\\case\\roi_1.dcm",
            "mre.roi.slice.2 = C:\\hepplus\\case\\roi_2.dcm",
            "mre.mag.slice.1 = D:\\export\\3dmmdi\\7\\mag_1.dcm % acquired first",
            "mre.mag.slice.2 = D:\\export\\7\\mag_2.dcm",
            "");

    private final Path root;

    public SeriesFixture(Path root) {
        this.root = root;
    }

    public SeriesFixture create() throws IOException {
        Files.createDirectories(caseDir());
        Files.writeString(digest(), DIGEST_TEXT);

        DicomTestFiles.write(caseDir().resolve("roi_1.dcm"), 2, 2, new int[]{1, 1, 0, 0}, 8, false, 10.0);
        DicomTestFiles.write(caseDir().resolve("roi_2.dcm"), 2, 2, new int[]{1, 1, 1, 1}, 8, false, 20.0);

        DicomTestFiles.writeMagnitude(inversionDir().resolve("7/mag_1.dcm"), 10.0);
        writeSecondMagnitude(20.0);

        writeContrast("26", 10.0, 2000, 4000, 9000, 9000);
        writeContrast("26", 20.0, 3000, 3000, 3000, 3000);
        writeContrast("27", 10.0, 1000, 1000, 0, 0);
        writeContrast("27", 20.0, 600, 600, 600, 600);
        writeContrast("28", 10.0, 100, 300, 0, 0);
        writeContrast("28", 20.0, 200, 200, 200, 200);
        return this;
    }

    /**
     * Write (or replace) the magnitude image that gives slice 2 its location.
     */
    public Path writeSecondMagnitude(double location) throws IOException {
        return DicomTestFiles.writeMagnitude(inputDir().resolve("7/mag_2.dcm"), location);
    }

    /**
     * Write (or replace) the 2x2 slice of contrast folder {@code s7<suffix>} at a location.
     */
    public Path writeContrast(String suffix, double location, int... pixels) throws IOException {
        Path file = contrastDir(suffix).resolve("IM_" + (int) location + ".dcm");
        return DicomTestFiles.writeSlice(file, 2, 2, pixels, location);
    }

    public Path inputDir() {
        return root.resolve("input");
    }

    public Path caseDir() {
        return inputDir().resolve("hepplus/case");
    }

    public Path digest() {
        return caseDir().resolve("series.alc2");
    }

    public Path inversionDir() {
        return inputDir().resolve("3dmmdi");
    }

    public Path contrastDir(String suffix) {
        return inversionDir().resolve("7").resolve("s7" + suffix);
    }
}

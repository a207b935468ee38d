/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.mrestats.core;

import io.xnatworks.mrestats.model.ContrastVolume;
import io.xnatworks.mrestats.model.RoiSlice;
import io.xnatworks.mrestats.model.SkippedSlice;
import io.xnatworks.mrestats.model.SliceBinding;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SliceIndex Tests")
class SliceIndexTest {

    private RecordingLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RecordingLogger();
    }

    private static ContrastVolume volume(String name, double... locations) {
        List<double[]> slices = new ArrayList<>();
        List<Double> locs = new ArrayList<>();
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < locations.length; i++) {
            slices.add(new double[]{i});
            locs.add(locations[i]);
            paths.add(Paths.get(name, "slice" + i + ".dcm"));
        }
        return new ContrastVolume(name, 1, 1, slices, locs, paths);
    }

    private static RoiSlice roi(int number, Double location) {
        return new RoiSlice(number, Paths.get("roi" + number + ".dcm"), location);
    }

    private static Map<String, ContrastVolume> volumes(ContrastVolume... volumes) {
        Map<String, ContrastVolume> map = new LinkedHashMap<>();
        for (ContrastVolume volume : volumes) {
            map.put(volume.getContrastName(), volume);
        }
        return map;
    }

    @Nested
    @DisplayName("Tolerance Tests")
    class ToleranceTests {

        @Test
        @DisplayName("Distance equal to the tolerance should match")
        void distanceEqualToToleranceMatches() {
            SliceIndex index = new SliceIndex(0.5);

            assertTrue(index.matches(10.0, 10.5));
            assertTrue(index.matches(10.5, 10.0));
            assertFalse(index.matches(10.0, 10.75));
        }

        @Test
        @DisplayName("Zero tolerance should require equal locations")
        void zeroToleranceRequiresEquality() {
            SliceIndex index = new SliceIndex(0);

            assertTrue(index.matches(-12.25, -12.25));
            assertFalse(index.matches(-12.25, -12.0));
        }

        @Test
        @DisplayName("Default tolerance should be 0.01 mm")
        void defaultTolerance() {
            assertEquals(0.01, new SliceIndex().getTolerance());
        }

        @Test
        @DisplayName("Should reject negative or non-finite tolerance")
        void shouldRejectInvalidTolerance() {
            assertThrows(IllegalArgumentException.class, () -> new SliceIndex(-0.1));
            assertThrows(IllegalArgumentException.class, () -> new SliceIndex(Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> new SliceIndex(Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("Should warn when tolerance exceeds half the slice spacing")
        void shouldWarnOnWideTolerance() {
            new SliceIndex(3.0).build(List.of(), volumes(volume("storage", 0.0, 5.0)), logger);

            assertTrue(logger.hasWarningContaining("exceeds half the minimum slice spacing"));
        }
    }

    @Nested
    @DisplayName("Binding Tests")
    class BindingTests {

        @Test
        @DisplayName("Should bind each ROI slice to the contrast slice at its location")
        void shouldBindByLocation() {
            SliceIndex index = new SliceIndex(0.5);
            SliceIndex.Result result = index.build(
                    List.of(roi(1, 10.0), roi(2, 15.25)),
                    volumes(volume("storage", 5.0, 10.0, 15.0), volume("loss", 5.0, 10.0, 15.0)),
                    logger);

            assertEquals(2, result.getBindings().size());
            assertTrue(result.getSkipped().isEmpty());

            SliceBinding first = result.getBindings().get(0);
            assertEquals(1, first.getSliceNumber());
            assertEquals(1, first.getContrastSliceIndex("storage"));
            assertEquals(Paths.get("loss", "slice1.dcm"), first.getContrastFilePath("loss"));

            SliceBinding second = result.getBindings().get(1);
            assertEquals(2, second.getContrastSliceIndex("storage"));
            assertEquals(15.25, second.getSliceLocation());
        }

        @Test
        @DisplayName("Should skip a slice whose nearest contrast slice is out of tolerance")
        void shouldSkipOutOfTolerance() {
            SliceIndex index = new SliceIndex(0.5);
            SliceIndex.Result result = index.build(
                    List.of(roi(1, 11.2)), volumes(volume("storage", 10.0, 15.0)), logger);

            assertTrue(result.getBindings().isEmpty());
            assertEquals(1, result.getSkipped().size());
            SkippedSlice skipped = result.getSkipped().get(0);
            assertEquals(1, skipped.getSliceNumber());
            assertEquals(11.2, skipped.getSliceLocation());
            assertTrue(logger.hasWarningContaining("nearest 1.200 mm away"));
        }

        @Test
        @DisplayName("Should skip a slice without location")
        void shouldSkipWithoutLocation() {
            SliceIndex.Result result = new SliceIndex().build(
                    List.of(roi(3, null)), volumes(volume("storage", 10.0)), logger);

            assertTrue(result.getBindings().isEmpty());
            assertEquals("no slice location", result.getSkipped().get(0).getReason());
            assertNull(result.getSkipped().get(0).getSliceLocation());
        }

        @Test
        @DisplayName("Should order bindings by slice number when coordinates descend")
        void shouldOrderBySliceNumber() {
            SliceIndex index = new SliceIndex(0.1);
            SliceIndex.Result result = index.build(
                    List.of(roi(3, -20.0), roi(1, 0.0), roi(2, -10.0)),
                    volumes(volume("storage", 0.0, -10.0, -20.0)), logger);

            List<Integer> numbers = new ArrayList<>();
            for (SliceBinding binding : result.getBindings()) {
                numbers.add(binding.getSliceNumber());
            }
            assertEquals(List.of(1, 2, 3), numbers);
            assertEquals(2, result.getBindings().get(2).getContrastSliceIndex("storage"));
        }

        @Test
        @DisplayName("Should reject ambiguous matches")
        void shouldRejectAmbiguousMatch() {
            SliceIndex index = new SliceIndex(1.0);
            SliceIndex.Result result = index.build(
                    List.of(roi(1, 10.0)), volumes(volume("storage", 9.5, 10.5)), logger);

            assertTrue(result.getBindings().isEmpty());
            assertEquals(1, result.getSkipped().size());
            assertTrue(logger.hasWarningContaining("matches 2 slices"));
        }

        @Test
        @DisplayName("Should leave out only the contrast that does not match")
        void shouldKeepPartialBinding() {
            SliceIndex index = new SliceIndex(0.5);
            SliceIndex.Result result = index.build(
                    List.of(roi(1, 10.0)),
                    volumes(volume("storage", 10.0), volume("loss", 12.0)), logger);

            assertEquals(1, result.getBindings().size());
            SliceBinding binding = result.getBindings().get(0);
            assertTrue(binding.hasContrast("storage"));
            assertFalse(binding.hasContrast("loss"));
            assertEquals(-1, binding.getContrastSliceIndex("loss"));
        }

        @Test
        @DisplayName("Empty volumes should be reported and ignored")
        void emptyVolumeIsReported() {
            SliceIndex.Result result = new SliceIndex().build(
                    List.of(roi(1, 10.0)),
                    volumes(volume("storage", 10.0), ContrastVolume.empty("loss")), logger);

            assertEquals(1, result.getBindings().size());
            assertTrue(logger.hasWarningContaining("No slices loaded for contrast loss"));
        }
    }
}

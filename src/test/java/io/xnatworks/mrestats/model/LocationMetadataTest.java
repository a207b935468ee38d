/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.mrestats.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class LocationMetadataTest {

    @Test
    @DisplayName("Metadata should list every ROI slice, bound or not")
    void listsEveryRoiSlice() {
        Path roi1 = Paths.get("case", "roi_1.dcm");
        Path roi2 = Paths.get("case", "roi_2.dcm");
        SliceBinding binding = new SliceBinding(1, roi1, 10.0,
                Map.of("storage", Paths.get("s726", "IM_10.dcm")), Map.of("storage", 0));

        LocationMetadata metadata = LocationMetadata.of(
                List.of(new RoiSlice(2, roi2, 31.0), new RoiSlice(1, roi1, 10.0)),
                List.of(binding),
                List.of(new SkippedSlice(2, 31.0, "no contrast slice within tolerance")));

        assertEquals(List.of(1, 2), List.copyOf(metadata.getSlices().keySet()));
        assertEquals(Paths.get("s726", "IM_10.dcm").toString(),
                metadata.getSlice(1).getContrastFilePaths().get("storage"));
        assertTrue(metadata.getSlice(2).getContrastFilePaths().isEmpty());
        assertEquals(31.0, metadata.getSlice(2).getSliceLocation());
    }

    @Test
    @DisplayName("JSON should use snake_case keys")
    void jsonKeys() {
        LocationMetadata metadata = LocationMetadata.of(
                List.of(new RoiSlice(3, Paths.get("roi_3.dcm"), null)), List.of(),
                List.of(new SkippedSlice(3, null, "no slice location")));
        StatisticsRecord record = new StatisticsRecord("liver");
        record.put("storage", "mean", "N/A");

        JsonNode json = new ObjectMapper().valueToTree(new MeasurementResult(metadata, Map.of("liver", record)));

        assertTrue(json.at("/location_metadata/slices/3/slice_location").isNull());
        assertEquals("roi_3.dcm", json.at("/location_metadata/slices/3/roi_file_path").asText());
        assertEquals("no slice location", json.at("/location_metadata/skipped/0/reason").asText());
        assertEquals(3, json.at("/location_metadata/skipped/0/slice_number").asInt());
        assertEquals("N/A", json.at("/statistics/liver/contrasts/storage/mean").asText());
    }

    @Test
    @DisplayName("Binding should require matching contrast maps")
    void bindingRequiresMatchingMaps() {
        assertThrows(IllegalArgumentException.class, () -> new SliceBinding(1, Paths.get("roi.dcm"), 0.0,
                Map.of("storage", Paths.get("a.dcm")), Map.of()));
    }

    @Test
    @DisplayName("Volume spacing should ignore order and duplicates")
    void volumeSpacing() {
        ContrastVolume volume = new ContrastVolume("storage", 1, 1,
                List.of(new double[]{0}, new double[]{0}, new double[]{0}),
                List.of(20.0, 10.0, 20.0),
                List.of(Paths.get("a"), Paths.get("b"), Paths.get("c")));

        assertEquals(10.0, volume.getMinimumSliceSpacing());
        assertEquals(Double.POSITIVE_INFINITY, ContrastVolume.empty("loss").getMinimumSliceSpacing());
        assertTrue(ContrastVolume.empty("loss").isEmpty());
    }

    @Test
    @DisplayName("Mask should count in-ROI pixels and check shape")
    void maskBasics() {
        RoiMask mask = new RoiMask("liver", 1, 1, 3, new boolean[]{true, false, true});

        assertEquals(2, mask.countInRoi());
        assertEquals(3, mask.getPixelCount());
        assertTrue(mask.hasSameShape(1, 3));
        assertFalse(mask.hasSameShape(3, 1));
    }
}

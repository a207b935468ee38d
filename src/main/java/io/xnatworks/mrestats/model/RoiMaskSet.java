/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ROI masks indexed by region name and slice number.
 */
public class RoiMaskSet {

    private final Map<String, Map<Integer, RoiMask>> masks = new LinkedHashMap<>();

    public void add(RoiMask mask) {
        masks.computeIfAbsent(mask.getRegion(), r -> new TreeMap<>()).put(mask.getSliceNumber(), mask);
    }

    /**
     * @return the mask, or null when the region has no mask on that slice
     */
    public RoiMask get(String region, int sliceNumber) {
        Map<Integer, RoiMask> bySlice = masks.get(region);
        return bySlice != null ? bySlice.get(sliceNumber) : null;
    }

    public List<String> getRegions() {
        return new ArrayList<>(masks.keySet());
    }

    public int size() {
        int total = 0;
        for (Map<Integer, RoiMask> bySlice : masks.values()) {
            total += bySlice.size();
        }
        return total;
    }
}

/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.digest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Key/value content of a Hepatogram Plus {@code .alc2} digest.
 *
 * Keys used for measurements:
 * - {@code mre.roi.slice.N}: ROI image of MRE slice N
 * - {@code mre.mag.slice.N}: magnitude image of MRE slice N (carries the SliceLocation)
 * - {@code mre.mag.seriesNumber}: series number of the magnitude images
 */
public class Alc2Digest {
    private static final Logger log = LoggerFactory.getLogger(Alc2Digest.class);

    public static final String ROI_SLICE_PREFIX = "mre.roi.slice.";
    public static final String MAG_SLICE_PREFIX = "mre.mag.slice.";
    public static final String MAG_SERIES_NUMBER = "mre.mag.seriesNumber";

    private final Map<String, String> content;
    private final Set<String> comments;

    public Alc2Digest(Map<String, String> content, Set<String> comments) {
        this.content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
        this.comments = Collections.unmodifiableSet(new LinkedHashSet<>(comments));
    }

    public Map<String, String> getContent() {
        return content;
    }

    public Set<String> getComments() {
        return comments;
    }

    public String get(String key) {
        return content.get(key);
    }

    /**
     * ROI file references by slice number. Entries whose slice number is not an integer are ignored.
     */
    public SortedMap<Integer, String> getRoiSliceFiles() {
        SortedMap<Integer, String> result = new TreeMap<>();
        for (Map.Entry<String, String> entry : content.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(ROI_SLICE_PREFIX)) {
                continue;
            }
            String suffix = key.substring(ROI_SLICE_PREFIX.length());
            try {
                result.put(Integer.parseInt(suffix), entry.getValue());
            } catch (NumberFormatException e) {
                log.debug("Ignoring digest key with non-numeric slice number: {}", key);
            }
        }
        return result;
    }

    /**
     * Magnitude file references of one slice: the value of {@code mre.mag.slice.N} and of any
     * {@code mre.mag.slice.N.*} key, in digest order.
     */
    public List<String> getMagnitudeSliceFiles(int sliceNumber) {
        String exact = MAG_SLICE_PREFIX + sliceNumber;
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : content.entrySet()) {
            String key = entry.getKey();
            if (key.equals(exact) || key.startsWith(exact + ".")) {
                result.add(entry.getValue());
            }
        }
        return result;
    }

    public String getMagnitudeSeriesNumber() {
        String value = content.get(MAG_SERIES_NUMBER);
        return value == null || value.isEmpty() ? null : value;
    }
}

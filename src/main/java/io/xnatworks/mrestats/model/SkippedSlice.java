/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An ROI slice that could not be bound to any contrast slice.
 */
public final class SkippedSlice {

    private final int sliceNumber;
    private final Double sliceLocation;
    private final String reason;

    public SkippedSlice(int sliceNumber, Double sliceLocation, String reason) {
        this.sliceNumber = sliceNumber;
        this.sliceLocation = sliceLocation;
        this.reason = reason;
    }

    @JsonProperty("slice_number")
    public int getSliceNumber() {
        return sliceNumber;
    }

    @JsonProperty("slice_location")
    public Double getSliceLocation() {
        return sliceLocation;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "SkippedSlice{" + sliceNumber + " @ " + sliceLocation + ": " + reason + "}";
    }
}

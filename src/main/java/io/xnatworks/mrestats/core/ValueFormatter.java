/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.core;

import java.util.Locale;

/**
 * Fixed-precision, locale-independent number formatting for report values.
 */
public final class ValueFormatter {

    private final int decimalPlaces;
    private final String pattern;

    public ValueFormatter(int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must be >= 0, got " + decimalPlaces);
        }
        this.decimalPlaces = decimalPlaces;
        this.pattern = "%." + decimalPlaces + "f";
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }

    public String format(double value) {
        String text = String.format(Locale.ROOT, pattern, value);
        // "-0.00" reads as a sign error in reports
        if (text.startsWith("-") && Double.parseDouble(text) == 0.0) {
            return text.substring(1);
        }
        return text;
    }
}

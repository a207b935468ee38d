/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.core;

/**
 * Receives progress and degradation messages of a measurement.
 * Implementations must not throw; messages never affect results.
 */
public interface AnalysisLogger {

    /**
     * Discards all messages.
     */
    AnalysisLogger NOOP = new AnalysisLogger() {
        @Override
        public void info(String message) {
        }

        @Override
        public void warning(String message) {
        }
    };

    void info(String message);

    void warning(String message);
}

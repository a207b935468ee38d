/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.mrestats.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every message for assertions.
 */
public class RecordingLogger implements AnalysisLogger {

    public final List<String> infos = new ArrayList<>();
    public final List<String> warnings = new ArrayList<>();

    @Override
    public void info(String message) {
        infos.add(message);
    }

    @Override
    public void warning(String message) {
        warnings.add(message);
    }

    public boolean hasWarningContaining(String text) {
        for (String warning : warnings) {
            if (warning.contains(text)) {
                return true;
            }
        }
        return false;
    }
}

/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.resolve;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A required digest, directory or ROI file could not be located.
 */
public class ResolutionException extends Exception {

    private final List<Path> attemptedPaths;

    public ResolutionException(String message, List<Path> attemptedPaths) {
        super(describe(message, attemptedPaths));
        this.attemptedPaths = Collections.unmodifiableList(new ArrayList<>(attemptedPaths));
    }

    public ResolutionException(String message, Path attemptedPath, Throwable cause) {
        super(describe(message, List.of(attemptedPath)), cause);
        this.attemptedPaths = List.of(attemptedPath);
    }

    public List<Path> getAttemptedPaths() {
        return attemptedPaths;
    }

    private static String describe(String message, List<Path> attemptedPaths) {
        if (attemptedPaths.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (tried: ");
        for (int i = 0; i < attemptedPaths.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(attemptedPaths.get(i));
        }
        return sb.append(')').toString();
    }
}

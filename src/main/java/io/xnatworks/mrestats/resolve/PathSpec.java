/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.resolve;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * A directory argument that is either given explicitly or located from the digest.
 */
public abstract class PathSpec {

    /** Command line value that selects {@link AutoResolve}. */
    public static final String AUTO_KEYWORD = "default";

    private static final PathSpec AUTO = new AutoResolve();

    private PathSpec() {
    }

    public static PathSpec auto() {
        return AUTO;
    }

    public static PathSpec explicit(Path path) {
        return new Explicit(path);
    }

    /**
     * @param value a path, or null, blank or {@value #AUTO_KEYWORD} for automatic resolution
     */
    public static PathSpec parse(String value) {
        if (value == null || value.isBlank() || AUTO_KEYWORD.equalsIgnoreCase(value.trim())) {
            return AUTO;
        }
        return new Explicit(Paths.get(value.trim()));
    }

    public abstract boolean isAutoResolve();

    /**
     * @throws IllegalStateException for {@link AutoResolve}
     */
    public abstract Path getPath();

    public static final class Explicit extends PathSpec {
        private final Path path;

        private Explicit(Path path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        @Override
        public boolean isAutoResolve() {
            return false;
        }

        @Override
        public Path getPath() {
            return path;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Explicit && path.equals(((Explicit) o).path);
        }

        @Override
        public int hashCode() {
            return path.hashCode();
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    public static final class AutoResolve extends PathSpec {
        private AutoResolve() {
        }

        @Override
        public boolean isAutoResolve() {
            return true;
        }

        @Override
        public Path getPath() {
            throw new IllegalStateException("AutoResolve has no path until resolved");
        }

        @Override
        public String toString() {
            return AUTO_KEYWORD;
        }
    }
}

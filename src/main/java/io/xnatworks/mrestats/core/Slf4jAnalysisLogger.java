/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Forwards measurement messages to an SLF4J logger.
 */
public class Slf4jAnalysisLogger implements AnalysisLogger {

    private final Logger logger;

    public Slf4jAnalysisLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static Slf4jAnalysisLogger forClass(Class<?> type) {
        return new Slf4jAnalysisLogger(LoggerFactory.getLogger(type));
    }

    @Override
    public void info(String message) {
        logger.info(message);
    }

    @Override
    public void warning(String message) {
        logger.warn(message);
    }
}

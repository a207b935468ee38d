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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parser for {@code key = value % comment} digest files.
 *
 * Blank lines and lines without {@code =} are ignored. Text after the first {@code %} is a comment.
 * A repeated key keeps its last value.
 */
public final class DigestParser {
    private static final Logger log = LoggerFactory.getLogger(DigestParser.class);

    private DigestParser() {
    }

    public static Alc2Digest parse(Path digestPath) throws IOException {
        byte[] bytes = Files.readAllBytes(digestPath);
        Alc2Digest digest = parse(new String(bytes, StandardCharsets.UTF_8));
        log.debug("Parsed digest {}: {} entries, {} comments",
                digestPath, digest.getContent().size(), digest.getComments().size());
        return digest;
    }

    public static Alc2Digest parse(String text) {
        Map<String, String> content = new LinkedHashMap<>();
        Set<String> comments = new LinkedHashSet<>();

        for (String line : text.split("\\r?\\n|\\r")) {
            if (line.isBlank()) {
                continue;
            }
            String data = line;
            int commentStart = line.indexOf('%');
            if (commentStart >= 0) {
                String comment = line.substring(commentStart + 1).trim();
                if (!comment.isEmpty()) {
                    comments.add(comment);
                }
                data = line.substring(0, commentStart);
            }
            int eq = data.indexOf('=');
            if (eq < 0) {
                continue;
            }
            content.put(data.substring(0, eq).trim(), data.substring(eq + 1).trim());
        }

        return new Alc2Digest(content, comments);
    }
}

package com.tracematrix.core.link;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a repository path is implementation code: it must match an inclusion
 * pattern (source directory or source extension) and no exclusion pattern (tests, docs,
 * markdown, READMEs).
 */
public class PathClassifier {

    private final List<Pattern> includes;
    private final List<Pattern> excludes;

    public PathClassifier(List<Pattern> includes, List<Pattern> excludes) {
        this.includes = List.copyOf(includes);
        this.excludes = List.copyOf(excludes);
    }

    public boolean isImplementation(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String normalized = path.replace('\\', '/');
        return anyMatch(includes, normalized) && !anyMatch(excludes, normalized);
    }

    private static boolean anyMatch(List<Pattern> patterns, String path) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}

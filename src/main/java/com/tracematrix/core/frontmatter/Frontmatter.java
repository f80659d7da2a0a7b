package com.tracematrix.core.frontmatter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of reading the {@code ---} fenced header of a markdown artifact.
 * <p>
 * A frontmatter is always a partial record: typed accessors return the supplied default
 * when a field is absent or blank, so callers never see {@code null} leak from a
 * hand-authored file. {@link #kind()} tells how the block was obtained.
 */
public final class Frontmatter {

    public enum Kind {
        /** No fenced block at the top of the file. */
        ABSENT,
        /** Block parsed as YAML. */
        PARSED,
        /** YAML rejected the block; fields were recovered line by line. */
        LENIENT
    }

    private static final Frontmatter ABSENT = new Frontmatter(Kind.ABSENT, Map.of(), null);

    private final Kind kind;
    private final Map<String, Object> fields;
    private final String problem;

    Frontmatter(Kind kind, Map<String, Object> fields, String problem) {
        this.kind = kind;
        this.fields = new LinkedHashMap<>(fields);
        this.problem = problem;
    }

    public static Frontmatter absent() {
        return ABSENT;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isPresent() {
        return kind != Kind.ABSENT;
    }

    /** Parser diagnostic when {@link Kind#LENIENT}, otherwise {@code null}. */
    public String problem() {
        return problem;
    }

    public String string(String key, String defaultValue) {
        Object value = fields.get(key);
        if (value == null || value instanceof Collection<?> || value instanceof Map<?, ?>) {
            return defaultValue;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? defaultValue : text;
    }

    /** First non-blank value among {@code keys}, or {@code defaultValue}. */
    public String firstString(String defaultValue, String... keys) {
        for (String key : keys) {
            String value = string(key, null);
            if (value != null) {
                return value;
            }
        }
        return defaultValue;
    }

    /**
     * Reads a list field. A scalar value is treated as a one-element list; blank entries are dropped.
     */
    public List<String> stringList(String... keys) {
        for (String key : keys) {
            Object value = fields.get(key);
            if (value == null) {
                continue;
            }
            var result = new ArrayList<String>();
            if (value instanceof Collection<?> items) {
                for (Object item : items) {
                    if (item != null && !String.valueOf(item).isBlank()) {
                        result.add(String.valueOf(item).trim());
                    }
                }
            } else if (!String.valueOf(value).isBlank()) {
                result.add(String.valueOf(value).trim());
            }
            return result;
        }
        return List.of();
    }

    public boolean flag(String key, boolean defaultValue) {
        Object value = fields.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value == null) {
            return defaultValue;
        }
        String text = String.valueOf(value).trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("yes")) return true;
        if (text.equalsIgnoreCase("false") || text.equalsIgnoreCase("no")) return false;
        return defaultValue;
    }

    @Override
    public String toString() {
        return "Frontmatter[" + kind + ", " + fields.keySet() + "]";
    }
}

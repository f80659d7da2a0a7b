package com.tracematrix.core.reference;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls requirement identifiers out of free text.
 * <p>
 * Matching is case-sensitive and requires exactly three digits: {@code REQ-001} matches,
 * {@code req-001}, {@code REQ-1} and {@code REQ-0011} do not. Every scanner that reads free
 * text goes through this class so coverage figures agree with each other.
 */
public final class ReferenceExtractor {

    static final Pattern REQUIREMENT_REF = Pattern.compile("(?<![A-Za-z0-9])REQ-\\d{3}(?!\\d)");

    private ReferenceExtractor() {}

    /**
     * @param text arbitrary text, may be {@code null}
     * @return the distinct identifiers found, in natural order
     */
    public static SortedSet<String> extractReferences(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptySortedSet();
        }
        var refs = new TreeSet<String>();
        Matcher matcher = REQUIREMENT_REF.matcher(text);
        while (matcher.find()) {
            refs.add(matcher.group());
        }
        return Collections.unmodifiableSortedSet(refs);
    }
}

package com.tracematrix.core.reference;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant comparison between a requirement ID and a loosely written reference to it.
 * <p>
 * Both sides are lower-cased. They match when equal, or when one of them, with a leading
 * {@code req-} removed, is a suffix of the other. That accepts {@code 044}, {@code req-044}
 * and {@code REQ-044} for {@code REQ-044}.
 * <p>
 * Known limitation: the suffix rule also accepts unrelated IDs that share trailing digits,
 * e.g. {@code 044} against {@code REQ-1044}. This leniency is kept on purpose until the
 * intended strictness is settled; do not tighten it silently.
 */
public final class RequirementIdMatcher {

    private static final String PREFIX = "req-";
    private static final Pattern BRANCH_REQUIREMENT = Pattern.compile("req-(\\d+)", Pattern.CASE_INSENSITIVE);

    private RequirementIdMatcher() {}

    public static boolean matches(String reference, String requirementId) {
        if (reference == null || requirementId == null) {
            return false;
        }
        String ref = reference.trim().toLowerCase(Locale.ROOT);
        String id = requirementId.trim().toLowerCase(Locale.ROOT);
        String bareRef = stripPrefix(ref);
        String bareId = stripPrefix(id);
        if (bareRef.isEmpty() || bareId.isEmpty()) {
            return false;
        }
        return ref.equals(id) || ref.endsWith(bareId) || id.endsWith(bareRef);
    }

    /**
     * Finds a {@code req-NNN} fragment anywhere in {@code text} (any case) and returns it
     * normalized to upper case with the number left-padded to three digits.
     */
    public static Optional<String> normalizedIdIn(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = BRANCH_REQUIREMENT.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(normalize(matcher.group(1)));
    }

    /** {@code 7 -> REQ-007}, {@code 1044 -> REQ-1044}. */
    public static String normalize(String digits) {
        var padded = new StringBuilder(digits);
        while (padded.length() < 3) {
            padded.insert(0, '0');
        }
        return "REQ-" + padded;
    }

    private static String stripPrefix(String value) {
        return value.startsWith(PREFIX) ? value.substring(PREFIX.length()) : value;
    }
}

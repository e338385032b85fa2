package com.contacts.merger.normalizer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Display-name rules shared by the loaders and the merge engine.
 * <p>
 * Records of the one modifiable address-book group, and every record coming from the secondary
 * source, carry a trailing {@value #MARKER} token. The token is ignored when names are compared.
 */
public final class NameNormalizer {

    public static final String MARKER = "Lab";

    private static final String MARKER_SUFFIX = " " + MARKER;
    private static final Pattern MARKER_WORD = Pattern.compile("\\b" + MARKER + "\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private NameNormalizer() {
    }

    public static String stripMarkerToken(String name) {
        if (name == null) {
            return "";
        }
        return collapseWhitespace(MARKER_WORD.matcher(name).replaceAll(""));
    }

    /** Lower-cased, marker-free form used only for equality matching. */
    public static String comparisonKey(String name) {
        return stripMarkerToken(name).toLowerCase(Locale.ROOT);
    }

    public static String normalizeDisplayName(String raw, boolean appendMarker, boolean preserveMarker) {
        if (raw == null || raw.isEmpty()) {
            return appendMarker ? MARKER : "";
        }
        String s = preserveMarker ? raw : MARKER_WORD.matcher(raw).replaceAll("");
        s = collapseWhitespace(s);
        if (appendMarker && !hasTrailingMarker(s)) {
            s = (s + MARKER_SUFFIX).trim();
        }
        return s;
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    private static boolean hasTrailingMarker(String value) {
        return value.equals(MARKER) || value.endsWith(MARKER_SUFFIX);
    }
}

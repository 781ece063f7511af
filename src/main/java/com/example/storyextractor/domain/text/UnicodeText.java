package com.example.storyextractor.domain.text;

import java.util.regex.Pattern;

/**
 * Whitespace handling for text taken from Word documents.
 * Treats every Unicode space separator as whitespace, so no-break spaces (U+00A0) and similar characters
 * that Word inserts are stripped like ordinary spaces. {@link String#trim()} and {@link String#strip()} keep them.
 */
public final class UnicodeText {

    private static final Pattern OUTER_WHITESPACE =
            Pattern.compile("^[\\p{Z}\\s]+|[\\p{Z}\\s]+$", Pattern.UNICODE_CHARACTER_CLASS);

    private UnicodeText() {
    }

    /**
     * @param value text to strip, may be {@code null}
     * @return text without leading or trailing Unicode whitespace, never {@code null}
     */
    public static String strip(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return OUTER_WHITESPACE.matcher(value).replaceAll("");
    }

    /**
     * @param value text to test, may be {@code null}
     * @return {@code true} when the text is null or consists of Unicode whitespace only
     */
    public static boolean isBlank(String value) {
        return strip(value).isEmpty();
    }
}

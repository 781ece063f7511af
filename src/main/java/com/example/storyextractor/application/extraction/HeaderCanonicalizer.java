package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.text.UnicodeText;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps the many header spellings authors use in acceptance criteria tables onto a fixed vocabulary.
 * Variants such as {@code "Sr. No"}, {@code "S.No"} or {@code "Sr.No."} all normalize to {@link #AC_NUMBER}.
 */
@Component
public class HeaderCanonicalizer {

    public static final String SCENARIO = "Scenario";
    public static final String GIVEN = "Given";
    public static final String WHEN = "When";
    public static final String THEN = "Then";
    public static final String EXPECTED = "Expected";
    public static final String ACCEPTANCE_CRITERIA = "Acceptance Criteria";
    public static final String AC_NUMBER = "AC #";

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w#]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Map<String, String> HEADER_ALIASES = Map.ofEntries(
            Map.entry("scenario", SCENARIO),
            Map.entry("given", GIVEN),
            Map.entry("precondition", GIVEN),
            Map.entry("when", WHEN),
            Map.entry("action", WHEN),
            Map.entry("then", THEN),
            Map.entry("expected", EXPECTED),
            Map.entry("expected result", EXPECTED),
            Map.entry("result", EXPECTED),
            Map.entry("acceptance criteria", ACCEPTANCE_CRITERIA),
            Map.entry("criteria", ACCEPTANCE_CRITERIA),
            Map.entry("ac", ACCEPTANCE_CRITERIA),
            Map.entry("#", AC_NUMBER),
            Map.entry("no", AC_NUMBER),
            Map.entry("id", AC_NUMBER),
            Map.entry("sr no", AC_NUMBER),
            Map.entry("s no", AC_NUMBER),
            Map.entry("sno", AC_NUMBER),
            Map.entry("srno", AC_NUMBER),
            Map.entry("ac #", AC_NUMBER),
            Map.entry("ac no", AC_NUMBER),
            Map.entry("ac number", AC_NUMBER)
    );

    /**
     * Normalizes a raw header cell and resolves it against the alias table.
     *
     * @param text raw header text, may be {@code null}
     * @return canonical header, the trimmed original when no alias matches, or an empty string for blank input
     */
    public String canonicalize(String text) {
        String raw = UnicodeText.strip(text);
        String normalized = PUNCTUATION.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll(" ");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        normalized = UnicodeText.strip(normalized);
        return HEADER_ALIASES.getOrDefault(normalized, raw);
    }
}

package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.EpicMarker;
import com.example.storyextractor.domain.model.StoryMarker;
import com.example.storyextractor.domain.text.UnicodeText;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes epic and story heading lines such as {@code "Epic 2 - Search"} or {@code "User Story 2.1.3: Filters"}.
 * Matching is case-insensitive and accepts a colon, hyphen, en dash or em dash as separator.
 */
@Component
public class MarkerMatcher {

    private static final Pattern EPIC_PATTERN = Pattern.compile(
            "^\\s*Epic\\s+(\\d+)\\s*[:\\-\\u2013\\u2014]\\s*(.+)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern STORY_PATTERN = Pattern.compile(
            "^\\s*(?:User\\s+)?Story\\s+(\\d+(?:\\.\\d+)*)\\s*[:\\-\\u2013\\u2014]\\s*(.+)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    public Optional<EpicMarker> matchEpic(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = EPIC_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new EpicMarker(matcher.group(1), UnicodeText.strip(matcher.group(2))));
    }

    public Optional<StoryMarker> matchStory(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = STORY_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new StoryMarker(matcher.group(1), UnicodeText.strip(matcher.group(2))));
    }
}

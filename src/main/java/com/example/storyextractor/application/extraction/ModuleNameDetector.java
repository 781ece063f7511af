package com.example.storyextractor.application.extraction;

import com.example.storyextractor.domain.model.DocumentBlock;
import com.example.storyextractor.domain.model.ParagraphBlock;
import com.example.storyextractor.domain.model.RequirementsTables;
import com.example.storyextractor.domain.text.UnicodeText;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the document wide module name given by a {@code "Module: <name>"} paragraph.
 */
@Component
public class ModuleNameDetector {

    private static final Pattern MODULE_PATTERN =
            Pattern.compile("Module\\s*[:\\-\\u2013\\u2014]\\s*(.+)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Searches the non-blank paragraph lines in document order. Tables are not considered.
     *
     * @param blocks document blocks
     * @return module name of the first match, or {@code "Unknown"}
     */
    public String detect(List<DocumentBlock> blocks) {
        String fullText = blocks.stream()
                .filter(ParagraphBlock.class::isInstance)
                .map(block -> UnicodeText.strip(((ParagraphBlock) block).text()))
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
        Matcher matcher = MODULE_PATTERN.matcher(fullText);
        if (matcher.find()) {
            return UnicodeText.strip(matcher.group(1));
        }
        return RequirementsTables.UNKNOWN;
    }
}

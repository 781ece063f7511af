package com.example.storyextractor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the story extractor.
 */
@ConfigurationProperties(prefix = "story-extractor")
public record StoryExtractorProperties(Export export) {

    public StoryExtractorProperties {
        export = export == null ? new Export(null, null, null) : export;
    }

    /**
     * Settings for the downloadable exports.
     *
     * @param storiesFileName            base file name of the Stories download
     * @param acceptanceCriteriaFileName base file name of the Acceptance Criteria download
     * @param csvByteOrderMark           whether CSV downloads start with a UTF-8 byte order mark
     */
    public record Export(String storiesFileName, String acceptanceCriteriaFileName, Boolean csvByteOrderMark) {

        public Export {
            storiesFileName = storiesFileName == null || storiesFileName.isBlank() ? "stories" : storiesFileName;
            acceptanceCriteriaFileName = acceptanceCriteriaFileName == null || acceptanceCriteriaFileName.isBlank()
                    ? "acceptance_criteria"
                    : acceptanceCriteriaFileName;
            csvByteOrderMark = csvByteOrderMark == null ? Boolean.TRUE : csvByteOrderMark;
        }
    }
}

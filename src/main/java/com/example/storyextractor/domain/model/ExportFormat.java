package com.example.storyextractor.domain.model;

import java.util.Locale;

/**
 * Download formats offered for the output tables.
 */
public enum ExportFormat {
    CSV("csv", "text/csv"),
    XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final String extension;
    private final String mediaType;

    ExportFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

	/**
	 * Parses a request parameter into a format.
	 * Invalid or unknown values fall back to {@link #CSV}.
	 *
	 * @param rawValue value coming from the HTTP layer
	 * @return parsed format
	 */
    public static ExportFormat fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return CSV;
        }
        String normalized = rawValue.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("EXCEL") || normalized.equals("XLS")) {
            return XLSX;
        }
        try {
            return ExportFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return CSV;
        }
    }
}

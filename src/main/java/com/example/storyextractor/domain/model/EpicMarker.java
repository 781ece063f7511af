package com.example.storyextractor.domain.model;

/**
 * Epic heading recognized in a paragraph such as {@code "Epic 1: Payments"}.
 */
public record EpicMarker(String number, String title) {

    /**
     * @return label used in the output tables, e.g. {@code "1: Payments"}
     */
    public String label() {
        return number + ": " + title;
    }
}

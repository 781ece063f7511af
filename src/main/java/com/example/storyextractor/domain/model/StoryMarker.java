package com.example.storyextractor.domain.model;

/**
 * Story heading recognized in a paragraph such as {@code "Story 1.1: Refund flow"}.
 */
public record StoryMarker(String storyId, String title) {
}

package com.example.storyextractor.domain.model;

/**
 * Domain DTO holding the plain text of a single document paragraph.
 */
public record ParagraphBlock(String text) implements DocumentBlock {

    public ParagraphBlock {
        text = text == null ? "" : text;
    }
}

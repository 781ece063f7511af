package com.example.storyextractor.domain.model;

/**
 * Domain marker for one top-level element of a Word document body.
 * A document is handed to the extraction core as an ordered list of these blocks, either
 * {@link ParagraphBlock} or {@link TableBlock}, in the order they appear in the source file.
 */
public interface DocumentBlock {
}

package com.example.storyextractor.application.extraction;

/**
 * Half-open range {@code [start, end)} of table row indices.
 */
public record RowRange(int start, int end) {

    public boolean isEmpty() {
        return start >= end;
    }
}

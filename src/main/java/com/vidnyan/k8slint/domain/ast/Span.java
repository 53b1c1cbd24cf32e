package com.vidnyan.k8slint.domain.ast;

/**
 * Extent of a node in its source file.
 *
 * @param start  char offset of the first character
 * @param end    char offset just past the last character
 * @param line   1-based line of {@code start}
 * @param column 1-based byte column of {@code start}, as Go tooling reports it
 */
public record Span(int start, int end, int line, int column) {

    public boolean encloses(Span other) {
        return other != null && start <= other.start && other.end <= end;
    }

    public String format() {
        return line + ":" + column;
    }
}

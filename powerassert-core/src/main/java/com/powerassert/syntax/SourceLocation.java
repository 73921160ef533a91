package com.powerassert.syntax;

/**
 * A position in source text. Both values are 1-based; the column counts UTF-8 bytes
 * from the start of the line and is not adjusted for display width.
 */
public record SourceLocation(int line, int column) {
}

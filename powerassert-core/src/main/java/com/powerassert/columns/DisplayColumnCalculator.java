package com.powerassert.columns;

import com.powerassert.syntax.SourceLocation;
import com.powerassert.syntax.SourceLocationConverter;
import com.powerassert.syntax.Syntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Converts node positions into 1-based terminal display columns.
 *
 * <p>The display column of a node is the display width of everything on its line before
 * it, plus one. On a pure ASCII line that is exactly the raw column.</p>
 */
public final class DisplayColumnCalculator {

    private static final Logger logger = LoggerFactory.getLogger(DisplayColumnCalculator.class);

    private final SourceLocationConverter converter;

    public DisplayColumnCalculator(SourceLocationConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    public int columnOf(Syntax node) {
        SourceLocation location = converter.location(node);
        return displayColumn(converter.lineBytes(location.line()), location.column());
    }

    /**
     * Display column for a raw 1-based byte column on a line. Falls back to the raw
     * column when the bytes before it cannot be decoded.
     */
    public static int displayColumn(byte[] lineBytes, int rawColumn) {
        OptionalInt width = DisplayWidth.ofUtf8(lineBytes, rawColumn - 1);
        if (width.isPresent()) {
            return width.getAsInt() + 1;
        }
        logger.debug("Prefix of {} bytes is not decodable, using raw column {}", rawColumn - 1, rawColumn);
        return rawColumn;
    }
}

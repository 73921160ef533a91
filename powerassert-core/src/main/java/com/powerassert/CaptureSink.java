package com.powerassert;

import java.util.Objects;

/**
 * How to spell a call to the external capture sink:
 * {@code receiver.function(value, columnLabel: column)}.
 *
 * <p>An empty receiver calls {@code function} unqualified; a null column label passes
 * the column positionally.</p>
 */
public record CaptureSink(
    String receiver,
    String function,
    String columnLabel
) {
    public static final CaptureSink DEFAULT = new CaptureSink("$0", "capture", "column");

    public CaptureSink {
        Objects.requireNonNull(receiver, "receiver");
        Objects.requireNonNull(function, "function");
        if (function.isEmpty()) {
            throw new IllegalArgumentException("Capture function name must not be empty");
        }
    }
}

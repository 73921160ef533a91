package com.powerassert.syntax;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the nodes of one tree instance to source locations.
 *
 * <p>The tree is printed once and every element's start and end byte offsets are
 * recorded by identity. A node starts where the text of its first token starts and ends
 * where the text of its last token ends; surrounding trivia is excluded.</p>
 */
public final class SourceLocationConverter {

    private final byte[] bytes;
    private final int[] lineOffsets; // byte offset at which each line starts
    private final Map<Syntax, Integer> startOffsets = new IdentityHashMap<>();
    private final Map<Syntax, Integer> endOffsets = new IdentityHashMap<>();

    public SourceLocationConverter(Syntax root) {
        Objects.requireNonNull(root, "root");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        index(root, out);
        this.bytes = out.toByteArray();
        this.lineOffsets = computeLineOffsets(bytes);
    }

    private void index(Syntax syntax, ByteArrayOutputStream out) {
        if (syntax instanceof Token token) {
            out.writeBytes(token.leadingTrivia().getBytes(StandardCharsets.UTF_8));
            startOffsets.put(token, out.size());
            out.writeBytes(token.text().getBytes(StandardCharsets.UTF_8));
            endOffsets.put(token, out.size());
            out.writeBytes(token.trailingTrivia().getBytes(StandardCharsets.UTF_8));
            return;
        }
        int fallback = out.size();
        for (Syntax child : syntax.children()) {
            index(child, out);
        }
        Token first = syntax.firstToken();
        Token last = syntax.lastToken();
        startOffsets.put(syntax, first != null ? startOffsets.get(first) : fallback);
        endOffsets.put(syntax, last != null ? endOffsets.get(last) : fallback);
    }

    private static int[] computeLineOffsets(byte[] bytes) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                offsets.add(i + 1);
            } else if (bytes[i] == '\r') {
                if (i + 1 < bytes.length && bytes[i + 1] == '\n') {
                    i++;
                }
                offsets.add(i + 1);
            }
        }
        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Location of the first character of the node's first token.
     *
     * @throws IllegalArgumentException if the node is not part of the bound tree
     */
    public SourceLocation location(Syntax node) {
        return locationOf(offsetOf(startOffsets, node));
    }

    /**
     * Location just past the last character of the node's last token.
     *
     * @throws IllegalArgumentException if the node is not part of the bound tree
     */
    public SourceLocation endLocation(Syntax node) {
        return locationOf(offsetOf(endOffsets, node));
    }

    public boolean contains(Syntax node) {
        return startOffsets.containsKey(node);
    }

    public int lineCount() {
        return lineOffsets.length;
    }

    /**
     * UTF-8 bytes of a line, without its line terminator.
     */
    public byte[] lineBytes(int line) {
        if (line < 1 || line > lineOffsets.length) {
            throw new IllegalArgumentException("Line " + line + " out of range 1.." + lineOffsets.length);
        }
        int start = lineOffsets[line - 1];
        int end = line < lineOffsets.length ? lineOffsets[line] : bytes.length;
        while (end > start && (bytes[end - 1] == '\n' || bytes[end - 1] == '\r')) {
            end--;
        }
        return Arrays.copyOfRange(bytes, start, end);
    }

    public String lineText(int line) {
        return new String(lineBytes(line), StandardCharsets.UTF_8);
    }

    public String source() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static int offsetOf(Map<Syntax, Integer> offsets, Syntax node) {
        Integer offset = offsets.get(node);
        if (offset == null) {
            throw new IllegalArgumentException("Node is not part of the tree this converter is bound to: "
                + node.toSource().strip());
        }
        return offset;
    }

    private SourceLocation locationOf(int offset) {
        int line = Arrays.binarySearch(lineOffsets, offset);
        if (line < 0) {
            line = -line - 2;
        }
        return new SourceLocation(line + 1, offset - lineOffsets[line] + 1);
    }
}

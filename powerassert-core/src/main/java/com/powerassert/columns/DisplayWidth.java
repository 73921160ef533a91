package com.powerassert.columns;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number of terminal cells a piece of text occupies.
 *
 * <p>Text is measured per extended grapheme cluster. A cluster made only of zero-width
 * code points (combining and enclosing marks, format and control characters, variation
 * selectors) takes no cell. A cluster whose base character is East Asian Wide or
 * Fullwidth, or which requests emoji presentation with U+FE0F, takes two. Everything
 * else takes one.</p>
 */
public final class DisplayWidth {

    private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

    private static final int EMOJI_PRESENTATION_SELECTOR = 0xFE0F;

    // Inclusive [start, end] ranges of East Asian Wide / Fullwidth code points, sorted.
    private static final int[][] WIDE_RANGES = {
        {0x1100, 0x115F}, {0x231A, 0x231B}, {0x2329, 0x232A}, {0x23E9, 0x23EC},
        {0x23F0, 0x23F0}, {0x23F3, 0x23F3}, {0x25FD, 0x25FE}, {0x2614, 0x2615},
        {0x2648, 0x2653}, {0x267F, 0x267F}, {0x2693, 0x2693}, {0x26A1, 0x26A1},
        {0x26AA, 0x26AB}, {0x26BD, 0x26BE}, {0x26C4, 0x26C5}, {0x26CE, 0x26CE},
        {0x26D4, 0x26D4}, {0x26EA, 0x26EA}, {0x26F2, 0x26F3}, {0x26F5, 0x26F5},
        {0x26FA, 0x26FA}, {0x26FD, 0x26FD}, {0x2705, 0x2705}, {0x270A, 0x270B},
        {0x2728, 0x2728}, {0x274C, 0x274C}, {0x274E, 0x274E}, {0x2753, 0x2755},
        {0x2757, 0x2757}, {0x2795, 0x2797}, {0x27B0, 0x27B0}, {0x27BF, 0x27BF},
        {0x2B1B, 0x2B1C}, {0x2B50, 0x2B50}, {0x2B55, 0x2B55}, {0x2E80, 0x303E},
        {0x3041, 0x33FF}, {0x3400, 0x4DBF}, {0x4E00, 0x9FFF}, {0xA000, 0xA4CF},
        {0xA960, 0xA97F}, {0xAC00, 0xD7A3}, {0xF900, 0xFAFF}, {0xFE10, 0xFE19},
        {0xFE30, 0xFE6F}, {0xFF00, 0xFF60}, {0xFFE0, 0xFFE6}, {0x16FE0, 0x16FE4},
        {0x17000, 0x18AFF}, {0x1B000, 0x1B2FF}, {0x1F004, 0x1F004}, {0x1F0CF, 0x1F0CF},
        {0x1F18E, 0x1F18E}, {0x1F191, 0x1F19A}, {0x1F200, 0x1F251}, {0x1F300, 0x1F64F},
        {0x1F680, 0x1F6FF}, {0x1F7E0, 0x1F7EB}, {0x1F90C, 0x1F9FF}, {0x1FA70, 0x1FAFF},
        {0x20000, 0x2FFFD}, {0x30000, 0x3FFFD},
    };

    private DisplayWidth() {
        // Utility class
    }

    public static int of(CharSequence text) {
        Matcher matcher = GRAPHEME_CLUSTER.matcher(text);
        int width = 0;
        while (matcher.find()) {
            width += clusterWidth(matcher.group());
        }
        return width;
    }

    /**
     * Width of the first {@code length} bytes of UTF-8 encoded text, or empty when those
     * bytes are not valid UTF-8 (for instance when they end inside a multi-byte sequence).
     */
    public static OptionalInt ofUtf8(byte[] bytes, int length) {
        if (length < 0 || length > bytes.length) {
            return OptionalInt.empty();
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(bytes, 0, length));
            return OptionalInt.of(of(decoded));
        } catch (CharacterCodingException e) {
            return OptionalInt.empty();
        }
    }

    static int clusterWidth(String cluster) {
        int base = -1;
        boolean emojiPresentation = false;
        for (int i = 0; i < cluster.length(); ) {
            int codePoint = cluster.codePointAt(i);
            i += Character.charCount(codePoint);
            if (codePoint == EMOJI_PRESENTATION_SELECTOR) {
                emojiPresentation = true;
            } else if (base < 0 && !isZeroWidth(codePoint)) {
                base = codePoint;
            }
        }
        if (base < 0) {
            return 0;
        }
        return emojiPresentation || isWide(base) ? 2 : 1;
    }

    static boolean isZeroWidth(int codePoint) {
        if (codePoint == 0x200B || (codePoint >= 0xFE00 && codePoint <= 0xFE0F)
                || (codePoint >= 0xE0100 && codePoint <= 0xE01EF)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK
            || type == Character.ENCLOSING_MARK
            || type == Character.FORMAT
            || type == Character.CONTROL;
    }

    static boolean isWide(int codePoint) {
        int low = 0;
        int high = WIDE_RANGES.length - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int[] range = WIDE_RANGES[mid];
            if (codePoint < range[0]) {
                high = mid - 1;
            } else if (codePoint > range[1]) {
                low = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }
}

package de.mirkosertic.lawnotes.util;

import java.util.regex.Pattern;

/**
 * Cleans statute text received from the law API.
 *
 * <p>Leaf strings of the document tree occasionally carry characters that break
 * pattern matching on the flattened text:</p>
 * <ul>
 *   <li>Unicode replacement characters from failed decoding</li>
 *   <li>Control characters that aren't whitespace</li>
 *   <li>Zero-width characters and byte order marks</li>
 * </ul>
 *
 * <p>Ideographic spaces (U+3000) inside a line are part of statute typography and are kept.</p>
 */
public final class TextCleaner {

    /**
     * Pattern matching characters to remove:
     * <ul>
     *   <li>U+0000-U+0008, U+000B-U+000C, U+000E-U+001F: control characters except TAB, LF and CR</li>
     *   <li>U+200B-U+200D: zero-width space, non-joiner and joiner</li>
     *   <li>U+FEFF: byte order mark</li>
     *   <li>U+FFFD: replacement character</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +
        "\u000B-\u000C" +
        "\u000E-\u001F" +
        "\u200B-\u200D" +
        "\uFEFF" +
        "\uFFFD" +
        "]"
    );

    private static final Pattern HORIZONTAL_WHITESPACE_RUN = Pattern.compile("[ \\t]+");

    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Remove invalid characters but keep whitespace exactly as it is.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static String removeInvalidCharacters(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return INVALID_CHARS.matcher(text).replaceAll("");
    }

    /**
     * Normalize the layout of flattened statute text: runs of spaces and tabs become
     * one space, every line is stripped of surrounding whitespace (ideographic spaces included)
     * and blank lines are dropped.
     *
     * @param text flattened text (may be null)
     * @return lines joined with {@code \n}; empty string if nothing but whitespace remains
     */
    public static String normalizeLines(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String collapsed = HORIZONTAL_WHITESPACE_RUN.matcher(text).replaceAll(" ");
        collapsed = EXCESS_NEWLINES.matcher(collapsed).replaceAll("\n\n");

        final StringBuilder result = new StringBuilder(collapsed.length());
        for (final String line : collapsed.split("\n", -1)) {
            final String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (result.length() > 0) {
                result.append('\n');
            }
            result.append(trimmed);
        }
        return result.toString();
    }
}

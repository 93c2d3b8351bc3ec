package de.mirkosertic.lawnotes.reference;

import java.nio.file.Path;

/**
 * Maps statute titles to note file names and wiki link targets.
 */
public final class NoteNames {

    public static final String NOTE_EXTENSION = ".md";

    private static final String FORBIDDEN_CHARACTERS = "/\\:*?\"<>|";

    private NoteNames() {
    }

    /**
     * Replaces characters that are not allowed in file names with {@code _},
     * trims whitespace and drops trailing periods.
     */
    public static String sanitize(final String title) {
        final StringBuilder result = new StringBuilder(title.length());
        for (int i = 0; i < title.length(); i++) {
            final char c = title.charAt(i);
            result.append(FORBIDDEN_CHARACTERS.indexOf(c) >= 0 ? '_' : c);
        }
        String sanitized = result.toString().trim();
        while (sanitized.endsWith(".")) {
            sanitized = sanitized.substring(0, sanitized.length() - 1);
        }
        return sanitized;
    }

    public static String fileName(final String title) {
        return sanitize(title) + NOTE_EXTENSION;
    }

    /**
     * Directory part of a link: forward slashes, no leading {@code ./}, no surrounding
     * slashes, empty for the current directory.
     */
    public static String linkDirectory(final Path outputDir) {
        String dir = outputDir.toString().replace('\\', '/');
        if (".".equals(dir)) {
            dir = "";
        }
        while (dir.startsWith("./")) {
            dir = dir.substring(2);
        }
        int start = 0;
        int end = dir.length();
        while (start < end && dir.charAt(start) == '/') {
            start++;
        }
        while (end > start && dir.charAt(end - 1) == '/') {
            end--;
        }
        return dir.substring(start, end);
    }

    public static String linkTarget(final String linkDirectory, final String title) {
        final String file = sanitize(title);
        return linkDirectory.isEmpty() ? file : linkDirectory + "/" + file;
    }
}

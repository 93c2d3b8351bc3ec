package de.mirkosertic.lawnotes.reference;

import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;

/**
 * Article headings in note bodies.
 * <p>
 * Every line starting with an article token gets a {@code ## 第N条} heading in front of it, which
 * gives the note one anchor per article and gives the link rewriter its paragraph scope.
 */
public final class ArticleHeadings {

    private static final String HEADING_PREFIX = "## ";

    private ArticleHeadings() {
    }

    public static String promote(final String text) {
        final StringBuilder out = new StringBuilder(text.length() + 64);
        for (final String line : text.lines().toList()) {
            if (line.startsWith("#")) {
                out.append(line).append('\n');
                continue;
            }
            final Matcher matcher = LawTextPatterns.ARTICLE_AT_LINE_START.matcher(line);
            if (matcher.find()) {
                final String token = matcher.group(1);
                out.append(HEADING_PREFIX).append(token).append('\n');
                if (!line.trim().equals(token)) {
                    out.append(line).append('\n');
                }
            } else {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * @return the article token of a heading line such as {@code ## 第三条の二（目的）} → {@code 第三条の二},
     * or null when the line is no article heading
     */
    public static @Nullable String extractAnchor(final String line) {
        int start = 0;
        while (start < line.length() && line.charAt(start) == '#') {
            start++;
        }
        final Matcher matcher = LawTextPatterns.ARTICLE_AT_LINE_START.matcher(line.substring(start).trim());
        return matcher.find() ? matcher.group(1) : null;
    }
}

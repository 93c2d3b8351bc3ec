package de.mirkosertic.lawnotes.reference;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns citations in a statute body into wiki links of the form
 * {@code [[<dir>/<note>#<anchor>|<label>]]}.
 * <p>
 * The body is processed line by line. Heading lines and lines that already contain a link are
 * copied verbatim, which makes rewriting idempotent. On every other line:
 * <ol>
 *     <li>citations of other statutes link to the article anchor of that statute's note</li>
 *     <li>bare article numbers link into the current statute</li>
 *     <li>paragraph and item numbers link to the last article heading seen so far, and stay plain
 *     text before the first heading</li>
 * </ol>
 * Each generated link is parked behind a placeholder until the line is done, so a later pass
 * never matches inside an earlier link.
 * <p>
 * Relative citations like {@code 前条} are left as they are and reported as unresolved.
 */
public class LinkRewriter {

    private static final char PLACEHOLDER_START = '\uE000';
    private static final char PLACEHOLDER_END = '\uE001';
    private static final Pattern PLACEHOLDER = Pattern.compile(PLACEHOLDER_START + "(\\d+)" + PLACEHOLDER_END);

    private final UnaryOperator<String> titleResolver;

    public LinkRewriter() {
        this(UnaryOperator.identity());
    }

    /**
     * @param titleResolver maps a normalized statute name to the title its note is stored under
     */
    public LinkRewriter(final UnaryOperator<String> titleResolver) {
        this.titleResolver = titleResolver;
    }

    /**
     * Result of a rewrite.
     *
     * @param linkedText       the rewritten body, every line terminated by a newline
     * @param unresolvedTokens relative citations left in the text, once per line they occur in
     */
    public record RewriteResult(String linkedText, List<String> unresolvedTokens) {
    }

    public RewriteResult rewrite(final String text, final String currentTitle, final Path linkBaseDir) {
        final String linkDir = NoteNames.linkDirectory(linkBaseDir);
        final String currentTarget = NoteNames.linkTarget(linkDir, currentTitle);

        final StringBuilder out = new StringBuilder(text.length() * 2);
        final List<String> unresolved = new ArrayList<>();
        @Nullable String lastArticleAnchor = null;

        for (final String line : text.lines().toList()) {
            if (line.startsWith("#") || line.contains("[[")) {
                out.append(line).append('\n');
                final String anchor = ArticleHeadings.extractAnchor(line);
                if (anchor != null) {
                    lastArticleAnchor = anchor;
                }
                continue;
            }

            final List<String> links = new ArrayList<>();
            String replaced = replaceAll(line, LawTextPatterns.EXTERNAL_REFERENCE, matcher -> {
                final String fragment = matcher.group("law");
                final String law = TitleNormalizer.normalize(fragment);
                if (law == null) {
                    return matcher.group();
                }
                // text in front of the name stays plain, later passes still see it
                final int nameStart = fragment.lastIndexOf(law);
                final String prefix = nameStart > 0 ? fragment.substring(0, nameStart) : "";
                final String article = matcher.group("article");
                final String target = NoteNames.linkTarget(linkDir, titleResolver.apply(law));
                return prefix + park(links, link(target, article, law + article));
            });

            replaced = replaceAll(replaced, LawTextPatterns.ARTICLE, matcher -> {
                final String article = matcher.group();
                return park(links, link(currentTarget, article, article));
            });

            final String anchor = lastArticleAnchor;
            replaced = replaceAll(replaced, LawTextPatterns.PARAGRAPH, matcher -> anchor == null
                    ? matcher.group()
                    : park(links, link(currentTarget, anchor, matcher.group())));
            replaced = replaceAll(replaced, LawTextPatterns.ITEM, matcher -> anchor == null
                    ? matcher.group()
                    : park(links, link(currentTarget, anchor, matcher.group())));

            replaced = replaceAll(replaced, PLACEHOLDER, matcher -> links.get(Integer.parseInt(matcher.group(1))));

            for (final String token : LawTextPatterns.ANAPHORIC_CITATIONS) {
                if (replaced.contains(token)) {
                    unresolved.add(token);
                }
            }

            final String newAnchor = ArticleHeadings.extractAnchor(replaced);
            if (newAnchor != null) {
                lastArticleAnchor = newAnchor;
            }
            out.append(replaced).append('\n');
        }
        return new RewriteResult(out.toString(), List.copyOf(unresolved));
    }

    private static String link(final String target, final String anchor, final String label) {
        return "[[" + target + "#" + anchor + "|" + label + "]]";
    }

    private static String park(final List<String> links, final String link) {
        links.add(link);
        return PLACEHOLDER_START + Integer.toString(links.size() - 1) + PLACEHOLDER_END;
    }

    private static String replaceAll(final String input, final Pattern pattern,
                                     final Function<Matcher, String> replacement) {
        final Matcher matcher = pattern.matcher(input);
        final StringBuilder result = new StringBuilder(input.length());
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}

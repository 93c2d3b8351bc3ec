package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.model.StatuteContents;
import de.mirkosertic.lawnotes.reference.ArticleHeadings;
import de.mirkosertic.lawnotes.reference.LinkRewriter;
import de.mirkosertic.lawnotes.reference.NoteNames;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes one Markdown note per statute: a YAML front matter block followed by the linked body.
 */
public class NoteWriter {

    private static final Logger logger = LoggerFactory.getLogger(NoteWriter.class);

    static final String SOURCE_API = "v2";

    private final Path outputDir;
    private final boolean noOverwrite;
    private final LinkRewriter linkRewriter;
    private final Clock clock;

    public NoteWriter(final Path outputDir, final boolean noOverwrite, final LinkRewriter linkRewriter,
                      final Clock clock) {
        this.outputDir = outputDir;
        this.noOverwrite = noOverwrite;
        this.linkRewriter = linkRewriter;
        this.clock = clock;
    }

    /**
     * @param path             the written note
     * @param unresolvedTokens relative citations the rewriter could not link
     */
    public record WrittenNote(Path path, List<String> unresolvedTokens) {
    }

    /**
     * @throws java.nio.file.FileAlreadyExistsException if overwriting is disabled and the note exists
     * @throws IOException                               if the note cannot be written
     */
    public WrittenNote write(final StatuteContents contents, final int depth) throws IOException {
        Files.createDirectories(outputDir);
        final Path path = outputDir.resolve(NoteNames.fileName(contents.lawTitle()));

        final String withHeadings = ArticleHeadings.promote(contents.text());
        final LinkRewriter.RewriteResult rewritten = linkRewriter.rewrite(withHeadings, contents.lawTitle(), outputDir);

        final String note = frontMatter(contents, depth) + stripTrailingNewlines(rewritten.linkedText()) + "\n";
        if (noOverwrite) {
            Files.writeString(path, note, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } else {
            Files.writeString(path, note, StandardCharsets.UTF_8);
        }
        logger.debug("Wrote note {} ({} unresolved relative citations)", path, rewritten.unresolvedTokens().size());
        return new WrittenNote(path, rewritten.unresolvedTokens());
    }

    String frontMatter(final StatuteContents contents, final int depth) {
        return "---\n"
                + "law_title: \"" + escapeYaml(contents.lawTitle()) + "\"\n"
                + "law_id: \"" + escapeYaml(contents.lawId()) + "\"\n"
                + "law_num: \"" + escapeYaml(contents.lawNum()) + "\"\n"
                + "source_api: \"" + SOURCE_API + "\"\n"
                + "fetched_at: \"" + DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock)) + "\"\n"
                + "depth: " + depth + "\n"
                + "has_original_xml: " + (contents.originalXml() != null) + "\n"
                + "---\n\n";
    }

    static String escapeYaml(final @Nullable String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String stripTrailingNewlines(final String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(0, end);
    }
}

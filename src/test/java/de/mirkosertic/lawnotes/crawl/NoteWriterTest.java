package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.model.StatuteContents;
import de.mirkosertic.lawnotes.reference.LinkRewriter;
import de.mirkosertic.lawnotes.reference.NoteNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NoteWriter Tests")
class NoteWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static final StatuteContents PATENT_ACT = new StatuteContents(
            "334AC0000000121", "昭和三十四年法律第百二十一号", "特許法",
            "第一条\nこの法律は、発明の保護を図る。\n前条の規定による。", null);

    @TempDir
    Path tempDir;

    private Path outputDir;

    @BeforeEach
    void setUp() {
        outputDir = tempDir.resolve("laws");
    }

    @Test
    @DisplayName("Should write front matter followed by the body with article headings")
    void shouldWriteNote() throws IOException {
        // Given
        final NoteWriter writer = new NoteWriter(outputDir, false, new LinkRewriter(), CLOCK);

        // When
        final NoteWriter.WrittenNote note = writer.write(PATENT_ACT, 1);

        // Then
        assertThat(note.path()).isEqualTo(outputDir.resolve("特許法.md"));
        assertThat(Files.readString(note.path(), StandardCharsets.UTF_8)).isEqualTo("""
                ---
                law_title: "特許法"
                law_id: "334AC0000000121"
                law_num: "昭和三十四年法律第百二十一号"
                source_api: "v2"
                fetched_at: "2024-05-01T12:00:00Z"
                depth: 1
                has_original_xml: false
                ---

                ## 第一条
                この法律は、発明の保護を図る。
                前条の規定による。
                """);
        assertThat(note.unresolvedTokens()).containsExactly("前条");
    }

    @Test
    void shouldLinkCitationsRelativeToOutputDirectory() throws IOException {
        final NoteWriter writer = new NoteWriter(outputDir, false, new LinkRewriter(), CLOCK);
        final StatuteContents contents = new StatuteContents("129AC0000000089", null, "商法",
                "第二条\n民法第九十条を準用する。", null);

        final NoteWriter.WrittenNote note = writer.write(contents, 0);

        final String target = NoteNames.linkTarget(NoteNames.linkDirectory(outputDir), "民法");
        assertThat(Files.readString(note.path(), StandardCharsets.UTF_8))
                .contains("law_num: \"\"")
                .contains("[[" + target + "#第九十条|民法第九十条]]を準用する。");
    }

    @Test
    void shouldSanitizeFileName() throws IOException {
        final NoteWriter writer = new NoteWriter(outputDir, false, new LinkRewriter(), CLOCK);
        final StatuteContents contents = new StatuteContents(null, null, "民法/商法", "本文", null);

        assertThat(writer.write(contents, 0).path().getFileName().toString()).isEqualTo("民法_商法.md");
    }

    @Test
    void shouldReplaceExistingNoteByDefault() throws IOException {
        final NoteWriter writer = new NoteWriter(outputDir, false, new LinkRewriter(), CLOCK);
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("特許法.md"), "old", StandardCharsets.UTF_8);

        final NoteWriter.WrittenNote note = writer.write(PATENT_ACT, 0);

        assertThat(Files.readString(note.path(), StandardCharsets.UTF_8)).startsWith("---\n");
    }

    @Test
    @DisplayName("Should refuse to replace an existing note when overwriting is disabled")
    void shouldNotOverwriteWhenDisabled() throws IOException {
        final NoteWriter writer = new NoteWriter(outputDir, true, new LinkRewriter(), CLOCK);
        Files.createDirectories(outputDir);
        final Path existing = outputDir.resolve("特許法.md");
        Files.writeString(existing, "old", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> writer.write(PATENT_ACT, 0)).isInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readString(existing, StandardCharsets.UTF_8)).isEqualTo("old");
    }

    @Test
    void shouldEscapeQuotesAndBackslashes() {
        assertThat(NoteWriter.escapeYaml("a\"b\\c")).isEqualTo("a\\\"b\\\\c");
        assertThat(NoteWriter.escapeYaml(null)).isEmpty();
    }

    @Test
    void shouldFlagOriginalMarkup() {
        final NoteWriter writer = new NoteWriter(outputDir, false, new LinkRewriter(), CLOCK);
        final StatuteContents withXml = new StatuteContents("id", "num", "特許法", "本文", "<Law/>");

        assertThat(writer.frontMatter(withXml, 2))
                .contains("depth: 2\n")
                .contains("has_original_xml: true\n");
    }
}

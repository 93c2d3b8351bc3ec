package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.model.UnresolvedRef;
import de.mirkosertic.lawnotes.model.UnresolvedRefRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnresolvedRefStoreTest {

    private static final Clock FIRST_RUN = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private static final Clock SECOND_RUN = Clock.fixed(Instant.parse("2024-06-01T08:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldNotTouchFileWithoutEvents() throws IOException {
        final Path file = tempDir.resolve("data").resolve("unresolved_refs.json");

        final int written = new UnresolvedRefStore(file, FIRST_RUN).merge(List.of());

        assertThat(written).isZero();
        assertThat(file).doesNotExist();
    }

    @Test
    void shouldCreateRecordsForNewPairs() throws IOException {
        // Given
        final Path file = tempDir.resolve("data").resolve("unresolved_refs.json");
        final UnresolvedRefStore store = new UnresolvedRefStore(file, FIRST_RUN);

        // When
        final int written = store.merge(List.of(
                new UnresolvedRef("特許法", "前条", null),
                new UnresolvedRef("特許法", "存在しない法", "参照先法令名の解決失敗")));

        // Then
        assertThat(written).isEqualTo(2);
        assertThat(store.load()).containsExactly(
                new UnresolvedRefRecord("特許法", "前条", "2024-05-01T12:00:00Z", "2024-05-01T12:00:00Z",
                        1, null, UnresolvedRefRecord.STATUS_PENDING),
                new UnresolvedRefRecord("特許法", "存在しない法", "2024-05-01T12:00:00Z", "2024-05-01T12:00:00Z",
                        1, "参照先法令名の解決失敗", UnresolvedRefRecord.STATUS_PENDING));
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .contains("\"items\"")
                .contains("\"source_law\" : \"特許法\"");
    }

    @Test
    void shouldCountRepeatedOccurrences() throws IOException {
        // Given
        final Path file = tempDir.resolve("unresolved.json");
        new UnresolvedRefStore(file, FIRST_RUN).merge(List.of(new UnresolvedRef("特許法", "前条", null)));

        // When
        final UnresolvedRefStore secondRun = new UnresolvedRefStore(file, SECOND_RUN);
        final int written = secondRun.merge(List.of(
                new UnresolvedRef("特許法", "前条", "前条の規定による。"),
                new UnresolvedRef("特許法", "前条", "別の文脈")));

        // Then
        assertThat(written).isEqualTo(1);
        final UnresolvedRefRecord stored = secondRun.load().get(0);
        assertThat(stored.count()).isEqualTo(3);
        assertThat(stored.firstSeenAt()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(stored.lastSeenAt()).isEqualTo("2024-06-01T08:30:00Z");
        assertThat(stored.sampleContext()).isEqualTo("前条の規定による。");
    }

    @Test
    void shouldKeepTriageStatus() throws IOException {
        final Path file = tempDir.resolve("unresolved.json");
        Files.writeString(file, """
                {"items": [{"source_law": "特許法", "alias": "前条", "first_seen_at": "2024-01-01T00:00:00Z",
                            "last_seen_at": "2024-01-01T00:00:00Z", "count": 4, "sample_context": null,
                            "status": "resolved"}]}
                """, StandardCharsets.UTF_8);

        new UnresolvedRefStore(file, FIRST_RUN).merge(List.of(new UnresolvedRef("特許法", "前条", null)));

        final UnresolvedRefRecord stored = new UnresolvedRefStore(file, FIRST_RUN).load().get(0);
        assertThat(stored.status()).isEqualTo("resolved");
        assertThat(stored.count()).isEqualTo(5);
    }

    @Test
    void shouldTreatSourceAndAliasAsKey() throws IOException {
        final Path file = tempDir.resolve("unresolved.json");
        final UnresolvedRefStore store = new UnresolvedRefStore(file, FIRST_RUN);

        store.merge(List.of(
                new UnresolvedRef("特許法", "前条", null),
                new UnresolvedRef("商標法", "前条", null)));

        assertThat(store.load()).extracting(UnresolvedRefRecord::sourceLaw).containsExactly("特許法", "商標法");
    }
}

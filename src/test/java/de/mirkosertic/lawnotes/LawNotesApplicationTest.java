package de.mirkosertic.lawnotes;

import de.mirkosertic.lawnotes.api.LawApi;
import de.mirkosertic.lawnotes.api.ListedStatute;
import de.mirkosertic.lawnotes.api.ListingPage;
import de.mirkosertic.lawnotes.config.ApplicationConfig;
import de.mirkosertic.lawnotes.model.StatuteCandidate;
import de.mirkosertic.lawnotes.model.StatuteContents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("LawNotesApplication Tests")
class LawNotesApplicationTest {

    private static final StatuteCandidate CIVIL_CODE = new StatuteCandidate(
            "129AC0000000089", "明治二十九年法律第八十九号", "民法", "1896-04-27");

    @TempDir
    Path tempDir;

    private LawApi lawApi;

    @BeforeEach
    void setUp() {
        lawApi = mock(LawApi.class);
    }

    private int execute(final String... args) {
        final LawNotesApplication application = new LawNotesApplication(config -> lawApi, (query, candidates) -> 0);
        final List<String> arguments = new ArrayList<>(List.of(
                "--output-dir", tempDir.resolve("laws").toString(),
                "--dict-path", tempDir.resolve("data/law_name_dict.json").toString(),
                "--unresolved-path", tempDir.resolve("data/unresolved_refs.json").toString()));
        arguments.addAll(List.of(args));
        return new CommandLine(application).execute(arguments.toArray(new String[0]));
    }

    @Test
    void shouldApplyCommandLineOptionsToConfiguration() {
        // Given
        final LawNotesApplication application = new LawNotesApplication(config -> lawApi, (query, candidates) -> 0);
        new CommandLine(application).parseArgs("--max-depth", "3", "--non-interactive", "--no-overwrite",
                "--retry", "5", "--timeout-ms", "1000", "--api-base-url", "http://localhost:9000", "特許法");
        final ApplicationConfig config = ApplicationConfig.load();

        // When
        application.applyOptions(config);

        // Then
        assertThat(application.lawTitle).isEqualTo("特許法");
        assertThat(config.getMaxDepth()).isEqualTo(3);
        assertThat(config.isNonInteractive()).isTrue();
        assertThat(config.isNoOverwrite()).isTrue();
        assertThat(config.getRetryAttempts()).isEqualTo(5);
        assertThat(config.getTimeoutMs()).isEqualTo(1000);
        assertThat(config.getApiBaseUrl()).isEqualTo("http://localhost:9000");
    }

    @Test
    @DisplayName("Should crawl the root statute and write its note")
    void shouldCrawlRootStatute() throws Exception {
        // Given
        when(lawApi.search("民法")).thenReturn(List.of(CIVIL_CODE));
        when(lawApi.fetchContents(CIVIL_CODE)).thenReturn(new StatuteContents(CIVIL_CODE.lawId(),
                CIVIL_CODE.lawNum(), "民法", "第一条\n私権は、公共の福祉に適合しなければならない。", null));

        // When
        final int exitCode = execute("--non-interactive", "民法");

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("laws").resolve("民法.md"), StandardCharsets.UTF_8))
                .contains("law_title: \"民法\"")
                .contains("## 第一条");
        assertThat(tempDir.resolve("data/law_name_dict.json")).exists();
    }

    @Test
    void shouldExitWithTwoWhenRootIsUnknown() {
        assertThat(execute("--non-interactive", "存在しない法")).isEqualTo(2);
    }

    @Test
    void shouldExitWithOneWithoutTitle() {
        assertThat(execute()).isEqualTo(1);
    }

    @Test
    void shouldBuildDictionaryWithoutTitle() throws Exception {
        when(lawApi.listPage(anyInt(), anyInt())).thenReturn(ListingPage.EMPTY);
        when(lawApi.listPage(anyInt(), eq(0))).thenReturn(ListingPage.of(List.of(new ListedStatute(CIVIL_CODE, null))));

        final int exitCode = execute("--build-dictionary");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("data/law_name_dict.json"), StandardCharsets.UTF_8))
                .contains("明治二十九年法律第八十九号");
    }

    @Test
    void shouldExitWithOneOnInvalidOptions() {
        assertThat(execute("--max-depth=-1", "民法")).isEqualTo(1);
        assertThat(execute("--unknown-option", "民法")).isEqualTo(1);
    }
}

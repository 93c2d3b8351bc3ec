package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.model.StatuteCandidate;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsoleCandidateSelectorTest {

    private static final List<StatuteCandidate> CANDIDATES = List.of(
            new StatuteCandidate("129AC0000000089", "明治二十九年法律第八十九号", "民法", "1896-04-27"),
            new StatuteCandidate(null, null, "民法施行法", null));

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleCandidateSelector selector(final String input) {
        return new ConsoleCandidateSelector(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldListCandidatesAndReturnZeroBasedIndex() throws Exception {
        final int index = selector(" 2 \n").select("民法", CANDIDATES);

        assertThat(index).isEqualTo(1);
        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("Several statutes match 民法")
                .contains("1. 民法 / 129AC0000000089 / 明治二十九年法律第八十九号 / 1896-04-27")
                .contains("2. 民法施行法 / - / - / -")
                .contains("Enter candidate number: ");
    }

    @Test
    void shouldRejectNonNumericInput() {
        assertThatThrownBy(() -> selector("abc\n").select("民法", CANDIDATES))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.INVALID_SELECTION))
                .hasMessage("Not a number: 'abc'");
    }

    @Test
    void shouldRejectOutOfRangeNumbers() {
        assertThatThrownBy(() -> selector("3\n").select("民法", CANDIDATES))
                .isInstanceOf(ResolutionException.class)
                .hasMessage("Candidate number out of range: 3");
        assertThatThrownBy(() -> selector("0\n").select("民法", CANDIDATES))
                .isInstanceOf(ResolutionException.class);
    }

    @Test
    void shouldRejectEndOfInput() {
        assertThatThrownBy(() -> selector("").select("民法", CANDIDATES))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.INVALID_SELECTION));
    }
}

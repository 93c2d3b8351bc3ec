package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.api.LawApi;
import de.mirkosertic.lawnotes.api.LawApiException;
import de.mirkosertic.lawnotes.dictionary.NameDictionary;
import de.mirkosertic.lawnotes.model.StatuteCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("CandidateResolver Tests")
class CandidateResolverTest {

    private static final StatuteCandidate CIVIL_CODE = new StatuteCandidate(
            "129AC0000000089", "明治二十九年法律第八十九号", "民法", "1896-04-27");
    private static final StatuteCandidate CIVIL_CODE_ENFORCEMENT = new StatuteCandidate(
            "131AC0000000011", "明治三十一年法律第十一号", "民法施行法", "1898-06-21");

    private LawApi lawApi;
    private CandidateSelector selector;
    private NameDictionary dictionary;

    @BeforeEach
    void setUp() {
        lawApi = mock(LawApi.class);
        selector = mock(CandidateSelector.class);
        dictionary = new NameDictionary();
    }

    private CandidateResolver resolver(final boolean nonInteractive) {
        return new CandidateResolver(lawApi, dictionary, nonInteractive, selector);
    }

    @Test
    @DisplayName("A dictionary hit should not cost a search")
    void shouldResolveFromDictionaryWithoutSearch() throws Exception {
        dictionary.register("民法", CIVIL_CODE.toDictionaryEntry());

        final StatuteCandidate candidate = resolver(true).resolve("旧民法");

        assertThat(candidate.lawId()).isEqualTo("129AC0000000089");
        assertThat(candidate.lawTitle()).isEqualTo("民法");
        verifyNoInteractions(lawApi);
    }

    @Test
    void shouldAcceptSingleResultAndLearnAliases() throws Exception {
        when(lawApi.search("新民法")).thenReturn(List.of(CIVIL_CODE));

        final StatuteCandidate candidate = resolver(true).resolve("新民法");

        assertThat(candidate).isEqualTo(CIVIL_CODE);
        assertThat(dictionary.get("民法")).isEqualTo(CIVIL_CODE.toDictionaryEntry());
        assertThat(dictionary.isDirty()).isTrue();
    }

    @Test
    void shouldFailWhenNothingIsFound() throws Exception {
        when(lawApi.search(anyString())).thenReturn(List.of());

        assertThatThrownBy(() -> resolver(true).resolve("存在しない法"))
                .isInstanceOfSatisfying(ResolutionException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.NOT_FOUND);
                    assertThat(e.getTitle()).isEqualTo("存在しない法");
                    assertThat(e.getMessage()).isEqualTo("No statute found for '存在しない法'");
                });
    }

    @Test
    void shouldWrapSearchFailures() throws Exception {
        final LawApiException failure = new LawApiException("API error 500", 500, null);
        when(lawApi.search(anyString())).thenThrow(failure);

        assertThatThrownBy(() -> resolver(true).resolve("民法"))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.SEARCH_FAILED))
                .hasCause(failure);
    }

    @Nested
    @DisplayName("Non-interactive mode")
    class NonInteractive {

        @Test
        void shouldPickTheExactTitleAmongSeveralResults() throws Exception {
            when(lawApi.search("民法")).thenReturn(List.of(CIVIL_CODE_ENFORCEMENT, CIVIL_CODE));

            assertThat(resolver(true).resolve("民法")).isEqualTo(CIVIL_CODE);
            verifyNoInteractions(selector);
        }

        @Test
        void shouldFailWhenNoResultMatchesExactly() throws Exception {
            when(lawApi.search("民")).thenReturn(List.of(CIVIL_CODE_ENFORCEMENT, CIVIL_CODE));

            assertThatThrownBy(() -> resolver(true).resolve("民"))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.AMBIGUOUS))
                    .hasMessageContaining("non-interactive mode");
            assertThat(dictionary.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Interactive mode")
    class Interactive {

        @Test
        void shouldAskSelectorAmongSeveralResults() throws Exception {
            final List<StatuteCandidate> results = List.of(CIVIL_CODE_ENFORCEMENT, CIVIL_CODE);
            when(lawApi.search("民法")).thenReturn(results);
            when(selector.select("民法", results)).thenReturn(1);

            assertThat(resolver(false).resolve("民法")).isEqualTo(CIVIL_CODE);
            verify(selector).select("民法", results);
        }

        @Test
        void shouldPropagateInvalidSelection() throws Exception {
            when(lawApi.search("民法")).thenReturn(List.of(CIVIL_CODE_ENFORCEMENT, CIVIL_CODE));
            when(selector.select(anyString(), anyList())).thenThrow(new ResolutionException(
                    ResolutionException.Reason.INVALID_SELECTION, "民法", "Candidate number out of range: 9"));

            assertThatThrownBy(() -> resolver(false).resolve("民法"))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.INVALID_SELECTION));
        }

        @Test
        void shouldTreatUnreadableInputAsInvalidSelection() throws Exception {
            when(lawApi.search("民法")).thenReturn(List.of(CIVIL_CODE_ENFORCEMENT, CIVIL_CODE));
            when(selector.select(anyString(), any())).thenThrow(new IOException("stream closed"));

            assertThatThrownBy(() -> resolver(false).resolve("民法"))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getReason()).isEqualTo(ResolutionException.Reason.INVALID_SELECTION))
                    .hasCauseInstanceOf(IOException.class);
        }
    }
}

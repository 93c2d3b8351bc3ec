package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.api.LawApi;
import de.mirkosertic.lawnotes.api.LawApiException;
import de.mirkosertic.lawnotes.dictionary.NameDictionary;
import de.mirkosertic.lawnotes.model.DictionaryEntry;
import de.mirkosertic.lawnotes.model.StatuteCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a statute name to exactly one statute.
 * <p>
 * The dictionary is asked first and a hit costs no request. Otherwise the name is searched:
 * a single result is taken, several results are narrowed to the one whose title equals the
 * query (non-interactive) or handed to the {@link CandidateSelector}. Every search based
 * resolution teaches the dictionary the query and the confirmed title as aliases.
 */
public class CandidateResolver {

    private static final Logger logger = LoggerFactory.getLogger(CandidateResolver.class);

    private final LawApi lawApi;
    private final NameDictionary dictionary;
    private final boolean nonInteractive;
    private final CandidateSelector selector;

    public CandidateResolver(final LawApi lawApi, final NameDictionary dictionary, final boolean nonInteractive,
                             final CandidateSelector selector) {
        this.lawApi = lawApi;
        this.dictionary = dictionary;
        this.nonInteractive = nonInteractive;
        this.selector = selector;
    }

    public StatuteCandidate resolve(final String title) throws ResolutionException {
        final DictionaryEntry known = dictionary.lookup(title);
        if (known != null) {
            logger.debug("Resolved '{}' from dictionary to {}", title, known.lawTitle());
            return StatuteCandidate.of(known);
        }

        final List<StatuteCandidate> candidates;
        try {
            candidates = lawApi.search(title);
        } catch (final LawApiException e) {
            throw new ResolutionException(ResolutionException.Reason.SEARCH_FAILED, title,
                    "Search for '" + title + "' failed: " + e.getMessage(), e);
        }

        if (candidates.isEmpty()) {
            throw new ResolutionException(ResolutionException.Reason.NOT_FOUND, title,
                    "No statute found for '" + title + "'");
        }
        if (candidates.size() == 1) {
            return accept(title, candidates.get(0));
        }
        if (nonInteractive) {
            return accept(title, exactMatch(title, candidates));
        }
        return accept(title, candidates.get(select(title, candidates)));
    }

    private StatuteCandidate exactMatch(final String title, final List<StatuteCandidate> candidates)
            throws ResolutionException {
        final List<StatuteCandidate> exact = new ArrayList<>();
        for (final StatuteCandidate candidate : candidates) {
            if (candidate.lawTitle().equals(title)) {
                exact.add(candidate);
            }
        }
        if (exact.size() != 1) {
            throw new ResolutionException(ResolutionException.Reason.AMBIGUOUS, title,
                    "'" + title + "' matches " + candidates.size()
                            + " statutes and none exactly, cannot choose one in non-interactive mode");
        }
        return exact.get(0);
    }

    private int select(final String title, final List<StatuteCandidate> candidates) throws ResolutionException {
        try {
            return selector.select(title, candidates);
        } catch (final IOException e) {
            throw new ResolutionException(ResolutionException.Reason.INVALID_SELECTION, title,
                    "Could not read selection: " + e.getMessage(), e);
        }
    }

    private StatuteCandidate accept(final String query, final StatuteCandidate candidate) {
        if (dictionary.registerAll(List.of(query, candidate.lawTitle()), candidate.toDictionaryEntry())) {
            logger.debug("Learned aliases for {} from query '{}'", candidate.lawTitle(), query);
        }
        return candidate;
    }
}

package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.model.StatuteCandidate;

import java.io.IOException;
import java.util.List;

/**
 * Lets a person pick one of several search results.
 */
@FunctionalInterface
public interface CandidateSelector {

    /**
     * @param query      the statute name that was searched
     * @param candidates at least two candidates
     * @return the zero based index of the chosen candidate
     * @throws ResolutionException with {@link ResolutionException.Reason#INVALID_SELECTION} if the
     *                             answer is not a valid candidate number
     * @throws IOException         if the answer cannot be read
     */
    int select(String query, List<StatuteCandidate> candidates) throws ResolutionException, IOException;
}

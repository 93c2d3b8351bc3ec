package de.mirkosertic.lawnotes.api;

import de.mirkosertic.lawnotes.model.StatuteCandidate;
import de.mirkosertic.lawnotes.model.StatuteContents;

import java.util.List;

/**
 * The remote statute database as seen by the crawler.
 * <p>
 * Implementations own retrying. A {@link LawApiException} is always the final outcome.
 */
public interface LawApi {

    /**
     * Searches statutes by title.
     *
     * @return matching statutes, possibly empty, without duplicates
     */
    List<StatuteCandidate> search(String title) throws LawApiException;

    /**
     * Fetches and flattens the body of a statute, addressed by its identifier or else its number.
     */
    StatuteContents fetchContents(StatuteCandidate candidate) throws LawApiException;

    /**
     * One page of the listing of all statutes. A page without any raw entries marks the end.
     */
    ListingPage listPage(int limit, int offset) throws LawApiException;
}

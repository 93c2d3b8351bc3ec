package de.mirkosertic.lawnotes.api;

import java.util.List;

/**
 * One page of the full statute listing.
 *
 * @param statutes the usable entries of the page
 * @param rawCount number of entries the API returned, including untitled ones that were skipped
 */
public record ListingPage(List<ListedStatute> statutes, int rawCount) {

    public static final ListingPage EMPTY = new ListingPage(List.of(), 0);

    public ListingPage {
        statutes = List.copyOf(statutes);
    }

    public static ListingPage of(final List<ListedStatute> statutes) {
        return new ListingPage(statutes, statutes.size());
    }

    /**
     * @return true if the API had nothing left to list
     */
    public boolean isLast() {
        return rawCount == 0;
    }
}

package de.mirkosertic.lawnotes.crawl;

/**
 * A statute name could not be resolved to exactly one statute.
 */
public class ResolutionException extends Exception {

    public enum Reason {
        /** The search returned nothing. */
        NOT_FOUND,
        /** Several candidates and no way to pick one without asking. */
        AMBIGUOUS,
        /** The user answered the selection prompt with something that is not a candidate number. */
        INVALID_SELECTION,
        /** The search request itself failed. */
        SEARCH_FAILED
    }

    private final Reason reason;
    private final String title;

    public ResolutionException(final Reason reason, final String title, final String message) {
        super(message);
        this.reason = reason;
        this.title = title;
    }

    public ResolutionException(final Reason reason, final String title, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.title = title;
    }

    public Reason getReason() {
        return reason;
    }

    public String getTitle() {
        return title;
    }
}

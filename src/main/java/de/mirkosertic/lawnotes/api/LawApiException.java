package de.mirkosertic.lawnotes.api;

import org.jspecify.annotations.Nullable;

import java.io.IOException;

/**
 * Terminal failure talking to the law API: a status that is not retried, retries used up,
 * or a response that does not have the expected shape.
 */
public class LawApiException extends IOException {

    /** Marker for failures that have no HTTP status, like connection errors or bad JSON. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public LawApiException(final String message) {
        this(message, NO_STATUS, null);
    }

    public LawApiException(final String message, final Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public LawApiException(final String message, final int statusCode, final @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

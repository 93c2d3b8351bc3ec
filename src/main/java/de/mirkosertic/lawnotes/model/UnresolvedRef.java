package de.mirkosertic.lawnotes.model;

import org.jspecify.annotations.Nullable;

/**
 * A citation that could not be turned into a link during the current run.
 *
 * @param alias statute name that failed to resolve, or an anaphoric token like {@code 前条}
 */
public record UnresolvedRef(String sourceLaw, String alias, @Nullable String sampleContext) {
}

package de.mirkosertic.lawnotes.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Persisted aggregate of all occurrences of one (source statute, alias) pair.
 */
public record UnresolvedRefRecord(
        @JsonProperty("source_law") String sourceLaw,
        @JsonProperty("alias") String alias,
        @JsonProperty("first_seen_at") String firstSeenAt,
        @JsonProperty("last_seen_at") String lastSeenAt,
        @JsonProperty("count") long count,
        @JsonProperty("sample_context") @Nullable String sampleContext,
        @JsonProperty("status") String status
) {

    public static final String STATUS_PENDING = "pending";

    public static UnresolvedRefRecord firstOccurrence(final UnresolvedRef ref, final String timestamp) {
        return new UnresolvedRefRecord(ref.sourceLaw(), ref.alias(), timestamp, timestamp, 1,
                ref.sampleContext(), STATUS_PENDING);
    }

    public boolean matches(final UnresolvedRef ref) {
        return sourceLaw.equals(ref.sourceLaw()) && alias.equals(ref.alias());
    }

    /**
     * Returns a copy counting one more occurrence. A missing sample context is filled from the event.
     */
    public UnresolvedRefRecord withOccurrence(final UnresolvedRef ref, final String timestamp) {
        final String context = sampleContext == null ? ref.sampleContext() : sampleContext;
        return new UnresolvedRefRecord(sourceLaw, alias, firstSeenAt, timestamp, count + 1, context, status);
    }
}

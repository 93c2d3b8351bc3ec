package de.mirkosertic.lawnotes.model;

import org.jspecify.annotations.Nullable;

/**
 * A statute as returned by a title search or the full listing.
 */
public record StatuteCandidate(
        @Nullable String lawId,
        @Nullable String lawNum,
        String lawTitle,
        @Nullable String promulgationDate
) {

    public static StatuteCandidate of(final DictionaryEntry entry) {
        return new StatuteCandidate(entry.lawId(), entry.lawNum(), entry.lawTitle(), null);
    }

    /**
     * Key used to detect that two resolutions point to the same statute.
     * The identifier is preferred over the statute number, the number over the title.
     */
    public String identityKey() {
        if (lawId != null && !lawId.isEmpty()) {
            return "id:" + lawId;
        }
        if (lawNum != null && !lawNum.isEmpty()) {
            return "num:" + lawNum;
        }
        return "title:" + lawTitle;
    }

    public String idDisplay() {
        return lawId != null ? lawId : "-";
    }

    public DictionaryEntry toDictionaryEntry() {
        return new DictionaryEntry(lawId, lawNum, lawTitle);
    }
}

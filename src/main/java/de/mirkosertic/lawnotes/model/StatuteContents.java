package de.mirkosertic.lawnotes.model;

import org.jspecify.annotations.Nullable;

/**
 * Fetched body of one statute, flattened into block separated plain text.
 *
 * @param originalXml raw markup of the statute; reserved, the JSON endpoint never fills it
 */
public record StatuteContents(
        @Nullable String lawId,
        @Nullable String lawNum,
        String lawTitle,
        String text,
        @Nullable String originalXml
) {

    public DictionaryEntry toDictionaryEntry() {
        return new DictionaryEntry(lawId, lawNum, lawTitle);
    }
}

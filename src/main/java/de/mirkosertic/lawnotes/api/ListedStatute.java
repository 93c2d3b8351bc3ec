package de.mirkosertic.lawnotes.api;

import de.mirkosertic.lawnotes.model.StatuteCandidate;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A statute from the full listing together with its registered abbreviations.
 *
 * @param abbreviation raw abbreviation field, several names separated by {@code ,} or {@code 、}
 */
public record ListedStatute(StatuteCandidate candidate, @Nullable String abbreviation) {

    public List<String> abbreviations() {
        final List<String> result = new ArrayList<>();
        if (abbreviation == null) {
            return result;
        }
        for (final String part : abbreviation.split("[,、，]")) {
            final String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}

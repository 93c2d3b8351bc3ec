package de.mirkosertic.lawnotes.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Resolved identity stored in the name dictionary for every alias of a statute.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record DictionaryEntry(
        @JsonProperty("law_id") @Nullable String lawId,
        @JsonProperty("law_num") @Nullable String lawNum,
        @JsonProperty("law_title") String lawTitle
) {
}

package de.mirkosertic.lawnotes.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Response of {@code GET /api/2/law_data/{id}}. The statute body stays an untyped tree and is
 * handed to {@link LawTextFlattener}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record LawDataResponse(
        @JsonProperty("law_info") LawsResponse.@Nullable LawInfo lawInfo,
        @JsonProperty("revision_info") LawsResponse.@Nullable RevisionInfo revisionInfo,
        @JsonProperty("law_full_text") @Nullable JsonNode lawFullText
) {
}

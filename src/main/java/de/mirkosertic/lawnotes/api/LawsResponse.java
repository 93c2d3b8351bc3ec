package de.mirkosertic.lawnotes.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Response of {@code GET /api/2/laws}, reduced to the fields the crawler reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record LawsResponse(@JsonProperty("laws") @Nullable List<LawEntry> laws) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LawEntry(
            @JsonProperty("law_info") @Nullable LawInfo lawInfo,
            @JsonProperty("revision_info") @Nullable RevisionInfo revisionInfo
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LawInfo(
            @JsonProperty("law_id") @Nullable String lawId,
            @JsonProperty("law_num") @Nullable String lawNum,
            @JsonProperty("promulgation_date") @Nullable String promulgationDate
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RevisionInfo(
            @JsonProperty("law_title") @Nullable String lawTitle,
            @JsonProperty("abbrev") @Nullable String abbrev
    ) {
    }
}

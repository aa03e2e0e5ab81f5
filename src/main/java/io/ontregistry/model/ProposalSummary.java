package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProposalSummary(
        @JsonProperty("total_discovered") int totalDiscovered,
        @JsonProperty("current_in_registry") int currentInRegistry,
        @JsonProperty("new_count") int newCount,
        @JsonProperty("updated_count") int updatedCount,
        @JsonProperty("removed_count") int removedCount,
        @JsonProperty("unchanged_count") int unchangedCount,
        @JsonProperty("unverified_count") int unverifiedCount
) {
    public static ProposalSummary empty() {
        return new ProposalSummary(0, 0, 0, 0, 0, 0, 0);
    }

    public int classifiedTotal() {
        return newCount + updatedCount + removedCount + unchangedCount + unverifiedCount;
    }
}

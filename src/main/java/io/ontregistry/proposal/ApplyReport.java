package io.ontregistry.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ApplyReport(
        @JsonProperty("proposal_id") String proposalId,
        @JsonProperty("already_applied") boolean alreadyApplied,
        @JsonProperty("applied_at") String appliedAt,
        @JsonProperty("items") List<Item> items
) {
    public ApplyReport {
        items = items == null ? List.of() : List.copyOf(items);
    }

    static ApplyReport alreadyApplied(String proposalId, String appliedAt) {
        return new ApplyReport(proposalId, true, appliedAt, List.of());
    }

    @JsonProperty("applied_count")
    public long appliedCount() {
        return items.stream().filter(Item::applied).count();
    }

    @JsonProperty("skipped_count")
    public long skippedCount() {
        return items.stream().filter(item -> !item.applied()).count();
    }

    /**
     * What happened to one proposal entry. {@code applied=false} means the store was not changed.
     */
    public record Item(
            @JsonProperty("category") String category,
            @JsonProperty("path") String path,
            @JsonProperty("run_id") String runId,
            @JsonProperty("applied") boolean applied,
            @JsonProperty("message") String message
    ) {
    }
}

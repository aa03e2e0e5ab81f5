package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Wire shape of a persisted proposal. Unchanged entries are kept only as a count.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
        "version", "id", "generated_at", "slurm_job_id", "slurm_node", "scan_duration_seconds", "scan_paths",
        "summary", "changes", "unchanged_count", "approval_status", "approved_at", "approved_by",
        "rejected_at", "rejected_by", "applied_at", "applied_by"
})
public record ProposalDocument(
        @JsonProperty("version") String version,
        @JsonProperty("id") String id,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("slurm_job_id") String jobId,
        @JsonProperty("slurm_node") String jobNode,
        @JsonProperty("scan_duration_seconds") double scanDurationSeconds,
        @JsonProperty("scan_paths") List<String> scanPaths,
        @JsonProperty("summary") ProposalSummary summary,
        @JsonProperty("changes") Changes changes,
        @JsonProperty("unchanged_count") int unchangedCount,
        @JsonProperty("approval_status") ApprovalStatus approvalStatus,
        @JsonProperty("approved_at") String approvedAt,
        @JsonProperty("approved_by") String approvedBy,
        @JsonProperty("rejected_at") @JsonInclude(JsonInclude.Include.NON_NULL) String rejectedAt,
        @JsonProperty("rejected_by") @JsonInclude(JsonInclude.Include.NON_NULL) String rejectedBy,
        @JsonProperty("applied_at") String appliedAt,
        @JsonProperty("applied_by") @JsonInclude(JsonInclude.Include.NON_NULL) String appliedBy
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Changes(
            @JsonProperty("new") List<ExperimentEntry> added,
            @JsonProperty("updated") List<ExperimentEntry> updated,
            @JsonProperty("removed") List<ExperimentEntry> removed,
            @JsonProperty("unverified") List<ExperimentEntry> unverified
    ) {
        public Changes {
            added = added == null ? List.of() : added;
            updated = updated == null ? List.of() : updated;
            removed = removed == null ? List.of() : removed;
            unverified = unverified == null ? List.of() : unverified;
        }
    }
}

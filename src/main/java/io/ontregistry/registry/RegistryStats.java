package io.ontregistry.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistryStats(
        @JsonProperty("total_experiments") int totalExperiments,
        @JsonProperty("unique_run_ids") int uniqueRunIds,
        @JsonProperty("unique_flowcells") int uniqueFlowcells,
        @JsonProperty("unique_devices") int uniqueDevices,
        @JsonProperty("unique_experiment_names") int uniqueExperimentNames,
        @JsonProperty("canonical_count") int canonicalCount,
        @JsonProperty("with_qc_data") int withQcData,
        @JsonProperty("with_pod5") int withPod5,
        @JsonProperty("merge_candidates") int mergeCandidates,
        @JsonProperty("total_reads") long totalReads,
        @JsonProperty("archived_count") int archivedCount
) {
}

package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a filesystem scan can observe about one run directory. Every field except {@code path} is
 * optional on input and defaults to empty or zero.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExperimentEntry(
        @JsonProperty("id") String id,
        @JsonProperty("path") String path,
        @JsonProperty("sample_id") String sampleId,
        @JsonProperty("flow_cell_id") String flowCellId,
        @JsonProperty("protocol_group_id") String protocolGroupId,
        @JsonProperty("protocol") String protocol,
        @JsonProperty("instrument") String instrument,
        @JsonProperty("started") String started,
        @JsonProperty("acquisition_stopped") String acquisitionStopped,
        @JsonProperty("metadata_source") String metadataSource,
        @JsonProperty("pod5_files") int pod5Files,
        @JsonProperty("fast5_files") int fast5Files,
        @JsonProperty("fastq_files") int fastqFiles,
        @JsonProperty("bam_files") int bamFiles,
        @JsonProperty("discovered_at") String discoveredAt,
        @JsonProperty("changes") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ExperimentChange> changes,
        @JsonProperty("removal_reason") @JsonInclude(JsonInclude.Include.NON_EMPTY) String removalReason
) {
    public static final String DEFAULT_METADATA_SOURCE = "final_summary";
    public static final String REASON_NOT_FOUND = "directory_not_found";
    public static final String REASON_EXISTENCE_UNKNOWN = "existence_unknown";

    public ExperimentEntry {
        id = emptyIfNull(id);
        path = emptyIfNull(path);
        sampleId = emptyIfNull(sampleId);
        flowCellId = emptyIfNull(flowCellId);
        protocolGroupId = emptyIfNull(protocolGroupId);
        protocol = emptyIfNull(protocol);
        instrument = emptyIfNull(instrument);
        started = emptyIfNull(started);
        acquisitionStopped = emptyIfNull(acquisitionStopped);
        metadataSource = metadataSource == null || metadataSource.isBlank() ? DEFAULT_METADATA_SOURCE : metadataSource;
        discoveredAt = emptyIfNull(discoveredAt);
        changes = changes == null ? List.of() : List.copyOf(changes);
        removalReason = emptyIfNull(removalReason);
    }

    public static ExperimentEntry ofPath(String path) {
        return new ExperimentEntry(null, path, null, null, null, null, null, null, null, null,
                0, 0, 0, 0, null, null, null);
    }

    public ExperimentEntry withChanges(List<ExperimentChange> newChanges) {
        return new ExperimentEntry(id, path, sampleId, flowCellId, protocolGroupId, protocol, instrument,
                started, acquisitionStopped, metadataSource, pod5Files, fast5Files, fastqFiles, bamFiles,
                discoveredAt, newChanges, removalReason);
    }

    public ExperimentEntry withRemovalReason(String reason) {
        return new ExperimentEntry(id, path, sampleId, flowCellId, protocolGroupId, protocol, instrument,
                started, acquisitionStopped, metadataSource, pod5Files, fast5Files, fastqFiles, bamFiles,
                discoveredAt, changes, reason);
    }

    public ExperimentEntry withFileCounts(int pod5, int fast5, int fastq, int bam) {
        return new ExperimentEntry(id, path, sampleId, flowCellId, protocolGroupId, protocol, instrument,
                started, acquisitionStopped, metadataSource, pod5, fast5, fastq, bam,
                discoveredAt, changes, removalReason);
    }

    public int fileCount(String field) {
        return switch (field) {
            case "pod5_files" -> pod5Files;
            case "fast5_files" -> fast5Files;
            case "fastq_files" -> fastqFiles;
            case "bam_files" -> bamFiles;
            default -> throw new IllegalArgumentException("Not a file-count field: " + field);
        };
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}

package io.ontregistry.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.ontregistry.model.ExperimentRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Secondary lookups over the record set. Always derived by replaying records; never loaded from
 * the persisted snapshot.
 */
public final class RecordIndexes {
    private final Map<String, List<String>> byFlowcell = new LinkedHashMap<>();
    private final Map<String, List<String>> byDevice = new LinkedHashMap<>();
    private final Map<String, List<String>> byExperiment = new LinkedHashMap<>();
    private final Map<String, String> byFingerprint = new LinkedHashMap<>();

    public static RecordIndexes rebuild(Collection<ExperimentRecord> records) {
        RecordIndexes indexes = new RecordIndexes();
        for (ExperimentRecord record : records) {
            indexes.index(record);
        }
        return indexes;
    }

    private void index(ExperimentRecord record) {
        String runId = record.getRunId();
        append(byFlowcell, record.getFlowcell(), runId);
        append(byDevice, record.getDevice(), runId);
        append(byExperiment, record.getExperimentName(), runId);
        // Last record wins.
        byFingerprint.put(FingerprintEngine.fingerprint(record), runId);
    }

    private static void append(Map<String, List<String>> index, String key, String runId) {
        if (key == null || key.isBlank()) {
            return;
        }
        List<String> ids = index.computeIfAbsent(key, k -> new ArrayList<>());
        if (!ids.contains(runId)) {
            ids.add(runId);
        }
    }

    public List<String> runIdsForFlowcell(String flowcell) {
        return byFlowcell.getOrDefault(flowcell, List.of());
    }

    public List<String> runIdsForDevice(String device) {
        return byDevice.getOrDefault(device, List.of());
    }

    public List<String> runIdsForExperiment(String experimentName) {
        return byExperiment.getOrDefault(experimentName, List.of());
    }

    public String runIdForFingerprint(String fingerprint) {
        return byFingerprint.get(fingerprint);
    }

    @JsonProperty("by_flowcell")
    public Map<String, List<String>> byFlowcell() {
        return Collections.unmodifiableMap(byFlowcell);
    }

    @JsonProperty("by_device")
    public Map<String, List<String>> byDevice() {
        return Collections.unmodifiableMap(byDevice);
    }

    @JsonProperty("by_experiment")
    public Map<String, List<String>> byExperiment() {
        return Collections.unmodifiableMap(byExperiment);
    }

    @JsonProperty("by_fingerprint")
    public Map<String, String> byFingerprint() {
        return Collections.unmodifiableMap(byFingerprint);
    }
}

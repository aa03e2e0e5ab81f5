package io.ontregistry.registry;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.ontregistry.model.ExperimentRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of the registry. {@code stats} and {@code indexes} are written for readers of the
 * file and ignored on load; unknown top-level keys are carried through.
 */
@JsonPropertyOrder({"version", "updated", "stats", "indexes", "experiments"})
public final class RegistryDocument {
    @JsonProperty("version")
    private String version;
    @JsonProperty("updated")
    private String updated;
    @JsonProperty("stats")
    private Object stats;
    @JsonProperty("indexes")
    private Object indexes;
    @JsonProperty("experiments")
    private LinkedHashMap<String, ExperimentRecord> experiments = new LinkedHashMap<>();

    private final Map<String, Object> extras = new LinkedHashMap<>();

    public RegistryDocument() {
    }

    RegistryDocument(String version, String updated, Object stats, Object indexes,
                     LinkedHashMap<String, ExperimentRecord> experiments, Map<String, Object> extras) {
        this.version = version;
        this.updated = updated;
        this.stats = stats;
        this.indexes = indexes;
        this.experiments = experiments;
        this.extras.putAll(extras);
    }

    public String version() {
        return version;
    }

    public String updated() {
        return updated;
    }

    public LinkedHashMap<String, ExperimentRecord> experiments() {
        return experiments == null ? new LinkedHashMap<>() : experiments;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return extras;
    }
}

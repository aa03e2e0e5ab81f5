package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEntry(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("action") String action,
        @JsonProperty("record_id") String recordId,
        @JsonProperty("actor") String actor,
        @JsonProperty("changes") Map<String, Object> changes
) {
    public AuditEntry {
        changes = changes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }
}

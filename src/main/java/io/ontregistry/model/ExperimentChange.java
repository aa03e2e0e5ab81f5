package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One field that differs between a discovered entry and the stored record for the same path.
 */
public record ExperimentChange(
        @JsonProperty("field") String field,
        @JsonProperty("old_value") Object oldValue,
        @JsonProperty("new_value") Object newValue
) {
}

package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    APPLIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (ApprovalStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown approval status: " + raw);
    }
}

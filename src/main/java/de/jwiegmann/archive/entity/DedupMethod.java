package de.jwiegmann.archive.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DedupMethod {
    EXACT("exact"),
    NEAR("near");

    private final String label;

    DedupMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}

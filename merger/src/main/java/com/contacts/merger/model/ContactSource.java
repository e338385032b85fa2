package com.contacts.merger.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactSource {
    PRIMARY("Primary"),
    SECONDARY("Secondary");

    private final String label;

    ContactSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}

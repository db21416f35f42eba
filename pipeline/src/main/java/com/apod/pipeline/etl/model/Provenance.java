package com.apod.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Provenance {
    LIVE("live"),
    CACHED("cached"),
    PLACEHOLDER("placeholder");

    private final String wireValue;

    Provenance(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Provenance fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Provenance provenance : values()) {
            if (provenance.wireValue.equals(normalized)) {
                return provenance;
            }
        }
        return null;
    }
}

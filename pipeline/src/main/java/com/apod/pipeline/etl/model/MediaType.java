package com.apod.pipeline.etl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MediaType {
    IMAGE("image"),
    VIDEO("video");

    private final String wireValue;

    MediaType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static MediaType fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MediaType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}

package com.mergeline.backend.commit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Raw state reported by a CI context on a commit.
 */
public enum CiState {
    PENDING,
    SUCCESS,
    FAILURE,
    ERROR;

    public boolean isFailing() {
        return this == FAILURE || this == ERROR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CiState fromWire(String value) {
        if (value == null || value.isBlank()) return PENDING;
        return CiState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

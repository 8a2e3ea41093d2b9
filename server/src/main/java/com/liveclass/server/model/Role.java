package com.liveclass.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Participant role inside a class room. Serialized as the lower-case wire value.
 */
public enum Role {
    STUDENT("student"),
    MODERATOR("moderator");

    private final String wire;

    Role(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Missing or blank values fall back to {@link #STUDENT}. */
    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null || value.isBlank()) return STUDENT;
        for (Role r : values()) {
            if (r.wire.equalsIgnoreCase(value.trim())) return r;
        }
        throw new IllegalArgumentException("unknown role: " + value);
    }
}

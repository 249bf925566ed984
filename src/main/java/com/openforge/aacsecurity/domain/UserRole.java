package com.openforge.aacsecurity.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * The three account roles, lowest privilege first.
 * Wire and token representation is the lower-case name ("student", "teacher", "admin").
 */
public enum UserRole {
    STUDENT,
    TEACHER,
    ADMIN;

    /** The role every public self-registration ends up with. */
    public static final UserRole LOWEST = STUDENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the wire form. Returns null for null input.
     *
     * @throws IllegalArgumentException for an unknown role name
     */
    @JsonCreator
    public static UserRole fromWire(String value) {
        if (value == null) return null;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid role '" + value + "'. Must be one of: student, teacher, admin"));
    }
}

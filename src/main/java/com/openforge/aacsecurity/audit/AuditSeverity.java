package com.openforge.aacsecurity.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditSeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse for query filters; null or blank means no filter. */
    public static AuditSeverity fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity '" + value + "'");
        }
    }
}

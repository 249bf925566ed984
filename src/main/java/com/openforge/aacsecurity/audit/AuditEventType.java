package com.openforge.aacsecurity.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditEventType {
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    PASSWORD_CHANGED,
    PRIVILEGE_ESCALATION_ATTEMPT,
    ACCOUNT_CREATED,
    ACCOUNT_DELETED,
    ADMIN_ACTION,
    ACCOUNT_LOCKED,
    ACCOUNT_UNLOCKED,
    ACCESS_DENIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse for query filters; null or blank means no filter. */
    public static AuditEventType fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event type '" + value + "'");
        }
    }
}

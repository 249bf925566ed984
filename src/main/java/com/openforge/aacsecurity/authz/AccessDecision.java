package com.openforge.aacsecurity.authz;

public record AccessDecision(boolean allowed, String reason) {

    static AccessDecision allow(String reason) {
        return new AccessDecision(true, reason);
    }

    static AccessDecision deny(String reason) {
        return new AccessDecision(false, reason);
    }
}

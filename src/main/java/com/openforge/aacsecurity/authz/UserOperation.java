package com.openforge.aacsecurity.authz;

/**
 * What an actor wants to do to a target account.
 * Profile operations are open to the owner and to delegated teachers;
 * administrative operations are admin-only.
 */
public enum UserOperation {
    VIEW_PROFILE(true),
    UPDATE_PROFILE(true),
    VIEW_PREFERENCES(true),
    UPDATE_PREFERENCES(true),
    MANAGE_ACCOUNT(false),
    VIEW_AUDIT_LOG(false);

    private final boolean profileScoped;

    UserOperation(boolean profileScoped) {
        this.profileScoped = profileScoped;
    }

    public boolean isProfileScoped() {
        return profileScoped;
    }
}

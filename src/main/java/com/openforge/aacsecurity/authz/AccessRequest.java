package com.openforge.aacsecurity.authz;

import com.openforge.aacsecurity.domain.UserRole;

/**
 * Inputs of one authorization decision.
 *
 * @param targetUserId null for operations without a specific target (audit log, user creation)
 * @param targetRole   null when there is no target
 */
public record AccessRequest(
        Long          actorId,
        UserRole      actorRole,
        Long          targetUserId,
        UserRole      targetRole,
        UserOperation operation
) {}

package com.openforge.aacsecurity.authz;

/**
 * Which students a teacher may act on.
 *
 * UNRESTRICTED applies while the teacher has no relationship records at all:
 * deployments without roster data keep working, teachers see every student.
 * As soon as one assignment exists the teacher is limited to ASSIGNED_ONLY.
 */
public enum RelationshipScope {
    UNRESTRICTED,
    ASSIGNED_ONLY
}

package com.openforge.aacsecurity.authz;

/**
 * Read access to teacher → student relationship records.
 */
public interface RelationshipLookup {

    boolean hasAnyAssignments(Long teacherId);

    boolean isAssigned(Long teacherId, Long studentId);
}

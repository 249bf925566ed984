package com.openforge.aacsecurity.audit;

import lombok.Builder;

import java.util.Map;

/**
 * One security event as handed to {@link AuditTrail#log(AuditEvent)}.
 * The timestamp is stamped by the trail from its clock at write time.
 *
 * @param extra free-form context, serialised to JSON; may be null
 */
@Builder
public record AuditEvent(
        AuditEventType      eventType,
        AuditSeverity       severity,
        Long                actorUserId,
        String              actorUsername,
        String              actorRole,
        String              sourceAddress,
        String              userAgent,
        String              targetEndpoint,
        String              description,
        boolean             success,
        Map<String, Object> extra
) {}

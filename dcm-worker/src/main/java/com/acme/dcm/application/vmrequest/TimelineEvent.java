package com.acme.dcm.application.vmrequest;

import com.acme.sourcing.core.Jsons;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of a request's timeline.
 *
 * @param id        derived from request, type and stream version, so replaying the same event yields the same entry
 * @param actorId   user who performed the action; null for entries written by the provisioning saga
 * @param details   JSON object with extra context such as a reason, or null
 */
public record TimelineEvent(
    UUID id,
    UUID requestId,
    UUID tenantId,
    TimelineEventType eventType,
    UUID actorId,
    String details,
    Instant occurredAt
) {

    public static TimelineEvent of(
        UUID requestId,
        UUID tenantId,
        TimelineEventType eventType,
        UUID actorId,
        String reason,
        Instant occurredAt,
        long version
    ) {
        UUID id = UUID.nameUUIDFromBytes(
            (eventType.name() + ":" + requestId + ":" + version).getBytes(StandardCharsets.UTF_8));
        String details = reason == null ? null : Jsons.toJson(Map.of("reason", reason));
        return new TimelineEvent(id, requestId, tenantId, eventType, actorId, details, occurredAt);
    }
}

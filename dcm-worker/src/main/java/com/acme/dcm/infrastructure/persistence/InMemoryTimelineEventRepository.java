package com.acme.dcm.infrastructure.persistence;

import com.acme.dcm.application.vmrequest.TimelineEvent;
import com.acme.dcm.application.vmrequest.TimelineEventProjectionUpdater;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory request timeline. Entries are keyed by id, so a replayed entry is ignored.
 */
@Slf4j
public class InMemoryTimelineEventRepository implements TimelineEventProjectionUpdater {

    private final Map<UUID, TimelineEvent> events = new ConcurrentHashMap<>();

    @Override
    public Result<Void, ProjectionError> addTimelineEvent(TimelineEvent event) {
        if (events.putIfAbsent(event.id(), event) == null) {
            log.debug("Added timeline event for request {}: {}", event.requestId(), event.eventType());
        }
        return Result.success(null);
    }

    /** Oldest first; another tenant's request reads as an empty timeline. */
    public List<TimelineEvent> findByRequestId(UUID tenantId, UUID requestId) {
        return events.values().stream()
            .filter(e -> e.requestId().equals(requestId) && e.tenantId().equals(tenantId))
            .sorted(Comparator.comparing(TimelineEvent::occurredAt))
            .collect(Collectors.toList());
    }
}

package com.acme.dcm.application.project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read port over the project read model. Eventually consistent with the event log.
 */
public interface ProjectQueryService {

    /**
     * @param normalizedName lower-cased project name
     * @param excludeProjectId project to ignore, e.g. the one being renamed; may be null
     */
    boolean existsByName(UUID tenantId, String normalizedName, UUID excludeProjectId);

    Optional<ProjectProjection> findById(UUID tenantId, UUID projectId);

    List<ProjectMemberProjection> findMembers(UUID projectId);
}

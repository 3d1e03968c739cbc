package com.acme.dcm.infrastructure.persistence;

import com.acme.dcm.application.project.ProjectMemberProjection;
import com.acme.dcm.application.project.ProjectProjection;
import com.acme.dcm.application.project.ProjectProjectionUpdater;
import com.acme.dcm.application.project.ProjectQueryService;
import com.acme.dcm.domain.model.project.ProjectRole;
import com.acme.dcm.domain.model.project.ProjectStatus;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.projection.ProjectionError;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory project read model.
 */
@Slf4j
public class InMemoryProjectProjectionRepository implements ProjectProjectionUpdater, ProjectQueryService {

    private final Map<UUID, ProjectProjection> projects = new ConcurrentHashMap<>();
    private final Map<UUID, Map<UUID, ProjectMemberProjection>> members = new ConcurrentHashMap<>();

    @Override
    public Result<Void, ProjectionError> insertProject(ProjectProjection project) {
        if (projects.putIfAbsent(project.id(), project) != null) {
            return Result.failure(new ProjectionError.DatabaseError("Project already projected: " + project.id()));
        }
        log.debug("Inserted project projection: projectId={}", project.id());
        return Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> updateProject(UUID projectId, String name, String description, Instant updatedAt, long version) {
        ProjectProjection updated = projects.computeIfPresent(projectId, (id, p) -> p.withDetails(name, description, updatedAt, version));
        return updated == null ? notFound(projectId) : Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> updateStatus(UUID projectId, ProjectStatus status, Instant updatedAt, long version) {
        ProjectProjection updated = projects.computeIfPresent(projectId, (id, p) -> p.withStatus(status, updatedAt, version));
        return updated == null ? notFound(projectId) : Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> insertMember(ProjectMemberProjection member) {
        members.computeIfAbsent(member.projectId(), id -> new ConcurrentHashMap<>()).put(member.userId(), member);
        return Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> updateMemberRole(UUID projectId, UUID userId, ProjectRole role) {
        Map<UUID, ProjectMemberProjection> projectMembers = members.get(projectId);
        if (projectMembers == null || projectMembers.computeIfPresent(userId, (id, m) -> m.withRole(role)) == null) {
            return Result.failure(new ProjectionError.NotFound("Member not found: project=" + projectId + " user=" + userId));
        }
        return Result.success(null);
    }

    @Override
    public Result<Void, ProjectionError> removeMember(UUID projectId, UUID userId) {
        Map<UUID, ProjectMemberProjection> projectMembers = members.get(projectId);
        if (projectMembers == null || projectMembers.remove(userId) == null) {
            return Result.failure(new ProjectionError.NotFound("Member not found: project=" + projectId + " user=" + userId));
        }
        return Result.success(null);
    }

    @Override
    public boolean existsByName(UUID tenantId, String normalizedName, UUID excludeProjectId) {
        return projects.values().stream()
            .filter(p -> p.tenantId().equals(tenantId))
            .filter(p -> !p.id().equals(excludeProjectId))
            .anyMatch(p -> p.name().toLowerCase(Locale.ROOT).equals(normalizedName));
    }

    @Override
    public Optional<ProjectProjection> findById(UUID tenantId, UUID projectId) {
        return Optional.ofNullable(projects.get(projectId))
            .filter(p -> Objects.equals(p.tenantId(), tenantId));
    }

    @Override
    public List<ProjectMemberProjection> findMembers(UUID projectId) {
        return new ArrayList<>(members.getOrDefault(projectId, Map.of()).values());
    }

    private static Result<Void, ProjectionError> notFound(UUID projectId) {
        return Result.failure(new ProjectionError.NotFound("Project not found: " + projectId));
    }
}

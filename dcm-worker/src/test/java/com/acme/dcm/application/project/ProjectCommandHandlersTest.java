package com.acme.dcm.application.project;

import com.acme.dcm.application.command.ArchiveProjectCommand;
import com.acme.dcm.application.command.AssignUserToProjectCommand;
import com.acme.dcm.application.command.CreateProjectCommand;
import com.acme.dcm.application.command.RemoveUserFromProjectCommand;
import com.acme.dcm.application.command.UnarchiveProjectCommand;
import com.acme.dcm.application.command.UpdateProjectCommand;
import com.acme.dcm.domain.model.project.ProjectRole;
import com.acme.dcm.domain.model.project.ProjectStatus;
import com.acme.dcm.infrastructure.event.ProjectEventDeserializer;
import com.acme.dcm.support.DcmTestHarness;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.event.EventPublisher;
import com.acme.sourcing.persistence.memory.InMemoryEventLog;
import com.acme.sourcing.projection.ProjectionError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Project command handlers over the in-memory event log and read model.
 */
@DisplayName("Project command handlers")
class ProjectCommandHandlersTest {

    private DcmTestHarness harness;
    private UUID tenantId;
    private UUID creatorId;
    private UUID projectId;

    @BeforeEach
    void setUp() {
        harness = new DcmTestHarness(EventPublisher.noop());
        tenantId = UUID.randomUUID();
        creatorId = UUID.randomUUID();
        projectId = harness.givenProject(tenantId, creatorId, "Alpha");
    }

    private UUID newCorrelation() {
        return UUID.randomUUID();
    }

    @Nested
    @DisplayName("CreateProjectHandler")
    class CreateProject {

        @Test
        @DisplayName("should append two events and fill the read model")
        void testCreate() {
            assertThat(harness.eventTypes(projectId)).containsExactly("ProjectCreated", "UserAssignedToProject");
            assertThat(harness.projects.findById(tenantId, projectId)).get()
                .satisfies(p -> {
                    assertThat(p.name()).isEqualTo("Alpha");
                    assertThat(p.status()).isEqualTo(ProjectStatus.ACTIVE);
                    assertThat(p.version()).isEqualTo(2);
                });
            assertThat(harness.projects.findMembers(projectId))
                .extracting(ProjectMemberProjection::userId, ProjectMemberProjection::role)
                .containsExactly(tuple(creatorId, ProjectRole.PROJECT_ADMIN));
        }

        @Test
        @DisplayName("should reject a name already used in the tenant, ignoring case")
        void testDuplicateName() {
            Result<CreateProjectResult, ProjectCommandError> result = harness.createProject.handle(
                new CreateProjectCommand(tenantId, creatorId, newCorrelation(), "  ALPHA ", null)
            );

            assertThat(result.errorOrNull()).isInstanceOf(ProjectCommandError.NameAlreadyExists.class);
        }

        @Test
        @DisplayName("should allow the same name in another tenant")
        void testSameNameOtherTenant() {
            Result<CreateProjectResult, ProjectCommandError> result = harness.createProject.handle(
                new CreateProjectCommand(UUID.randomUUID(), creatorId, newCorrelation(), "Alpha", null)
            );

            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should report an invalid name as a validation failure")
        void testInvalidName() {
            Result<CreateProjectResult, ProjectCommandError> result = harness.createProject.handle(
                new CreateProjectCommand(tenantId, creatorId, newCorrelation(), "x", null)
            );

            assertThat(result.errorOrNull().kind()).isEqualTo(ProjectCommandError.Kind.VALIDATION_FAILED);
        }
    }

    @Nested
    @DisplayName("Membership handlers")
    class Membership {

        @Test
        @DisplayName("assigning the same role twice should write one event")
        void testIdempotentAssign() {
            UUID dev = UUID.randomUUID();
            AssignUserToProjectCommand assign = new AssignUserToProjectCommand(
                tenantId, creatorId, newCorrelation(), projectId, dev, ProjectRole.MEMBER, null
            );

            Result<AssignUserToProjectResult, ProjectCommandError> first = harness.assignUser.handle(assign);
            Result<AssignUserToProjectResult, ProjectCommandError> second = harness.assignUser.handle(assign);

            assertThat(first.getOrNull().wasAlreadyMember()).isFalse();
            assertThat(second.getOrNull().wasAlreadyMember()).isTrue();
            assertThat(harness.eventLog.load(projectId)).hasSize(3);
            assertThat(harness.projects.findMembers(projectId)).hasSize(2);
        }

        @Test
        @DisplayName("changing a member's role should update the read model")
        void testRoleChange() {
            UUID dev = UUID.randomUUID();
            harness.assignUser.handle(new AssignUserToProjectCommand(
                tenantId, creatorId, newCorrelation(), projectId, dev, ProjectRole.MEMBER, null));

            harness.assignUser.handle(new AssignUserToProjectCommand(
                tenantId, creatorId, newCorrelation(), projectId, dev, ProjectRole.PROJECT_ADMIN, 3L));

            assertThat(harness.eventTypes(projectId)).last().isEqualTo("ProjectMemberRoleChanged");
            assertThat(harness.projects.findMembers(projectId))
                .filteredOn(m -> m.userId().equals(dev))
                .extracting(ProjectMemberProjection::role)
                .containsExactly(ProjectRole.PROJECT_ADMIN);
        }

        @Test
        @DisplayName("the creator cannot be removed while active or archived")
        void testCreatorProtected() {
            RemoveUserFromProjectCommand removeCreator = new RemoveUserFromProjectCommand(
                tenantId, creatorId, newCorrelation(), projectId, creatorId, null
            );

            assertThat(harness.removeUser.handle(removeCreator).errorOrNull().kind())
                .isEqualTo(ProjectCommandError.Kind.CANNOT_REMOVE_CREATOR);

            harness.archiveProject.handle(new ArchiveProjectCommand(tenantId, creatorId, newCorrelation(), projectId, null));

            assertThat(harness.removeUser.handle(removeCreator).errorOrNull().kind())
                .isEqualTo(ProjectCommandError.Kind.CANNOT_REMOVE_CREATOR);
        }

        @Test
        @DisplayName("removing a member should update the read model")
        void testRemoveMember() {
            UUID dev = UUID.randomUUID();
            harness.assignUser.handle(new AssignUserToProjectCommand(
                tenantId, creatorId, newCorrelation(), projectId, dev, ProjectRole.MEMBER, null));

            Result<UUID, ProjectCommandError> result = harness.removeUser.handle(
                new RemoveUserFromProjectCommand(tenantId, creatorId, newCorrelation(), projectId, dev, null));

            assertThat(result.isSuccess()).isTrue();
            assertThat(harness.projects.findMembers(projectId))
                .extracting(ProjectMemberProjection::userId).containsExactly(creatorId);
        }

        @Test
        @DisplayName("assigning to an archived project should fail")
        void testAssignArchived() {
            harness.archiveProject.handle(new ArchiveProjectCommand(tenantId, creatorId, newCorrelation(), projectId, null));

            Result<AssignUserToProjectResult, ProjectCommandError> result = harness.assignUser.handle(
                new AssignUserToProjectCommand(tenantId, creatorId, newCorrelation(), projectId, UUID.randomUUID(), ProjectRole.MEMBER, null));

            assertThat(result.errorOrNull()).isInstanceOf(ProjectCommandError.ProjectArchived.class);
        }
    }

    @Nested
    @DisplayName("Lifecycle handlers")
    class Lifecycle {

        @Test
        @DisplayName("archive and unarchive should be idempotent and projected")
        void testArchiveUnarchive() {
            ArchiveProjectCommand archive = new ArchiveProjectCommand(tenantId, creatorId, newCorrelation(), projectId, null);

            assertThat(harness.archiveProject.handle(archive).isSuccess()).isTrue();
            assertThat(harness.archiveProject.handle(archive).isSuccess()).isTrue();
            assertThat(harness.eventLog.load(projectId)).hasSize(3);
            assertThat(harness.projects.findById(tenantId, projectId).get().status()).isEqualTo(ProjectStatus.ARCHIVED);

            harness.unarchiveProject.handle(new UnarchiveProjectCommand(tenantId, creatorId, newCorrelation(), projectId, null));

            assertThat(harness.projects.findById(tenantId, projectId).get().status()).isEqualTo(ProjectStatus.ACTIVE);
        }

        @Test
        @DisplayName("update should enforce name uniqueness and the expected version")
        void testUpdate() {
            harness.givenProject(tenantId, creatorId, "Beta");

            Result<UUID, ProjectCommandError> taken = harness.updateProject.handle(
                new UpdateProjectCommand(tenantId, creatorId, newCorrelation(), projectId, "beta", null, null));
            Result<UUID, ProjectCommandError> stale = harness.updateProject.handle(
                new UpdateProjectCommand(tenantId, creatorId, newCorrelation(), projectId, "Gamma", null, 1L));
            Result<UUID, ProjectCommandError> renamed = harness.updateProject.handle(
                new UpdateProjectCommand(tenantId, creatorId, newCorrelation(), projectId, "Gamma", "Renamed", 2L));

            assertThat(taken.errorOrNull()).isInstanceOf(ProjectCommandError.NameAlreadyExists.class);
            assertThat(stale.errorOrNull()).isInstanceOfSatisfying(ProjectCommandError.ConcurrencyConflict.class, e -> {
                assertThat(e.expectedVersion()).isEqualTo(1);
                assertThat(e.actualVersion()).isEqualTo(2);
            });
            assertThat(renamed.isSuccess()).isTrue();
            assertThat(harness.projects.findById(tenantId, projectId).get().name()).isEqualTo("Gamma");
        }

        @Test
        @DisplayName("keeping the same name with different case should not clash with itself")
        void testUpdateSameName() {
            Result<UUID, ProjectCommandError> result = harness.updateProject.handle(
                new UpdateProjectCommand(tenantId, creatorId, newCorrelation(), projectId, "ALPHA", "New text", null));

            assertThat(result.isSuccess()).isTrue();
        }
    }

    @Nested
    @DisplayName("Tenant isolation and failures")
    class Isolation {

        @Test
        @DisplayName("another tenant's project should be reported as not found")
        void testTenantMismatch() {
            Result<UUID, ProjectCommandError> result = harness.archiveProject.handle(
                new ArchiveProjectCommand(UUID.randomUUID(), creatorId, newCorrelation(), projectId, null));

            assertThat(result.errorOrNull()).isEqualTo(
                new ProjectCommandError.NotFound(projectId, "Project not found: " + projectId));
            assertThat(harness.eventLog.load(projectId)).hasSize(2);
        }

        @Test
        @DisplayName("an unknown project should be reported as not found")
        void testUnknownProject() {
            UUID unknown = UUID.randomUUID();

            Result<UUID, ProjectCommandError> result = harness.archiveProject.handle(
                new ArchiveProjectCommand(tenantId, creatorId, newCorrelation(), unknown, null));

            assertThat(result.errorOrNull().message()).isEqualTo("Project not found: " + unknown);
        }

        @Test
        @DisplayName("a failing read model should not fail the command")
        void testProjectionFailureNonFatal() {
            // Given
            InMemoryEventLog eventLog = new InMemoryEventLog();
            ProjectProjectionUpdater updater = mock(ProjectProjectionUpdater.class);
            ProjectQueryService queries = mock(ProjectQueryService.class);
            when(queries.existsByName(any(), any(), any())).thenReturn(false);
            when(updater.insertProject(any())).thenReturn(Result.failure(new ProjectionError.DatabaseError("read model down")));
            when(updater.insertMember(any())).thenThrow(new IllegalStateException("read model down"));
            CreateProjectHandler handler = new CreateProjectHandler(eventLog, EventPublisher.noop(), queries, updater);

            // When
            Result<CreateProjectResult, ProjectCommandError> result = handler.handle(
                new CreateProjectCommand(tenantId, creatorId, newCorrelation(), "Delta", null));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(eventLog.load(result.getOrNull().projectId())).hasSize(2);
            verify(updater).insertMember(any());
        }

        @Test
        @DisplayName("events in the log should replay through the registered deserializer")
        void testReplay() {
            ProjectEventDeserializer deserializer = new ProjectEventDeserializer();

            assertThat(harness.eventLog.load(projectId))
                .map(deserializer::deserialize)
                .allSatisfy(e -> assertThat(e.aggregateId()).isEqualTo(projectId));
        }
    }
}

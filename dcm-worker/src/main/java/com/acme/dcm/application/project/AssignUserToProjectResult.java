package com.acme.dcm.application.project;

import java.util.UUID;

/**
 * @param wasAlreadyMember true when the user was a member before, with the same or another role
 */
public record AssignUserToProjectResult(UUID projectId, boolean wasAlreadyMember) {}

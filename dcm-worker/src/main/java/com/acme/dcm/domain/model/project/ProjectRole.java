package com.acme.dcm.domain.model.project;

/**
 * Role of a user within a project
 */
public enum ProjectRole {
    MEMBER,
    PROJECT_ADMIN
}

package com.acme.dcm.domain.model.project;

public enum ProjectStatus {
    ACTIVE,
    ARCHIVED
}

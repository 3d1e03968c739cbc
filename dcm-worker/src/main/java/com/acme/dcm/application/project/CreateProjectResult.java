package com.acme.dcm.application.project;

import java.util.UUID;

public record CreateProjectResult(UUID projectId, long version) {}

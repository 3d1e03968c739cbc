package com.acme.dcm.config;

import com.acme.dcm.infrastructure.persistence.InMemoryProjectProjectionRepository;
import com.acme.dcm.infrastructure.persistence.InMemoryTimelineEventRepository;
import com.acme.dcm.infrastructure.persistence.InMemoryVmProvisioningProgressRepository;
import com.acme.dcm.infrastructure.persistence.InMemoryVmRequestProjectionRepository;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Read-model bindings. One project repository instance serves both the updater and query ports.
 */
@Factory
public class RepositoryConfiguration {

    @Singleton
    public InMemoryProjectProjectionRepository projectProjectionRepository() {
        return new InMemoryProjectProjectionRepository();
    }

    @Singleton
    public InMemoryVmRequestProjectionRepository vmRequestProjectionRepository() {
        return new InMemoryVmRequestProjectionRepository();
    }

    @Singleton
    public InMemoryVmProvisioningProgressRepository vmProvisioningProgressRepository() {
        return new InMemoryVmProvisioningProgressRepository();
    }

    @Singleton
    public InMemoryTimelineEventRepository timelineEventRepository() {
        return new InMemoryTimelineEventRepository();
    }
}

package com.acme.dcm.infrastructure.event;

import com.acme.dcm.domain.model.project.ProjectEvent;
import com.acme.sourcing.event.JacksonEventDeserializer;
import io.micronaut.context.annotation.Context;

/**
 * Deserializer for the Project stream. Created eagerly so an incomplete registry fails startup.
 */
@Context
public class ProjectEventDeserializer extends JacksonEventDeserializer<ProjectEvent> {

    public ProjectEventDeserializer() {
        super(EventTypeRegistries.project());
    }
}

package com.acme.sourcing.command;

import com.acme.sourcing.event.EventMetadata;
import java.util.UUID;

/** A command issued by a user on behalf of a tenant. */
public interface TenantCommand extends DomainCommand {

  UUID tenantId();

  UUID userId();

  UUID correlationId();

  default EventMetadata metadata() {
    return EventMetadata.create(tenantId(), userId(), correlationId());
  }
}

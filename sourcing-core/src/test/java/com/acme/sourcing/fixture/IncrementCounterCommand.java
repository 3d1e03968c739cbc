package com.acme.sourcing.fixture;

import com.acme.sourcing.command.TenantCommand;
import java.util.UUID;

public record IncrementCounterCommand(
    UUID tenantId, UUID userId, UUID correlationId, UUID counterId, int amount, Long expectedVersion)
    implements TenantCommand {}

package com.acme.dcm.config;

import com.acme.dcm.infrastructure.hypervisor.SimulatedHypervisorAdapter;
import com.acme.sourcing.resilience.Sleeper;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;

import java.time.Duration;

/**
 * Hypervisor binding. Fails startup when the provisioning timeouts are inconsistent.
 */
@Factory
public class HypervisorConfiguration {

    @Singleton
    public SimulatedHypervisorAdapter hypervisorPort(
        ProvisioningTimeouts timeouts,
        Sleeper sleeper,
        @Value("${hypervisor.simulated.clone-duration:0s}") Duration cloneDuration,
        @Value("${hypervisor.simulated.network-duration:0s}") Duration networkDuration
    ) {
        return new SimulatedHypervisorAdapter(timeouts, cloneDuration, networkDuration, sleeper);
    }
}

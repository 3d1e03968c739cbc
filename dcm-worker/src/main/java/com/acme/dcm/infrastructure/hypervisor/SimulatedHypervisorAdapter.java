package com.acme.dcm.infrastructure.hypervisor;

import com.acme.dcm.application.vm.HypervisorError;
import com.acme.dcm.application.vm.HypervisorPort;
import com.acme.dcm.application.vm.VmProvisioningResult;
import com.acme.dcm.application.vm.VmSpec;
import com.acme.dcm.config.ProvisioningTimeouts;
import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.resilience.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Hypervisor stand-in for environments without a virtualization platform.
 *
 * <p>Clone and network phases take the configured simulated time. A phase that would outlast its
 * timeout is cut off at the timeout and reported as {@link HypervisorError.Timeout}. Failures can
 * be scripted with {@link #failNextCalls}; each queued error is returned by one call.
 */
@Slf4j
public class SimulatedHypervisorAdapter implements HypervisorPort {

    private final ProvisioningTimeouts timeouts;
    private final Duration cloneDuration;
    private final Duration networkDuration;
    private final Sleeper sleeper;
    private final Queue<HypervisorError> scriptedFailures = new ConcurrentLinkedQueue<>();
    private final AtomicInteger vmCounter = new AtomicInteger();
    private final AtomicInteger invocations = new AtomicInteger();

    public SimulatedHypervisorAdapter(ProvisioningTimeouts timeouts, Duration cloneDuration, Duration networkDuration, Sleeper sleeper) {
        timeouts.validate();
        this.timeouts = timeouts;
        this.cloneDuration = cloneDuration;
        this.networkDuration = networkDuration;
        this.sleeper = sleeper;
    }

    public void failNextCalls(HypervisorError... errors) {
        for (HypervisorError error : errors) {
            scriptedFailures.add(error);
        }
    }

    public int getInvocationCount() {
        return invocations.get();
    }

    @Override
    public Result<VmProvisioningResult, HypervisorError> createVm(VmSpec spec, Consumer<VmProvisioningStage> onProgress) {
        invocations.incrementAndGet();
        Cancellation.checkpoint();

        HypervisorError scripted = scriptedFailures.poll();
        if (scripted != null) {
            log.info("Simulated failure for {}: {}", spec.name(), scripted.message());
            return Result.failure(scripted);
        }

        onProgress.accept(VmProvisioningStage.CLONING);
        if (!runPhase(cloneDuration, timeouts.getCloneTimeout())) {
            return Result.failure(new HypervisorError.Timeout(
                "Clone of " + spec.template() + " exceeded " + timeouts.getCloneTimeout()
            ));
        }

        onProgress.accept(VmProvisioningStage.CONFIGURING);
        onProgress.accept(VmProvisioningStage.POWERING_ON);

        onProgress.accept(VmProvisioningStage.WAITING_FOR_NETWORK);
        if (!runPhase(networkDuration, timeouts.getNetworkTimeout())) {
            return Result.failure(new HypervisorError.Timeout(
                "Network of " + spec.name() + " not ready within " + timeouts.getNetworkTimeout()
            ));
        }

        onProgress.accept(VmProvisioningStage.READY);
        int n = vmCounter.incrementAndGet();
        VmProvisioningResult result = new VmProvisioningResult(
            "vm-" + (1000 + n),
            "10.0." + (n / 250) + "." + (n % 250 + 2),
            spec.name(),
            null
        );
        log.info("Simulated VM created: name={} vmwareVmId={} ip={}", spec.name(), result.vmwareVmId(), result.ipAddress());
        return Result.success(result);
    }

    /** Waits for the phase, at most until its timeout. Returns false if the timeout was hit. */
    private boolean runPhase(Duration duration, Duration timeout) {
        if (duration.compareTo(timeout) > 0) {
            sleeper.sleep(timeout);
            return false;
        }
        if (!duration.isZero()) {
            sleeper.sleep(duration);
        }
        return true;
    }
}

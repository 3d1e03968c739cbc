package com.acme.dcm.application.vm;

import com.acme.dcm.domain.model.vm.VmProvisioningStage;
import com.acme.sourcing.config.RetryConfig;
import com.acme.sourcing.core.Cancellation;
import com.acme.sourcing.core.Result;
import com.acme.sourcing.resilience.Sleeper;
import io.micronaut.context.annotation.Value;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Calls the hypervisor with retry and exponential backoff.
 *
 * <p>Transient errors are retried up to {@link RetryConfig#getMaxAttempts()} invocations in total,
 * waiting {@link RetryConfig#backoffFor(int)} between them. Permanent errors are returned after the
 * first invocation. An exception thrown by the port becomes an {@link HypervisorError.ApiError} and
 * is retried like any other transient error.
 *
 * <p>Each invocation runs on a separate thread and is bounded by the overall provisioning timeout. An
 * invocation that outlives it is interrupted and counted as a {@link HypervisorError.Timeout}.
 * Cancellation, including an interrupt during a backoff wait, propagates at once.
 */
@Slf4j
@Singleton
public class ResilientProvisioningService implements AutoCloseable {

    private final HypervisorPort hypervisorPort;
    private final RetryConfig retryConfig;
    private final Sleeper sleeper;
    private final Duration overallTimeout;
    private final ExecutorService callExecutor;

    public ResilientProvisioningService(
        HypervisorPort hypervisorPort,
        RetryConfig retryConfig,
        Sleeper sleeper,
        @Value("${provisioning.timeouts.overall-timeout:10m}") Duration overallTimeout
    ) {
        this.hypervisorPort = hypervisorPort;
        this.retryConfig = retryConfig;
        this.sleeper = sleeper;
        this.overallTimeout = overallTimeout;
        AtomicInteger threadCount = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "hypervisor-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Result<VmProvisioningResult, ProvisioningFailure> createVmWithRetry(
        VmSpec spec,
        UUID correlationId,
        Consumer<VmProvisioningStage> onProgress
    ) {
        int maxAttempts = retryConfig.getMaxAttempts();
        HypervisorError lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                log.info("Provisioning attempt {}/{}. correlationId={}", attempt, maxAttempts, correlationId);
            }

            Result<VmProvisioningResult, HypervisorError> result;
            try {
                Cancellation.checkpoint();
                result = createVmWithinBudget(spec, onProgress);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error during provisioning. correlationId={}", correlationId, e);
                result = Result.failure(new HypervisorError.ApiError("Unexpected error: " + e.getMessage(), e));
            }

            if (result.isSuccess()) {
                if (attempt > 1) {
                    log.info("Provisioning succeeded on attempt {}/{}. correlationId={}", attempt, maxAttempts, correlationId);
                }
                return Result.success(result.getOrNull());
            }

            HypervisorError error = result.errorOrNull();
            lastError = error;
            if (!error.isRetriable()) {
                log.info("Permanent error detected, skipping retry. correlationId={} errorCode={} error={}",
                    correlationId, error.errorCode(), error.message());
                return Result.failure(new ProvisioningFailure.HypervisorFailure(error));
            }

            if (attempt < maxAttempts) {
                Duration wait = retryConfig.backoffFor(attempt);
                log.warn("Retry attempt {}/{} for provisioning. correlationId={} lastError={} waitDuration={}s",
                    attempt, maxAttempts, correlationId, error.message(), wait.toSeconds());
                sleeper.sleep(wait);
            }
        }

        log.error("Max retries ({}) exhausted for provisioning. correlationId={} lastError={} errorCode={}",
            maxAttempts, correlationId, lastError.message(), lastError.errorCode());
        return Result.failure(new ProvisioningFailure.Exhausted(new RetryExhaustedError(
            maxAttempts, lastError.errorCode(), lastError.userMessage(), lastError
        )));
    }

    private Result<VmProvisioningResult, HypervisorError> createVmWithinBudget(
        VmSpec spec,
        Consumer<VmProvisioningStage> onProgress
    ) {
        Map<String, String> logContext = MDC.getCopyOfContextMap();
        Future<Result<VmProvisioningResult, HypervisorError>> call = callExecutor.submit(() -> {
            if (logContext != null) {
                MDC.setContextMap(logContext);
            }
            try {
                return hypervisorPort.createVm(spec, onProgress);
            } finally {
                MDC.clear();
            }
        });

        try {
            return call.get(overallTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Hypervisor call exceeded overall timeout of {}s for vm={}", overallTimeout.toSeconds(), spec.name());
            return Result.failure(new HypervisorError.Timeout(
                "Provisioning did not complete within " + overallTimeout.toSeconds() + "s"));
        } catch (InterruptedException e) {
            call.cancel(true);
            throw Cancellation.fromInterrupt(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            Cancellation.rethrowIfCancelled(cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    @PreDestroy
    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}

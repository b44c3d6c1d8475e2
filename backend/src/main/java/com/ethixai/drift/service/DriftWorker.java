package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.BaselineDocument;
import com.ethixai.drift.dto.DriftAnalysis;
import com.ethixai.drift.dto.DriftCycleResult;
import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.exception.BaselineNotFoundException;
import com.ethixai.drift.exception.CycleTimeoutException;
import com.ethixai.drift.exception.InsufficientDataException;
import com.ethixai.drift.exception.TransientStoreException;
import com.ethixai.drift.model.DriftAlert;
import com.ethixai.drift.model.DriftSnapshot;
import com.ethixai.drift.model.WindowMode;
import com.ethixai.drift.repository.DriftSnapshotRepository;
import com.ethixai.drift.util.JsonCodec;
import com.ethixai.drift.util.ModelIds;
import com.ethixai.drift.util.StoreErrors;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one drift evaluation cycle for one model: fetch the window, compare it with the baseline, then write
 * alerts, retrain request and snapshot in a single transaction at the very end.
 * <p>
 * There is no timer here. Callers (cron, scheduler, admin API) invoke {@link #runCycle} per model and mode.
 * Cycles for the same model never overlap within a process; an invocation that finds one running is skipped.
 */
@Service
@Slf4j
public class DriftWorker {

    private final EvaluationSource evaluationSource;
    private final BaselineService baselineService;
    private final DriftAnalyzer driftAnalyzer;
    private final AlertService alertService;
    private final DriftSnapshotRepository snapshotRepository;
    private final DriftMetricsExporter metricsExporter;
    private final DriftProperties properties;
    private final JsonCodec jsonCodec;
    private final Retry driftStoreRetry;
    private final PlatformTransactionManager transactionManager;
    private final Executor driftExecutor;
    private final Clock clock;

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public DriftWorker(EvaluationSource evaluationSource,
                       BaselineService baselineService,
                       DriftAnalyzer driftAnalyzer,
                       AlertService alertService,
                       DriftSnapshotRepository snapshotRepository,
                       DriftMetricsExporter metricsExporter,
                       DriftProperties properties,
                       JsonCodec jsonCodec,
                       Retry driftStoreRetry,
                       PlatformTransactionManager transactionManager,
                       @Qualifier("driftExecutor") Executor driftExecutor,
                       Clock clock) {
        this.evaluationSource = evaluationSource;
        this.baselineService = baselineService;
        this.driftAnalyzer = driftAnalyzer;
        this.alertService = alertService;
        this.snapshotRepository = snapshotRepository;
        this.metricsExporter = metricsExporter;
        this.properties = properties;
        this.jsonCodec = jsonCodec;
        this.driftStoreRetry = driftStoreRetry;
        this.transactionManager = transactionManager;
        this.driftExecutor = driftExecutor;
        this.clock = clock;
    }

    public DriftCycleResult runCycle(String modelId, WindowMode mode) {
        return runCycle(modelId, mode, clock.instant());
    }

    public DriftCycleResult runCycle(String modelId, WindowMode mode, Instant windowEnd) {
        ModelIds.validate(modelId);
        DriftProperties.Window window = properties.window(mode);
        Instant windowStart = windowEnd.minus(window.getLength());
        long startedAt = System.nanoTime();

        if (!running.add(modelId)) {
            log.info("Drift cycle skipped model={} mode={} reason=already running", modelId, mode);
            DriftCycleResult result = DriftCycleResult.skipped(modelId, mode, windowStart, windowEnd, 0,
                    "Cycle already running for model " + modelId);
            metricsExporter.recordCycle(mode, result.outcome(), Duration.ZERO);
            return result;
        }

        String cycleId = UUID.randomUUID().toString();
        MDC.put("modelId", modelId);
        MDC.put("mode", mode.name());
        MDC.put("cycleId", cycleId);
        Duration timeout = properties.getWorker().getCycleTimeout();
        CycleDeadline deadline = new CycleDeadline(timeout);
        boolean handedOff = false;
        DriftCycleResult result;
        try {
            Supplier<DriftCycleResult> attempts = Retry.decorateSupplier(driftStoreRetry,
                    () -> execute(modelId, mode, windowStart, windowEnd, window.getMaxSamples(), deadline));
            // the slot is held until the work really stops, even after a timeout
            CompletableFuture<DriftCycleResult> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return attempts.get();
                } finally {
                    running.remove(modelId);
                }
            }, driftExecutor);
            handedOff = true;
            try {
                result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (deadline.expire()) {
                    future.cancel(true);
                    log.warn("Drift cycle timed out model={} mode={} timeout={}", modelId, mode, timeout);
                    result = DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                            DriftCycleResult.Outcome.TIMED_OUT, "Cycle exceeded " + timeout);
                } else {
                    // the commit was already under way when the timeout hit; report what it actually did
                    log.info("Drift cycle passed its timeout while committing model={} mode={}", modelId, mode);
                    result = awaitCommit(future, modelId, mode, windowStart, windowEnd);
                }
            } catch (ExecutionException e) {
                result = fromFailure(modelId, mode, windowStart, windowEnd, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                String reason = deadline.expire()
                        ? "Interrupted while waiting for cycle"
                        : "Interrupted while cycle was committing";
                result = DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                        DriftCycleResult.Outcome.FAILED, reason);
            }
        } catch (RejectedExecutionException e) {
            log.warn("Drift cycle rejected model={} mode={} reason=executor saturated", modelId, mode);
            result = DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                    DriftCycleResult.Outcome.FAILED, "Drift executor saturated");
        } finally {
            if (!handedOff) {
                running.remove(modelId);
            }
            MDC.remove("modelId");
            MDC.remove("mode");
            MDC.remove("cycleId");
        }
        metricsExporter.recordCycle(mode, result.outcome(), Duration.ofNanos(System.nanoTime() - startedAt));
        return result;
    }

    public boolean isRunning(String modelId) {
        return running.contains(modelId);
    }

    private DriftCycleResult execute(String modelId, WindowMode mode, Instant windowStart, Instant windowEnd,
                                     int maxSamples, CycleDeadline deadline) {
        try {
            List<EvaluationSample> samples = evaluationSource.fetchWindow(modelId, windowStart, windowEnd, maxSamples);
            int minSamples = properties.getWorker().getMinSamples();
            if (samples.size() < minSamples) {
                throw new InsufficientDataException("Window has " + samples.size() + " samples, " + minSamples
                        + " required", samples.size(), minSamples);
            }
            BaselineDocument baseline = baselineService.get(modelId);
            deadline.check("analysis");
            DriftAnalysis analysis = driftAnalyzer.analyze(baseline, samples);
            deadline.check("persistence");

            TransactionTemplate transaction = new TransactionTemplate(transactionManager);
            transaction.setTimeout(deadline.remainingSeconds());
            DriftCycleResult result;
            try {
                result = transaction.execute(status ->
                        persist(modelId, mode, windowStart, windowEnd, analysis, deadline));
            } catch (RuntimeException e) {
                deadline.releaseCommit();
                throw e;
            }
            publishMetrics(modelId, analysis, result != null && result.needsRetraining());
            return result;
        } catch (DataAccessException e) {
            throw StoreErrors.translate("Drift cycle for model " + modelId, e);
        }
    }

    private DriftCycleResult persist(String modelId, WindowMode mode, Instant windowStart, Instant windowEnd,
                                     DriftAnalysis analysis, CycleDeadline deadline) {
        List<DriftAlert> alerts = alertService.evaluate(modelId, windowStart, windowEnd,
                analysis.signals(properties.getThresholds()));
        boolean needsRetraining = alertService.shouldTriggerRetrain(modelId);
        DriftSnapshot snapshot = snapshotRepository.save(DriftSnapshot.builder()
                .modelId(modelId)
                .mode(mode)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .sampleCount(analysis.getSampleCount())
                .featureDrifts(jsonCodec.write(orEmpty(analysis.getFeatureDrifts())))
                .scoreDrift(jsonCodec.write(analysis.getScoreDrift()))
                .fairnessDrift(jsonCodec.write(orEmpty(analysis.getFairnessDrifts())))
                .dataQualityDrift(jsonCodec.write(orEmpty(analysis.getDataQualityDrifts())))
                .explanationDrift(jsonCodec.write(analysis.getExplanationDrift()))
                .overallStatus(analysis.getOverallStatus())
                .criticalCount(analysis.getCriticalCount())
                .warningCount(analysis.getWarningCount())
                .needsRetraining(needsRetraining)
                .createdAt(clock.instant())
                .build());
        // a cycle that ran out of time rolls back everything it wrote
        deadline.claimCommit();
        log.info("Drift cycle completed model={} mode={} samples={} status={} alerts={} needsRetraining={}",
                modelId, mode, analysis.getSampleCount(), analysis.getOverallStatus(), alerts.size(), needsRetraining);
        return new DriftCycleResult(modelId, mode, DriftCycleResult.Outcome.COMPLETED, windowStart, windowEnd,
                analysis.getSampleCount(), snapshot.getId(), analysis.getOverallStatus(), alerts.size(),
                needsRetraining, null);
    }

    private void publishMetrics(String modelId, DriftAnalysis analysis, boolean needsRetraining) {
        try {
            metricsExporter.publishSnapshot(modelId, analysis, needsRetraining);
            metricsExporter.publishOpenAlerts(modelId, alertService.openAlertCounts(modelId));
        } catch (RuntimeException e) {
            log.warn("Failed to publish drift metrics model={} error={}", modelId, e.getMessage());
        }
    }

    private DriftCycleResult awaitCommit(CompletableFuture<DriftCycleResult> future, String modelId, WindowMode mode,
                                         Instant windowStart, Instant windowEnd) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return fromFailure(modelId, mode, windowStart, windowEnd, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                    DriftCycleResult.Outcome.FAILED, "Interrupted while waiting for cycle commit");
        }
    }

    private DriftCycleResult fromFailure(String modelId, WindowMode mode, Instant windowStart, Instant windowEnd,
                                         Throwable cause) {
        if (cause instanceof InsufficientDataException insufficient) {
            log.info("Drift cycle skipped model={} mode={} samples={} required={}", modelId, mode,
                    insufficient.getSampleCount(), insufficient.getRequired());
            return DriftCycleResult.skipped(modelId, mode, windowStart, windowEnd, insufficient.getSampleCount(),
                    insufficient.getMessage());
        }
        if (cause instanceof BaselineNotFoundException) {
            log.warn("Drift cycle failed model={} mode={} reason=no baseline", modelId, mode);
            return DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                    DriftCycleResult.Outcome.FAILED, cause.getMessage());
        }
        if (cause instanceof CycleTimeoutException) {
            log.warn("Drift cycle aborted model={} mode={} reason={}", modelId, mode, cause.getMessage());
            return DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                    DriftCycleResult.Outcome.TIMED_OUT, cause.getMessage());
        }
        if (cause instanceof TransientStoreException) {
            log.error("Drift cycle abandoned model={} mode={} after {} attempts", modelId, mode,
                    properties.getWorker().getRetryAttempts(), cause);
            return DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                    DriftCycleResult.Outcome.FAILED, "Store unavailable: " + cause.getMessage());
        }
        log.error("Drift cycle failed model={} mode={}", modelId, mode, cause);
        return DriftCycleResult.failed(modelId, mode, windowStart, windowEnd,
                DriftCycleResult.Outcome.FAILED, cause == null ? "Unknown failure" : cause.getMessage());
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}

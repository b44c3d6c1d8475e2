package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.model.WindowMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * In-process stand-in for the external cron. Disabled unless {@code drift.scheduler.enabled=true}; deployments
 * that trigger cycles through the admin API leave it off.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "drift.scheduler.enabled", havingValue = "true")
public class DriftCycleScheduler {

    private final DriftWorker driftWorker;
    private final RetentionService retentionService;
    private final BaselineService baselineService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final DriftProperties properties;

    @Scheduled(cron = "${drift.scheduler.streaming-cron}")
    public void runStreamingCycles() {
        scheduledTaskGuard.run("drift-streaming", () -> runAll(WindowMode.STREAMING));
    }

    @Scheduled(cron = "${drift.scheduler.batch-cron}")
    public void runBatchCycles() {
        scheduledTaskGuard.run("drift-batch", () -> runAll(WindowMode.BATCH));
    }

    @Scheduled(cron = "${drift.scheduler.cleanup-cron}")
    public void runCleanup() {
        scheduledTaskGuard.run("drift-cleanup", retentionService::runCleanup);
    }

    void runAll(WindowMode mode) {
        List<String> models = properties.getScheduler().getModels().isEmpty()
                ? baselineService.listModelIds()
                : properties.getScheduler().getModels();
        for (String modelId : models) {
            // one model failing must not starve the others
            scheduledTaskGuard.run("drift-" + mode.name().toLowerCase() + ":" + modelId,
                    () -> driftWorker.runCycle(modelId, mode));
        }
        log.debug("Scheduled {} drift cycles dispatched for {} models", mode, models.size());
    }
}

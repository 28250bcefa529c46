package com.artifactduo.server.service.pipeline;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.exception.BusinessException;
import com.artifactduo.server.exception.PipelineBusyException;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.api.pipeline.ManualDeployRequest;
import com.artifactduo.server.model.api.pipeline.PipelineStatus;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.model.internal.CycleResult;
import com.artifactduo.server.model.internal.DeploymentTarget;
import com.artifactduo.server.model.internal.PipelineContext;
import com.artifactduo.server.model.internal.PipelineSnapshot;
import com.artifactduo.server.model.internal.TargetDeployResult;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.deploy.DeploymentFanout;
import com.artifactduo.server.service.history.HistoryStore;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Control surface of the pipeline: starts runs on the worker thread, and pauses, resumes or
 * cancels the active one.
 * <p>
 * At most one run (scan cycle or manual deploy) is active per process. A trigger while busy fails
 * with {@link PipelineBusyException} and is never queued.
 */
@Service
@Slf4j
public class PipelineControlService {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AtomicReference<PipelineContext> currentContext = new AtomicReference<>();

    private final PipelineOrchestrator pipelineOrchestrator;

    private final DeploymentFanout deploymentFanout;

    private final PipelineConfigService pipelineConfigService;

    private final TelemetryBus telemetryBus;

    private final HistoryStore historyStore;

    private final Executor pipelineWorkerExecutor;

    private final Clock clock;

    @Autowired
    public PipelineControlService(
            PipelineOrchestrator pipelineOrchestrator,
            DeploymentFanout deploymentFanout,
            PipelineConfigService pipelineConfigService,
            TelemetryBus telemetryBus,
            HistoryStore historyStore,
            @Qualifier("pipelineWorkerExecutor") Executor pipelineWorkerExecutor,
            Clock clock) {
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.deploymentFanout = deploymentFanout;
        this.pipelineConfigService = pipelineConfigService;
        this.telemetryBus = telemetryBus;
        this.historyStore = historyStore;
        this.pipelineWorkerExecutor = pipelineWorkerExecutor;
        this.clock = clock;
    }

    public CompletableFuture<CycleResult> startCycle() throws PipelineBusyException {
        PipelineSnapshot snapshot = this.pipelineConfigService.getSnapshot();
        PipelineContext context = this.acquire("scan cycle");
        return this.submit(context, () -> {
            CycleResult cycleResult = this.pipelineOrchestrator.runCycle(
                    snapshot, context, LocalDateTime.now(this.clock));
            this.telemetryBus.info("Scan finished (%s): found %s, copied %s, skipped %s, errors %s".formatted(
                    cycleResult.getStatus().getName(),
                    cycleResult.getFoundFolders().size(),
                    cycleResult.getCopiedFolders().size(),
                    cycleResult.getSkippedFolders().size(),
                    cycleResult.getErrors().size()));
            return cycleResult;
        });
    }

    public CompletableFuture<TargetDeployResult> manualDeploy(ManualDeployRequest manualDeployRequest)
            throws PipelineBusyException, ValidationException {
        if (ObjectUtils.isEmpty(manualDeployRequest)) {
            throw new ValidationException("manualDeploy failed. manualDeployRequest is null");
        }
        DeploymentTarget target = PipelineConfigService.buildTarget(manualDeployRequest.getServer());
        PipelineContext context = this.acquire("manual deploy");
        return this.submit(context, () -> this.deploymentFanout.deployManual(
                target,
                manualDeployRequest.getPostCommands(),
                manualDeployRequest.getLocalPath(),
                manualDeployRequest.getRemotePath(),
                context));
    }

    public String testConnection(PipelineSettings.ServerSetting serverSetting) throws ValidationException {
        return this.deploymentFanout.testConnection(PipelineConfigService.buildTarget(serverSetting));
    }

    public boolean cancel() {
        PipelineContext context = this.currentContext.get();
        if (ObjectUtils.isEmpty(context)) {
            return false;
        }
        context.cancel();
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.CANCEL, "cancel requested"));
        this.telemetryBus.warn("Cancel requested");
        return true;
    }

    public boolean pause() {
        PipelineContext context = this.currentContext.get();
        if (ObjectUtils.isEmpty(context)) {
            return false;
        }
        context.pause();
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.PAUSE, "paused"));
        this.telemetryBus.info("Paused");
        return true;
    }

    public boolean resume() {
        PipelineContext context = this.currentContext.get();
        if (ObjectUtils.isEmpty(context)) {
            return false;
        }
        context.resume();
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.RESUME, "resumed"));
        this.telemetryBus.info("Resumed");
        return true;
    }

    public boolean isBusy() {
        return this.running.get();
    }

    public PipelineStatus getStatus() {
        PipelineStatus pipelineStatus = new PipelineStatus();
        PipelineContext context = this.currentContext.get();
        pipelineStatus.setBusy(this.running.get());
        pipelineStatus.setPaused(ObjectUtils.isNotEmpty(context) && context.isPaused());
        pipelineStatus.setCancelRequested(ObjectUtils.isNotEmpty(context) && context.isCancelled());
        return pipelineStatus;
    }

    private PipelineContext acquire(String runName) throws PipelineBusyException {
        if (!this.running.compareAndSet(false, true)) {
            throw new PipelineBusyException("start %s failed. another run is still active".formatted(runName));
        }
        PipelineContext context = new PipelineContext(this.pipelineConfigService.getPauseCheckIntervalMillis());
        this.currentContext.set(context);
        return context;
    }

    private void release(PipelineContext context) {
        this.currentContext.compareAndSet(context, null);
        this.running.set(false);
    }

    private <T> CompletableFuture<T> submit(PipelineContext context, Supplier<T> run) {
        Supplier<T> guardedRun = () -> {
            try {
                return run.get();
            } catch (RuntimeException e) {
                this.telemetryBus.error("Run failed: %s".formatted(e.getMessage()));
                log.error("pipeline run failed.", e);
                throw e;
            } finally {
                this.telemetryBus.clearProgress();
                this.release(context);
            }
        };
        try {
            return CompletableFuture.supplyAsync(guardedRun, this.pipelineWorkerExecutor);
        } catch (RejectedExecutionException e) {
            this.release(context);
            throw new BusinessException("submit pipeline run failed. worker rejected the run", e);
        }
    }
}

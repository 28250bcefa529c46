package com.artifactduo.server.service.pipeline;

import com.artifactduo.server.enums.CycleStatusEnum;
import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.exception.ArtifactDuoException;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.model.internal.ArtifactTask;
import com.artifactduo.server.model.internal.Candidate;
import com.artifactduo.server.model.internal.CycleResult;
import com.artifactduo.server.model.internal.DeployResult;
import com.artifactduo.server.model.internal.DeploymentTarget;
import com.artifactduo.server.model.internal.PipelineContext;
import com.artifactduo.server.model.internal.PipelineSnapshot;
import com.artifactduo.server.model.internal.TaskRule;
import com.artifactduo.server.model.internal.TransferResult;
import com.artifactduo.server.service.deploy.DeploymentFanout;
import com.artifactduo.server.service.history.HistoryStore;
import com.artifactduo.server.service.matcher.PatternMatcher;
import com.artifactduo.server.service.matcher.RecencySelector;
import com.artifactduo.server.service.matcher.TimeWindowGate;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import com.artifactduo.server.service.transfer.TransferEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Runs one scan cycle over every enabled task of a {@link PipelineSnapshot}.
 * <p>
 * Tasks run one after another. An I/O error ends only the task that raised it and is collected
 * into {@link CycleResult#getErrors()}. Cancellation ends the cycle at the next checkpoint and is
 * reported through the cycle status.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    private final TimeWindowGate timeWindowGate;

    private final PatternMatcher patternMatcher;

    private final RecencySelector recencySelector;

    private final TransferEngine transferEngine;

    private final DeploymentFanout deploymentFanout;

    private final TelemetryBus telemetryBus;

    private final HistoryStore historyStore;

    @Autowired
    public PipelineOrchestrator(
            TimeWindowGate timeWindowGate,
            PatternMatcher patternMatcher,
            RecencySelector recencySelector,
            TransferEngine transferEngine,
            DeploymentFanout deploymentFanout,
            TelemetryBus telemetryBus,
            HistoryStore historyStore) {
        this.timeWindowGate = timeWindowGate;
        this.patternMatcher = patternMatcher;
        this.recencySelector = recencySelector;
        this.transferEngine = transferEngine;
        this.deploymentFanout = deploymentFanout;
        this.telemetryBus = telemetryBus;
        this.historyStore = historyStore;
    }

    public CycleResult runCycle(PipelineSnapshot snapshot, PipelineContext context, LocalDateTime now)
            throws ValidationException {
        if (ObjectUtils.anyNull(snapshot, context, now)) {
            throw new ValidationException("runCycle failed. snapshot, context or now is null");
        }
        CycleResult cycleResult = new CycleResult();
        // 时间窗口检查, 不在窗口内则整个周期跳过
        if (!this.timeWindowGate.isAdmitted(snapshot.timeRanges(), now.toLocalTime())) {
            cycleResult.setStatus(CycleStatusEnum.SKIPPED_OUT_OF_WINDOW);
            this.historyStore.append(HistoryEntry.of(HistoryActionEnum.CYCLE_SKIPPED,
                    "scan skipped. %s is outside of %s".formatted(now.toLocalTime(), snapshot.timeRanges())));
            this.telemetryBus.info("Outside of scan time ranges %s, cycle skipped".formatted(snapshot.timeRanges()));
            return cycleResult;
        }
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.CYCLE_START,
                "scan started. %s tasks".formatted(snapshot.tasks().size())));
        this.telemetryBus.info("Scan started: %s tasks".formatted(snapshot.tasks().size()));
        for (ArtifactTask task : snapshot.tasks()) {
            if (context.isCancelled()) {
                break;
            }
            if (!task.enabled()) {
                continue;
            }
            cycleResult.setScannedPaths(cycleResult.getScannedPaths() + 1);
            try {
                this.runTask(snapshot, task, context, now, cycleResult);
            } catch (ArtifactDuoException e) {
                String error = "[%s] %s".formatted(task.name(), e.getMessage());
                cycleResult.getErrors().add(error);
                this.telemetryBus.error("Task failed: %s".formatted(error));
                log.debug("task {} failed", task.name(), e);
            }
        }
        if (context.isCancelled()) {
            cycleResult.setStatus(CycleStatusEnum.CANCELLED);
            this.historyStore.append(HistoryEntry.of(HistoryActionEnum.CYCLE_CANCELLED,
                    "scan cancelled. %s folders copied".formatted(cycleResult.getCopiedFolders().size())));
            this.telemetryBus.warn("Scan cancelled");
        }
        return cycleResult;
    }

    private void runTask(
            PipelineSnapshot snapshot,
            ArtifactTask task,
            PipelineContext context,
            LocalDateTime now,
            CycleResult cycleResult) {
        this.telemetryBus.info("[%s] Scanning %s".formatted(task.name(), task.remotePath()));
        TaskRule rule = task.rule();
        Optional<Candidate> selected = switch (rule.getType()) {
            case VERSION_MATCH -> {
                String version = ((TaskRule.VersionMatch) rule).version();
                List<Candidate> candidates = this.patternMatcher.scan(task.remotePath());
                yield this.recencySelector.select(candidates, version, now.toLocalDate());
            }
            case DATE_MATCH -> this.patternMatcher.lookupByDate(
                    task.remotePath(), ((TaskRule.DateMatch) rule).dateFormat(), now);
        };
        if (selected.isEmpty()) {
            this.telemetryBus.info("[%s] No eligible folder found".formatted(task.name()));
            return;
        }
        Candidate candidate = selected.get();
        cycleResult.getFoundFolders().add(candidate.name());
        this.telemetryBus.info("[%s] Found candidate: %s".formatted(task.name(), candidate.name()));
        Path destParent = ObjectUtils.defaultIfNull(task.localPath(), snapshot.destinationPath());
        TransferResult transferResult = this.transferEngine.copy(
                candidate.path(), destParent, snapshot.filterRules(), context);
        switch (transferResult.getStatus()) {
            case SKIPPED -> cycleResult.getSkippedFolders().add(candidate.name());
            case NOTHING_TO_COPY, CANCELLED -> {
                return;
            }
            case COMPLETED -> cycleResult.getCopiedFolders().add(candidate.name());
        }
        if (!snapshot.deployEnabled() || !transferResult.isCompleted()) {
            return;
        }
        List<DeploymentTarget> targets = snapshot.enabledTargets();
        if (targets.isEmpty()) {
            this.telemetryBus.warn("Deploy is enabled but no deployment target is enabled");
            return;
        }
        // 部署失败不影响 copy 的结果
        DeployResult deployResult = this.deploymentFanout.deploy(
                transferResult.getDestination(),
                transferResult.getArtifactName(),
                targets,
                snapshot.postCommands(),
                context);
        cycleResult.getDeployResults().add(deployResult);
        if (deployResult.getFailedCount() > 0) {
            this.telemetryBus.warn("[%s] Deploy failed on %s of %s targets".formatted(
                    task.name(), deployResult.getFailedCount(), targets.size()));
        }
    }
}

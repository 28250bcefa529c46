package com.artifactduo.server.service.pipeline;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.exception.ArtifactDuoException;
import com.artifactduo.server.exception.PipelineBusyException;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.history.HistoryStore;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Interval trigger of scan cycles. The first scan fires right after start; a tick that finds the
 * pipeline busy is dropped.
 */
@Service
@Slf4j
public class PipelineScheduler {

    private static final DateTimeFormatter NEXT_RUN_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PipelineControlService pipelineControlService;

    private final PipelineConfigService pipelineConfigService;

    private final TelemetryBus telemetryBus;

    private final HistoryStore historyStore;

    private final ThreadPoolTaskScheduler pipelineTaskScheduler;

    private final Clock clock;

    private final AtomicReference<LocalDateTime> nextRunTime = new AtomicReference<>();

    private ScheduledFuture<?> scheduledFuture;

    private long intervalMinutes;

    @Autowired
    public PipelineScheduler(
            PipelineControlService pipelineControlService,
            PipelineConfigService pipelineConfigService,
            TelemetryBus telemetryBus,
            HistoryStore historyStore,
            @Qualifier("pipelineTaskScheduler") ThreadPoolTaskScheduler pipelineTaskScheduler,
            Clock clock) {
        this.pipelineControlService = pipelineControlService;
        this.pipelineConfigService = pipelineConfigService;
        this.telemetryBus = telemetryBus;
        this.historyStore = historyStore;
        this.pipelineTaskScheduler = pipelineTaskScheduler;
        this.clock = clock;
    }

    public synchronized boolean start() {
        if (this.isRunning()) {
            return false;
        }
        this.intervalMinutes = this.pipelineConfigService.getSnapshot().intervalMinutes();
        this.scheduledFuture = this.pipelineTaskScheduler.scheduleAtFixedRate(
                this::trigger, Duration.ofMinutes(this.intervalMinutes));
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.SCHEDULER_START,
                "scheduler started. interval %s minutes".formatted(this.intervalMinutes)));
        this.telemetryBus.info("Scheduler started, scanning every %s minutes".formatted(this.intervalMinutes));
        return true;
    }

    public synchronized boolean stop() {
        if (!this.isRunning()) {
            return false;
        }
        this.scheduledFuture.cancel(false);
        this.scheduledFuture = null;
        this.nextRunTime.set(null);
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.SCHEDULER_STOP, "scheduler stopped"));
        this.telemetryBus.info("Scheduler stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return ObjectUtils.isNotEmpty(this.scheduledFuture) && !this.scheduledFuture.isCancelled();
    }

    public String getNextRunTime() {
        LocalDateTime next = this.nextRunTime.get();
        return ObjectUtils.isEmpty(next) ? "-" : next.format(NEXT_RUN_FORMATTER);
    }

    void trigger() {
        this.nextRunTime.set(LocalDateTime.now(this.clock).plusMinutes(this.intervalMinutes));
        try {
            this.pipelineControlService.startCycle();
        } catch (PipelineBusyException e) {
            this.telemetryBus.warn("Previous run is still active, scheduled scan skipped");
        } catch (ArtifactDuoException e) {
            // 定时任务里的异常不能抛出, 否则后续的 tick 不会再执行
            log.error("scheduled scan failed to start.", e);
        }
    }
}

package com.artifactduo.server.controller;

import com.artifactduo.server.model.api.global.ArtifactDuoHttpResponse;
import com.artifactduo.server.model.api.pipeline.PipelineStatus;
import com.artifactduo.server.model.telemetry.LogEvent;
import com.artifactduo.server.model.telemetry.ProgressEvent;
import com.artifactduo.server.service.pipeline.PipelineControlService;
import com.artifactduo.server.service.pipeline.PipelineScheduler;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/pipeline")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class PipelineController {

    private final PipelineControlService pipelineControlService;

    private final PipelineScheduler pipelineScheduler;

    private final TelemetryBus telemetryBus;

    @Autowired
    public PipelineController(
            PipelineControlService pipelineControlService,
            PipelineScheduler pipelineScheduler,
            TelemetryBus telemetryBus) {
        this.pipelineControlService = pipelineControlService;
        this.pipelineScheduler = pipelineScheduler;
        this.telemetryBus = telemetryBus;
    }

    // 立即返回, 结果通过 get-logs 和 get-progress 获取
    @PostMapping("/start-cycle")
    public ArtifactDuoHttpResponse<Void> startCycle() {
        this.pipelineControlService.startCycle();
        return ArtifactDuoHttpResponse.success(null, "scan cycle started");
    }

    @PostMapping("/cancel")
    public ArtifactDuoHttpResponse<Void> cancel() {
        if (!this.pipelineControlService.cancel()) {
            return ArtifactDuoHttpResponse.success(null, "no active run");
        }
        return ArtifactDuoHttpResponse.success();
    }

    @PostMapping("/pause")
    public ArtifactDuoHttpResponse<Void> pause() {
        if (!this.pipelineControlService.pause()) {
            return ArtifactDuoHttpResponse.success(null, "no active run");
        }
        return ArtifactDuoHttpResponse.success();
    }

    @PostMapping("/resume")
    public ArtifactDuoHttpResponse<Void> resume() {
        if (!this.pipelineControlService.resume()) {
            return ArtifactDuoHttpResponse.success(null, "no active run");
        }
        return ArtifactDuoHttpResponse.success();
    }

    @PostMapping("/start-scheduler")
    public ArtifactDuoHttpResponse<Void> startScheduler() {
        if (!this.pipelineScheduler.start()) {
            return ArtifactDuoHttpResponse.success(null, "scheduler is already running");
        }
        return ArtifactDuoHttpResponse.success();
    }

    @PostMapping("/stop-scheduler")
    public ArtifactDuoHttpResponse<Void> stopScheduler() {
        if (!this.pipelineScheduler.stop()) {
            return ArtifactDuoHttpResponse.success(null, "scheduler is not running");
        }
        return ArtifactDuoHttpResponse.success();
    }

    @GetMapping("/get-status")
    public ArtifactDuoHttpResponse<PipelineStatus> getStatus() {
        PipelineStatus pipelineStatus = this.pipelineControlService.getStatus();
        pipelineStatus.setSchedulerRunning(this.pipelineScheduler.isRunning());
        pipelineStatus.setNextRunTime(this.pipelineScheduler.getNextRunTime());
        return ArtifactDuoHttpResponse.success(pipelineStatus);
    }

    @GetMapping("/get-logs")
    public ArtifactDuoHttpResponse<List<LogEvent>> getLogs(@RequestParam(defaultValue = "200") int limit) {
        return ArtifactDuoHttpResponse.success(this.telemetryBus.getRecentLogs(limit));
    }

    @GetMapping("/get-progress")
    public ArtifactDuoHttpResponse<ProgressEvent> getProgress() {
        return ArtifactDuoHttpResponse.success(this.telemetryBus.getLatestProgress());
    }
}

package com.artifactduo.server.model.api.pipeline;

import lombok.Data;

@Data
public class PipelineStatus {

    private boolean busy;

    private boolean paused;

    private boolean cancelRequested;

    private boolean schedulerRunning;

    // 下次定时扫描时间, 未启动时为 "-"
    private String nextRunTime;
}

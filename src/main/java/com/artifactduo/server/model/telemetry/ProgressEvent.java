package com.artifactduo.server.model.telemetry;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProgressEvent {

    // 当前文件, 或 artifact 名称
    private String label;

    private long totalBytes;

    private long copiedBytes;

    private double percentage;

    // bytes per second
    private double speed;

    private long etaSeconds;

    private long elapsedSeconds;

    private String localPath;

    // 本地复制时为 null
    private String remotePath;

    // 本地复制时为 null
    private String targetName;
}

package com.artifactduo.server.service.transfer;

import com.artifactduo.server.model.telemetry.ProgressEvent;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import lombok.Getter;

/**
 * Byte counter of one transfer that publishes throttled {@link ProgressEvent}s.
 * Used from the single worker thread that runs the transfer.
 */
public class ProgressTracker {

    private final TelemetryBus telemetryBus;

    private final long minIntervalMillis;

    @Getter
    private final long totalBytes;

    @Getter
    private long copiedBytes;

    private final long startMillis;

    private long lastEmitMillis;

    private String label;

    private String localPath;

    private String remotePath;

    private final String targetName;

    public ProgressTracker(TelemetryBus telemetryBus, long totalBytes, long minIntervalMillis, String targetName) {
        this.telemetryBus = telemetryBus;
        this.totalBytes = totalBytes;
        this.minIntervalMillis = minIntervalMillis;
        this.targetName = targetName;
        this.startMillis = System.currentTimeMillis();
        this.lastEmitMillis = 0;
    }

    public void setCurrentFile(String label, String localPath, String remotePath) {
        this.label = label;
        this.localPath = localPath;
        this.remotePath = remotePath;
    }

    public void advance(long bytes) {
        this.copiedBytes += bytes;
        long now = System.currentTimeMillis();
        if (now - this.lastEmitMillis >= this.minIntervalMillis) {
            this.emit(now);
        }
    }

    // 文件完成或传输结束时调用, 不受间隔限制
    public void emitNow() {
        this.emit(System.currentTimeMillis());
    }

    private void emit(long now) {
        this.lastEmitMillis = now;
        double elapsedSeconds = (now - this.startMillis) / 1000.0;
        double speed = elapsedSeconds > 0 ? this.copiedBytes / elapsedSeconds : 0;
        long remainingBytes = Math.max(0, this.totalBytes - this.copiedBytes);
        long etaSeconds = speed > 0 ? (long) Math.ceil(remainingBytes / speed) : 0;
        double percentage = this.totalBytes > 0 ?
                Math.min(100.0, this.copiedBytes * 100.0 / this.totalBytes) :
                100.0;
        this.telemetryBus.emitProgress(ProgressEvent.builder()
                .label(this.label)
                .totalBytes(this.totalBytes)
                .copiedBytes(this.copiedBytes)
                .percentage(percentage)
                .speed(speed)
                .etaSeconds(etaSeconds)
                .elapsedSeconds((long) elapsedSeconds)
                .localPath(this.localPath)
                .remotePath(this.remotePath)
                .targetName(this.targetName)
                .build());
    }
}

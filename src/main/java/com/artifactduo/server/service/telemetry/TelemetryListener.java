package com.artifactduo.server.service.telemetry;

import com.artifactduo.server.model.telemetry.LogEvent;
import com.artifactduo.server.model.telemetry.ProgressEvent;

/**
 * Receives pipeline events on the worker thread that produced them.
 */
public interface TelemetryListener {

    default void onLog(LogEvent logEvent) {}

    default void onProgress(ProgressEvent progressEvent) {}

    default void onProgressCleared() {}
}

package com.artifactduo.server.service.telemetry;

import com.artifactduo.server.enums.LogLevelEnum;
import com.artifactduo.server.model.telemetry.LogEvent;
import com.artifactduo.server.model.telemetry.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event stream of a pipeline run: log lines and progress ticks.
 * <p>
 * Every log event is mirrored to slf4j. The newest {@value #MAX_RECENT_LOGS} log events and the
 * latest progress are kept for polling clients.
 */
@Component
@Slf4j
public class TelemetryBus {

    private static final int MAX_RECENT_LOGS = 1000;

    private final List<TelemetryListener> listeners = new CopyOnWriteArrayList<>();

    // newest first
    private final Deque<LogEvent> recentLogs = new ConcurrentLinkedDeque<>();

    private final AtomicInteger recentLogSize = new AtomicInteger(0);

    private final AtomicReference<ProgressEvent> latestProgress = new AtomicReference<>();

    public void addListener(TelemetryListener listener) {
        this.listeners.add(listener);
    }

    public void removeListener(TelemetryListener listener) {
        this.listeners.remove(listener);
    }

    public void info(String message) {
        this.emitLog(LogLevelEnum.INFO, message);
    }

    public void warn(String message) {
        this.emitLog(LogLevelEnum.WARN, message);
    }

    public void error(String message) {
        this.emitLog(LogLevelEnum.ERROR, message);
    }

    public void success(String message) {
        this.emitLog(LogLevelEnum.SUCCESS, message);
    }

    public void emitLog(LogLevelEnum level, String message) {
        switch (level) {
            case WARN -> log.warn(message);
            case ERROR -> log.error(message);
            case INFO, SUCCESS -> log.info(message);
        }
        LogEvent logEvent = new LogEvent(message, level, Instant.now());
        this.recentLogs.addFirst(logEvent);
        if (this.recentLogSize.incrementAndGet() > MAX_RECENT_LOGS) {
            this.recentLogs.pollLast();
            this.recentLogSize.decrementAndGet();
        }
        for (TelemetryListener listener : this.listeners) {
            try {
                listener.onLog(logEvent);
            } catch (Exception e) {
                log.warn("telemetry listener {} failed on log event", listener, e);
            }
        }
    }

    public void emitProgress(ProgressEvent progressEvent) {
        this.latestProgress.set(progressEvent);
        for (TelemetryListener listener : this.listeners) {
            try {
                listener.onProgress(progressEvent);
            } catch (Exception e) {
                log.warn("telemetry listener {} failed on progress event", listener, e);
            }
        }
    }

    public void clearProgress() {
        this.latestProgress.set(null);
        for (TelemetryListener listener : this.listeners) {
            try {
                listener.onProgressCleared();
            } catch (Exception e) {
                log.warn("telemetry listener {} failed on progress clear", listener, e);
            }
        }
    }

    public ProgressEvent getLatestProgress() {
        return this.latestProgress.get();
    }

    public List<LogEvent> getRecentLogs(int limit) {
        List<LogEvent> result = new ArrayList<>(Math.min(Math.max(limit, 0), MAX_RECENT_LOGS));
        for (LogEvent logEvent : this.recentLogs) {
            if (result.size() >= limit) {
                break;
            }
            result.add(logEvent);
        }
        return result;
    }
}

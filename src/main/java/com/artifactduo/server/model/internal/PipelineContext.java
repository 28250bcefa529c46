package com.artifactduo.server.model.internal;

import com.artifactduo.server.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancel and pause flags of one pipeline run, shared by reference with every worker.
 * <p>
 * Both flags are level triggered. Cancellation always wins over pause: a paused worker
 * wakes up every {@code pauseCheckIntervalMillis} and leaves the wait once cancelled.
 */
@Slf4j
public class PipelineContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final AtomicBoolean paused = new AtomicBoolean(false);

    private final long pauseCheckIntervalMillis;

    public PipelineContext(long pauseCheckIntervalMillis) {
        this.pauseCheckIntervalMillis = Math.max(1L, pauseCheckIntervalMillis);
    }

    public void cancel() {
        this.cancelled.set(true);
    }

    public void pause() {
        this.paused.set(true);
    }

    public void resume() {
        this.paused.set(false);
    }

    public boolean isCancelled() {
        return this.cancelled.get();
    }

    public boolean isPaused() {
        return this.paused.get();
    }

    /**
     * Blocks while paused.
     *
     * @return {@code false} if the run got cancelled before or during the wait
     */
    public boolean awaitIfPaused() {
        while (this.paused.get()) {
            if (this.cancelled.get()) {
                return false;
            }
            try {
                Thread.sleep(this.pauseCheckIntervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BusinessException("awaitIfPaused failed. worker thread got interrupted", e);
            }
        }
        return !this.cancelled.get();
    }
}

package com.artifactduo.server.service.history;

import com.artifactduo.server.exception.FileOperationException;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * History kept in memory and mirrored to a JSON file when {@code system.history-file-path} is set.
 * A file that can't be read or written is logged and the store keeps working in memory.
 */
@Service
@Slf4j
public class JsonFileHistoryStore implements HistoryStore {

    private final Path historyFile;

    // newest first
    private final LinkedList<HistoryEntry> entries = new LinkedList<>();

    private final AtomicBoolean saving = new AtomicBoolean(false);

    private final AtomicBoolean dirty = new AtomicBoolean(false);

    @Autowired
    public JsonFileHistoryStore(PipelineSettings pipelineSettings) {
        String historyFilePath = ObjectUtils.isEmpty(pipelineSettings.getSystem()) ?
                null :
                pipelineSettings.getSystem().getHistoryFilePath();
        this.historyFile = StringUtils.isBlank(historyFilePath) ? null : Paths.get(historyFilePath);
        this.load();
    }

    @Override
    public void append(HistoryEntry historyEntry) {
        synchronized (this.entries) {
            this.entries.addFirst(historyEntry);
            while (this.entries.size() > MAX_ENTRIES) {
                this.entries.removeLast();
            }
        }
        this.save();
    }

    @Override
    public List<HistoryEntry> getHistory() {
        synchronized (this.entries) {
            return new ArrayList<>(this.entries);
        }
    }

    @Override
    public void clear() {
        synchronized (this.entries) {
            this.entries.clear();
        }
        this.save();
    }

    private void load() {
        if (ObjectUtils.isEmpty(this.historyFile) || !Files.isRegularFile(this.historyFile)) {
            return;
        }
        try {
            String content = Files.readString(this.historyFile, StandardCharsets.UTF_8);
            List<HistoryEntry> loaded = JsonUtil.deserToList(content, HistoryEntry.class);
            this.entries.addAll(loaded.subList(0, Math.min(loaded.size(), MAX_ENTRIES)));
            log.info("loaded {} history entries from {}", this.entries.size(), this.historyFile);
        } catch (Exception e) {
            // 历史文件损坏, 从空历史开始
            log.warn("load history failed. start with empty history. historyFile is {}", this.historyFile, e);
        }
    }

    /**
     * Writes the latest entries outside of the entries lock. A caller that finds another write in
     * progress only marks the file dirty; the writing thread loops until it has written the newest
     * snapshot.
     */
    private void save() {
        if (ObjectUtils.isEmpty(this.historyFile)) {
            return;
        }
        this.dirty.set(true);
        while (this.dirty.get() && this.saving.compareAndSet(false, true)) {
            try {
                this.dirty.set(false);
                this.writeFile(this.getHistory());
            } finally {
                this.saving.set(false);
            }
        }
    }

    private void writeFile(List<HistoryEntry> snapshot) {
        try {
            if (snapshot.isEmpty()) {
                Files.deleteIfExists(this.historyFile);
                return;
            }
            Path parent = this.historyFile.toAbsolutePath().getParent();
            if (ObjectUtils.isNotEmpty(parent)) {
                Files.createDirectories(parent);
            }
            Files.writeString(this.historyFile, JsonUtil.serializeToString(snapshot), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("save history failed. historyFile is {}", this.historyFile,
                    new FileOperationException("save history failed.", e));
        }
    }
}

package com.artifactduo.server.service.transfer;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.enums.TransferStatusEnum;
import com.artifactduo.server.exception.FileOperationException;
import com.artifactduo.server.exception.ResourceNotFoundException;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.model.internal.FilterRules;
import com.artifactduo.server.model.internal.PipelineContext;
import com.artifactduo.server.model.internal.TransferResult;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.history.HistoryStore;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import com.artifactduo.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies one artifact folder from the build share into the local destination.
 * <p>
 * An existing destination folder is never touched. Files are copied in 64 KiB chunks; the
 * copy stops at the next chunk when the run is cancelled and waits in place while it is
 * paused. Partially written files stay on disk after a cancellation.
 */
@Service
@Slf4j
public class TransferEngine {

    private final TelemetryBus telemetryBus;

    private final HistoryStore historyStore;

    private final PipelineConfigService pipelineConfigService;

    @Autowired
    public TransferEngine(
            TelemetryBus telemetryBus,
            HistoryStore historyStore,
            PipelineConfigService pipelineConfigService) {
        this.telemetryBus = telemetryBus;
        this.historyStore = historyStore;
        this.pipelineConfigService = pipelineConfigService;
    }

    public TransferResult copy(
            Path sourceDir,
            Path destParentDir,
            FilterRules filterRules,
            PipelineContext context)
            throws ValidationException, ResourceNotFoundException, FileOperationException {
        if (ObjectUtils.anyNull(sourceDir, destParentDir, context) || sourceDir.getFileName() == null) {
            throw new ValidationException("copy failed. sourceDir, destParentDir or context is null");
        }
        String artifactName = sourceDir.getFileName().toString();
        Path destination = destParentDir.resolve(artifactName);
        // 本地已存在则跳过, 不做任何修改
        if (Files.exists(destination)) {
            this.telemetryBus.info("Skipped (exists): %s -> %s".formatted(artifactName, destination));
            return TransferResult.of(TransferStatusEnum.SKIPPED, artifactName, destination);
        }
        FilesystemUtil.isFolderPathValid(sourceDir);
        // 过滤并统计总大小
        FilterRules rules = ObjectUtils.defaultIfNull(filterRules, FilterRules.matchAll());
        List<Path> files = new ArrayList<>();
        for (Path file : FilesystemUtil.getAllFileRecursively(sourceDir)) {
            if (rules.isIncluded(file.getFileName().toString())) {
                files.add(file);
            }
        }
        if (files.isEmpty()) {
            this.telemetryBus.warn("Nothing to copy in %s with %s".formatted(sourceDir, rules));
            return TransferResult.of(TransferStatusEnum.NOTHING_TO_COPY, artifactName, destination);
        }
        long totalBytes = 0;
        for (Path file : files) {
            totalBytes += FilesystemUtil.getFileSizeInBytes(file);
        }
        TransferResult result = TransferResult.of(TransferStatusEnum.COMPLETED, artifactName, destination)
                .setTotalBytes(totalBytes);
        this.historyStore.append(this.copyHistoryEntry(
                HistoryActionEnum.COPY_STARTED,
                "copy started. %s files, %s".formatted(files.size(), FileUtils.byteCountToDisplaySize(totalBytes)),
                sourceDir,
                result));
        this.telemetryBus.info("Copying %s (%s files, %s) -> %s".formatted(
                artifactName, files.size(), FileUtils.byteCountToDisplaySize(totalBytes), destination));
        // 逐个文件复制
        ProgressTracker progressTracker = new ProgressTracker(
                this.telemetryBus, totalBytes, this.pipelineConfigService.getProgressIntervalMillis(), null);
        boolean cancelled = false;
        try {
            Files.createDirectories(destination);
            for (Path file : files) {
                if (context.isCancelled()) {
                    cancelled = true;
                    break;
                }
                String relativePath = FilesystemUtil.splitPath(sourceDir, file);
                Path target = destination.resolve(relativePath);
                Files.createDirectories(target.getParent());
                progressTracker.setCurrentFile(relativePath, file.toString(), null);
                boolean fileCompleted;
                try (InputStream in = Files.newInputStream(file);
                     OutputStream out = Files.newOutputStream(target,
                             StandardOpenOption.CREATE,
                             StandardOpenOption.TRUNCATE_EXISTING,
                             StandardOpenOption.WRITE)) {
                    fileCompleted = ChunkedCopier.copy(in, out, context, progressTracker, true);
                }
                if (!fileCompleted) {
                    cancelled = true;
                    break;
                }
                result.getCopiedFiles().add(relativePath);
                progressTracker.emitNow();
            }
        } catch (IOException | RuntimeException e) {
            result.setBytesCopied(progressTracker.getCopiedBytes());
            this.historyStore.append(this.copyHistoryEntry(
                    HistoryActionEnum.COPY_FAILED,
                    "copy failed after %s files. %s".formatted(result.getFilesCopied(), e.getMessage()),
                    sourceDir,
                    result));
            throw new FileOperationException("copy failed. sourceDir is %s, destination is %s"
                    .formatted(sourceDir, destination), e);
        }
        result.setBytesCopied(progressTracker.getCopiedBytes());
        if (cancelled) {
            result.setStatus(TransferStatusEnum.CANCELLED);
            this.historyStore.append(this.copyHistoryEntry(
                    HistoryActionEnum.COPY_CANCELLED,
                    "copy cancelled. %s of %s files copied".formatted(result.getFilesCopied(), files.size()),
                    sourceDir,
                    result));
            this.telemetryBus.warn("Copy cancelled: %s (%s of %s files)".formatted(
                    artifactName, result.getFilesCopied(), files.size()));
            return result;
        }
        this.historyStore.append(this.copyHistoryEntry(
                HistoryActionEnum.COPY_COMPLETED,
                "copy completed. %s files, %s".formatted(
                        result.getFilesCopied(), FileUtils.byteCountToDisplaySize(result.getBytesCopied())),
                sourceDir,
                result));
        this.telemetryBus.success("Successfully copied: %s".formatted(artifactName));
        return result;
    }

    private HistoryEntry copyHistoryEntry(
            HistoryActionEnum action,
            String description,
            Path sourceDir,
            TransferResult result) {
        return HistoryEntry.of(action, description)
                .setFolderName(result.getArtifactName())
                .setSourcePath(sourceDir.toString())
                .setTargetPath(result.getDestination().toString())
                .setCopiedFilesCount(result.getFilesCopied())
                .setTotalSize(action == HistoryActionEnum.COPY_STARTED ?
                        result.getTotalBytes() :
                        result.getBytesCopied())
                .setFiles(new ArrayList<>(result.getCopiedFiles()));
    }
}

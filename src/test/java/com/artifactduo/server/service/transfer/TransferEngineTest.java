package com.artifactduo.server.service.transfer;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.enums.TransferStatusEnum;
import com.artifactduo.server.exception.ResourceNotFoundException;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.model.internal.FilterRules;
import com.artifactduo.server.model.internal.PipelineContext;
import com.artifactduo.server.model.internal.TransferResult;
import com.artifactduo.server.model.telemetry.ProgressEvent;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.history.InMemoryHistoryStore;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import com.artifactduo.server.service.telemetry.TelemetryListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.artifactduo.server.FileOperationTestUtil.createArtifactFolder;
import static com.artifactduo.server.FileOperationTestUtil.createFile;
import static org.junit.jupiter.api.Assertions.*;

class TransferEngineTest {

    private static final int FILE_SIZE = 2 * ChunkedCopier.CHUNK_SIZE;

    @TempDir
    Path tempDir;

    private Path remoteFolder;

    private Path destinationFolder;

    private TelemetryBus telemetryBus;

    private InMemoryHistoryStore historyStore;

    private PipelineConfigService pipelineConfigService;

    private TransferEngine transferEngine;

    @BeforeEach
    void setUp() throws IOException {
        this.remoteFolder = Files.createDirectories(this.tempDir.resolve("remote"));
        this.destinationFolder = Files.createDirectories(this.tempDir.resolve("destination"));
        PipelineSettings pipelineSettings = new PipelineSettings();
        pipelineSettings.getSystem().setProgressIntervalMillis(0L);
        this.telemetryBus = new TelemetryBus();
        this.historyStore = new InMemoryHistoryStore();
        this.pipelineConfigService = new PipelineConfigService(pipelineSettings, this.historyStore);
        this.transferEngine = new TransferEngine(this.telemetryBus, this.historyStore, this.pipelineConfigService);
    }

    @Test
    void shouldCopyWholeTree() throws IOException {
        Path source = createArtifactFolder(
                this.remoteFolder.resolve("2026_02_11_03_34(1.0)"), "app.jar", "conf/app.yml", "conf/deep/x.txt");

        TransferResult result = this.transferEngine.copy(
                source, this.destinationFolder, FilterRules.matchAll(), new PipelineContext(10));

        assertEquals(TransferStatusEnum.COMPLETED, result.getStatus());
        assertEquals(List.of("app.jar", "conf/app.yml", "conf/deep/x.txt"), result.getCopiedFiles());
        Path destination = this.destinationFolder.resolve("2026_02_11_03_34(1.0)");
        assertEquals(destination, result.getDestination());
        assertEquals("content of conf/deep/x.txt", Files.readString(destination.resolve("conf/deep/x.txt")));
        assertEquals(result.getTotalBytes(), result.getBytesCopied());
        assertEquals(1, this.historyStore.getByAction(HistoryActionEnum.COPY_STARTED).size());
        HistoryEntry completed = this.historyStore.getByAction(HistoryActionEnum.COPY_COMPLETED).get(0);
        assertEquals(3, completed.getCopiedFilesCount());
        assertEquals("2026_02_11_03_34(1.0)", completed.getFolderName());
        assertEquals(100.0, this.telemetryBus.getLatestProgress().getPercentage());
    }

    @Test
    void shouldSkipExistingDestinationEveryTime() throws IOException {
        Path source = createArtifactFolder(this.remoteFolder.resolve("artifact"), "a.txt");
        Path existing = Files.createDirectories(this.destinationFolder.resolve("artifact"));
        Files.writeString(existing.resolve("marker.txt"), "keep");

        for (int i = 0; i < 2; i++) {
            TransferResult result = this.transferEngine.copy(
                    source, this.destinationFolder, FilterRules.matchAll(), new PipelineContext(10));
            assertEquals(TransferStatusEnum.SKIPPED, result.getStatus());
        }

        assertFalse(Files.exists(existing.resolve("a.txt")));
        assertEquals("keep", Files.readString(existing.resolve("marker.txt")));
        assertTrue(this.historyStore.getHistory().isEmpty());
    }

    @Test
    void shouldCopyOnlyFilteredFiles() throws IOException {
        Path source = createArtifactFolder(
                this.remoteFolder.resolve("artifact"), "app-1.0.tar.gz", "build.log", "sub/app-1.0-debug.tar.gz");

        TransferResult result = this.transferEngine.copy(
                source,
                this.destinationFolder,
                new FilterRules(List.of(".tar.gz"), List.of("debug")),
                new PipelineContext(10));

        assertEquals(List.of("sub/app-1.0-debug.tar.gz"), result.getCopiedFiles());
        assertFalse(Files.exists(this.destinationFolder.resolve("artifact/build.log")));
    }

    @Test
    void shouldReportNothingToCopyWithoutCreatingDestination() throws IOException {
        Path source = createArtifactFolder(this.remoteFolder.resolve("artifact"), "build.log");

        TransferResult result = this.transferEngine.copy(
                source, this.destinationFolder, new FilterRules(List.of("jar"), List.of()), new PipelineContext(10));

        assertEquals(TransferStatusEnum.NOTHING_TO_COPY, result.getStatus());
        assertFalse(Files.exists(this.destinationFolder.resolve("artifact")));
        assertTrue(this.historyStore.getHistory().isEmpty());
    }

    @Test
    void shouldFailOnMissingSource() {
        assertThrows(ResourceNotFoundException.class, () -> this.transferEngine.copy(
                this.remoteFolder.resolve("missing"),
                this.destinationFolder,
                FilterRules.matchAll(),
                new PipelineContext(10)));
    }

    @Test
    void shouldKeepFullyWrittenFilesOnCancel() throws IOException {
        Path source = this.remoteFolder.resolve("artifact");
        for (String name : List.of("a.bin", "b.bin", "c.bin", "d.bin")) {
            createFile(source.resolve(name), FILE_SIZE);
        }
        PipelineContext context = new PipelineContext(10);
        // 第二个文件写完时取消
        this.telemetryBus.addListener(new TelemetryListener() {
            @Override
            public void onProgress(ProgressEvent progressEvent) {
                if (progressEvent.getCopiedBytes() >= 2L * FILE_SIZE) {
                    context.cancel();
                }
            }
        });

        TransferResult result = this.transferEngine.copy(source, this.destinationFolder, FilterRules.matchAll(), context);

        assertEquals(TransferStatusEnum.CANCELLED, result.getStatus());
        assertEquals(List.of("a.bin", "b.bin"), result.getCopiedFiles());
        Path destination = this.destinationFolder.resolve("artifact");
        assertEquals(FILE_SIZE, Files.size(destination.resolve("b.bin")));
        assertFalse(Files.exists(destination.resolve("c.bin")));
        assertFalse(Files.exists(destination.resolve("d.bin")));
        HistoryEntry cancelled = this.historyStore.getByAction(HistoryActionEnum.COPY_CANCELLED).get(0);
        assertEquals(2, cancelled.getCopiedFilesCount());
        assertEquals(List.of("a.bin", "b.bin"), cancelled.getFiles());
        assertTrue(this.historyStore.getByAction(HistoryActionEnum.COPY_COMPLETED).isEmpty());
    }

    @Test
    void shouldLeavePauseWhenCancelled() throws Exception {
        Path source = this.remoteFolder.resolve("artifact");
        createFile(source.resolve("a.bin"), FILE_SIZE);
        PipelineContext context = new PipelineContext(10);
        context.pause();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            context.cancel();
        });
        canceller.start();

        TransferResult result = assertTimeoutPreemptively(Duration.ofSeconds(10), () ->
                this.transferEngine.copy(source, this.destinationFolder, FilterRules.matchAll(), context));
        canceller.join();

        assertEquals(TransferStatusEnum.CANCELLED, result.getStatus());
        assertEquals(0, result.getFilesCopied());
        assertEquals(0, result.getBytesCopied());
    }

    @Test
    void shouldThrottleProgressWithUpdatedInterval() throws IOException {
        Path source = this.remoteFolder.resolve("artifact");
        createFile(source.resolve("a.bin"), 4 * ChunkedCopier.CHUNK_SIZE);
        PipelineSettings newSettings = new PipelineSettings();
        newSettings.setDestinationPath(this.destinationFolder.toString());
        newSettings.getSystem().setProgressIntervalMillis(3_600_000L);
        this.pipelineConfigService.updateSettings(newSettings);
        List<ProgressEvent> progressEvents = new ArrayList<>();
        this.telemetryBus.addListener(new TelemetryListener() {
            @Override
            public void onProgress(ProgressEvent progressEvent) {
                progressEvents.add(progressEvent);
            }
        });

        this.transferEngine.copy(source, this.destinationFolder, FilterRules.matchAll(), new PipelineContext(10));

        // 第一个 chunk 立即发布, 之后只剩文件完成时的一次
        assertEquals(2, progressEvents.size());
        assertEquals(4L * ChunkedCopier.CHUNK_SIZE, progressEvents.get(1).getCopiedBytes());
    }
}

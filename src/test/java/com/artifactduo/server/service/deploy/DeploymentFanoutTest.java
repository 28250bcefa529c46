package com.artifactduo.server.service.deploy;

import com.artifactduo.server.enums.DeployStatusEnum;
import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.exception.DeploymentException;
import com.artifactduo.server.exception.ResourceNotFoundException;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.model.internal.DeployResult;
import com.artifactduo.server.model.internal.DeploymentTarget;
import com.artifactduo.server.model.internal.PipelineContext;
import com.artifactduo.server.model.internal.TargetDeployResult;
import com.artifactduo.server.model.telemetry.ProgressEvent;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.history.InMemoryHistoryStore;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import com.artifactduo.server.service.telemetry.TelemetryListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.artifactduo.server.FileOperationTestUtil.createArtifactFolder;
import static com.artifactduo.server.FileOperationTestUtil.createTextFile;
import static org.junit.jupiter.api.Assertions.*;

class DeploymentFanoutTest {

    private static final String ARTIFACT_NAME = "2026_02_11_03_34(2.1.0)";

    @TempDir
    Path tempDir;

    private Path artifactRoot;

    private FakeRemoteSessionFactory remoteSessionFactory;

    private InMemoryHistoryStore historyStore;

    private TelemetryBus telemetryBus;

    private DeploymentFanout deploymentFanout;

    @BeforeEach
    void setUp() throws IOException {
        this.artifactRoot = createArtifactFolder(
                this.tempDir.resolve(ARTIFACT_NAME), "build.log", "app-2.1.0.tar.gz", "conf/app.yml");
        this.remoteSessionFactory = new FakeRemoteSessionFactory();
        this.historyStore = new InMemoryHistoryStore();
        PipelineSettings pipelineSettings = new PipelineSettings();
        pipelineSettings.getSystem().setProgressIntervalMillis(0L);
        this.telemetryBus = new TelemetryBus();
        this.deploymentFanout = new DeploymentFanout(
                this.remoteSessionFactory,
                new CommandTemplateResolver(),
                this.telemetryBus,
                this.historyStore,
                new PipelineConfigService(pipelineSettings, this.historyStore));
    }

    @Test
    void failingTargetDoesNotStopOthers() {
        this.remoteSessionFactory.failAuthenticationFor("host-2");
        List<DeploymentTarget> targets = List.of(target("host-1"), target("host-2"), target("host-3"));

        DeployResult deployResult = this.deploymentFanout.deploy(
                this.artifactRoot, ARTIFACT_NAME, targets, List.of("echo ${filename}"), new PipelineContext(10));

        assertEquals(List.of(DeployStatusEnum.SUCCESS, DeployStatusEnum.FAILED, DeployStatusEnum.SUCCESS),
                deployResult.getTargetResults().stream().map(TargetDeployResult::getStatus).toList());
        assertEquals(List.of("host-1", "host-2", "host-3"), this.remoteSessionFactory.getConnectAttempts());
        assertEquals(1, deployResult.getFailedCount());
        assertTrue(deployResult.getTargetResults().get(1).getMessage().contains("authentication failed"));
        for (String host : List.of("host-1", "host-3")) {
            FakeRemoteSessionFactory.FakeRemoteSession session = this.remoteSessionFactory.getSession(host);
            String remoteRoot = "/opt/app/" + ARTIFACT_NAME;
            assertTrue(session.getFolders().contains(remoteRoot));
            assertTrue(session.getFolders().contains(remoteRoot + "/conf"));
            assertEquals("content of conf/app.yml",
                    session.getFiles().get(remoteRoot + "/conf/app.yml").toString(StandardCharsets.UTF_8));
            assertEquals(List.of("echo app-2.1.0"), session.getCommands());
            assertEquals(1, session.getCloseCount());
        }
        assertEquals(3, deployResult.getTargetResults().get(0).getFilesUploaded());
        assertEquals(2, this.historyStore.getByAction(HistoryActionEnum.DEPLOY_SUCCESS).size());
        assertEquals(1, this.historyStore.getByAction(HistoryActionEnum.DEPLOY_FAILED).size());
    }

    @Test
    void failingCommandIsBestEffort() {
        DeployResult deployResult = this.deploymentFanout.deploy(
                this.artifactRoot,
                ARTIFACT_NAME,
                List.of(target("host-1")),
                List.of("fail now", "echo done"),
                new PipelineContext(10));

        TargetDeployResult targetResult = deployResult.getTargetResults().get(0);
        assertTrue(targetResult.isSuccess());
        assertEquals(2, targetResult.getCommandResults().size());
        assertEquals(1, targetResult.getCommandResults().get(0).getExitCode());
        assertEquals(List.of("fail now", "echo done"), this.remoteSessionFactory.getSession("host-1").getCommands());
    }

    @Test
    void cancelledRunStartsNoTarget() {
        PipelineContext context = new PipelineContext(10);
        context.cancel();

        DeployResult deployResult = this.deploymentFanout.deploy(
                this.artifactRoot, ARTIFACT_NAME, List.of(target("host-1"), target("host-2")), List.of(), context);

        assertTrue(deployResult.isCancelled());
        assertEquals(2, deployResult.getTargetResults().size());
        assertTrue(this.remoteSessionFactory.getConnectAttempts().isEmpty());
    }

    @Test
    void uploadProgressCarriesTargetAndPaths() {
        List<ProgressEvent> progressEvents = new ArrayList<>();
        this.telemetryBus.addListener(new TelemetryListener() {
            @Override
            public void onProgress(ProgressEvent progressEvent) {
                progressEvents.add(progressEvent);
            }
        });

        this.deploymentFanout.deploy(
                this.artifactRoot, ARTIFACT_NAME, List.of(target("host-1")), List.of(), new PipelineContext(10));

        assertFalse(progressEvents.isEmpty());
        assertTrue(progressEvents.stream().allMatch(event -> "host-1".equals(event.getTargetName())));
        ProgressEvent confEvent = progressEvents.stream()
                .filter(event -> "conf/app.yml".equals(event.getLabel()))
                .findFirst()
                .orElseThrow();
        assertEquals("/opt/app/" + ARTIFACT_NAME + "/conf/app.yml", confEvent.getRemotePath());
        assertEquals(this.artifactRoot.resolve("conf/app.yml").toString(), confEvent.getLocalPath());
        assertEquals(100.0, progressEvents.get(progressEvents.size() - 1).getPercentage());
    }

    @Test
    void pausedUploadWaitsForResume() throws Exception {
        PipelineContext context = new PipelineContext(10);
        context.pause();

        CompletableFuture<DeployResult> future = CompletableFuture.supplyAsync(() -> this.deploymentFanout.deploy(
                this.artifactRoot, ARTIFACT_NAME, List.of(target("host-1")), List.of("echo ${filename}"), context));
        Thread.sleep(300);
        assertFalse(future.isDone());
        assertNull(this.telemetryBus.getLatestProgress());

        context.resume();
        DeployResult deployResult = future.get(10, TimeUnit.SECONDS);

        TargetDeployResult targetResult = deployResult.getTargetResults().get(0);
        assertTrue(targetResult.isSuccess());
        assertEquals(3, targetResult.getFilesUploaded());
        assertEquals(List.of("echo app-2.1.0"), this.remoteSessionFactory.getSession("host-1").getCommands());
    }

    @Test
    void cancelWhilePausedFinishesConnectedTarget() throws Exception {
        PipelineContext context = new PipelineContext(10);
        context.pause();

        CompletableFuture<DeployResult> future = CompletableFuture.supplyAsync(() -> this.deploymentFanout.deploy(
                this.artifactRoot, ARTIFACT_NAME, List.of(target("host-1"), target("host-2")), List.of(), context));
        long deadline = System.currentTimeMillis() + 10_000;
        while (!this.remoteSessionFactory.getConnectAttempts().contains("host-1")) {
            assertTrue(System.currentTimeMillis() < deadline, "host-1 never connected");
            Thread.sleep(10);
        }
        context.cancel();
        DeployResult deployResult = future.get(10, TimeUnit.SECONDS);

        // 已连接的目标上传完成, 未开始的目标被取消
        assertEquals(List.of(DeployStatusEnum.SUCCESS, DeployStatusEnum.CANCELLED),
                deployResult.getTargetResults().stream().map(TargetDeployResult::getStatus).toList());
        assertEquals(3, deployResult.getTargetResults().get(0).getFilesUploaded());
        assertEquals("content of conf/app.yml", this.remoteSessionFactory.getSession("host-1").getFiles()
                .get("/opt/app/" + ARTIFACT_NAME + "/conf/app.yml").toString(StandardCharsets.UTF_8));
        assertEquals(List.of("host-1"), this.remoteSessionFactory.getConnectAttempts());
    }

    @Test
    void disabledTargetIsSkipped() {
        DeploymentTarget disabled = new DeploymentTarget(
                "off", false, "off", "host-off", 22, "deploy", "secret", "/opt/app");

        DeployResult deployResult = this.deploymentFanout.deploy(
                this.artifactRoot, ARTIFACT_NAME, List.of(disabled, target("host-1")), List.of(), new PipelineContext(10));

        assertEquals(1, deployResult.getTargetResults().size());
        assertEquals(List.of("host-1"), this.remoteSessionFactory.getConnectAttempts());
    }

    @Test
    void manualDeployAppendsLocalNameToFolderPath() throws IOException {
        Path file = createTextFile(this.tempDir.resolve("pkg-1.0.tar.gz"), "payload");

        TargetDeployResult targetResult = this.deploymentFanout.deployManual(
                target("host-1"), List.of("install ${filename}"), file.toString(), "/srv/drop/", new PipelineContext(10));

        assertTrue(targetResult.isSuccess());
        assertEquals("/srv/drop/pkg-1.0.tar.gz", targetResult.getRemotePath());
        FakeRemoteSessionFactory.FakeRemoteSession session = this.remoteSessionFactory.getSession("host-1");
        assertEquals("payload", session.getFiles().get("/srv/drop/pkg-1.0.tar.gz").toString(StandardCharsets.UTF_8));
        assertTrue(session.getFolders().contains("/srv/drop"));
        assertEquals(List.of("install pkg-1.0"), session.getCommands());
        assertEquals(1, this.historyStore.getByAction(HistoryActionEnum.MANUAL_DEPLOY).size());
    }

    @Test
    void manualDeployRejectsMissingLocalPath() {
        assertThrows(ResourceNotFoundException.class, () -> this.deploymentFanout.deployManual(
                target("host-1"), List.of(), this.tempDir.resolve("missing").toString(), "/srv/", new PipelineContext(10)));
    }

    @Test
    void resolvesManualRemotePath() {
        assertEquals("/opt/app/pkg", DeploymentFanout.resolveManualRemotePath("/opt/app/", "pkg"));
        assertEquals("C:/deploy/pkg", DeploymentFanout.resolveManualRemotePath("C:\\deploy\\", "pkg"));
        assertEquals("/opt/app/custom", DeploymentFanout.resolveManualRemotePath("/opt/app/custom", "pkg"));
        assertEquals("/opt/app/pkg", DeploymentFanout.joinRemotePath("/opt/app//", "pkg"));
    }

    @Test
    void testConnectionPropagatesFailure() {
        this.remoteSessionFactory.failAuthenticationFor("host-2");

        assertEquals("Connected to host-1", this.deploymentFanout.testConnection(target("host-1")));
        assertThrows(DeploymentException.class, () -> this.deploymentFanout.testConnection(target("host-2")));
    }

    private static DeploymentTarget target(String host) {
        return new DeploymentTarget(host, true, host, host, 22, "deploy", "secret", "/opt/app");
    }
}

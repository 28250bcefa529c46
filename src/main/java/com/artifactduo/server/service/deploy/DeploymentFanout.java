package com.artifactduo.server.service.deploy;

import com.artifactduo.server.enums.DeployStatusEnum;
import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.exception.DeploymentException;
import com.artifactduo.server.exception.FileOperationException;
import com.artifactduo.server.exception.ResourceNotFoundException;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.model.internal.CommandResult;
import com.artifactduo.server.model.internal.DeployResult;
import com.artifactduo.server.model.internal.DeploymentTarget;
import com.artifactduo.server.model.internal.PipelineContext;
import com.artifactduo.server.model.internal.TargetDeployResult;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.history.HistoryStore;
import com.artifactduo.server.service.telemetry.TelemetryBus;
import com.artifactduo.server.service.transfer.ChunkedCopier;
import com.artifactduo.server.service.transfer.ProgressTracker;
import com.artifactduo.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pushes a local artifact to every enabled deployment target, one target after another, and runs
 * the post-transfer commands on each.
 * <p>
 * A failing target never stops the others. Cancellation is checked before each target; a target
 * that already connected finishes its upload and commands.
 */
@Service
@Slf4j
public class DeploymentFanout {

    private final RemoteSessionFactory remoteSessionFactory;

    private final CommandTemplateResolver commandTemplateResolver;

    private final TelemetryBus telemetryBus;

    private final HistoryStore historyStore;

    private final PipelineConfigService pipelineConfigService;

    @Autowired
    public DeploymentFanout(
            RemoteSessionFactory remoteSessionFactory,
            CommandTemplateResolver commandTemplateResolver,
            TelemetryBus telemetryBus,
            HistoryStore historyStore,
            PipelineConfigService pipelineConfigService) {
        this.remoteSessionFactory = remoteSessionFactory;
        this.commandTemplateResolver = commandTemplateResolver;
        this.telemetryBus = telemetryBus;
        this.historyStore = historyStore;
        this.pipelineConfigService = pipelineConfigService;
    }

    public DeployResult deploy(
            Path artifactRoot,
            String artifactName,
            List<DeploymentTarget> targets,
            List<String> postCommands,
            PipelineContext context) throws ValidationException {
        if (ObjectUtils.anyNull(artifactRoot, context) || StringUtils.isBlank(artifactName)) {
            throw new ValidationException("deploy failed. artifactRoot, artifactName or context is null");
        }
        DeployResult deployResult = new DeployResult(artifactName);
        for (DeploymentTarget target : CollectionUtils.emptyIfNull(targets)) {
            if (!target.enabled()) {
                continue;
            }
            if (context.isCancelled()) {
                deployResult.getTargetResults().add(TargetDeployResult.of(target, DeployStatusEnum.CANCELLED)
                        .setMessage("cancelled before start"));
                continue;
            }
            String remoteDestination = joinRemotePath(target.remotePath(), artifactName);
            TargetDeployResult targetResult = this.deployToTarget(
                    target, artifactRoot, artifactName, remoteDestination, postCommands, context);
            this.historyStore.append(HistoryEntry.of(
                            targetResult.isSuccess() ? HistoryActionEnum.DEPLOY_SUCCESS : HistoryActionEnum.DEPLOY_FAILED,
                            "[%s] %s".formatted(target.name(), targetResult.getMessage()))
                    .setFolderName(artifactName)
                    .setSourcePath(artifactRoot.toString())
                    .setTargetPath("%s:%s".formatted(target.host(), remoteDestination))
                    .setCopiedFilesCount(targetResult.getFilesUploaded())
                    .setTotalSize(targetResult.getBytesUploaded()));
            deployResult.getTargetResults().add(targetResult);
        }
        return deployResult;
    }

    /**
     * Connects and disconnects right away.
     */
    public String testConnection(DeploymentTarget target) throws DeploymentException {
        try (RemoteSession ignored = this.remoteSessionFactory.connect(target)) {
            this.telemetryBus.success("[%s] Connection OK (%s@%s:%s)"
                    .formatted(target.name(), target.user(), target.host(), target.port()));
            return "Connected to %s".formatted(target.name());
        }
    }

    /**
     * Uploads an arbitrary local file or folder to one target. A remote path ending with a
     * separator gets the local name appended.
     */
    public TargetDeployResult deployManual(
            DeploymentTarget target,
            List<String> postCommands,
            String localPath,
            String remotePath,
            PipelineContext context) throws ValidationException, ResourceNotFoundException {
        if (ObjectUtils.anyNull(target, context) || StringUtils.isAnyBlank(localPath, remotePath)) {
            throw new ValidationException("deployManual failed. target, localPath or remotePath is empty");
        }
        Path localRoot = Paths.get(localPath.trim());
        if (!Files.exists(localRoot) || localRoot.getFileName() == null) {
            throw new ResourceNotFoundException("deployManual failed. localPath %s doesn't exist".formatted(localPath));
        }
        String localName = localRoot.getFileName().toString();
        String remoteDestination = resolveManualRemotePath(remotePath, localName);
        TargetDeployResult targetResult = this.deployToTarget(
                target, localRoot, localName, remoteDestination, postCommands, context);
        this.historyStore.append(HistoryEntry.of(
                        HistoryActionEnum.MANUAL_DEPLOY,
                        "[%s] %s".formatted(target.name(), targetResult.getMessage()))
                .setFolderName(localName)
                .setSourcePath(localRoot.toString())
                .setTargetPath("%s:%s".formatted(target.host(), remoteDestination))
                .setCopiedFilesCount(targetResult.getFilesUploaded())
                .setTotalSize(targetResult.getBytesUploaded()));
        return targetResult;
    }

    static String joinRemotePath(String remoteBase, String name) {
        String base = StringUtils.stripEnd(StringUtils.defaultString(remoteBase).replace('\\', '/'), "/");
        return base + "/" + name;
    }

    static String resolveManualRemotePath(String remotePath, String localName) {
        String normalized = remotePath.trim().replace('\\', '/');
        if (normalized.endsWith("/")) {
            return joinRemotePath(normalized, localName);
        }
        return normalized;
    }

    private TargetDeployResult deployToTarget(
            DeploymentTarget target,
            Path localRoot,
            String artifactName,
            String remoteDestination,
            List<String> postCommands,
            PipelineContext context) {
        TargetDeployResult targetResult = TargetDeployResult.of(target, DeployStatusEnum.SUCCESS)
                .setRemotePath(remoteDestination);
        long startMillis = System.currentTimeMillis();
        this.telemetryBus.info("[%s] Connecting to %s:%s".formatted(target.name(), target.host(), target.port()));
        try (RemoteSession session = this.remoteSessionFactory.connect(target)) {
            this.telemetryBus.info("[%s] Uploading %s -> %s".formatted(target.name(), localRoot, remoteDestination));
            this.upload(session, target, localRoot, remoteDestination, context, targetResult);
            String filename = this.commandTemplateResolver.resolveFilename(localRoot, artifactName);
            for (String commandTemplate : CollectionUtils.emptyIfNull(postCommands)) {
                if (StringUtils.isBlank(commandTemplate)) {
                    continue;
                }
                targetResult.getCommandResults().add(this.runCommand(
                        session, target, this.commandTemplateResolver.resolve(commandTemplate, filename)));
            }
            targetResult.setMessage("deployed %s files (%s) to %s".formatted(
                    targetResult.getFilesUploaded(),
                    FileUtils.byteCountToDisplaySize(targetResult.getBytesUploaded()),
                    remoteDestination));
            this.telemetryBus.success("[%s] Deploy finished: %s".formatted(target.name(), artifactName));
        } catch (DeploymentException | IOException | FileOperationException e) {
            targetResult.setStatus(DeployStatusEnum.FAILED).setMessage(e.getMessage());
            this.telemetryBus.error("[%s] Deploy failed: %s".formatted(target.name(), e.getMessage()));
            log.debug("deploy to {} failed", target, e);
        } finally {
            targetResult.setElapsedMillis(System.currentTimeMillis() - startMillis);
        }
        return targetResult;
    }

    private void upload(
            RemoteSession session,
            DeploymentTarget target,
            Path localRoot,
            String remoteDestination,
            PipelineContext context,
            TargetDeployResult targetResult) throws IOException {
        List<Path> files;
        if (Files.isRegularFile(localRoot)) {
            files = List.of(localRoot);
        } else {
            files = FilesystemUtil.getAllFileRecursively(localRoot);
            if (session.exists(remoteDestination)) {
                this.telemetryBus.warn("[%s] %s already exists, files will be overwritten"
                        .formatted(target.name(), remoteDestination));
            }
            session.mkdirs(remoteDestination);
        }
        long totalBytes = 0;
        for (Path file : files) {
            totalBytes += FilesystemUtil.getFileSizeInBytes(file);
        }
        ProgressTracker progressTracker = new ProgressTracker(
                this.telemetryBus, totalBytes, this.pipelineConfigService.getProgressIntervalMillis(), target.name());
        Set<String> createdFolders = new HashSet<>();
        createdFolders.add(remoteDestination);
        for (Path file : files) {
            String remoteFile;
            String label;
            if (file.equals(localRoot)) {
                remoteFile = remoteDestination;
                label = file.getFileName().toString();
            } else {
                label = FilesystemUtil.splitPath(localRoot, file);
                remoteFile = remoteDestination + "/" + label;
            }
            String remoteParent = StringUtils.substringBeforeLast(remoteFile, "/");
            if (StringUtils.isNotEmpty(remoteParent) && createdFolders.add(remoteParent)) {
                session.mkdirs(remoteParent);
            }
            progressTracker.setCurrentFile(label, file.toString(), remoteFile);
            // 已连接的目标不响应取消, 只响应暂停
            try (InputStream in = Files.newInputStream(file);
                 OutputStream out = session.openForWrite(remoteFile)) {
                ChunkedCopier.copy(in, out, context, progressTracker, false);
            }
            targetResult.setFilesUploaded(targetResult.getFilesUploaded() + 1);
            progressTracker.emitNow();
        }
        targetResult.setBytesUploaded(progressTracker.getCopiedBytes());
    }

    private CommandResult runCommand(RemoteSession session, DeploymentTarget target, String command) {
        this.telemetryBus.info("[%s] $ %s".formatted(target.name(), command));
        CommandResult commandResult;
        try {
            commandResult = session.exec(command);
        } catch (IOException e) {
            commandResult = CommandResult.of(command, -1, e.getMessage());
        }
        if (StringUtils.isNotBlank(commandResult.getOutput())) {
            this.telemetryBus.info("[%s] > %s".formatted(target.name(), commandResult.getOutput().trim()));
        }
        // 命令失败只记录, 不影响部署结果
        if (!commandResult.isSuccess()) {
            this.telemetryBus.error("[%s] Command failed (exit %s): %s"
                    .formatted(target.name(), commandResult.getExitCode(), command));
        }
        return commandResult;
    }
}

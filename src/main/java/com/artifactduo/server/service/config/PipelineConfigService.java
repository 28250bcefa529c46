package com.artifactduo.server.service.config;

import com.artifactduo.server.enums.HistoryActionEnum;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.model.history.HistoryEntry;
import com.artifactduo.server.model.internal.ArtifactTask;
import com.artifactduo.server.model.internal.DeploymentTarget;
import com.artifactduo.server.model.internal.FilterRules;
import com.artifactduo.server.model.internal.PipelineSnapshot;
import com.artifactduo.server.model.internal.TaskRule;
import com.artifactduo.server.service.history.HistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the configuration snapshot consumed by scan cycles. A cycle reads the snapshot once;
 * an update swaps the whole snapshot and never touches a running cycle.
 */
@Service
@Slf4j
public class PipelineConfigService {

    private static final long DEFAULT_PROGRESS_INTERVAL_MILLIS = 300L;

    private static final long DEFAULT_PAUSE_CHECK_INTERVAL_MILLIS = 100L;

    private static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10000;

    private static final LocalDateTime DATE_FORMAT_SAMPLE = LocalDateTime.of(2026, 2, 11, 10, 0);

    private final PipelineSettings pipelineSettings;

    private final HistoryStore historyStore;

    private final AtomicReference<PipelineSettings> currentSettings = new AtomicReference<>();

    private final AtomicReference<PipelineSnapshot> currentSnapshot = new AtomicReference<>();

    @Autowired
    public PipelineConfigService(PipelineSettings pipelineSettings, HistoryStore historyStore) {
        this.pipelineSettings = pipelineSettings;
        this.historyStore = historyStore;
    }

    /**
     * Builds the first snapshot from application properties. Invalid configuration is fatal.
     */
    public void init() {
        PipelineSnapshot snapshot = buildSnapshot(this.pipelineSettings);
        this.currentSettings.set(this.pipelineSettings);
        this.currentSnapshot.set(snapshot);
        log.info("pipeline config loaded. {} tasks, {} deployment targets",
                snapshot.tasks().size(), snapshot.targets().size());
    }

    public PipelineSnapshot getSnapshot() {
        PipelineSnapshot snapshot = this.currentSnapshot.get();
        if (ObjectUtils.isEmpty(snapshot)) {
            throw new ValidationException("getSnapshot failed. pipeline config is not loaded");
        }
        return snapshot;
    }

    // init 之前返回启动时的配置
    public PipelineSettings getSettings() {
        return ObjectUtils.defaultIfNull(this.currentSettings.get(), this.pipelineSettings);
    }

    public long getProgressIntervalMillis() {
        PipelineSettings.System system = this.getSettings().getSystem();
        if (ObjectUtils.isEmpty(system) || ObjectUtils.isEmpty(system.getProgressIntervalMillis())) {
            return DEFAULT_PROGRESS_INTERVAL_MILLIS;
        }
        return system.getProgressIntervalMillis();
    }

    public long getPauseCheckIntervalMillis() {
        PipelineSettings.System system = this.getSettings().getSystem();
        if (ObjectUtils.isEmpty(system) || ObjectUtils.isEmpty(system.getPauseCheckIntervalMillis())) {
            return DEFAULT_PAUSE_CHECK_INTERVAL_MILLIS;
        }
        return system.getPauseCheckIntervalMillis();
    }

    public int getConnectTimeoutMillis() {
        PipelineSettings.System system = this.getSettings().getSystem();
        return ObjectUtils.isEmpty(system) ? DEFAULT_CONNECT_TIMEOUT_MILLIS : system.getConnectTimeoutMillis();
    }

    public PipelineSnapshot updateSettings(PipelineSettings newSettings) throws ValidationException {
        if (ObjectUtils.isNotEmpty(newSettings)) {
            this.keepStoredPasswords(newSettings);
        }
        PipelineSnapshot snapshot = buildSnapshot(newSettings);
        this.currentSettings.set(newSettings);
        this.currentSnapshot.set(snapshot);
        this.historyStore.append(HistoryEntry.of(HistoryActionEnum.CONFIG,
                "config updated. %s tasks, %s deployment targets".formatted(
                        snapshot.tasks().size(), snapshot.targets().size())));
        return snapshot;
    }

    /**
     * get-config never returns passwords, so a server posted back without one keeps the password
     * stored for the server with the same id.
     */
    private void keepStoredPasswords(PipelineSettings newSettings) {
        PipelineSettings storedSettings = this.getSettings();
        if (ObjectUtils.isEmpty(storedSettings)) {
            return;
        }
        for (PipelineSettings.ServerSetting server : CollectionUtils.emptyIfNull(newSettings.getServers())) {
            if (ObjectUtils.isEmpty(server) || ObjectUtils.isNotEmpty(server.getPassword())) {
                continue;
            }
            String serverId = serverId(server);
            for (PipelineSettings.ServerSetting stored : CollectionUtils.emptyIfNull(storedSettings.getServers())) {
                if (ObjectUtils.isNotEmpty(stored) && StringUtils.equals(serverId, serverId(stored))) {
                    server.setPassword(stored.getPassword());
                    break;
                }
            }
        }
    }

    private static String serverId(PipelineSettings.ServerSetting server) {
        return StringUtils.firstNonBlank(server.getId(), server.getName(), server.getHost());
    }

    public static PipelineSnapshot buildSnapshot(PipelineSettings settings) throws ValidationException {
        if (ObjectUtils.isEmpty(settings)) {
            throw new ValidationException("buildSnapshot failed. settings is null");
        }
        if (StringUtils.isBlank(settings.getDestinationPath())) {
            throw new ValidationException("buildSnapshot failed. destinationPath is empty");
        }
        Path destinationPath = toPath(settings.getDestinationPath(), "destinationPath");
        List<ArtifactTask> tasks = new ArrayList<>();
        for (PipelineSettings.TaskSetting taskSetting : CollectionUtils.emptyIfNull(settings.getTasks())) {
            tasks.add(buildTask(taskSetting));
        }
        List<DeploymentTarget> targets = new ArrayList<>();
        for (PipelineSettings.ServerSetting serverSetting : CollectionUtils.emptyIfNull(settings.getServers())) {
            targets.add(buildTarget(serverSetting));
        }
        long intervalMinutes = ObjectUtils.isEmpty(settings.getSystem()) ||
                ObjectUtils.isEmpty(settings.getSystem().getIntervalMinutes()) ?
                10L :
                settings.getSystem().getIntervalMinutes();
        if (intervalMinutes <= 0) {
            throw new ValidationException("buildSnapshot failed. intervalMinutes must be positive");
        }
        return new PipelineSnapshot(
                destinationPath,
                List.copyOf(tasks),
                List.copyOf(CollectionUtils.emptyIfNull(settings.getTimeRanges())),
                new FilterRules(settings.getFileExtensions(), settings.getFilenameIncludes()),
                settings.isDeployEnabled(),
                List.copyOf(targets),
                List.copyOf(CollectionUtils.emptyIfNull(settings.getPostCommands())),
                intervalMinutes
        );
    }

    public static DeploymentTarget buildTarget(PipelineSettings.ServerSetting serverSetting)
            throws ValidationException {
        if (ObjectUtils.isEmpty(serverSetting)) {
            throw new ValidationException("buildTarget failed. server is null");
        }
        if (StringUtils.isAnyBlank(serverSetting.getHost(), serverSetting.getUser())) {
            throw new ValidationException("buildTarget failed. host or user is empty. server is %s"
                    .formatted(serverSetting.getName()));
        }
        if (serverSetting.getPort() <= 0 || serverSetting.getPort() > 65535) {
            throw new ValidationException("buildTarget failed. port %s is invalid. server is %s"
                    .formatted(serverSetting.getPort(), serverSetting.getName()));
        }
        String name = StringUtils.defaultIfBlank(serverSetting.getName(), serverSetting.getHost());
        return new DeploymentTarget(
                StringUtils.defaultIfBlank(serverSetting.getId(), name),
                serverSetting.isEnabled(),
                name,
                serverSetting.getHost(),
                serverSetting.getPort(),
                serverSetting.getUser(),
                StringUtils.defaultString(serverSetting.getPassword()),
                StringUtils.defaultString(serverSetting.getRemotePath())
        );
    }

    private static ArtifactTask buildTask(PipelineSettings.TaskSetting taskSetting) throws ValidationException {
        if (ObjectUtils.isEmpty(taskSetting) || StringUtils.isBlank(taskSetting.getRemotePath())) {
            throw new ValidationException("buildTask failed. remotePath is empty. task is %s".formatted(taskSetting));
        }
        if (ObjectUtils.isEmpty(taskSetting.getRuleType())) {
            throw new ValidationException("buildTask failed. ruleType is empty. task is %s".formatted(taskSetting));
        }
        TaskRule rule = switch (taskSetting.getRuleType()) {
            case VERSION_MATCH -> {
                if (StringUtils.isBlank(taskSetting.getVersion())) {
                    throw new ValidationException("buildTask failed. version is empty. task is %s"
                            .formatted(taskSetting));
                }
                yield new TaskRule.VersionMatch(taskSetting.getVersion().trim());
            }
            case DATE_MATCH -> {
                String dateFormat = StringUtils.defaultIfBlank(
                        taskSetting.getDateFormat(), TaskRule.DateMatch.DEFAULT_DATE_FORMAT);
                // 用样例时间格式化一次, 需要时区的 pattern 也会在这里被拒绝
                try {
                    DATE_FORMAT_SAMPLE.format(DateTimeFormatter.ofPattern(dateFormat));
                } catch (IllegalArgumentException | DateTimeException e) {
                    throw new ValidationException("buildTask failed. dateFormat %s is invalid. task is %s"
                            .formatted(dateFormat, taskSetting), e);
                }
                yield new TaskRule.DateMatch(dateFormat);
            }
        };
        Path localPath = StringUtils.isBlank(taskSetting.getLocalPath()) ?
                null :
                toPath(taskSetting.getLocalPath(), "localPath");
        String name = StringUtils.defaultIfBlank(taskSetting.getName(), taskSetting.getRemotePath());
        return new ArtifactTask(
                name,
                taskSetting.isEnabled(),
                toPath(taskSetting.getRemotePath(), "remotePath"),
                localPath,
                rule
        );
    }

    private static Path toPath(String pathString, String fieldName) throws ValidationException {
        try {
            return Paths.get(pathString.trim());
        } catch (InvalidPathException e) {
            throw new ValidationException("%s %s is invalid".formatted(fieldName, pathString), e);
        }
    }
}

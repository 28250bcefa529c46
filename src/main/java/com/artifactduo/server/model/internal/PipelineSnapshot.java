package com.artifactduo.server.model.internal;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable configuration consumed by one scan cycle.
 */
public record PipelineSnapshot(
        Path destinationPath,
        List<ArtifactTask> tasks,
        List<String> timeRanges,
        FilterRules filterRules,
        boolean deployEnabled,
        List<DeploymentTarget> targets,
        List<String> postCommands,
        long intervalMinutes) {

    public List<DeploymentTarget> enabledTargets() {
        return this.targets.stream().filter(DeploymentTarget::enabled).toList();
    }
}

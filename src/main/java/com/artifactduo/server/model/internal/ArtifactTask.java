package com.artifactduo.server.model.internal;

import java.nio.file.Path;

// localPath 为 null 时使用全局 destinationPath
public record ArtifactTask(
        String name,
        boolean enabled,
        Path remotePath,
        Path localPath,
        TaskRule rule) {
}

package com.artifactduo.server.model.internal;

import com.artifactduo.server.enums.CycleStatusEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate outcome of one scan cycle. A cancelled cycle is reported through {@link #status},
 * never through {@link #errors}.
 */
@Data
public class CycleResult {

    private CycleStatusEnum status = CycleStatusEnum.COMPLETED;

    private int scannedPaths;

    private List<String> foundFolders = new ArrayList<>();

    private List<String> copiedFolders = new ArrayList<>();

    // 本地已存在而跳过的目录
    private List<String> skippedFolders = new ArrayList<>();

    private List<String> errors = new ArrayList<>();

    private List<DeployResult> deployResults = new ArrayList<>();

    public boolean isCancelled() {
        return this.status == CycleStatusEnum.CANCELLED;
    }
}

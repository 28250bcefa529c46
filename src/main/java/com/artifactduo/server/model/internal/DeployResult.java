package com.artifactduo.server.model.internal;

import com.artifactduo.server.enums.DeployStatusEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DeployResult {

    private String artifactName;

    private List<TargetDeployResult> targetResults = new ArrayList<>();

    public DeployResult(String artifactName) {
        this.artifactName = artifactName;
    }

    public boolean isCancelled() {
        return this.targetResults.stream().anyMatch(result -> result.getStatus() == DeployStatusEnum.CANCELLED);
    }

    public long getFailedCount() {
        return this.targetResults.stream().filter(result -> result.getStatus() == DeployStatusEnum.FAILED).count();
    }
}

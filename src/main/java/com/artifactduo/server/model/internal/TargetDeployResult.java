package com.artifactduo.server.model.internal;

import com.artifactduo.server.enums.DeployStatusEnum;
import lombok.Data;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

@Data
@Accessors(chain = true)
public class TargetDeployResult {

    private String targetId;

    private String targetName;

    private DeployStatusEnum status;

    private String remotePath;

    private String message;

    private long elapsedMillis;

    private long bytesUploaded;

    private int filesUploaded;

    private List<CommandResult> commandResults = new ArrayList<>();

    public static TargetDeployResult of(DeploymentTarget target, DeployStatusEnum status) {
        return new TargetDeployResult()
                .setTargetId(target.id())
                .setTargetName(target.name())
                .setStatus(status);
    }

    public boolean isSuccess() {
        return this.status == DeployStatusEnum.SUCCESS;
    }
}

package com.artifactduo.server.model.internal;

import com.artifactduo.server.enums.TransferStatusEnum;
import lombok.Data;
import lombok.experimental.Accessors;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Accessors(chain = true)
public class TransferResult {

    private TransferStatusEnum status;

    private String artifactName;

    // dest parent + artifact name
    private Path destination;

    private long totalBytes;

    private long bytesCopied;

    // 已完整写入的文件, 相对于 artifact 根目录
    private List<String> copiedFiles = new ArrayList<>();

    private TransferResult() {}

    public static TransferResult of(TransferStatusEnum status, String artifactName, Path destination) {
        return new TransferResult().setStatus(status).setArtifactName(artifactName).setDestination(destination);
    }

    public int getFilesCopied() {
        return this.copiedFiles.size();
    }

    public boolean isCompleted() {
        return this.status == TransferStatusEnum.COMPLETED;
    }
}

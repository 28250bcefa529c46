package com.artifactduo.server.model.api.pipeline;

import com.artifactduo.server.model.config.PipelineSettings;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ManualDeployRequest {

    private PipelineSettings.ServerSetting server;

    private List<String> postCommands = new ArrayList<>();

    private String localPath;

    // 以 "/" 结尾时, 追加 localPath 的目录名
    private String remotePath;
}

package com.artifactduo.server.controller;

import com.artifactduo.server.model.api.global.ArtifactDuoHttpResponse;
import com.artifactduo.server.model.api.pipeline.ManualDeployRequest;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.service.pipeline.PipelineControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/deployment")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class DeploymentController {

    private final PipelineControlService pipelineControlService;

    @Autowired
    public DeploymentController(PipelineControlService pipelineControlService) {
        this.pipelineControlService = pipelineControlService;
    }

    // 只连接和认证, 不上传
    @PostMapping("/test-connection")
    public ArtifactDuoHttpResponse<String> testConnection(@RequestBody PipelineSettings.ServerSetting serverSetting) {
        return ArtifactDuoHttpResponse.success(this.pipelineControlService.testConnection(serverSetting));
    }

    @PostMapping("/manual-deploy")
    public ArtifactDuoHttpResponse<Void> manualDeploy(@RequestBody ManualDeployRequest manualDeployRequest) {
        this.pipelineControlService.manualDeploy(manualDeployRequest);
        return ArtifactDuoHttpResponse.success(null, "manual deploy started");
    }
}

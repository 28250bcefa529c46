package com.artifactduo.server.controller;

import com.artifactduo.server.model.api.global.ArtifactDuoHttpResponse;
import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.model.internal.PipelineSnapshot;
import com.artifactduo.server.service.config.PipelineConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/config")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class ConfigController {

    private final PipelineConfigService pipelineConfigService;

    @Autowired
    public ConfigController(PipelineConfigService pipelineConfigService) {
        this.pipelineConfigService = pipelineConfigService;
    }

    @GetMapping("/get-config")
    public ArtifactDuoHttpResponse<PipelineSettings> getConfig() {
        return ArtifactDuoHttpResponse.success(this.pipelineConfigService.getSettings());
    }

    // 只替换内存中的配置, 正在运行的 cycle 继续使用旧的 snapshot
    @PostMapping("/update-config")
    public ArtifactDuoHttpResponse<Void> updateConfig(@RequestBody PipelineSettings pipelineSettings) {
        PipelineSnapshot snapshot = this.pipelineConfigService.updateSettings(pipelineSettings);
        return ArtifactDuoHttpResponse.success(null, "config updated. %s tasks, %s deployment targets"
                .formatted(snapshot.tasks().size(), snapshot.targets().size()));
    }
}

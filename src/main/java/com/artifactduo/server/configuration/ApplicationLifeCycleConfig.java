package com.artifactduo.server.configuration;

import com.artifactduo.server.model.config.PipelineSettings;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.artifactduo.server.service.pipeline.PipelineScheduler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    private final PipelineConfigService pipelineConfigService;

    private final PipelineScheduler pipelineScheduler;

    private final PipelineSettings pipelineSettings;

    @Autowired
    public ApplicationLifeCycleConfig(
            PipelineConfigService pipelineConfigService,
            PipelineScheduler pipelineScheduler,
            PipelineSettings pipelineSettings) {
        this.pipelineConfigService = pipelineConfigService;
        this.pipelineScheduler = pipelineScheduler;
        this.pipelineSettings = pipelineSettings;
    }

    @PostConstruct
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        // 配置错误直接抛出, 应用启动失败
        this.pipelineConfigService.init();
        if (ObjectUtils.isNotEmpty(this.pipelineSettings.getSystem()) &&
                this.pipelineSettings.getSystem().isSchedulerAutoStart()) {
            this.pipelineScheduler.start();
        }
    }
}

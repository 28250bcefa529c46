package com.artifactduo.server.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProjectConfig {

    // 时间窗口和 "今天/昨天" 都按本地时区计算
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

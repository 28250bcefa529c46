package com.artifactduo.server.model.config;

import com.artifactduo.server.enums.TaskRuleTypeEnum;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("artifactduo.server")
@Component
@Data
@NoArgsConstructor
public class PipelineSettings {

    // 全局本地目标路径, task 没有配置 localPath 时使用
    private String destinationPath;

    private List<TaskSetting> tasks = new ArrayList<>();

    // "HH:mm-HH:mm", 为空表示任何时间都可以扫描
    private List<String> timeRanges = new ArrayList<>();

    private List<String> fileExtensions = new ArrayList<>();

    private List<String> filenameIncludes = new ArrayList<>();

    private boolean deployEnabled;

    private List<ServerSetting> servers = new ArrayList<>();

    private List<String> postCommands = new ArrayList<>();

    private System system = new System();

    @Data
    public static class TaskSetting {

        private String name;

        private boolean enabled = true;

        private String remotePath;

        // 可选, 覆盖 destinationPath
        private String localPath;

        private TaskRuleTypeEnum ruleType = TaskRuleTypeEnum.VERSION_MATCH;

        private String version;

        private String dateFormat;
    }

    @Data
    public static class ServerSetting {

        private String id;

        private boolean enabled = true;

        private String name;

        private String host;

        private int port = 22;

        private String user;

        // 只接收, 不在 get-config 中返回
        @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
        private String password;

        private String remotePath;
    }

    @Data
    public static class System {

        @JsonSerialize(using = ToStringSerializer.class)
        private Long intervalMinutes = 10L;

        private boolean schedulerAutoStart;

        @JsonSerialize(using = ToStringSerializer.class)
        private Long progressIntervalMillis = 300L;

        @JsonSerialize(using = ToStringSerializer.class)
        private Long pauseCheckIntervalMillis = 100L;

        private int connectTimeoutMillis = 10000;

        private String historyFilePath;
    }
}

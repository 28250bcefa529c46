package com.artifactduo.server.model.telemetry;

import com.artifactduo.server.enums.LogLevelEnum;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class LogEvent {

    private String message;

    private LogLevelEnum level;

    private Instant time;
}

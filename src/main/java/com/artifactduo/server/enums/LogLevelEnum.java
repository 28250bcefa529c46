package com.artifactduo.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum LogLevelEnum {

    INFO("info"),

    WARN("warn"),

    ERROR("error"),

    SUCCESS("success"),
    ;

    private final String name;
}

package com.artifactduo.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum DeployStatusEnum {

    SUCCESS("SUCCESS"),

    FAILED("FAILED"),

    CANCELLED("CANCELLED"), // 取消时尚未开始的 target
    ;

    private final String name;
}

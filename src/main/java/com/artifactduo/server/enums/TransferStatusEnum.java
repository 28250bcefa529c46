package com.artifactduo.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum TransferStatusEnum {

    COMPLETED("COMPLETED"),

    SKIPPED("SKIPPED"), // 本地目标目录已存在

    NOTHING_TO_COPY("NOTHING_TO_COPY"), // 过滤后没有文件

    CANCELLED("CANCELLED"),
    ;

    private final String name;
}

package com.artifactduo.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum TaskRuleTypeEnum {

    // 目录名形如 2026_02_11_03_34(1.3.7.P18)
    VERSION_MATCH("VERSION_MATCH"),

    // 目录名等于当天日期, 例如 260211
    DATE_MATCH("DATE_MATCH"),
    ;

    private final String name;
}

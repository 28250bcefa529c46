package com.artifactduo.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum CycleStatusEnum {

    COMPLETED("COMPLETED"),

    CANCELLED("CANCELLED"),

    SKIPPED_OUT_OF_WINDOW("SKIPPED_OUT_OF_WINDOW"),
    ;

    private final String name;
}

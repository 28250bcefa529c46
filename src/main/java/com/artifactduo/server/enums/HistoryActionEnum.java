package com.artifactduo.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum HistoryActionEnum {

    COPY_STARTED("COPY_STARTED"),

    COPY_COMPLETED("COPY_COMPLETED"),

    COPY_CANCELLED("COPY_CANCELLED"),

    COPY_FAILED("COPY_FAILED"),

    DEPLOY_SUCCESS("DEPLOY_SUCCESS"),

    DEPLOY_FAILED("DEPLOY_FAILED"),

    CYCLE_START("CYCLE_START"),

    CYCLE_SKIPPED("CYCLE_SKIPPED"),

    CYCLE_CANCELLED("CYCLE_CANCELLED"),

    PAUSE("PAUSE"),

    RESUME("RESUME"),

    CANCEL("CANCEL"),

    SCHEDULER_START("SCHEDULER_START"),

    SCHEDULER_STOP("SCHEDULER_STOP"),

    MANUAL_DEPLOY("MANUAL_DEPLOY"),

    CONFIG("CONFIG"),
    ;

    private final String name;
}

package com.artifactduo.server.model.internal;

import com.artifactduo.server.enums.TaskRuleTypeEnum;

/**
 * How a task locates its artifact folder in the remote directory.
 * <p>
 * Callers dispatch with a {@code switch} over {@link #getType()} without a {@code default} branch,
 * so adding a rule forces every dispatch site to handle it.
 */
public sealed interface TaskRule permits TaskRule.VersionMatch, TaskRule.DateMatch {

    TaskRuleTypeEnum getType();

    /**
     * Newest {@code YYYY_MM_DD_HH_MM(version)} folder whose version equals {@code version}.
     */
    record VersionMatch(String version) implements TaskRule {

        @Override
        public TaskRuleTypeEnum getType() {
            return TaskRuleTypeEnum.VERSION_MATCH;
        }
    }

    /**
     * Folder named after today's date formatted with {@code dateFormat}.
     */
    record DateMatch(String dateFormat) implements TaskRule {

        public static final String DEFAULT_DATE_FORMAT = "yyMMdd";

        @Override
        public TaskRuleTypeEnum getType() {
            return TaskRuleTypeEnum.DATE_MATCH;
        }
    }
}

package com.artifactduo.server.model.internal;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.time.LocalDateTime;

public record Candidate(
        Path path,
        String name,
        String version,
        LocalDateTime timestamp) {

    // 解析失败的目录名使用这个时间, 比较 "最新" 时永远排在最后
    public static final LocalDateTime SENTINEL_TIMESTAMP = LocalDateTime.MIN;

    public static Candidate unparsed(Path path, String name) {
        return new Candidate(path, name, "", SENTINEL_TIMESTAMP);
    }

    public boolean isParsed() {
        return StringUtils.isNotEmpty(this.version) && !SENTINEL_TIMESTAMP.equals(this.timestamp);
    }
}

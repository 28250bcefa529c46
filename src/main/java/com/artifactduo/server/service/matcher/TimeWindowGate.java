package com.artifactduo.server.service.matcher;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a scan cycle may run at a given time of day.
 * <p>
 * Ranges are {@code HH:mm-HH:mm}, inclusive at both ends. A range whose start is after its end
 * spans midnight. Malformed ranges are ignored; with no usable range every time is admitted.
 */
@Component
@Slf4j
public class TimeWindowGate {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm");

    public boolean isAdmitted(List<String> timeRanges, LocalTime now) {
        List<TimeRange> parsedRanges = this.parseRanges(timeRanges);
        if (parsedRanges.isEmpty()) {
            return true;
        }
        // 精确到分钟
        LocalTime minute = now.withSecond(0).withNano(0);
        for (TimeRange timeRange : parsedRanges) {
            if (timeRange.contains(minute)) {
                return true;
            }
        }
        return false;
    }

    public List<TimeRange> parseRanges(List<String> timeRanges) {
        List<TimeRange> result = new ArrayList<>();
        for (String timeRange : CollectionUtils.emptyIfNull(timeRanges)) {
            TimeRange parsed = parseRange(timeRange);
            if (parsed == null) {
                log.warn("time range '{}' is malformed, ignored", timeRange);
                continue;
            }
            result.add(parsed);
        }
        return result;
    }

    static TimeRange parseRange(String timeRange) {
        if (StringUtils.isBlank(timeRange)) {
            return null;
        }
        String[] parts = timeRange.trim().split("-");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new TimeRange(
                    LocalTime.parse(parts[0].trim(), TIME_FORMATTER),
                    LocalTime.parse(parts[1].trim(), TIME_FORMATTER));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public record TimeRange(LocalTime start, LocalTime end) {

        public boolean contains(LocalTime time) {
            if (!this.start.isAfter(this.end)) {
                return !time.isBefore(this.start) && !time.isAfter(this.end);
            }
            // 跨越午夜, 例如 22:00-02:00
            return !time.isBefore(this.start) || !time.isAfter(this.end);
        }
    }
}

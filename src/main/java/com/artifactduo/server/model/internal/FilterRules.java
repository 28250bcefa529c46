package com.artifactduo.server.model.internal;

import lombok.Getter;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * File name filter applied before a transfer.
 * <p>
 * A file is kept when it matches at least one extension (or no extension is configured)
 * and contains at least one include substring (or no include is configured).
 */
@Getter
public class FilterRules {

    private static final FilterRules MATCH_ALL = new FilterRules(List.of(), List.of());

    // 统一为小写且不带前导 "."
    private final List<String> extensions;

    private final List<String> includes;

    public FilterRules(List<String> extensions, List<String> includes) {
        this.extensions = normalizeExtensions(extensions);
        this.includes = CollectionUtils.emptyIfNull(includes).stream()
                .filter(StringUtils::isNotEmpty)
                .toList();
    }

    public static FilterRules matchAll() {
        return MATCH_ALL;
    }

    public boolean isIncluded(String fileName) {
        if (StringUtils.isEmpty(fileName)) {
            return false;
        }
        return this.isExtensionMatched(fileName) && this.isIncludeMatched(fileName);
    }

    public boolean isExtensionMatched(String fileName) {
        if (this.extensions.isEmpty()) {
            return true;
        }
        String lowerCaseName = fileName.toLowerCase(Locale.ROOT);
        for (String extension : this.extensions) {
            if (lowerCaseName.endsWith("." + extension)) {
                return true;
            }
        }
        return false;
    }

    public boolean isIncludeMatched(String fileName) {
        if (this.includes.isEmpty()) {
            return true;
        }
        for (String include : this.includes) {
            if (fileName.contains(include)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalizeExtensions(List<String> extensions) {
        return CollectionUtils.emptyIfNull(extensions).stream()
                .map(StringUtils::trimToEmpty)
                .map(extension -> StringUtils.removeStart(extension, "."))
                .filter(StringUtils::isNotEmpty)
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public String toString() {
        return "FilterRules(extensions=%s, includes=%s)".formatted(this.extensions, this.includes);
    }
}

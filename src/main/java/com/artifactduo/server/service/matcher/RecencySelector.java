package com.artifactduo.server.service.matcher;

import com.artifactduo.server.model.internal.Candidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the newest candidate of a version and admits it only when it was built today or yesterday.
 */
@Component
@Slf4j
public class RecencySelector {

    public Optional<Candidate> findNewest(List<Candidate> candidates, String targetVersion) {
        if (CollectionUtils.isEmpty(candidates)) {
            return Optional.empty();
        }
        // List.sort 是稳定排序, 时间相同的保持原来的顺序
        List<Candidate> versionMatches = new ArrayList<>(candidates.stream()
                .filter(Candidate::isParsed)
                .filter(candidate -> candidate.version().equals(targetVersion))
                .toList());
        versionMatches.sort(Comparator.comparing(Candidate::timestamp).reversed());
        return versionMatches.stream().findFirst();
    }

    public boolean isRecent(Candidate candidate, LocalDate today) {
        if (!candidate.isParsed()) {
            return false;
        }
        LocalDate folderDate = candidate.timestamp().toLocalDate();
        return folderDate.equals(today) || folderDate.equals(today.minusDays(1));
    }

    /**
     * Newest candidate of {@code targetVersion}, or empty when there is none or the newest one
     * is older than yesterday.
     */
    public Optional<Candidate> select(List<Candidate> candidates, String targetVersion, LocalDate today) {
        Optional<Candidate> newest = this.findNewest(candidates, targetVersion);
        if (newest.isEmpty()) {
            return Optional.empty();
        }
        Candidate candidate = newest.get();
        if (!this.isRecent(candidate, today)) {
            log.info("newest folder {} of version {} is older than yesterday, ignored",
                    candidate.name(), targetVersion);
            return Optional.empty();
        }
        return newest;
    }
}

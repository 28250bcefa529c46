package com.artifactduo.server.service.matcher;

import com.artifactduo.server.exception.FileOperationException;
import com.artifactduo.server.exception.ResourceNotFoundException;
import com.artifactduo.server.exception.ValidationException;
import com.artifactduo.server.model.internal.Candidate;
import com.artifactduo.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns artifact folder names into {@link Candidate}s.
 * <p>
 * Version tagged folders look like {@code 2026_02_11_03_34(1.3.7.P18)}: a fixed width timestamp
 * followed by the version in parentheses. Date tagged folders are named after the day they were
 * built and are looked up directly instead of being listed.
 */
@Component
@Slf4j
public class PatternMatcher {

    private static final Pattern VERSION_FOLDER_PATTERN =
            Pattern.compile("^(\\d{4}_\\d{2}_\\d{2}_\\d{2}_\\d{2})\\((.+)\\)$");

    // uuuu 配合 STRICT, 拒绝 2026_13_40 这样的日期
    private static final DateTimeFormatter FOLDER_TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("uuuu_MM_dd_HH_mm").withResolverStyle(ResolverStyle.STRICT);

    public Candidate parse(Path folder) {
        return this.parse(folder, folder.getFileName().toString());
    }

    public Candidate parse(Path path, String name) {
        if (StringUtils.isEmpty(name)) {
            return Candidate.unparsed(path, name);
        }
        Matcher matcher = VERSION_FOLDER_PATTERN.matcher(name);
        if (!matcher.matches()) {
            return Candidate.unparsed(path, name);
        }
        try {
            LocalDateTime timestamp = LocalDateTime.parse(matcher.group(1), FOLDER_TIMESTAMP_FORMATTER);
            return new Candidate(path, name, matcher.group(2), timestamp);
        } catch (DateTimeParseException e) {
            log.debug("folder {} looks version tagged but has invalid timestamp", name);
            return Candidate.unparsed(path, name);
        }
    }

    /**
     * Parses every sub-folder of {@code remoteFolder}, in name order. Unparseable names are
     * included with an empty version.
     */
    public List<Candidate> scan(Path remoteFolder) throws FileOperationException {
        List<Path> subFolders = FilesystemUtil.getSubFolders(remoteFolder);
        return subFolders.stream().map(this::parse).toList();
    }

    /**
     * Date tagged lookup: {@code remoteFolder/<now formatted with dateFormat>} when it is a folder.
     * Only a missing dated folder is "not found"; an unreachable {@code remoteFolder} is an error.
     */
    public Optional<Candidate> lookupByDate(Path remoteFolder, String dateFormat, LocalDateTime now)
            throws ValidationException, ResourceNotFoundException {
        FilesystemUtil.isFolderPathValid(remoteFolder);
        String folderName;
        try {
            folderName = now.format(DateTimeFormatter.ofPattern(dateFormat));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ValidationException("lookupByDate failed. dateFormat %s can't format %s"
                    .formatted(dateFormat, now), e);
        }
        Path folder = remoteFolder.resolve(folderName);
        if (!Files.isDirectory(folder)) {
            return Optional.empty();
        }
        return Optional.of(new Candidate(folder, folderName, folderName, now));
    }
}

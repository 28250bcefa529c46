package com.artifactduo.server.service.deploy;

import com.artifactduo.server.exception.FileOperationException;
import com.artifactduo.server.util.FilesystemUtil;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Variable substitution for post-transfer commands.
 * <p>
 * {@code ${filename}} becomes the name of the first {@code .tar.gz} file of the uploaded tree
 * without that suffix, or the artifact name when the tree holds no such file.
 */
@Component
public class CommandTemplateResolver {

    public static final String FILENAME_VARIABLE = "${filename}";

    private static final String TAR_GZ_SUFFIX = ".tar.gz";

    public String resolveFilename(Path artifactRoot, String fallbackName) throws FileOperationException {
        if (Files.isRegularFile(artifactRoot)) {
            String fileName = artifactRoot.getFileName().toString();
            return fileName.endsWith(TAR_GZ_SUFFIX) ? StringUtils.removeEnd(fileName, TAR_GZ_SUFFIX) : fallbackName;
        }
        if (!Files.isDirectory(artifactRoot)) {
            return fallbackName;
        }
        List<Path> files = FilesystemUtil.getAllFileRecursively(artifactRoot);
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (fileName.endsWith(TAR_GZ_SUFFIX)) {
                return StringUtils.removeEnd(fileName, TAR_GZ_SUFFIX);
            }
        }
        return fallbackName;
    }

    public String resolve(String commandTemplate, String filename) {
        return StringUtils.replace(commandTemplate, FILENAME_VARIABLE, filename);
    }
}

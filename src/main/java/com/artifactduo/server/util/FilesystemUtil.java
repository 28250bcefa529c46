package com.artifactduo.server.util;

import com.artifactduo.server.exception.FileOperationException;
import com.artifactduo.server.exception.ResourceNotFoundException;
import com.artifactduo.server.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

@Slf4j
public class FilesystemUtil {

    private FilesystemUtil() {}

    /**
     * Relative path of {@code file} under {@code baseFolder}, always with "/" separators.
     */
    public static String splitPath(Path baseFolder, Path file) throws ValidationException {
        Path base = baseFolder.normalize();
        Path full = file.normalize();
        // 判断 file 是否包含在 baseFolder 中
        if (!full.startsWith(base)) {
            throw new ValidationException("splitPath failed. " +
                    "file doesn't locate in baseFolder. file is %s, baseFolder is %s".formatted(file, baseFolder));
        }
        return base.relativize(full).toString().replace('\\', '/');
    }

    public static Path isFolderPathValid(Path folder) throws ValidationException, ResourceNotFoundException {
        if (ObjectUtils.isEmpty(folder)) {
            throw new ValidationException("isFolderPathValid failed. folder is null");
        }
        if (Files.exists(folder) && Files.isDirectory(folder)) {
            return folder;
        }
        throw new ResourceNotFoundException(("isFolderPathValid failed. " +
                "folder doesn't exist or is not folder. folder is %s").formatted(folder));
    }

    /**
     * Direct sub-folders of {@code folder}, sorted by name.
     */
    public static List<Path> getSubFolders(Path folder) throws FileOperationException {
        List<Path> result = new ArrayList<>(10);
        try (DirectoryStream<Path> subFolderStream = Files.newDirectoryStream(folder)) {
            for (Path subFolder : subFolderStream) {
                if (Files.isDirectory(subFolder)) {
                    result.add(subFolder);
                }
            }
        } catch (IOException | SecurityException e) {
            throw new FileOperationException("getSubFolders failed. folder is %s".formatted(folder), e);
        }
        result.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return result;
    }

    /**
     * All regular files below {@code root}, sorted by relative path. Walks with an explicit
     * pending-directory list so deep trees don't grow the call stack.
     */
    public static List<Path> getAllFileRecursively(Path root) throws FileOperationException {
        List<Path> result = new ArrayList<>();
        Deque<Path> pendingFolders = new ArrayDeque<>();
        pendingFolders.push(root);
        while (!pendingFolders.isEmpty()) {
            Path folder = pendingFolders.pop();
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(folder)) {
                for (Path entry : entries) {
                    if (Files.isDirectory(entry)) {
                        pendingFolders.push(entry);
                    } else if (Files.isRegularFile(entry)) {
                        result.add(entry);
                    }
                }
            } catch (IOException | SecurityException e) {
                throw new FileOperationException("getAllFileRecursively failed. folder is %s".formatted(folder), e);
            }
        }
        result.sort(Comparator.comparing(file -> splitPath(root, file)));
        return result;
    }

    public static long getFileSizeInBytes(Path file) throws FileOperationException {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new FileOperationException("getFileSizeInBytes failed. file is %s".formatted(file), e);
        }
    }
}

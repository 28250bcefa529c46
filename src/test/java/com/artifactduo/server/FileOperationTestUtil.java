package com.artifactduo.server;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Random;

@Slf4j
public class FileOperationTestUtil {

    private static final Random random = new Random();

    public static Path createFile(Path file, int sizeInBytes) throws IOException {
        Files.createDirectories(file.getParent());
        byte[] content = new byte[sizeInBytes];
        random.nextBytes(content);
        return Files.write(file, content);
    }

    public static Path createTextFile(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    // 每个相对路径创建一个小文本文件
    public static Path createArtifactFolder(Path folder, String... relativeFiles) throws IOException {
        Files.createDirectories(folder);
        for (String relativeFile : relativeFiles) {
            createTextFile(folder.resolve(relativeFile), "content of " + relativeFile);
        }
        return folder;
    }

    public static void deleteAllFoldersLeaveItSelf(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.error("The specified path does not exist.");
            return;
        }

        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return super.visitFile(file, attrs);
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (dir.equals(path)) {
                    return super.postVisitDirectory(dir, exc);
                }
                Files.delete(dir);
                return super.postVisitDirectory(dir, exc);
            }
        });
    }
}

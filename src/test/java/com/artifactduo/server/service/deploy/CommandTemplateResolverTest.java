package com.artifactduo.server.service.deploy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.artifactduo.server.FileOperationTestUtil.createArtifactFolder;
import static com.artifactduo.server.FileOperationTestUtil.createTextFile;
import static org.junit.jupiter.api.Assertions.*;

class CommandTemplateResolverTest {

    private final CommandTemplateResolver commandTemplateResolver = new CommandTemplateResolver();

    @TempDir
    Path tempDir;

    @Test
    void shouldUseFirstTarGzFileName() throws IOException {
        Path artifact = createArtifactFolder(this.tempDir.resolve("2026_02_11_03_34(2.1.0)"),
                "build.log", "app-2.1.0.tar.gz", "zz/other-9.9.tar.gz");

        String filename = this.commandTemplateResolver.resolveFilename(artifact, "2026_02_11_03_34(2.1.0)");

        assertEquals("app-2.1.0", filename);
        assertEquals("echo app-2.1.0", this.commandTemplateResolver.resolve("echo ${filename}", filename));
    }

    @Test
    void shouldFallBackToArtifactName() throws IOException {
        Path artifact = createArtifactFolder(this.tempDir.resolve("260211"), "build.log", "app.tgz");

        String filename = this.commandTemplateResolver.resolveFilename(artifact, "260211");

        assertEquals("echo 260211", this.commandTemplateResolver.resolve("echo ${filename}", filename));
    }

    @Test
    void shouldResolveSingleFile() throws IOException {
        Path file = createTextFile(this.tempDir.resolve("pkg-1.0.tar.gz"), "x");

        assertEquals("pkg-1.0", this.commandTemplateResolver.resolveFilename(file, "fallback"));
    }

    @Test
    void shouldReplaceEveryOccurrence() {
        assertEquals("tar xzf app.tar.gz -C /opt/app",
                this.commandTemplateResolver.resolve("tar xzf ${filename}.tar.gz -C /opt/${filename}", "app"));
        assertEquals("systemctl restart app", this.commandTemplateResolver.resolve("systemctl restart app", "x"));
    }
}

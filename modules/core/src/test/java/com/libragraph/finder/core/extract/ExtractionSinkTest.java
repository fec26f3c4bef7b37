package com.libragraph.finder.core.extract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ExtractionSinkTest {

    private final ExtractionSink sink = new ExtractionSink();

    @TempDir
    Path tempDir;

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldWriteUnderBaseName() throws IOException {
        Path written = sink.extract(tempDir, "deep/path/report.txt", bytes("content"));

        assertThat(written).isEqualTo(tempDir.resolve("report.txt"));
        assertThat(written).hasContent("content");
    }

    @Test
    void shouldCreateMissingDirectory() throws IOException {
        Path target = tempDir.resolve("a/b");

        sink.extract(target, "x.bin", bytes("x"));

        assertThat(target.resolve("x.bin")).exists();
    }

    @Test
    void shouldNumberCollidingNames() throws IOException {
        Path first = sink.extract(tempDir, "a/report.txt", bytes("one"));
        Path second = sink.extract(tempDir, "b/report.txt", bytes("two"));
        Path third = sink.extract(tempDir, "report.txt", bytes("three"));

        assertThat(first.getFileName().toString()).isEqualTo("report.txt");
        assertThat(second.getFileName().toString()).isEqualTo("report_1.txt");
        assertThat(third.getFileName().toString()).isEqualTo("report_2.txt");
        assertThat(first).hasContent("one");
        assertThat(second).hasContent("two");
    }

    @Test
    void shouldNumberNamesWithoutExtension() throws IOException {
        Files.writeString(tempDir.resolve("README"), "existing");

        Path written = sink.extract(tempDir, "README", bytes("new"));

        assertThat(written.getFileName().toString()).isEqualTo("README_1");
        assertThat(tempDir.resolve("README")).hasContent("existing");
    }

    @Test
    void shouldKeepExtractionInsideDirectory() throws IOException {
        Path written = sink.extract(tempDir, "..\\..\\evil.sh", bytes("x"));
        Path unnamed = sink.extract(tempDir, "dir/..", bytes("y"));

        assertThat(written).isEqualTo(tempDir.resolve("evil.sh"));
        assertThat(unnamed).isEqualTo(tempDir.resolve("unnamed"));
    }

    @Test
    void shouldFailWhenTargetIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file"), "occupied");

        assertThatThrownBy(() -> sink.extract(file, "x.bin", bytes("x")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void shouldDeriveBaseName() {
        assertThat(ExtractionSink.baseName("a/b/c.txt")).isEqualTo("c.txt");
        assertThat(ExtractionSink.baseName("a\\b\\c.txt")).isEqualTo("c.txt");
        assertThat(ExtractionSink.baseName("dir/")).isEqualTo("dir");
        assertThat(ExtractionSink.baseName("")).isEqualTo("unnamed");
    }
}

package org.dxworks.rfcmark.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class AtomicFileWriterTest {

    @TempDir
    Path directory;

    @Test
    void write_replacesTheTargetAndLeavesNothingElse() throws IOException {
        Path target = directory.resolve("out").resolve("rfc1.md");

        AtomicFileWriter.write(target, "first\n");
        AtomicFileWriter.write(target, "second\n");

        assertEquals("second\n", Files.readString(target, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(List.of("rfc1.md"), files.map(path -> path.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void write_failureKeepsTheOldContent() throws IOException {
        Path target = directory.resolve("taken");
        Files.createDirectories(target.resolve("child"));

        assertThrows(IOException.class, () -> AtomicFileWriter.write(target, "text"));

        assertTrue(Files.isDirectory(target.resolve("child")));
        try (Stream<Path> files = Files.list(directory)) {
            assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".tmp")));
        }
    }
}

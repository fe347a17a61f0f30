package com.pivotbot.backend.service.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_shouldReplaceExistingContentAndLeaveNoTempFiles() throws Exception {
        Path target = tempDir.resolve("state").resolve("trade_state.json");

        AtomicFileWriter.write(target, "{\"count\":1}");
        AtomicFileWriter.write(target, "{\"count\":2,\"note\":\"über\"}");

        assertEquals("{\"count\":2,\"note\":\"über\"}", Files.readString(target));
        List<Path> files;
        try (Stream<Path> listing = Files.list(target.getParent())) {
            files = listing.collect(Collectors.toList());
        }
        assertEquals(List.of(target), files);
    }

    @Test
    void write_withLargeContent_shouldWriteEveryByte() throws Exception {
        Path target = tempDir.resolve("status_report.json");
        String content = "x".repeat(256 * 1024);

        AtomicFileWriter.write(target, content);

        assertEquals(content.length(), Files.size(target));
    }
}

package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.vo.LogTailVO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LogViewServiceTest {

    @TempDir
    Path logDir;

    private void writeLines(String name, int count) throws IOException {
        String body = IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
        Files.writeString(logDir.resolve(name), body + "\n", StandardCharsets.UTF_8);
    }

    @Test
    void tailsTheNewestLines() throws IOException {
        writeLines("application.log", 30);
        LogTailVO tail = new LogViewService(logDir.toString()).tail(" Application ", 5);
        // below-minimum requests are raised to 20
        assertEquals(20, tail.getLineCount());
        assertEquals("line 11", tail.getLines().get(0));
        assertEquals("line 30", tail.getLines().get(19));
        assertEquals("application", tail.getSource());
        assertEquals("ok", tail.getStatus());
    }

    @Test
    void lineCountIsCapped() throws IOException {
        writeLines("errors.log", 1500);
        LogTailVO tail = new LogViewService(logDir.toString()).tail("errors", 5000);
        assertEquals(1000, tail.getLines().size());
        assertEquals("line 1500", tail.getLines().get(999));
    }

    @Test
    void missingFile() {
        LogViewService service = new LogViewService(logDir.toString());
        assertThrows(NoSuchFileException.class, () -> service.tail("errors", 50));
    }

    @Test
    void unknownSource() {
        LogViewService service = new LogViewService(logDir.toString());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> service.tail("audit", 50));
        assertEquals("Unsupported log source: audit", e.getMessage());
    }
}

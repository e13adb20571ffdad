package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.vo.LogTailVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.io.InputStreamReader;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Locale;
import java.util.Set;

/**
 * Tails the runtime's rolling log files.
 */
@Service
@Slf4j
public class LogViewService {

    public static final Set<String> VALID_SOURCES = Set.of("application", "errors");
    static final int MIN_LINES = 20;
    static final int MAX_LINES = 1000;

    private final Path logDir;

    public LogViewService(@Value("${logs.dir:logs}") String logDir) {
        this.logDir = Paths.get(logDir);
    }

    /**
     * @throws IllegalArgumentException for an unknown source
     * @throws NoSuchFileException when the log file has not been written yet
     */
    public LogTailVO tail(String source, int lines) throws IOException {
        String normalized = source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
        if (!VALID_SOURCES.contains(normalized)) {
            throw new IllegalArgumentException("Unsupported log source: " + source);
        }
        int limit = Math.max(MIN_LINES, Math.min(MAX_LINES, lines));
        Path file = logDir.resolve(normalized + ".log");
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Log file not found");
        }
        Deque<String> buffer = new ArrayDeque<>(limit);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.REPLACE)))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (buffer.size() == limit) buffer.removeFirst();
                buffer.addLast(line);
            }
        }
        return LogTailVO.builder()
                .status("ok")
                .source(normalized)
                .path(file.toString())
                .lineCount(buffer.size())
                .lines(new ArrayList<>(buffer))
                .timestamp(Instant.now())
                .build();
    }
}

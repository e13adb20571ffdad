package com.sandy.aiot.edge.runtime.vo;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class LogTailVO {
    private String status;
    private String source;
    private String path;
    private int lineCount;
    private List<String> lines;
    private Instant timestamp;
}

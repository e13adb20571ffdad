package com.sandy.aiot.edge.runtime.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sandy.aiot.edge.runtime.entity.RuntimeMode;
import com.sandy.aiot.edge.runtime.service.LogViewService;
import com.sandy.aiot.edge.runtime.service.impl.EdgeRuntimeService;
import com.sandy.aiot.edge.runtime.vo.LogTailVO;
import com.sandy.aiot.edge.runtime.vo.RuntimePayloadVO;
import com.sandy.aiot.edge.runtime.vo.ServiceHealthVO;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.Locale;

/**
 * Control surface for the edge runtime: dashboard payload, status, mode / scenario / auto-apply switches.
 */
@RestController
@RequestMapping("/monitoring/laptop")
@RequiredArgsConstructor
@Slf4j
public class RuntimeController {

    private final EdgeRuntimeService edgeRuntimeService;
    private final LogViewService logViewService;

    @GetMapping("/live-dashboard")
    public RuntimePayloadVO liveDashboard(@RequestParam(name = "history_limit", defaultValue = "30") int historyLimit,
                                          @RequestParam(name = "event_limit", defaultValue = "30") int eventLimit,
                                          @RequestParam(name = "alert_limit", defaultValue = "10") int alertLimit) {
        return edgeRuntimeService.latestPayload(historyLimit, eventLimit, alertLimit);
    }

    @GetMapping("/status")
    public ServiceHealthVO status() {
        return edgeRuntimeService.healthStatus();
    }

    @PostMapping("/scan")
    public ResponseEntity<ActionResp> scan() {
        edgeRuntimeService.scanNow();
        return ResponseEntity.ok(ActionResp.ok());
    }

    @PostMapping("/auto-apply")
    public UpdateResp autoApply(@RequestBody AutoApplyReq req) {
        boolean enabled = req.getEnabled() == null || req.getEnabled();
        edgeRuntimeService.setAutoApply(enabled);
        UpdateResp resp = UpdateResp.updated();
        resp.setAutoApplyPowerProfile(enabled);
        return resp;
    }

    @PostMapping("/mode")
    public UpdateResp mode(@RequestBody ModeReq req) {
        String mode = req.getMode() == null ? RuntimeMode.LIVE_EDGE.name() : req.getMode();
        edgeRuntimeService.setMode(mode);
        UpdateResp resp = UpdateResp.updated();
        resp.setMode(mode.trim().toUpperCase(Locale.ROOT));
        return resp;
    }

    @PostMapping("/scenario")
    public UpdateResp scenario(@RequestBody ScenarioReq req) {
        String scenario = req.getScenario() == null ? "normal" : req.getScenario();
        int cycles = req.getCycles() == null ? 12 : req.getCycles();
        edgeRuntimeService.setScenario(scenario, cycles);
        UpdateResp resp = UpdateResp.updated();
        resp.setScenario(scenario.trim().toLowerCase(Locale.ROOT));
        resp.setCycles(cycles);
        return resp;
    }

    @GetMapping("/logs")
    public LogTailVO logs(@RequestParam(defaultValue = "application") String source,
                          @RequestParam(defaultValue = "150") int lines) throws IOException {
        return logViewService.tail(source, lines);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ActionResp> rejected(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ActionResp.fail(e.getMessage()));
    }

    @ExceptionHandler(NoSuchFileException.class)
    public ResponseEntity<ActionResp> missingFile(NoSuchFileException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ActionResp.fail("Log file not found: " + e.getFile()));
    }

    @Data
    public static class ModeReq {
        private String mode;
    }

    @Data
    public static class ScenarioReq {
        private String scenario;
        private Integer cycles;
    }

    @Data
    public static class AutoApplyReq {
        private Boolean enabled;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class UpdateResp {
        private String status;
        private String mode;
        private String scenario;
        private Integer cycles;
        private Boolean autoApplyPowerProfile;
        private Instant timestamp;
        public static UpdateResp updated() { UpdateResp r = new UpdateResp(); r.status = "updated"; r.timestamp = Instant.now(); return r; }
    }

    @Data
    public static class ActionResp {
        private boolean success;
        private String message;
        public static ActionResp ok() { ActionResp r = new ActionResp(); r.success = true; return r; }
        public static ActionResp fail(String msg) { ActionResp r = new ActionResp(); r.success = false; r.message = msg; return r; }
    }
}

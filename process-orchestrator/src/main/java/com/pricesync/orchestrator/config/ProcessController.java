package com.pricesync.orchestrator.config;

import com.pricesync.orchestrator.model.CallResult;
import com.pricesync.orchestrator.model.ProcessDefinition;
import com.pricesync.orchestrator.model.ScheduleUpdate;
import com.pricesync.orchestrator.service.ProcessControlService;
import com.pricesync.orchestrator.service.ProcessRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP control surface consumed by the chat transport.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class ProcessController {

    private final ProcessControlService controlService;
    private final ProcessRegistry registry;

    // ── Processes ─────────────────────────────────────────────────────────────

    @GetMapping("/processes")
    public ResponseEntity<List<ProcessDefinition>> processes() {
        return ResponseEntity.ok(List.copyOf(controlService.processes()));
    }

    /**
     * Run a chain and wait for its result.
     *
     * POST /processes/Sale/run
     */
    @PostMapping("/processes/{name}/run")
    public ResponseEntity<ProcessControlService.ManualRun> run(@PathVariable String name) {
        return ResponseEntity.ok(controlService.runManual(name));
    }

    /**
     * Start a chain in the background. The response says whether it has to wait for
     * a chain that is already running.
     */
    @PostMapping("/processes/{name}/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String name) {
        registry.require(name);
        boolean busy = controlService.isRunning();
        new Thread(() -> controlService.runManual(name), "manual-run-" + name).start();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("process", name);
        body.put("queued", busy);
        if (busy) {
            body.put("message", "Another process is already running; '" + name + "' will start when it finishes");
        }
        return ResponseEntity.accepted().body(body);
    }

    // ── Schedules ─────────────────────────────────────────────────────────────

    @GetMapping("/schedules")
    public ResponseEntity<Map<String, String>> schedules() {
        return ResponseEntity.ok(controlService.getSchedules());
    }

    /**
     * PUT /schedules/Sale?time=08:30   (time=- disables)
     */
    @PutMapping("/schedules/{name}")
    public ResponseEntity<ScheduleUpdate> setSchedule(@PathVariable String name, @RequestParam String time) {
        return ResponseEntity.ok(controlService.setSchedule(name, time));
    }

    @DeleteMapping("/schedules/{name}")
    public ResponseEntity<ScheduleUpdate> clearSchedule(@PathVariable String name) {
        return ResponseEntity.ok(controlService.setSchedule(name, ProcessControlService.DISABLE));
    }

    // ── Status & logs ─────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<?> latestStatus() {
        return controlService.getLatestStatus()
                .<ResponseEntity<?>>map(status -> ResponseEntity.ok(status))
                .orElseGet(() -> noHistory("No process has run yet"));
    }

    @GetMapping("/status/{name}")
    public ResponseEntity<?> status(@PathVariable String name) {
        return controlService.getLastStatus(name)
                .<ResponseEntity<?>>map(status -> ResponseEntity.ok(status))
                .orElseGet(() -> noHistory("Process '" + name + "' has not run yet"));
    }

    @GetMapping("/logs/{parser}")
    public ResponseEntity<CallResult> logs(@PathVariable String parser) {
        CallResult result = controlService.getParserLogs(parser);
        return result.succeeded()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
    }

    // ── Errors ────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private ResponseEntity<Map<String, String>> noHistory(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", message));
    }
}

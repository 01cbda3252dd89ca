package com.boxofficeintel.daily.config;

import com.boxofficeintel.daily.service.CollectionOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class CollectionController {

    private final CollectionOrchestrator orchestrator;

    // ── Collection triggers ──────────────────────────────────────────────────

    /**
     * Collect a date range in the background. The run slot is claimed before the response, so
     * a cancel that follows the 202 always reaches the run.
     *
     * POST /collect/trigger?start=2024-01-01&end=2024-03-31
     *
     * Without parameters the configured range is collected.
     */
    @PostMapping("/collect/trigger")
    public ResponseEntity<Map<String, String>> trigger(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        if ((start == null) != (end == null)) {
            return ResponseEntity.badRequest().body(Map.of("error", "start and end must be given together"));
        }
        if (start != null && end.isBefore(start)) {
            return ResponseEntity.badRequest().body(Map.of("error", "end must not be before start"));
        }
        if (!orchestrator.startCollect(start, end, "manual")) {
            return busy();
        }
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "start", start == null ? "configured" : start.toString(),
                "end", end == null ? "configured" : end.toString()));
    }

    @PostMapping("/collect/retry-skipped")
    public ResponseEntity<Map<String, String>> retrySkipped() {
        if (!orchestrator.startRetrySkipped()) {
            return busy();
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "skipped dates"));
    }

    @PostMapping("/collect/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        boolean requested = orchestrator.cancel();
        return ResponseEntity.ok(Map.of("status", requested ? "cancelling" : "idle"));
    }

    @PostMapping("/aggregate")
    public ResponseEntity<Map<String, String>> aggregate() {
        if (!orchestrator.startAggregateOnly()) {
            return busy();
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "feature table"));
    }

    @GetMapping("/collect/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(orchestrator.status());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static ResponseEntity<Map<String, String>> busy() {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "a collection run is already in progress"));
    }
}

package com.example.rcaengine.controller;

import com.example.rcaengine.model.RawAlertEvent;
import com.example.rcaengine.service.CorrelationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Alert feed REST API Controller.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final CorrelationEngine correlationEngine;

    @PostMapping
    public ResponseEntity<CorrelationEngine.IngestResult> ingest(@RequestBody RawAlertEvent event) {
        return ResponseEntity.ok(correlationEngine.submit(event).join());
    }

    /**
     * Ingest a batch in order. Alerts for the same component keep their
     * relative order; the response lists results in request order.
     */
    @PostMapping("/batch")
    public ResponseEntity<List<CorrelationEngine.IngestResult>> ingestBatch(@RequestBody List<RawAlertEvent> events) {
        List<CompletableFuture<CorrelationEngine.IngestResult>> pending = new ArrayList<>();
        for (RawAlertEvent event : events) {
            pending.add(correlationEngine.submit(event));
        }
        return ResponseEntity.ok(pending.stream().map(CompletableFuture::join).toList());
    }
}

package com.hourlyhigh.controller;

import com.hourlyhigh.engine.GroupReduceEngine;
import com.hourlyhigh.generator.SyntheticTradeGenerator;
import com.hourlyhigh.service.TradeIngestService;
import com.hourlyhigh.sink.HourlyHighStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final GroupReduceEngine engine;
    private final HourlyHighStore store;
    private final TradeIngestService ingestService;
    private final Optional<SyntheticTradeGenerator> generator;

    public StatusController(GroupReduceEngine engine,
                            HourlyHighStore store,
                            TradeIngestService ingestService,
                            Optional<SyntheticTradeGenerator> generator) {
        this.engine = engine;
        this.store = store;
        this.ingestService = ingestService;
        this.generator = generator;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Detailed service status.
     * GET /status → engine, store and ingestion counters
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now().getEpochSecond());
        body.put("interval", engine.getInterval().getLabel());
        body.put("shards", engine.shardCount());
        body.put("groups", engine.groupCount());
        body.put("liveRows", store.size());
        body.put("batchesProcessed", engine.batchesProcessed());
        body.put("diffsEmitted", engine.diffsEmitted());
        body.put("engineFailed", engine.isFailed());
        body.put("committedTime", ingestService.committedTime());
        body.put("tradesAccepted", ingestService.acceptedCount());
        body.put("tradesRejected", ingestService.rejectedCount());
        body.put("tradesGenerated", generator.map(SyntheticTradeGenerator::getGeneratedCount).orElse(0L));
        return ResponseEntity.ok(body);
    }

    /**
     * Lists all categories with a live high.
     * GET /categories → [0, 1, ...]
     */
    @GetMapping("/categories")
    public ResponseEntity<List<Integer>> categories() {
        return ResponseEntity.ok(store.categories());
    }
}

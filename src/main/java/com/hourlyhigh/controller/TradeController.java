package com.hourlyhigh.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.hourlyhigh.error.OrderingException;
import com.hourlyhigh.service.IngestReport;
import com.hourlyhigh.service.TradeIngestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Trade submission API.
 *
 * <pre>
 * POST /trades?commit=true          [{"timestamp":1717200000,"category":5,"price":"10.00"}]
 * POST /trades/retract?commit=true  same body
 * POST /trades/commit
 * </pre>
 *
 * Each trade is validated on its own, field types included; the response lists rejected positions with a
 * reason.
 */
@RestController
@RequestMapping("/trades")
public class TradeController {

    private static final Logger log = LoggerFactory.getLogger(TradeController.class);

    private final TradeIngestService ingestService;

    public TradeController(TradeIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @PostMapping
    public ResponseEntity<IngestReport> submit(
            @RequestBody List<JsonNode> trades,
            @RequestParam(defaultValue = "false") boolean commit) {
        IngestReport report = ingestService.submitJson(trades);
        return ResponseEntity.ok(commit ? report.withCommittedTime(ingestService.commit()) : report);
    }

    @PostMapping("/retract")
    public ResponseEntity<IngestReport> retract(
            @RequestBody List<JsonNode> trades,
            @RequestParam(defaultValue = "false") boolean commit) {
        IngestReport report = ingestService.retractJson(trades);
        return ResponseEntity.ok(commit ? report.withCommittedTime(ingestService.commit()) : report);
    }

    @PostMapping("/commit")
    public ResponseEntity<Map<String, Long>> commit() {
        return ResponseEntity.ok(Map.of("committedTime", ingestService.commit()));
    }

    @ExceptionHandler(OrderingException.class)
    public ResponseEntity<Map<String, String>> onOrdering(OrderingException e) {
        log.warn("Commit rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}

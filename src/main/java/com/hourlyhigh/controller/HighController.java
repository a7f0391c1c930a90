package com.hourlyhigh.controller;

import com.hourlyhigh.engine.GroupReduceEngine;
import com.hourlyhigh.model.GroupKey;
import com.hourlyhigh.model.HourlyHigh;
import com.hourlyhigh.sink.HourlyHighStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing the materialized hourly highs.
 *
 * <pre>
 * GET /highs?category=5&amp;from=1717200000&amp;to=1717210800
 * GET /highs/5/1717200000
 * </pre>
 */
@RestController
@RequestMapping("/highs")
public class HighController {

    private static final Logger log = LoggerFactory.getLogger(HighController.class);

    private final HourlyHighStore store;
    private final GroupReduceEngine engine;

    public HighController(HourlyHighStore store, GroupReduceEngine engine) {
        this.store = store;
        this.engine = engine;
    }

    /**
     * Live highs of a category for buckets within {@code [from, to]}.
     */
    @GetMapping
    public ResponseEntity<HighResponse> range(
            @RequestParam int category,
            @RequestParam long from,
            @RequestParam long to
    ) {
        log.info("Highs request: category={} from={} to={}", category, from, to);

        if (category < 0) {
            return ResponseEntity.badRequest().body(HighResponse.error("Category must be non-negative"));
        }
        if (from > to) {
            return ResponseEntity.badRequest().body(HighResponse.error("'from' must be <= 'to'"));
        }

        List<HourlyHigh> rows = store.query(category, from, to);
        if (rows.isEmpty()) {
            log.debug("No highs found for category={} from={} to={}", category, from, to);
            return ResponseEntity.ok(HighResponse.noData(category));
        }
        return ResponseEntity.ok(HighResponse.ok(category, rows));
    }

    /**
     * The live high of one group. A group without contributions is {@code no_data}, not an error.
     * Any timestamp inside the bucket may be given.
     */
    @GetMapping("/{category}/{timestamp}")
    public ResponseEntity<HighResponse> single(@PathVariable int category, @PathVariable long timestamp) {
        if (category < 0) {
            return ResponseEntity.badRequest().body(HighResponse.error("Category must be non-negative"));
        }
        GroupKey key = new GroupKey(engine.getInterval().bucketStart(timestamp), category);
        return engine.currentHigh(key)
                .map(row -> ResponseEntity.ok(HighResponse.ok(category, List.of(row))))
                .orElseGet(() -> ResponseEntity.ok(HighResponse.noData(category)));
    }
}

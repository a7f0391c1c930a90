package com.hourlyhigh.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hourlyhigh.model.HourlyHigh;

import java.util.ArrayList;
import java.util.List;

/**
 * REST response DTO for hourly highs of one category, in columnar form.
 *
 * <pre>
 * {
 *   "s": "ok",
 *   "category": 5,
 *   "t": [1717200000, ...],
 *   "h": ["15", "10.25", ...]
 * }
 * </pre>
 *
 * Highs are plain decimal strings without trailing zeros, so no precision is lost on the way out.
 */
public record HighResponse(
        @JsonProperty("s") String status,
        @JsonProperty("category") Integer category,
        @JsonProperty("t") List<Long> buckets,
        @JsonProperty("h") List<String> highs
) {

    /**
     * Build a successful response from rows sorted by bucket.
     */
    public static HighResponse ok(int category, List<HourlyHigh> rows) {
        List<Long> t = new ArrayList<>();
        List<String> h = new ArrayList<>();
        for (HourlyHigh row : rows) {
            t.add(row.bucket());
            h.add(row.high().toPlainString());
        }
        return new HighResponse("ok", category, t, h);
    }

    /**
     * Build an empty successful response (no live rows).
     */
    public static HighResponse noData(int category) {
        return new HighResponse("no_data", category, List.of(), List.of());
    }

    public static HighResponse error(String message) {
        return new HighResponse("error: " + message, null, List.of(), List.of());
    }
}

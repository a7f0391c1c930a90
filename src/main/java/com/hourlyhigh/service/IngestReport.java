package com.hourlyhigh.service;

import java.util.List;

/**
 * Outcome of staging a list of submitted trades.
 *
 * @param accepted      Number of trades staged
 * @param rejected      One entry per rejected trade, in submission order
 * @param committedTime Logical time of the commit that followed, or {@code -1} if none did
 */
public record IngestReport(int accepted, List<Rejection> rejected, long committedTime) {

    /**
     * @param index  Position of the trade in the submitted list
     * @param reason Why it was rejected
     */
    public record Rejection(int index, String reason) {}

    public IngestReport withCommittedTime(long time) {
        return new IngestReport(accepted, rejected, time);
    }
}

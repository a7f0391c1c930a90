package com.hourlyhigh.session;

import com.hourlyhigh.event.TradeDiff;

import java.util.List;

/**
 * Downstream of an {@link InputSession}. Receives each committed batch exactly once, in time order.
 */
@FunctionalInterface
public interface BatchConsumer {

    /**
     * @param time  Logical time of the batch, strictly greater than any earlier batch
     * @param diffs Consolidated diffs of the batch, all stamped with {@code time}
     */
    void accept(long time, List<TradeDiff> diffs);
}

package com.hourlyhigh.event;

import com.hourlyhigh.model.Trade;

import java.util.Objects;

/**
 * A signed change to the trade multiset, committed at a logical time.
 *
 * @param trade        The trade
 * @param time         Logical time of the batch carrying this diff
 * @param multiplicity Net number of instances added (negative for retractions), never zero
 */
public record TradeDiff(Trade trade, long time, long multiplicity) {

    public TradeDiff {
        Objects.requireNonNull(trade, "trade");
        if (multiplicity == 0) throw new IllegalArgumentException("Multiplicity must be non-zero");
    }
}

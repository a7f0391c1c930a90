package com.hourlyhigh.event;

import com.hourlyhigh.model.Trade;

import java.util.Objects;

/**
 * An insertion or retraction of one trade instance.
 *
 * @param kind  Whether the trade is added to or removed from the input
 * @param trade The trade concerned
 */
public record TradeChange(Kind kind, Trade trade) {

    public enum Kind {
        INSERT(1),
        RETRACT(-1);

        private final int multiplicity;

        Kind(int multiplicity) {
            this.multiplicity = multiplicity;
        }

        public int multiplicity() {
            return multiplicity;
        }
    }

    public TradeChange {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(trade, "trade");
    }

    public static TradeChange insert(Trade trade) {
        return new TradeChange(Kind.INSERT, trade);
    }

    public static TradeChange retract(Trade trade) {
        return new TradeChange(Kind.RETRACT, trade);
    }

    public int multiplicity() {
        return kind.multiplicity();
    }
}

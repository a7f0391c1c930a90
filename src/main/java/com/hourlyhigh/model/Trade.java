package com.hourlyhigh.model;

import com.hourlyhigh.error.InvalidTradeException;

import java.math.BigDecimal;

/**
 * A single trade.
 *
 * <p>The price is stored in canonical form (trailing zeros stripped) so that
 * {@code 10.00} and {@code 10.0} are the same record and merge their multiplicities.
 *
 * @param timestamp Unix timestamp in seconds, may be negative
 * @param category  Category id, non-negative
 * @param price     Exact decimal price
 */
public record Trade(long timestamp, int category, BigDecimal price) {

    public Trade {
        if (category < 0) throw new InvalidTradeException("Category must be non-negative: " + category);
        price = PricePolicy.canonical(price);
    }
}

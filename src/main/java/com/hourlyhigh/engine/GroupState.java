package com.hourlyhigh.engine;

import com.hourlyhigh.model.HourlyHigh;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable state of one group: net multiplicity per distinct price.
 *
 * <p>This class is NOT thread-safe. It is owned by exactly one {@link KeyShard}.
 *
 * <p>The highest positive-multiplicity price is cached. A full rescan happens only when the cached price
 * loses its last positive instance.
 */
class GroupState {

    /** Prices are canonical, so {@code compareTo} agrees with {@code equals}. Zero entries are pruned. */
    private final TreeMap<BigDecimal, Long> counts = new TreeMap<>();

    /** Highest price with positive multiplicity, or null if there is none. */
    private BigDecimal high;

    /** Row last emitted for this group, or null if nothing is live. */
    private HourlyHigh emitted;

    /**
     * Add {@code delta} instances of {@code price}.
     */
    void apply(BigDecimal price, long delta) {
        if (delta == 0) return;
        Long merged = counts.merge(price, delta, (current, d) -> {
            long sum = current + d;
            return sum == 0 ? null : sum;
        });
        long count = merged == null ? 0 : merged;

        if (count > 0) {
            if (high == null || price.compareTo(high) > 0) {
                high = price;
            }
        } else if (high != null && price.compareTo(high) == 0) {
            high = rescan();
        }
    }

    private BigDecimal rescan() {
        for (Map.Entry<BigDecimal, Long> e : counts.descendingMap().entrySet()) {
            if (e.getValue() > 0) return e.getKey();
        }
        return null;
    }

    BigDecimal high() {
        return high;
    }

    long count(BigDecimal price) {
        return counts.getOrDefault(price, 0L);
    }

    int distinctPrices() {
        return counts.size();
    }

    /** True once every price has netted out to zero. */
    boolean isEmpty() {
        return counts.isEmpty();
    }

    HourlyHigh emitted() {
        return emitted;
    }

    void emitted(HourlyHigh row) {
        this.emitted = row;
    }
}

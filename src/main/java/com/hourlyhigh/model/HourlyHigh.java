package com.hourlyhigh.model;

import java.math.BigDecimal;

/**
 * Immutable aggregate row: the highest live price of a category within one bucket.
 * The high is kept in the same canonical form as {@link Trade#price()}.
 *
 * @param bucket   Bucket start time in Unix seconds
 * @param category Category id
 * @param high     Maximum price with positive net multiplicity in the group
 */
public record HourlyHigh(long bucket, int category, BigDecimal high) {

    public HourlyHigh {
        if (high == null) throw new IllegalArgumentException("High must not be null");
        high = PricePolicy.canonical(high);
    }

    public static HourlyHigh of(GroupKey key, BigDecimal high) {
        return new HourlyHigh(key.bucket(), key.category(), high);
    }

    public GroupKey key() {
        return new GroupKey(bucket, category);
    }
}

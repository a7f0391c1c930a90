package com.hourlyhigh.model;

/**
 * Grouping key for the hourly high aggregation: a bucket start and a category.
 * Uses Java record for automatic equals/hashCode, safe for use as a map key.
 *
 * @param bucket   Bucket start time in Unix seconds (aligned to the engine's interval)
 * @param category Category id
 */
public record GroupKey(long bucket, int category) implements Comparable<GroupKey> {

    public static GroupKey of(Trade trade, Interval interval) {
        return new GroupKey(interval.bucketStart(trade.timestamp()), trade.category());
    }

    @Override
    public int compareTo(GroupKey other) {
        int byBucket = Long.compare(bucket, other.bucket);
        return byBucket != 0 ? byBucket : Integer.compare(category, other.category);
    }
}

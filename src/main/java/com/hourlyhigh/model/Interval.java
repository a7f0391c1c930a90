package com.hourlyhigh.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supported bucket widths for grouping trades.
 * Each entry maps a human-readable label to its duration in seconds.
 *
 * <p>Bucketing uses the mathematical floor, so a negative timestamp lands in the
 * bucket that starts at or before it: with {@link #ONE_HOUR}, {@code -1} maps to
 * {@code -3600}, not {@code 0}.
 */
public enum Interval {

    ONE_MINUTE("1m", 60),
    FIVE_MINUTES("5m", 300),
    FIFTEEN_MINUTES("15m", 900),
    ONE_HOUR("1h", 3600),
    ONE_DAY("1d", 86400);

    private final String label;
    private final long seconds;

    private static final Map<String, Interval> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(Interval::getLabel, Function.identity()));

    Interval(String label, long seconds) {
        this.label = label;
        this.seconds = seconds;
    }

    public String getLabel() {
        return label;
    }

    public long getSeconds() {
        return seconds;
    }

    /**
     * Given a raw Unix timestamp in seconds, compute the start of the bucket it falls into.
     */
    public long bucketStart(long timestampSeconds) {
        return floorToBucket(timestampSeconds, seconds);
    }

    /**
     * {@code ts - floorMod(ts, width)}. Never truncates toward zero.
     *
     * @throws IllegalArgumentException if {@code width} is not positive
     */
    public static long floorToBucket(long timestampSeconds, long width) {
        if (width <= 0) throw new IllegalArgumentException("Bucket width must be positive: " + width);
        return timestampSeconds - Math.floorMod(timestampSeconds, width);
    }

    /**
     * Look up an Interval by its label string (e.g., "1h").
     */
    public static Optional<Interval> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    /**
     * Returns all supported label strings for validation or documentation.
     */
    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(Interval::getLabel).toArray(String[]::new);
    }
}

package com.hourlyhigh.event;

import com.hourlyhigh.model.HourlyHigh;

import java.util.Objects;

/**
 * One entry of the aggregate-diff stream.
 *
 * <p>{@code -1} retracts exactly this previously emitted row, {@code +1} states that this row now holds.
 *
 * @param high         The aggregate row
 * @param time         Logical time of the batch that produced it
 * @param multiplicity {@code -1} or {@code +1}
 */
public record HighDiff(HourlyHigh high, long time, int multiplicity) {

    public HighDiff {
        Objects.requireNonNull(high, "high");
        if (multiplicity != 1 && multiplicity != -1) {
            throw new IllegalArgumentException("Multiplicity must be +1 or -1: " + multiplicity);
        }
    }

    public static HighDiff insert(HourlyHigh high, long time) {
        return new HighDiff(high, time, 1);
    }

    public static HighDiff retract(HourlyHigh high, long time) {
        return new HighDiff(high, time, -1);
    }

    public boolean isRetraction() {
        return multiplicity < 0;
    }
}

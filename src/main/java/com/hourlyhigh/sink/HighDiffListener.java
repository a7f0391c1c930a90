package com.hourlyhigh.sink;

import com.hourlyhigh.event.HighDiff;

import java.util.List;

/**
 * Consumer of the aggregate-diff stream.
 */
@FunctionalInterface
public interface HighDiffListener {

    /**
     * Called once per processed batch that changed at least one aggregate.
     *
     * @param time  Logical time of the batch
     * @param diffs Changes ordered by (bucket, category), a retraction before the insertion replacing it
     */
    void onDiffs(long time, List<HighDiff> diffs);
}

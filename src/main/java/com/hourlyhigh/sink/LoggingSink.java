package com.hourlyhigh.sink;

import com.hourlyhigh.event.HighDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes every aggregate change to the log, one line per diff.
 */
public class LoggingSink implements HighDiffListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingSink.class);

    @Override
    public void onDiffs(long time, List<HighDiff> diffs) {
        for (HighDiff diff : diffs) {
            log.info("HOURLY: bucket={} category={} high={} diff={} time={}",
                    diff.high().bucket(), diff.high().category(), diff.high().high().toPlainString(),
                    diff.isRetraction() ? "-1" : "+1", time);
        }
    }

    @Override
    public String toString() {
        return "LoggingSink";
    }
}

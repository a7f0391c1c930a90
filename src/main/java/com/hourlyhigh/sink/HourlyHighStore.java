package com.hourlyhigh.sink;

import com.hourlyhigh.event.HighDiff;
import com.hourlyhigh.model.GroupKey;
import com.hourlyhigh.model.HourlyHigh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * In-memory table materialized from the aggregate-diff stream, keyed on {@link GroupKey}.
 *
 * <p>Each batch of diffs is checked in full and then applied under the write lock, so readers see either all of
 * a batch or none of it. A retraction must name the exact live row and an insertion must not land on a key
 * that already has one; a batch breaking either rule is refused as a whole.
 */
@Repository
public class HourlyHighStore implements HighDiffListener {

    private static final Logger log = LoggerFactory.getLogger(HourlyHighStore.class);

    private final Map<GroupKey, HourlyHigh> rows = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @throws IllegalStateException if a diff contradicts the table; nothing of the batch is applied
     */
    @Override
    public void onDiffs(long time, List<HighDiff> diffs) {
        lock.writeLock().lock();
        try {
            // Key -> row after this batch, null for a retired row
            Map<GroupKey, HourlyHigh> changes = new HashMap<>();
            for (HighDiff diff : diffs) {
                HourlyHigh row = diff.high();
                GroupKey key = row.key();
                HourlyHigh current = changes.containsKey(key) ? changes.get(key) : rows.get(key);
                if (diff.isRetraction()) {
                    if (!row.equals(current)) {
                        throw new IllegalStateException("Retraction of " + row + " does not match live row " + current);
                    }
                    changes.put(key, null);
                } else {
                    if (current != null) {
                        throw new IllegalStateException("Insertion of " + row + " over live row " + current);
                    }
                    changes.put(key, row);
                }
            }
            changes.forEach((key, row) -> {
                if (row == null) {
                    rows.remove(key);
                } else {
                    rows.put(key, row);
                }
            });
            log.debug("Applied {} diffs at time={}, rows={}", diffs.size(), time, rows.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The live row of a group, empty if the group currently has none.
     */
    public Optional<HourlyHigh> get(GroupKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rows.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rows of one category with a bucket in {@code [from, to]}, sorted ascending by bucket.
     */
    public List<HourlyHigh> query(int category, long from, long to) {
        lock.readLock().lock();
        try {
            return rows.values().stream()
                    .filter(r -> r.category() == category)
                    .filter(r -> r.bucket() >= from && r.bucket() <= to)
                    .sorted(Comparator.comparingLong(HourlyHigh::bucket))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Distinct categories with at least one live row, sorted.
     */
    public List<Integer> categories() {
        lock.readLock().lock();
        try {
            return rows.keySet().stream()
                    .map(GroupKey::category)
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears all rows, primarily for testing.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            rows.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "HourlyHighStore";
    }
}

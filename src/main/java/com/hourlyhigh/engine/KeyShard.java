package com.hourlyhigh.engine;

import com.hourlyhigh.event.HighDiff;
import com.hourlyhigh.model.GroupKey;
import com.hourlyhigh.model.HourlyHigh;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The group states of the keys routed to one worker.
 *
 * <p>Only one thread touches {@link #groups} at a time: the engine hands each shard to a single task per batch
 * and waits for all tasks before the next batch. {@link #live} only changes through {@link #publish(List)},
 * which the engine calls for every shard at once after the whole batch has been applied; it guards both
 * {@code publish} and the reads with its view lock.
 */
class KeyShard {

    private final Map<GroupKey, GroupState> groups = new HashMap<>();
    private final Map<GroupKey, HourlyHigh> live = new HashMap<>();

    /**
     * Apply consolidated per-price deltas and return the resulting aggregate changes.
     *
     * @param time   Logical time of the batch
     * @param deltas Per key, net multiplicity change per price; no zero entries
     */
    List<HighDiff> apply(long time, Map<GroupKey, Map<BigDecimal, Long>> deltas) {
        List<HighDiff> out = new ArrayList<>();
        for (Map.Entry<GroupKey, Map<BigDecimal, Long>> entry : deltas.entrySet()) {
            GroupKey key = entry.getKey();
            GroupState state = groups.computeIfAbsent(key, k -> new GroupState());
            entry.getValue().forEach(state::apply);

            HourlyHigh previous = state.emitted();
            HourlyHigh next = state.high() == null ? null : HourlyHigh.of(key, state.high());
            if (!Objects.equals(previous, next)) {
                if (previous != null) out.add(HighDiff.retract(previous, time));
                if (next != null) out.add(HighDiff.insert(next, time));
                state.emitted(next);
            }

            if (state.isEmpty()) {
                groups.remove(key);
            }
        }
        return out;
    }

    /**
     * Make the changes returned by {@link #apply} readable through {@link #live(GroupKey)}.
     */
    void publish(List<HighDiff> diffs) {
        for (HighDiff diff : diffs) {
            HourlyHigh row = diff.high();
            if (diff.isRetraction()) {
                live.remove(row.key(), row);
            } else {
                live.put(row.key(), row);
            }
        }
    }

    Optional<HourlyHigh> live(GroupKey key) {
        return Optional.ofNullable(live.get(key));
    }

    int groupCount() {
        return groups.size();
    }

    int liveCount() {
        return live.size();
    }

    void clear() {
        groups.clear();
        live.clear();
    }
}

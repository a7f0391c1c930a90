package com.hourlyhigh.engine;

import com.hourlyhigh.error.OrderingException;
import com.hourlyhigh.event.HighDiff;
import com.hourlyhigh.event.TradeDiff;
import com.hourlyhigh.model.GroupKey;
import com.hourlyhigh.model.HourlyHigh;
import com.hourlyhigh.model.Interval;
import com.hourlyhigh.session.BatchConsumer;
import com.hourlyhigh.sink.HighDiffListener;
import com.hourlyhigh.sink.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keyed incremental max aggregator.
 *
 * <p>Each committed batch is:
 * <ul>
 *   <li>consolidated by (group key, price), so a key changes at most once per batch</li>
 *   <li>split across {@link KeyShard}s by key hash, each shard processed by one task on the worker executor</li>
 *   <li>turned into {@link HighDiff}s, sorted by key with the retraction before its replacement</li>
 *   <li>published to every subscribed {@link HighDiffListener}</li>
 * </ul>
 *
 * <p>Batches are processed one at a time in strictly increasing logical time. Live rows of a batch become
 * readable through {@link #currentHigh} together, once every shard has finished with it, and before any
 * listener is called. If a shard task fails the engine is left failed and rejects every later batch, since
 * the shards that completed cannot be rolled back. The engine owns all group state; {@link #close()}
 * discards it.
 */
public class GroupReduceEngine implements BatchConsumer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GroupReduceEngine.class);

    private static final Comparator<HighDiff> OUTPUT_ORDER = Comparator
            .comparing((HighDiff d) -> d.high().key())
            .thenComparingInt(HighDiff::multiplicity);

    private final Interval interval;
    private final Executor executor;
    private final KeyShard[] shards;
    private final List<HighDiffListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    /** Guards the live rows of every shard. */
    private final ReadWriteLock viewLock = new ReentrantReadWriteLock();

    private final AtomicLong batchesProcessed = new AtomicLong();
    private final AtomicLong diffsEmitted = new AtomicLong();

    /** Time of the last processed batch. Guarded by {@link #lock}. */
    private long lastTime = Long.MIN_VALUE;
    private boolean closed;
    /** Cause of the batch that left the shards partially applied. Guarded by {@link #lock}. */
    private RuntimeException failure;

    /**
     * @param interval   Bucket width used to derive group keys
     * @param shardCount Number of key partitions, each processed by at most one thread at a time
     * @param executor   Runs shard tasks; a direct executor processes shards inline
     */
    public GroupReduceEngine(Interval interval, int shardCount, Executor executor) {
        if (shardCount < 1) throw new IllegalArgumentException("Shard count must be at least 1: " + shardCount);
        this.interval = Objects.requireNonNull(interval);
        this.executor = Objects.requireNonNull(executor);
        this.shards = new KeyShard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new KeyShard();
        }
        log.info("Group-reduce engine ready: interval={} shards={}", interval.getLabel(), shardCount);
    }

    /**
     * Process one committed batch.
     *
     * @throws OrderingException if {@code time} is not after the previous batch; nothing is applied
     */
    @Override
    public void accept(long time, List<TradeDiff> diffs) {
        lock.lock();
        try {
            if (closed) throw new IllegalStateException("Engine is closed");
            if (failure != null) throw new IllegalStateException("Engine failed on an earlier batch", failure);
            if (time <= lastTime) {
                throw new OrderingException("Batches must arrive in increasing logical time", time, lastTime);
            }

            List<Map<GroupKey, Map<BigDecimal, Long>>> partitions = consolidate(diffs);
            List<List<HighDiff>> perShard;
            try {
                perShard = process(time, partitions);
            } catch (RuntimeException e) {
                failure = e;
                log.error("Batch time={} failed in a shard task, engine stops accepting batches", time, e);
                throw e;
            }

            List<HighDiff> output = new ArrayList<>();
            viewLock.writeLock().lock();
            try {
                for (int i = 0; i < shards.length; i++) {
                    shards[i].publish(perShard.get(i));
                    output.addAll(perShard.get(i));
                }
            } finally {
                viewLock.writeLock().unlock();
            }
            output.sort(OUTPUT_ORDER);

            lastTime = time;
            batchesProcessed.incrementAndGet();
            diffsEmitted.addAndGet(output.size());
            log.debug("Batch time={} diffs={} emitted={}", time, diffs.size(), output.size());

            if (!output.isEmpty()) {
                publish(time, List.copyOf(output));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merge diffs per shard, key and price. Entries that cancel out are dropped.
     */
    private List<Map<GroupKey, Map<BigDecimal, Long>>> consolidate(List<TradeDiff> diffs) {
        List<Map<GroupKey, Map<BigDecimal, Long>>> partitions = new ArrayList<>(shards.length);
        for (int i = 0; i < shards.length; i++) {
            partitions.add(new HashMap<>());
        }
        for (TradeDiff diff : diffs) {
            GroupKey key = GroupKey.of(diff.trade(), interval);
            Map<BigDecimal, Long> prices = partitions.get(shardOf(key))
                    .computeIfAbsent(key, k -> new HashMap<>());
            prices.merge(diff.trade().price(), diff.multiplicity(), (current, d) -> {
                long sum = current + d;
                return sum == 0 ? null : sum;
            });
        }
        for (Map<GroupKey, Map<BigDecimal, Long>> partition : partitions) {
            partition.values().removeIf(Map::isEmpty);
        }
        return partitions;
    }

    /**
     * Run one task per non-empty partition and wait for all of them. Returns the changes of each shard,
     * indexed like {@link #shards}.
     */
    private List<List<HighDiff>> process(long time, List<Map<GroupKey, Map<BigDecimal, Long>>> partitions) {
        List<CompletableFuture<List<HighDiff>>> tasks = new ArrayList<>(shards.length);
        try {
            for (int i = 0; i < shards.length; i++) {
                Map<GroupKey, Map<BigDecimal, Long>> partition = partitions.get(i);
                KeyShard shard = shards[i];
                tasks.add(partition.isEmpty()
                        ? CompletableFuture.completedFuture(List.of())
                        : CompletableFuture.supplyAsync(() -> shard.apply(time, partition), executor));
            }
        } catch (RuntimeException e) {
            // Typically a RejectedExecutionException from a saturated or shut down executor
            awaitQuietly(tasks);
            throw e;
        }

        List<List<HighDiff>> results = new ArrayList<>(shards.length);
        try {
            for (CompletableFuture<List<HighDiff>> task : tasks) {
                results.add(task.join());
            }
        } catch (CompletionException e) {
            awaitQuietly(tasks);
            if (e.getCause() instanceof RuntimeException cause) throw cause;
            throw e;
        }
        return results;
    }

    /**
     * Wait until no task of a failed batch is still touching its shard. Their own failures are logged; the
     * caller rethrows the first one.
     */
    private static void awaitQuietly(List<CompletableFuture<List<HighDiff>>> tasks) {
        for (CompletableFuture<List<HighDiff>> task : tasks) {
            try {
                task.join();
            } catch (CompletionException | CancellationException e) {
                log.debug("Shard task of the failed batch also ended abnormally", e);
            }
        }
    }

    private void publish(long time, List<HighDiff> output) {
        for (HighDiffListener listener : listeners) {
            try {
                listener.onDiffs(time, output);
            } catch (RuntimeException e) {
                // State for this batch is already committed.
                log.error("Listener {} failed on batch time={}", listener, time, e);
            }
        }
    }

    /**
     * Register a consumer of the aggregate-diff stream. It sees only batches processed after this call.
     */
    public Subscription subscribe(HighDiffListener listener) {
        Objects.requireNonNull(listener);
        listeners.add(listener);
        log.info("Subscribed listener {}", listener);
        return () -> {
            if (listeners.remove(listener)) {
                log.info("Unsubscribed listener {}", listener);
            }
        };
    }

    /**
     * The live aggregate of a group. Empty if the group has no positive-multiplicity price.
     */
    public Optional<HourlyHigh> currentHigh(GroupKey key) {
        viewLock.readLock().lock();
        try {
            return shards[shardOf(key)].live(key);
        } finally {
            viewLock.readLock().unlock();
        }
    }

    public Optional<HourlyHigh> currentHigh(long timestampSeconds, int category) {
        return currentHigh(new GroupKey(interval.bucketStart(timestampSeconds), category));
    }

    /** Number of groups holding any non-zero multiplicity. */
    public int groupCount() {
        lock.lock();
        try {
            int total = 0;
            for (KeyShard shard : shards) {
                total += shard.groupCount();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    /** Number of groups with a live aggregate row. */
    public int liveCount() {
        viewLock.readLock().lock();
        try {
            int total = 0;
            for (KeyShard shard : shards) {
                total += shard.liveCount();
            }
            return total;
        } finally {
            viewLock.readLock().unlock();
        }
    }

    /** Whether a shard task failed and the engine no longer accepts batches. */
    public boolean isFailed() {
        lock.lock();
        try {
            return failure != null;
        } finally {
            lock.unlock();
        }
    }

    public long lastTime() {
        lock.lock();
        try {
            return lastTime;
        } finally {
            lock.unlock();
        }
    }

    public long batchesProcessed() {
        return batchesProcessed.get();
    }

    public long diffsEmitted() {
        return diffsEmitted.get();
    }

    public Interval getInterval() {
        return interval;
    }

    public int shardCount() {
        return shards.length;
    }

    /**
     * Drop all group state and listeners. Further batches are rejected.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            log.info("Closing engine: groups={} live={} batches={}", groupCount(), liveCount(),
                    batchesProcessed.get());
            viewLock.writeLock().lock();
            try {
                for (KeyShard shard : shards) {
                    shard.clear();
                }
            } finally {
                viewLock.writeLock().unlock();
            }
            listeners.clear();
        } finally {
            lock.unlock();
        }
    }

    private int shardOf(GroupKey key) {
        return Math.floorMod(key.hashCode(), shards.length);
    }
}

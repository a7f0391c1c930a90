package com.hourlyhigh.session;

import com.hourlyhigh.error.OrderingException;
import com.hourlyhigh.event.TradeChange;
import com.hourlyhigh.event.TradeDiff;
import com.hourlyhigh.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stages trade diffs under a pending logical time and commits them as one atomic batch on {@link #flush()}.
 *
 * <p>Nothing reaches the {@link BatchConsumer} before a flush. Delivery happens while the session lock is
 * held, so every effect of a batch is visible to anyone who acquires the lock afterwards.
 *
 * <p>Time starts with pending time {@code 0} and nothing committed ({@code -1}).
 */
public class InputSession {

    private static final Logger log = LoggerFactory.getLogger(InputSession.class);

    private final BatchConsumer downstream;
    private final ReentrantLock lock = new ReentrantLock();

    /** Net multiplicity per staged trade. Guarded by {@link #lock}. */
    private final Map<Trade, Long> staged = new HashMap<>();
    private long pendingTime = 0;
    private long committedTime = -1;

    public InputSession(BatchConsumer downstream) {
        this.downstream = Objects.requireNonNull(downstream);
    }

    /** Stage one instance of {@code trade}. */
    public void insert(Trade trade) {
        update(trade, 1);
    }

    /** Stage the removal of one instance of {@code trade}. */
    public void retract(Trade trade) {
        update(trade, -1);
    }

    public void update(TradeChange change) {
        update(change.trade(), change.multiplicity());
    }

    /**
     * Stage an arbitrary signed diff. Diffs for identical trades are summed.
     */
    public void update(Trade trade, long multiplicity) {
        Objects.requireNonNull(trade, "trade");
        if (multiplicity == 0) return;
        lock.lock();
        try {
            staged.merge(trade, multiplicity, Long::sum);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move the pending time forward.
     *
     * @throws OrderingException if {@code time} is not after the committed time or lies before the pending time
     */
    public void advanceTo(long time) {
        lock.lock();
        try {
            if (time <= committedTime) {
                throw new OrderingException("Logical time must advance past the committed time", time, committedTime);
            }
            if (time < pendingTime) {
                throw new OrderingException("Logical time must not regress", time, pendingTime);
            }
            pendingTime = time;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deliver everything staged as one batch stamped with the pending time, then clear the stage.
     * A flush with nothing staged does nothing.
     *
     * @return the number of diffs delivered
     * @throws OrderingException if the pending time has already been committed; the stage is kept
     */
    public int flush() {
        lock.lock();
        try {
            List<TradeDiff> batch = new ArrayList<>(staged.size());
            for (Map.Entry<Trade, Long> e : staged.entrySet()) {
                if (e.getValue() != 0) {
                    batch.add(new TradeDiff(e.getKey(), pendingTime, e.getValue()));
                }
            }
            if (batch.isEmpty()) {
                staged.clear();
                return 0;
            }
            if (pendingTime <= committedTime) {
                throw new OrderingException("Advance the session before flushing again", pendingTime, committedTime);
            }

            downstream.accept(pendingTime, batch);
            committedTime = pendingTime;
            staged.clear();
            log.debug("Committed batch time={} diffs={}", committedTime, batch.size());
            return batch.size();
        } finally {
            lock.unlock();
        }
    }

    public long pendingTime() {
        lock.lock();
        try {
            return pendingTime;
        } finally {
            lock.unlock();
        }
    }

    public long committedTime() {
        lock.lock();
        try {
            return committedTime;
        } finally {
            lock.unlock();
        }
    }

    /** Number of distinct trades currently staged, including ones whose diffs cancelled out. */
    public int stagedCount() {
        lock.lock();
        try {
            return staged.size();
        } finally {
            lock.unlock();
        }
    }
}

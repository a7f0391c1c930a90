package com.hourlyhigh.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hourlyhigh.error.InvalidTradeException;
import com.hourlyhigh.event.TradeChange;
import com.hourlyhigh.model.Trade;
import com.hourlyhigh.session.InputSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for trades coming from outside:
 * <ul>
 *   <li>Validates each submitted trade on its own, so one malformed record never aborts the rest</li>
 *   <li>Stages the valid ones as insertions or retractions in the {@link InputSession}</li>
 *   <li>Drives the logical clock: each {@link #commit()} advances one tick and flushes</li>
 * </ul>
 */
@Service
public class TradeIngestService {

    private static final Logger log = LoggerFactory.getLogger(TradeIngestService.class);

    private final InputSession session;
    private final ReentrantLock commitLock = new ReentrantLock();
    private final AtomicLong acceptedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    public TradeIngestService(InputSession session) {
        this.session = session;
    }

    /**
     * Validate and stage insertions. Nothing is visible downstream until {@link #commit()}.
     */
    public IngestReport submit(List<TradeRequest> requests) {
        return stage(requests, TradeRequest::toTrade, TradeChange.Kind.INSERT);
    }

    /**
     * Validate and stage retractions.
     */
    public IngestReport retract(List<TradeRequest> requests) {
        return stage(requests, TradeRequest::toTrade, TradeChange.Kind.RETRACT);
    }

    /**
     * Stage insertions from raw JSON records, as posted to the REST API. Type errors are per-record rejections.
     */
    public IngestReport submitJson(List<JsonNode> records) {
        return stage(records, node -> TradeRequest.fromJson(node).toTrade(), TradeChange.Kind.INSERT);
    }

    /**
     * Stage retractions from raw JSON records.
     */
    public IngestReport retractJson(List<JsonNode> records) {
        return stage(records, node -> TradeRequest.fromJson(node).toTrade(), TradeChange.Kind.RETRACT);
    }

    /**
     * Stage already-validated trades as insertions.
     */
    public void submitTrades(Collection<Trade> trades) {
        for (Trade trade : trades) {
            session.insert(trade);
        }
        acceptedCount.addAndGet(trades.size());
    }

    private <T> IngestReport stage(List<T> requests, Function<T, Trade> parser, TradeChange.Kind kind) {
        List<IngestReport.Rejection> rejections = new ArrayList<>();
        int accepted = 0;
        for (int i = 0; i < requests.size(); i++) {
            T request = requests.get(i);
            try {
                if (request == null) throw new InvalidTradeException("Trade must not be null");
                session.update(new TradeChange(kind, parser.apply(request)));
                accepted++;
            } catch (InvalidTradeException e) {
                log.warn("Rejected trade #{} ({}): {}", i, kind, e.getMessage());
                rejections.add(new IngestReport.Rejection(i, e.getMessage()));
            }
        }
        acceptedCount.addAndGet(accepted);
        rejectedCount.addAndGet(rejections.size());
        log.debug("Staged {} {} diffs, rejected {}", accepted, kind, rejections.size());
        return new IngestReport(accepted, List.copyOf(rejections), -1);
    }

    /**
     * Advance the logical clock by one tick past the last commit and flush the stage.
     *
     * @return the last committed logical time, unchanged if nothing was staged
     */
    public long commit() {
        commitLock.lock();
        try {
            long next = Math.max(session.pendingTime(), session.committedTime() + 1);
            session.advanceTo(next);
            int diffs = session.flush();
            log.debug("Commit time={} diffs={}", next, diffs);
            return session.committedTime();
        } finally {
            commitLock.unlock();
        }
    }

    public long committedTime() {
        return session.committedTime();
    }

    public long acceptedCount() {
        return acceptedCount.get();
    }

    public long rejectedCount() {
        return rejectedCount.get();
    }
}

package com.hourlyhigh.generator;

import com.hourlyhigh.model.Trade;
import com.hourlyhigh.service.TradeIngestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synthetic trade generator.
 *
 * <p>Trades are unevenly spread across categories: category {@code i} (1-based) gets weight
 * {@code 1 / i^exponent}, normalised to sum to 1, and exactly {@code round(weight * total)} trades.
 * Timestamps are uniform over June to December 2024, prices uniform in {@code [1.00, 100000.00)} with two
 * fractional digits.
 *
 * <p>Each scheduled run stages one batch and commits it under the next logical time. Stopping the
 * application midway leaves every committed batch in place.
 */
@Component
@ConditionalOnProperty(name = "hourly.generator.enabled", havingValue = "true", matchIfMissing = true)
public class SyntheticTradeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticTradeGenerator.class);

    /** 2024-06-01 00:00:00 UTC */
    public static final long START_TIME = 1717192800L;
    /** 2024-12-31 23:59:59 UTC */
    public static final long END_TIME = 1735599599L;

    private static final long MIN_PRICE_CENTS = 100L;
    private static final long MAX_PRICE_CENTS = 10_000_000L;

    private final TradeIngestService ingestService;
    private final int[] plan;
    private final int batchSize;
    private final Random random;
    private final AtomicLong generated = new AtomicLong(0);

    /** Generation cursor. Guarded by {@code this}. */
    private int category = 0;
    private int producedInCategory = 0;

    public SyntheticTradeGenerator(
            TradeIngestService ingestService,
            @Value("${hourly.generator.trades:20000000}") long totalTrades,
            @Value("${hourly.generator.categories:700}") int categories,
            @Value("${hourly.generator.exponent:1.3}") double exponent,
            @Value("${hourly.generator.batch-size:100000}") int batchSize,
            @Value("${hourly.generator.seed:0}") long seed) {
        if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be positive");
        this.ingestService = ingestService;
        this.plan = plan(totalTrades, categories, exponent);
        this.batchSize = batchSize;
        this.random = seed == 0 ? new Random() : new Random(seed);

        log.info("SyntheticTradeGenerator initialized: trades={} categories={} exponent={} batchSize={}",
                totalTrades, categories, exponent, batchSize);
    }

    /**
     * Normalised weights {@code 1 / i^exponent} for {@code i = 1..categories}.
     */
    public static double[] weights(int categories, double exponent) {
        if (categories <= 0) throw new IllegalArgumentException("Categories must be positive");
        double[] weights = new double[categories];
        double sum = 0;
        for (int i = 0; i < categories; i++) {
            weights[i] = 1.0 / Math.pow(i + 1, exponent);
            sum += weights[i];
        }
        for (int i = 0; i < categories; i++) {
            weights[i] /= sum;
        }
        return weights;
    }

    /**
     * Number of trades per category: {@code round(weight * totalTrades)}.
     */
    public static int[] plan(long totalTrades, int categories, double exponent) {
        if (totalTrades < 0) throw new IllegalArgumentException("Trade count must be non-negative");
        double[] weights = weights(categories, exponent);
        int[] counts = new int[categories];
        for (int i = 0; i < categories; i++) {
            counts[i] = Math.toIntExact(Math.round(weights[i] * totalTrades));
        }
        return counts;
    }

    /**
     * Stage and commit one batch. Rate is controlled by {@code hourly.generator.interval-ms}.
     */
    @Scheduled(fixedDelayString = "${hourly.generator.interval-ms:100}")
    public void generate() {
        List<Trade> batch = nextBatch();
        if (batch.isEmpty()) return;

        ingestService.submitTrades(batch);
        long time = ingestService.commit();

        long count = generated.addAndGet(batch.size());
        if (isFinished()) {
            log.info("Generation finished: {} trades, last time={}", count, time);
        } else {
            log.info("Generated {} trades so far, time={}", count, time);
        }
    }

    /**
     * Generate and commit everything that is left. Returns the number of trades generated by this call.
     */
    public long runToCompletion() {
        long before = generated.get();
        while (!isFinished()) {
            generate();
        }
        return generated.get() - before;
    }

    synchronized List<Trade> nextBatch() {
        List<Trade> batch = new ArrayList<>(batchSize);
        while (batch.size() < batchSize && category < plan.length) {
            if (producedInCategory >= plan[category]) {
                category++;
                producedInCategory = 0;
                continue;
            }
            batch.add(randomTrade(category));
            producedInCategory++;
        }
        return batch;
    }

    private Trade randomTrade(int category) {
        long timestamp = START_TIME + random.nextLong(END_TIME - START_TIME + 1);
        long cents = MIN_PRICE_CENTS + random.nextLong(MAX_PRICE_CENTS - MIN_PRICE_CENTS);
        return new Trade(timestamp, category, BigDecimal.valueOf(cents, 2));
    }

    public synchronized boolean isFinished() {
        while (category < plan.length && producedInCategory >= plan[category]) {
            category++;
            producedInCategory = 0;
        }
        return category >= plan.length;
    }

    /**
     * Total trades generated since startup, exposed for status.
     */
    public long getGeneratedCount() {
        return generated.get();
    }

    public int[] getPlan() {
        return plan.clone();
    }
}

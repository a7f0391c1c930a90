package com.hourlyhigh.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hourlyhigh.engine.GroupReduceEngine;
import com.hourlyhigh.model.GroupKey;
import com.hourlyhigh.model.Interval;
import com.hourlyhigh.session.InputSession;
import com.hourlyhigh.sink.HourlyHighStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TradeIngestService")
class TradeIngestServiceTest {

    private static final long HOUR = 1717200000L;

    private HourlyHighStore store;
    private GroupReduceEngine engine;
    private TradeIngestService service;

    @BeforeEach
    void setUp() {
        store = new HourlyHighStore();
        engine = new GroupReduceEngine(Interval.ONE_HOUR, 2, Runnable::run);
        engine.subscribe(store);
        service = new TradeIngestService(new InputSession(engine));
    }

    @Test
    @DisplayName("Malformed trades are reported one by one while the rest are committed")
    void partialBatch() {
        IngestReport report = service.submit(Arrays.asList(
                new TradeRequest(HOUR, 1, "10.00"),
                new TradeRequest(HOUR, -4, "11"),
                new TradeRequest(HOUR + 60, 1, "12.5"),
                new TradeRequest(null, 1, "13"),
                new TradeRequest(HOUR, 2, "0." + "1".repeat(30)),
                new TradeRequest(HOUR, 2, "abc"),
                null,
                new TradeRequest(HOUR + 120, 2, "7")));

        assertThat(report.accepted()).isEqualTo(3);
        assertThat(report.rejected()).extracting(IngestReport.Rejection::index).containsExactly(1, 3, 4, 5, 6);
        assertThat(report.rejected().get(2).reason()).contains("fractional digits");
        assertThat(store.size()).isZero();

        long time = service.commit();

        assertThat(time).isZero();
        assertThat(store.get(new GroupKey(HOUR, 1)))
                .hasValueSatisfying(h -> assertThat(h.high()).isEqualByComparingTo("12.5"));
        assertThat(store.get(new GroupKey(HOUR, 2)))
                .hasValueSatisfying(h -> assertThat(h.high()).isEqualByComparingTo("7"));
        assertThat(service.acceptedCount()).isEqualTo(3);
        assertThat(service.rejectedCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Raw JSON records with wrong field types are rejected one by one")
    void jsonRecordsTypedPerRecord() throws Exception {
        List<JsonNode> records = new ArrayList<>();
        new ObjectMapper().readTree("["
                + "{\"timestamp\":1717200000,\"category\":3,\"price\":\"9.50\"},"
                + "{\"timestamp\":\"yesterday\",\"category\":3,\"price\":\"1\"},"
                + "{\"timestamp\":1717200000,\"category\":3000000000,\"price\":\"1\"},"
                + "{\"timestamp\":1717200000,\"category\":3,\"price\":{\"amount\":1}},"
                + "\"not a trade\","
                + "{\"timestamp\":\"1717203600\",\"category\":3,\"price\":12.25},"
                + "{\"category\":3,\"price\":\"1\"}"
                + "]").forEach(records::add);

        IngestReport report = service.submitJson(records);

        assertThat(report.accepted()).isEqualTo(2);
        assertThat(report.rejected()).extracting(IngestReport.Rejection::index).containsExactly(1, 2, 3, 4, 6);
        assertThat(report.rejected()).extracting(IngestReport.Rejection::reason).containsExactly(
                "Timestamp is not an integer: yesterday",
                "Category is not a 32-bit integer: 3000000000",
                "Price is not a decimal number: {\"amount\":1}",
                "Trade must be a JSON object",
                "Timestamp is required");

        service.commit();
        assertThat(store.get(new GroupKey(HOUR, 3)))
                .hasValueSatisfying(h -> assertThat(h.high()).isEqualByComparingTo("9.5"));
        assertThat(store.get(new GroupKey(HOUR + 3600, 3)))
                .hasValueSatisfying(h -> assertThat(h.high()).isEqualByComparingTo("12.25"));
    }

    @Test
    @DisplayName("Each commit advances the logical clock by one")
    void commitsAdvanceClock() {
        service.submit(List.of(new TradeRequest(HOUR, 1, "10")));
        assertThat(service.commit()).isEqualTo(0);
        service.submit(List.of(new TradeRequest(HOUR, 1, "20")));
        assertThat(service.commit()).isEqualTo(1);
        service.retract(List.of(new TradeRequest(HOUR, 1, "20")));
        assertThat(service.commit()).isEqualTo(2);

        assertThat(engine.lastTime()).isEqualTo(2);
        assertThat(store.get(new GroupKey(HOUR, 1)))
                .hasValueSatisfying(h -> assertThat(h.high()).isEqualByComparingTo("10"));
    }

    @Test
    @DisplayName("Committing with nothing staged keeps the committed time")
    void emptyCommit() {
        assertThat(service.commit()).isEqualTo(-1);
        service.submit(List.of(new TradeRequest(HOUR, 1, "10")));
        assertThat(service.commit()).isEqualTo(0);
        assertThat(service.commit()).isEqualTo(0);
        assertThat(engine.batchesProcessed()).isEqualTo(1);
    }
}

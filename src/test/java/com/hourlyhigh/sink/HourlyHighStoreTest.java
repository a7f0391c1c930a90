package com.hourlyhigh.sink;

import com.hourlyhigh.event.HighDiff;
import com.hourlyhigh.model.GroupKey;
import com.hourlyhigh.model.HourlyHigh;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HourlyHighStore")
class HourlyHighStoreTest {

    private HourlyHighStore store;

    private static HourlyHigh row(long bucket, int category, String high) {
        return new HourlyHigh(bucket, category, new BigDecimal(high));
    }

    @BeforeEach
    void setUp() {
        store = new HourlyHighStore();
    }

    @Test
    @DisplayName("Insertions materialize rows, queries return them sorted by bucket")
    void insertAndQuery() {
        store.onDiffs(1, List.of(
                HighDiff.insert(row(7200, 1, "3"), 1),
                HighDiff.insert(row(0, 1, "1"), 1),
                HighDiff.insert(row(3600, 1, "2"), 1),
                HighDiff.insert(row(0, 2, "9"), 1)));

        assertThat(store.query(1, 0, 7200)).extracting(HourlyHigh::bucket).containsExactly(0L, 3600L, 7200L);
        assertThat(store.query(1, 3600, 3600)).containsExactly(row(3600, 1, "2"));
        assertThat(store.query(3, 0, 7200)).isEmpty();
        assertThat(store.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("A retraction followed by an insertion replaces the row")
    void replace() {
        store.onDiffs(1, List.of(HighDiff.insert(row(0, 1, "10"), 1)));
        store.onDiffs(2, List.of(HighDiff.retract(row(0, 1, "10"), 2), HighDiff.insert(row(0, 1, "12"), 2)));

        assertThat(store.get(new GroupKey(0, 1))).contains(row(0, 1, "12"));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A second live row for the same key is refused")
    void secondLiveRowRefused() {
        store.onDiffs(1, List.of(HighDiff.insert(row(0, 1, "10"), 1)));
        assertThatThrownBy(() -> store.onDiffs(2, List.of(HighDiff.insert(row(0, 1, "11"), 2))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(new GroupKey(0, 1))).contains(row(0, 1, "10"));
    }

    @Test
    @DisplayName("A retraction must match the live row exactly")
    void mismatchedRetractionRefused() {
        store.onDiffs(1, List.of(HighDiff.insert(row(0, 1, "10"), 1)));
        assertThatThrownBy(() -> store.onDiffs(2, List.of(HighDiff.retract(row(0, 1, "9"), 2))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.onDiffs(2, List.of(HighDiff.retract(row(3600, 1, "10"), 2))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A batch with a contradicting diff is refused as a whole")
    void contradictingBatchLeavesTableUntouched() {
        store.onDiffs(1, List.of(HighDiff.insert(row(0, 1, "10"), 1), HighDiff.insert(row(0, 2, "20"), 1)));

        assertThatThrownBy(() -> store.onDiffs(2, List.of(
                HighDiff.retract(row(0, 1, "10"), 2),
                HighDiff.insert(row(0, 1, "11"), 2),
                HighDiff.insert(row(3600, 1, "5"), 2),
                HighDiff.retract(row(0, 2, "99"), 2))))
                .isInstanceOf(IllegalStateException.class);

        assertThat(store.get(new GroupKey(0, 1))).contains(row(0, 1, "10"));
        assertThat(store.get(new GroupKey(3600, 1))).isEmpty();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Retraction and insertion of the same key within one batch both apply")
    void retractThenInsertInOneBatch() {
        store.onDiffs(1, List.of(HighDiff.insert(row(0, 1, "10"), 1)));
        store.onDiffs(2, List.of(
                HighDiff.retract(row(0, 1, "10"), 2),
                HighDiff.insert(row(0, 1, "8"), 2),
                HighDiff.insert(row(0, 3, "1"), 2)));

        assertThat(store.get(new GroupKey(0, 1))).contains(row(0, 1, "8"));
        assertThat(store.categories()).containsExactly(1, 3);
    }

    @Test
    @DisplayName("Missing groups read as no value")
    void missingGroup() {
        assertThat(store.get(new GroupKey(0, 1))).isEmpty();
    }

    @Test
    @DisplayName("categories lists distinct live categories sorted; clear empties the table")
    void categoriesAndClear() {
        store.onDiffs(1, List.of(
                HighDiff.insert(row(0, 9, "1"), 1),
                HighDiff.insert(row(0, 2, "1"), 1),
                HighDiff.insert(row(3600, 2, "1"), 1)));
        assertThat(store.categories()).containsExactly(2, 9);

        store.clear();
        assertThat(store.size()).isZero();
    }
}

package com.hourlyhigh.model;

import com.hourlyhigh.error.InvalidTradeException;
import com.hourlyhigh.error.PrecisionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Trade and price policy")
class TradeTest {

    @Test
    @DisplayName("Numerically equal prices make equal trades")
    void canonicalPrice() {
        Trade a = new Trade(100, 1, new BigDecimal("10.00"));
        Trade b = new Trade(100, 1, new BigDecimal("10"));
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.price()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Zero in any scale is the same price")
    void zeroPrice() {
        assertThat(new Trade(0, 0, new BigDecimal("0.000")).price()).isEqualTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Negative category is rejected")
    void negativeCategory() {
        assertThatThrownBy(() -> new Trade(0, -1, BigDecimal.ONE))
                .isInstanceOf(InvalidTradeException.class)
                .hasMessageContaining("Category");
    }

    @Test
    @DisplayName("Null price is rejected")
    void nullPrice() {
        assertThatThrownBy(() -> new Trade(0, 1, null)).isInstanceOf(InvalidTradeException.class);
    }

    @Test
    @DisplayName("More than 28 fractional digits raises PrecisionException instead of rounding")
    void tooManyFractionalDigits() {
        BigDecimal fine = new BigDecimal("0." + "1".repeat(28));
        assertThat(new Trade(0, 1, fine).price()).isEqualTo(fine);

        BigDecimal tooFine = new BigDecimal("0." + "1".repeat(29));
        assertThatThrownBy(() -> new Trade(0, 1, tooFine)).isInstanceOf(PrecisionException.class);
    }

    @Test
    @DisplayName("A mantissa wider than 96 bits raises PrecisionException")
    void mantissaTooWide() {
        BigDecimal max = new BigDecimal(java.math.BigInteger.TWO.pow(96).subtract(java.math.BigInteger.ONE));
        assertThat(PricePolicy.canonical(max)).isEqualByComparingTo(max);

        BigDecimal over = new BigDecimal(java.math.BigInteger.TWO.pow(96));
        assertThatThrownBy(() -> PricePolicy.canonical(over)).isInstanceOf(PrecisionException.class);
        assertThatThrownBy(() -> PricePolicy.canonical(new BigDecimal("1E+30"))).isInstanceOf(PrecisionException.class);
    }

    @Test
    @DisplayName("Trailing zeros do not count against precision")
    void trailingZerosIgnored() {
        BigDecimal padded = new BigDecimal("1." + "0".repeat(40));
        assertThat(PricePolicy.canonical(padded)).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("parse rejects blank and non-numeric text")
    void parseRejectsGarbage() {
        assertThat(PricePolicy.parse(" 15.00 ")).isEqualByComparingTo("15");
        assertThatThrownBy(() -> PricePolicy.parse("")).isInstanceOf(InvalidTradeException.class);
        assertThatThrownBy(() -> PricePolicy.parse(null)).isInstanceOf(InvalidTradeException.class);
        assertThatThrownBy(() -> PricePolicy.parse("ten")).isInstanceOf(InvalidTradeException.class);
    }
}

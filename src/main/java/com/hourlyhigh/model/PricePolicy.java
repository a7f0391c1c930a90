package com.hourlyhigh.model;

import com.hourlyhigh.error.InvalidTradeException;
import com.hourlyhigh.error.PrecisionException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact decimal rules for prices.
 *
 * <p>A representable price fits a 96-bit unsigned mantissa with at most 28 fractional
 * digits. Anything larger is rejected rather than rounded.
 */
public final class PricePolicy {

    public static final int MAX_SCALE = 28;
    public static final int MANTISSA_BITS = 96;

    private PricePolicy() {
    }

    /**
     * Validate a price and return its canonical form.
     *
     * @throws InvalidTradeException if the price is null
     * @throws PrecisionException    if the price is not representable
     */
    public static BigDecimal canonical(BigDecimal price) {
        if (price == null) throw new InvalidTradeException("Price must not be null");
        BigDecimal stripped = price.signum() == 0 ? BigDecimal.ZERO : price.stripTrailingZeros();
        if (stripped.scale() > MAX_SCALE) {
            throw new PrecisionException("Price " + price.toPlainString()
                    + " has more than " + MAX_SCALE + " fractional digits");
        }
        BigInteger mantissa = stripped.scale() < 0
                ? stripped.setScale(0).unscaledValue()
                : stripped.unscaledValue();
        if (mantissa.abs().bitLength() > MANTISSA_BITS) {
            throw new PrecisionException("Price " + price.toPlainString()
                    + " exceeds " + MANTISSA_BITS + "-bit decimal precision");
        }
        return stripped;
    }

    /**
     * Parse a textual price without going through floating point.
     *
     * @throws InvalidTradeException if the text is blank or not a decimal number
     * @throws PrecisionException    if the value is not representable
     */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) throw new InvalidTradeException("Price must not be blank");
        BigDecimal value;
        try {
            value = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidTradeException("Price is not a decimal number: " + text, e);
        }
        return canonical(value);
    }
}

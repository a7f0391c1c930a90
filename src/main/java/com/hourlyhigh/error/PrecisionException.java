package com.hourlyhigh.error;

/**
 * A price cannot be represented exactly. Prices are never silently truncated.
 */
public class PrecisionException extends InvalidTradeException {

    public PrecisionException(String message) {
        super(message);
    }
}

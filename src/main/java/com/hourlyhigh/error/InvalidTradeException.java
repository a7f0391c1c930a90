package com.hourlyhigh.error;

/**
 * A submitted trade is malformed and was rejected before reaching aggregation state.
 */
public class InvalidTradeException extends IllegalArgumentException {

    public InvalidTradeException(String message) {
        super(message);
    }

    public InvalidTradeException(String message, Throwable cause) {
        super(message, cause);
    }
}

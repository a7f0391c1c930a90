package com.hourlyhigh.sink;

/**
 * Handle returned by a subscription. Closing it stops delivery; closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}

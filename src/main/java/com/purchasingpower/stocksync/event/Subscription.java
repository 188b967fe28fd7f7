package com.purchasingpower.stocksync.event;

/**
 * Handle for a registered listener. Closing it stops further deliveries; closing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}

package com.purchasingpower.stocksync.event;

/**
 * Callback for {@link EntityChangeEvent}s, invoked on the thread that committed the change.
 */
@FunctionalInterface
public interface EntityChangeListener {

    void onEntityChanged(EntityChangeEvent event);
}

package com.purchasingpower.stocksync.event;

/**
 * Broadcasts entity change notifications to subscribed listeners.
 *
 * <p>The bus is owned by the application's composition root and injected wherever
 * changes are published or observed.
 *
 * <p>Contract:
 * <ul>
 *   <li>delivery is synchronous, on the publishing thread</li>
 *   <li>listeners are called in subscription order, each exactly once per event</li>
 *   <li>a listener that publishes from inside its callback recurses on the same stack</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface EntityChangeBus {

    /**
     * Register a listener for all future events.
     *
     * @return a subscription that removes the listener when closed
     */
    Subscription subscribe(EntityChangeListener listener);

    /**
     * Deliver an event to every listener subscribed at the moment of the call.
     */
    void publish(EntityChangeEvent event);

    /**
     * Number of live subscriptions.
     */
    int subscriberCount();
}

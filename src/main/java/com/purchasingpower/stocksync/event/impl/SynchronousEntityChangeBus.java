package com.purchasingpower.stocksync.event.impl;

import com.purchasingpower.stocksync.event.EntityChangeBus;
import com.purchasingpower.stocksync.event.EntityChangeEvent;
import com.purchasingpower.stocksync.event.EntityChangeListener;
import com.purchasingpower.stocksync.event.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link EntityChangeBus} delivering on the publishing thread.
 *
 * <p>Each publish iterates a snapshot of the listener list: a listener subscribed from
 * inside a callback first hears the next event, a listener closed mid-broadcast is skipped.
 * A listener that throws aborts the broadcast and the exception reaches the publisher.
 */
@Slf4j
public class SynchronousEntityChangeBus implements EntityChangeBus {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(EntityChangeListener listener) {
        Registration registration = new Registration(Objects.requireNonNull(listener, "listener"));
        registrations.add(registration);
        log.debug("Listener subscribed, {} active", registrations.size());
        return registration;
    }

    @Override
    public void publish(EntityChangeEvent event) {
        log.debug("Publishing change of {} to {} listeners",
                event.entityType().getSimpleName(), registrations.size());
        for (Registration registration : registrations) {
            if (registration.active) {
                registration.listener.onEntityChanged(event);
            }
        }
    }

    @Override
    public int subscriberCount() {
        return registrations.size();
    }

    private final class Registration implements Subscription {

        private final EntityChangeListener listener;
        private volatile boolean active = true;

        private Registration(EntityChangeListener listener) {
            this.listener = listener;
        }

        @Override
        public void close() {
            if (active) {
                active = false;
                registrations.remove(this);
                log.debug("Listener unsubscribed, {} active", registrations.size());
            }
        }
    }
}

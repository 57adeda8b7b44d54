package com.cinematic.engine.events;

/**
 * Handle of a live event subscription. Closing it stops delivery.
 */
public interface EventSubscription extends AutoCloseable {

    @Override
    void close();
}

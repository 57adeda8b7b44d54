package com.cinematic.engine.events;

import com.cinematic.core.model.StageEvent;

/**
 * Receives state-change events of a subscribed project.
 */
@FunctionalInterface
public interface StageEventListener {

    void onEvent(StageEvent event);
}

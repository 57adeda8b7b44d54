package com.cinematic.core.repository;

import com.cinematic.core.model.StageEvent;

import java.util.List;
import java.util.UUID;

/**
 * Store of state-change events, ordered per project by sequence number.
 */
public interface EventRepository {

    /**
     * Append an event. An event stored earlier under the same project and
     * sequence number is replaced.
     *
     * @param event The event to append
     */
    void append(StageEvent event);

    /**
     * Find events of a project with a sequence number greater than {@code afterSequence}.
     *
     * @param projectId The project ID
     * @param afterSequence Exclusive lower bound; 0 returns everything
     * @return Events ordered by sequence number
     */
    List<StageEvent> findByProjectAfter(UUID projectId, long afterSequence);

    /**
     * Get the highest sequence number recorded for a project.
     *
     * @param projectId The project ID
     * @return The last sequence number, or 0 if the project has no events
     */
    long getLastSequenceNumber(UUID projectId);

    /**
     * Delete every event of a project.
     *
     * @param projectId The project ID
     */
    void deleteByProject(UUID projectId);
}

package com.cinematic.engine.persistence;

import com.cinematic.core.model.StageEvent;
import com.cinematic.core.repository.EventRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of EventRepository.
 * Events of a project are kept in sequence order.
 */
public class InMemoryEventRepository implements EventRepository {

    private final Map<UUID, List<StageEvent>> events = new ConcurrentHashMap<>();

    @Override
    public void append(StageEvent event) {
        List<StageEvent> projectEvents = events.computeIfAbsent(event.projectId(), id -> new CopyOnWriteArrayList<>());
        synchronized (projectEvents) {
            if (projectEvents.removeIf(e -> e.sequenceNumber() == event.sequenceNumber())) {
                projectEvents.add(event);
                projectEvents.sort(Comparator.comparingLong(StageEvent::sequenceNumber));
            } else {
                projectEvents.add(event);
            }
        }
    }

    @Override
    public List<StageEvent> findByProjectAfter(UUID projectId, long afterSequence) {
        List<StageEvent> projectEvents = events.get(projectId);
        if (projectEvents == null) {
            return List.of();
        }
        return projectEvents.stream()
            .filter(e -> e.sequenceNumber() > afterSequence)
            .toList();
    }

    @Override
    public long getLastSequenceNumber(UUID projectId) {
        List<StageEvent> projectEvents = events.get(projectId);
        if (projectEvents == null || projectEvents.isEmpty()) {
            return 0;
        }
        return projectEvents.get(projectEvents.size() - 1).sequenceNumber();
    }

    @Override
    public void deleteByProject(UUID projectId) {
        events.remove(projectId);
    }
}

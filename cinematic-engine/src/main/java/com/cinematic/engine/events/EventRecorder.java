package com.cinematic.engine.events;

import com.cinematic.core.model.StageEvent;
import com.cinematic.core.model.StageEventType;
import com.cinematic.core.model.StageState;
import com.cinematic.core.repository.EventRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Numbers, stores and fans out state-change events.
 *
 * Events go through three steps, all taken under the owning project's
 * serialization: {@link #prepare} numbers them after the last published
 * event, {@link #store} writes them together with the transition they
 * describe, and {@link #publish} advances the sequence and notifies
 * subscribers once that write succeeded. A failed write publishes nothing, so
 * the same sequence numbers are handed out again. Listeners are called on a
 * single notifier thread, which keeps delivery in sequence order.
 */
public class EventRecorder {

    private static final Logger log = LoggerFactory.getLogger(EventRecorder.class);

    /**
     * An event before it is numbered.
     *
     * @param stageId null for project-level events
     * @param payload event details, may be empty
     */
    public record Draft(
        StageEventType type,
        String stageId,
        StageState state,
        Map<String, ?> payload,
        String actor
    ) {}

    private final EventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final Map<UUID, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<UUID, List<StageEventListener>> listeners = new ConcurrentHashMap<>();
    private final ExecutorService notifier;

    public EventRecorder(EventRepository eventRepository, ObjectMapper objectMapper) {
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        this.notifier = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "event-notifier");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Number drafts after the last published event of the project.
     * Nothing is written and the sequence does not move.
     *
     * @param percent progress reported with every event of the batch
     */
    public List<StageEvent> prepare(UUID projectId, List<Draft> drafts, int percent) {
        long last = sequences.computeIfAbsent(projectId,
            id -> new AtomicLong(eventRepository.getLastSequenceNumber(id))).get();

        List<StageEvent> prepared = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            JsonNode payloadNode = draft.payload() == null || draft.payload().isEmpty()
                ? objectMapper.createObjectNode()
                : objectMapper.valueToTree(draft.payload());
            prepared.add(StageEvent.create(projectId, ++last, draft.type(), draft.stageId(), draft.state(),
                percent, payloadNode, draft.actor()));
        }
        return prepared;
    }

    /**
     * Write prepared events. Rewriting a sequence number replaces the earlier event.
     */
    public void store(List<StageEvent> events) {
        for (StageEvent event : events) {
            eventRepository.append(event);
        }
    }

    /**
     * Mark stored events as committed and deliver them to subscribers.
     */
    public void publish(List<StageEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        StageEvent last = events.get(events.size() - 1);
        sequences.computeIfAbsent(last.projectId(), id -> new AtomicLong()).set(last.sequenceNumber());
        for (StageEvent event : events) {
            log.debug("Event #{} {} {} ({}%)", event.sequenceNumber(), event.type(),
                event.stageId() != null ? event.stageId() : "", event.percent());
            notifyListeners(event);
        }
    }

    public List<StageEvent> events(UUID projectId, long afterSequence) {
        return eventRepository.findByProjectAfter(projectId, afterSequence);
    }

    public EventSubscription subscribe(UUID projectId, StageEventListener listener) {
        List<StageEventListener> projectListeners =
            listeners.computeIfAbsent(projectId, id -> new CopyOnWriteArrayList<>());
        projectListeners.add(listener);
        return () -> projectListeners.remove(listener);
    }

    public int subscriberCount(UUID projectId) {
        List<StageEventListener> projectListeners = listeners.get(projectId);
        return projectListeners != null ? projectListeners.size() : 0;
    }

    /**
     * Drop the events, sequence and subscribers of a deleted project.
     */
    public void forget(UUID projectId) {
        eventRepository.deleteByProject(projectId);
        sequences.remove(projectId);
        listeners.remove(projectId);
    }

    public void shutdown() {
        notifier.shutdown();
        try {
            if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
                notifier.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifier.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========== Internal Methods ==========

    private void notifyListeners(StageEvent event) {
        List<StageEventListener> projectListeners = listeners.get(event.projectId());
        if (projectListeners == null || projectListeners.isEmpty()) {
            return;
        }
        try {
            notifier.execute(() -> {
                for (StageEventListener listener : projectListeners) {
                    try {
                        listener.onEvent(event);
                    } catch (Exception e) {
                        log.warn("Event listener failed for event #{} of project {}: {}",
                            event.sequenceNumber(), event.projectId(), e.getMessage());
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Notifier stopped; event #{} not delivered to subscribers", event.sequenceNumber());
        }
    }
}

package com.cinematic.api.rest;

import com.cinematic.core.model.StageEvent;
import com.cinematic.core.model.StageEventType;
import com.cinematic.engine.events.EventSubscription;
import com.cinematic.engine.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State-change events of a project, polled or streamed.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/events")
public class EventController {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private static final Duration STREAM_TIMEOUT = Duration.ofMinutes(30);

    // No event can follow these
    private static final Set<StageEventType> FINAL_EVENTS =
        Set.of(StageEventType.PROJECT_COMPLETED, StageEventType.PROJECT_CANCELLED);

    private final PipelineService pipelineService;

    public EventController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping
    public ResponseEntity<List<StageEvent>> getEvents(
            @PathVariable UUID projectId,
            @RequestParam(defaultValue = "0") long after) {
        return ResponseEntity.ok(pipelineService.events(projectId, after));
    }

    /**
     * Replay events after the given sequence, then stream new ones as Server-Sent Events.
     */
    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @PathVariable UUID projectId,
            @RequestParam(defaultValue = "0") long after) {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT.toMillis());
        EventStream stream = new EventStream(projectId, emitter, after);

        // Replay and subscription share the stream lock so nothing is sent twice or out of order
        synchronized (stream) {
            stream.subscription.set(pipelineService.subscribe(projectId, stream::send));
            for (StageEvent event : pipelineService.events(projectId, after)) {
                stream.send(event);
            }
        }

        emitter.onCompletion(stream::close);
        emitter.onTimeout(stream::close);
        emitter.onError(e -> stream.close());
        return emitter;
    }

    private static final class EventStream {

        private final UUID projectId;
        private final SseEmitter emitter;
        private final AtomicReference<EventSubscription> subscription = new AtomicReference<>();
        private long lastSent;
        private boolean closed;

        EventStream(UUID projectId, SseEmitter emitter, long after) {
            this.projectId = projectId;
            this.emitter = emitter;
            this.lastSent = after;
        }

        synchronized void send(StageEvent event) {
            if (closed || event.sequenceNumber() <= lastSent) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.sequenceNumber()))
                    .name(event.type().name())
                    .data(event, MediaType.APPLICATION_JSON));
                lastSent = event.sequenceNumber();
            } catch (IOException e) {
                log.debug("Event stream of project {} closed by client: {}", projectId, e.getMessage());
                close();
                return;
            }
            if (FINAL_EVENTS.contains(event.type())) {
                close();
                emitter.complete();
            }
        }

        synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            EventSubscription current = subscription.getAndSet(null);
            if (current != null) {
                current.close();
            }
        }
    }
}

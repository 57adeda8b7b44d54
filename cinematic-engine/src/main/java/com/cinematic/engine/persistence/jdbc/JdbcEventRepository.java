package com.cinematic.engine.persistence.jdbc;

import com.cinematic.core.model.StageEvent;
import com.cinematic.core.model.StageEventType;
import com.cinematic.core.model.StageState;
import com.cinematic.core.repository.EventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of EventRepository.
 * Events are immutable and unique per (project, sequence number).
 */
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EventRowMapper rowMapper;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EventRowMapper();
    }

    @Override
    public void append(StageEvent event) {
        String sql = """
            INSERT INTO stage_events (
                event_id, project_id, sequence_number, event_type,
                stage_id, state, percent, event_timestamp, payload, actor
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (project_id, sequence_number) DO UPDATE SET
                event_id = EXCLUDED.event_id,
                event_type = EXCLUDED.event_type,
                stage_id = EXCLUDED.stage_id,
                state = EXCLUDED.state,
                percent = EXCLUDED.percent,
                event_timestamp = EXCLUDED.event_timestamp,
                payload = EXCLUDED.payload,
                actor = EXCLUDED.actor
            """;

        PersistenceGuard.run("append event", () -> jdbcTemplate.update(sql,
            event.eventId(),
            event.projectId(),
            event.sequenceNumber(),
            event.type().name(),
            event.stageId(),
            event.state() != null ? event.state().name() : null,
            event.percent(),
            Timestamp.from(event.timestamp()),
            serializePayload(event.payload()),
            event.actor()
        ));
        log.trace("Appended event {} (seq={}) for project {}", event.type(), event.sequenceNumber(), event.projectId());
    }

    @Override
    public List<StageEvent> findByProjectAfter(UUID projectId, long afterSequence) {
        String sql = """
            SELECT * FROM stage_events
            WHERE project_id = ? AND sequence_number > ?
            ORDER BY sequence_number ASC
            """;
        return PersistenceGuard.call("find events",
            () -> jdbcTemplate.query(sql, rowMapper, projectId, afterSequence));
    }

    @Override
    public long getLastSequenceNumber(UUID projectId) {
        String sql = """
            SELECT COALESCE(MAX(sequence_number), 0)
            FROM stage_events
            WHERE project_id = ?
            """;
        Long seq = PersistenceGuard.call("last event sequence",
            () -> jdbcTemplate.queryForObject(sql, Long.class, projectId));
        return seq != null ? seq : 0L;
    }

    @Override
    public void deleteByProject(UUID projectId) {
        PersistenceGuard.run("delete events",
            () -> jdbcTemplate.update("DELETE FROM stage_events WHERE project_id = ?", projectId));
    }

    private String serializePayload(JsonNode payload) {
        if (payload == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize payload: {}", e.getMessage());
            return "{}";
        }
    }

    private class EventRowMapper implements RowMapper<StageEvent> {
        @Override
        public StageEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            String state = rs.getString("state");
            return new StageEvent(
                UUID.fromString(rs.getString("event_id")),
                UUID.fromString(rs.getString("project_id")),
                rs.getLong("sequence_number"),
                StageEventType.valueOf(rs.getString("event_type")),
                rs.getString("stage_id"),
                state != null ? StageState.valueOf(state) : null,
                rs.getInt("percent"),
                rs.getTimestamp("event_timestamp").toInstant(),
                deserializePayload(rs.getString("payload")),
                rs.getString("actor")
            );
        }

        private JsonNode deserializePayload(String json) {
            if (json == null || json.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                log.warn("Failed to deserialize payload: {}", e.getMessage());
                return objectMapper.createObjectNode();
            }
        }
    }
}

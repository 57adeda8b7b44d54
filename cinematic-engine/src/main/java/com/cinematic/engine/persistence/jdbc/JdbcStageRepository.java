package com.cinematic.engine.persistence.jdbc;

import com.cinematic.core.model.ContentTarget;
import com.cinematic.core.model.FailureClass;
import com.cinematic.core.model.ResourceClass;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageKind;
import com.cinematic.core.model.StageState;
import com.cinematic.core.repository.StageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of StageRepository.
 *
 * A transition and its cascade are written in one transaction. The transaction
 * is opened explicitly so that failing to reach the database at its start is
 * reported as an outage like any other connectivity failure.
 */
public class JdbcStageRepository implements StageRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcStageRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final StageRowMapper rowMapper;

    public JdbcStageRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                               PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.rowMapper = new StageRowMapper();
    }

    @Override
    public void saveAll(List<Stage> stages) {
        String sql = """
            INSERT INTO stages (
                project_id, stage_id, stage_index, kind, scene_number, check_target,
                resource_class, depends_on, state, retry_count, failure_class,
                error_code, last_error, output_asset_key, retry_at,
                updated_at, started_at, completed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        PersistenceGuard.run("save stages", () -> transactionTemplate.executeWithoutResult(status ->
            jdbcTemplate.batchUpdate(sql, stages, stages.size(), (ps, stage) -> {
                ps.setObject(1, stage.projectId());
                ps.setString(2, stage.stageId());
                ps.setInt(3, stage.index());
                ps.setString(4, stage.kind().name());
                ps.setObject(5, stage.sceneNumber(), Types.INTEGER);
                ps.setString(6, stage.checkTarget() != null ? stage.checkTarget().name() : null);
                ps.setString(7, stage.resourceClass().name());
                ps.setString(8, toJson(stage.dependsOn()));
                ps.setString(9, stage.state().name());
                ps.setInt(10, stage.retryCount());
                ps.setString(11, stage.failureClass() != null ? stage.failureClass().name() : null);
                ps.setString(12, stage.errorCode());
                ps.setString(13, stage.lastError());
                ps.setString(14, stage.outputAssetKey());
                ps.setTimestamp(15, toTimestamp(stage.retryAt()));
                ps.setTimestamp(16, toTimestamp(stage.updatedAt()));
                ps.setTimestamp(17, toTimestamp(stage.startedAt()));
                ps.setTimestamp(18, toTimestamp(stage.completedAt()));
            })));
        log.debug("Saved {} stages", stages.size());
    }

    @Override
    public void updateAll(List<Stage> stages) {
        if (stages.isEmpty()) {
            return;
        }
        String sql = """
            UPDATE stages SET
                state = ?,
                retry_count = ?,
                failure_class = ?,
                error_code = ?,
                last_error = ?,
                output_asset_key = ?,
                retry_at = ?,
                updated_at = ?,
                started_at = ?,
                completed_at = ?
            WHERE project_id = ? AND stage_id = ?
            """;

        PersistenceGuard.run("update stages", () -> transactionTemplate.executeWithoutResult(status -> {
            int[][] counts = jdbcTemplate.batchUpdate(sql, stages, stages.size(), (ps, stage) -> {
                ps.setString(1, stage.state().name());
                ps.setInt(2, stage.retryCount());
                ps.setString(3, stage.failureClass() != null ? stage.failureClass().name() : null);
                ps.setString(4, stage.errorCode());
                ps.setString(5, stage.lastError());
                ps.setString(6, stage.outputAssetKey());
                ps.setTimestamp(7, toTimestamp(stage.retryAt()));
                ps.setTimestamp(8, toTimestamp(stage.updatedAt()));
                ps.setTimestamp(9, toTimestamp(stage.startedAt()));
                ps.setTimestamp(10, toTimestamp(stage.completedAt()));
                ps.setObject(11, stage.projectId());
                ps.setString(12, stage.stageId());
            });
            for (int[] batch : counts) {
                for (int rows : batch) {
                    if (rows == 0) {
                        // Rolls back the whole batch
                        throw new IncorrectResultSizeDataAccessException("Stage update matched no row", 1, 0);
                    }
                }
            }
        }));
    }

    @Override
    public List<Stage> findByProject(UUID projectId) {
        String sql = """
            SELECT * FROM stages
            WHERE project_id = ?
            ORDER BY stage_index ASC
            """;
        return PersistenceGuard.call("find stages", () -> jdbcTemplate.query(sql, rowMapper, projectId));
    }

    @Override
    public List<Stage> findByState(StageState state, int limit) {
        String sql = """
            SELECT * FROM stages
            WHERE state = ?
            ORDER BY updated_at ASC
            LIMIT ?
            """;
        return PersistenceGuard.call("find stages by state",
            () -> jdbcTemplate.query(sql, rowMapper, state.name(), limit));
    }

    @Override
    public void deleteByProject(UUID projectId) {
        PersistenceGuard.run("delete stages",
            () -> jdbcTemplate.update("DELETE FROM stages WHERE project_id = ?", projectId));
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Dependencies cannot be serialized", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class StageRowMapper implements RowMapper<Stage> {
        @Override
        public Stage mapRow(ResultSet rs, int rowNum) throws SQLException {
            List<String> dependsOn;
            try {
                dependsOn = objectMapper.readValue(rs.getString("depends_on"), STRING_LIST);
            } catch (JsonProcessingException e) {
                throw new SQLException("Unreadable dependencies of stage " + rs.getString("stage_id"), e);
            }
            int sceneNumber = rs.getInt("scene_number");
            Integer scene = rs.wasNull() ? null : sceneNumber;
            String checkTarget = rs.getString("check_target");
            String failureClass = rs.getString("failure_class");

            return new Stage(
                UUID.fromString(rs.getString("project_id")),
                rs.getString("stage_id"),
                rs.getInt("stage_index"),
                StageKind.valueOf(rs.getString("kind")),
                scene,
                checkTarget != null ? ContentTarget.valueOf(checkTarget) : null,
                ResourceClass.valueOf(rs.getString("resource_class")),
                dependsOn,
                StageState.valueOf(rs.getString("state")),
                rs.getInt("retry_count"),
                failureClass != null ? FailureClass.valueOf(failureClass) : null,
                rs.getString("error_code"),
                rs.getString("last_error"),
                rs.getString("output_asset_key"),
                toInstant(rs.getTimestamp("retry_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at"))
            );
        }
    }
}

package com.cinematic.engine.persistence.jdbc;

import com.cinematic.core.exception.NotFoundException;
import com.cinematic.core.model.CompositionPolicy;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.Scene;
import com.cinematic.core.repository.ProjectRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ProjectRepository.
 * The scene list is immutable after submission and stored as JSONB.
 */
public class JdbcProjectRepository implements ProjectRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcProjectRepository.class);
    private static final TypeReference<List<Scene>> SCENE_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ProjectRowMapper rowMapper;

    public JdbcProjectRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new ProjectRowMapper();
    }

    @Override
    public void save(Project project) {
        String sql = """
            INSERT INTO projects (
                project_id, title, scenes, aspect_ratio, composition_policy,
                cancel_requested_at, final_asset_key, created_at, updated_at
            ) VALUES (?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            """;

        PersistenceGuard.run("save project", () -> jdbcTemplate.update(sql,
            project.projectId(),
            project.title(),
            toJson(project.scenes()),
            project.aspectRatio(),
            project.compositionPolicy().name(),
            toTimestamp(project.cancelRequestedAt()),
            project.finalAssetKey(),
            toTimestamp(project.createdAt()),
            toTimestamp(project.updatedAt())
        ));
        log.debug("Saved project {}", project.projectId());
    }

    @Override
    public void update(Project project) {
        String sql = """
            UPDATE projects SET
                cancel_requested_at = ?,
                final_asset_key = ?,
                updated_at = ?
            WHERE project_id = ?
            """;

        int rows = PersistenceGuard.call("update project", () -> jdbcTemplate.update(sql,
            toTimestamp(project.cancelRequestedAt()),
            project.finalAssetKey(),
            toTimestamp(Instant.now()),
            project.projectId()
        ));
        if (rows == 0) {
            throw new NotFoundException("Project", project.projectId().toString());
        }
    }

    @Override
    public Optional<Project> findById(UUID projectId) {
        String sql = "SELECT * FROM projects WHERE project_id = ?";
        List<Project> results = PersistenceGuard.call("find project",
            () -> jdbcTemplate.query(sql, rowMapper, projectId));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Project> findAll() {
        String sql = "SELECT * FROM projects ORDER BY created_at ASC";
        return PersistenceGuard.call("list projects", () -> jdbcTemplate.query(sql, rowMapper));
    }

    @Override
    public boolean delete(UUID projectId) {
        String sql = "DELETE FROM projects WHERE project_id = ?";
        return PersistenceGuard.call("delete project", () -> jdbcTemplate.update(sql, projectId)) > 0;
    }

    @Override
    public void ping() {
        PersistenceGuard.run("ping", () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }

    private String toJson(List<Scene> scenes) {
        try {
            return objectMapper.writeValueAsString(scenes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Scenes cannot be serialized", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class ProjectRowMapper implements RowMapper<Project> {
        @Override
        public Project mapRow(ResultSet rs, int rowNum) throws SQLException {
            List<Scene> scenes;
            try {
                scenes = objectMapper.readValue(rs.getString("scenes"), SCENE_LIST);
            } catch (JsonProcessingException e) {
                throw new SQLException("Unreadable scenes of project " + rs.getString("project_id"), e);
            }
            return new Project(
                UUID.fromString(rs.getString("project_id")),
                rs.getString("title"),
                scenes,
                rs.getString("aspect_ratio"),
                CompositionPolicy.valueOf(rs.getString("composition_policy")),
                toInstant(rs.getTimestamp("cancel_requested_at")),
                rs.getString("final_asset_key"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        }
    }
}

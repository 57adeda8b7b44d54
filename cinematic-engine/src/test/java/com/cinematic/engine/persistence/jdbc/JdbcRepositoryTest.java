package com.cinematic.engine.persistence.jdbc;

import com.cinematic.core.graph.StageGraphBuilder;
import com.cinematic.core.model.FailureClass;
import com.cinematic.core.model.Project;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.SoundEffectSpec;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageEvent;
import com.cinematic.core.model.StageEventType;
import com.cinematic.core.model.StageState;
import com.cinematic.core.model.StylePreset;
import com.cinematic.core.model.TransitionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Repository round trips against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("cinematic_test")
        .withUsername("test")
        .withPassword("test");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JdbcProjectRepository projectRepository;
    private JdbcStageRepository stageRepository;
    private JdbcEventRepository eventRepository;

    @BeforeAll
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/cinematic-schema.sql")).execute(dataSource);

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        projectRepository = new JdbcProjectRepository(jdbcTemplate, objectMapper);
        stageRepository = new JdbcStageRepository(jdbcTemplate, objectMapper, new DataSourceTransactionManager(dataSource));
        eventRepository = new JdbcEventRepository(jdbcTemplate, objectMapper);
    }

    @Test
    @DisplayName("Projects keep their scenes, style and sound effects")
    void testProjectRoundTrip() {
        Project project = Project.create("Archive", List.of(
            Scene.of(1, "Old library", 2.5)
                .withStyle(StylePreset.NOIR)
                .withTransition(TransitionType.CROSSFADE)
                .withSoundEffects(List.of(new SoundEffectSpec("pages", "turning slowly"))),
            Scene.of(2, "Candle light", 1.5)));
        projectRepository.save(project);

        Project loaded = projectRepository.findById(project.projectId()).orElseThrow();

        assertThat(loaded.title()).isEqualTo("Archive");
        assertThat(loaded.scenes()).isEqualTo(project.scenes());
        assertThat(loaded.compositionPolicy()).isEqualTo(project.compositionPolicy());
        assertThat(loaded.cancelRequestedAt()).isNull();

        projectRepository.update(loaded.withFinalAsset("renders/archive.mp4"));
        assertThat(projectRepository.findById(project.projectId()).orElseThrow().finalAssetKey())
            .isEqualTo("renders/archive.mp4");
    }

    @Test
    @DisplayName("Stage batches are saved and updated atomically")
    void testStageUpdates() {
        Project project = saveProject();
        List<Stage> stages = new StageGraphBuilder().build(project).toStages();
        stageRepository.saveAll(stages);

        Stage check = stages.get(0).withReady().withRunning()
            .withFailed(FailureClass.TRANSIENT, "RATE_LIMITED", "slow down");
        Stage image = stages.get(1);
        stageRepository.updateAll(List.of(check));

        List<Stage> loaded = stageRepository.findByProject(project.projectId());
        assertThat(loaded).hasSize(stages.size());
        assertThat(loaded.get(0).state()).isEqualTo(StageState.FAILED);
        assertThat(loaded.get(0).errorCode()).isEqualTo("RATE_LIMITED");
        assertThat(loaded.get(1).dependsOn()).isEqualTo(image.dependsOn());

        Stage ghost = Stage.create(project.projectId(), "s9:image-gen", 99, image.kind(), 9, null, List.of());
        assertThatThrownBy(() -> stageRepository.updateAll(List.of(image.withReady(), ghost.withReady())))
            .isInstanceOf(DataAccessException.class);
        assertThat(stageRepository.findByProject(project.projectId()).get(1).state()).isEqualTo(StageState.PENDING);
    }

    @Test
    @DisplayName("Events are ordered by sequence and removed with their project")
    void testEventsAndCascade() {
        Project project = saveProject();
        stageRepository.saveAll(new StageGraphBuilder().build(project).toStages());
        for (long seq = 1; seq <= 3; seq++) {
            eventRepository.append(StageEvent.create(project.projectId(), seq, StageEventType.STAGE_READY,
                "s1:prompt-check", StageState.READY, 0, objectMapper.createObjectNode().put("n", seq),
                StageEvent.ACTOR_SCHEDULER));
        }

        assertThat(eventRepository.getLastSequenceNumber(project.projectId())).isEqualTo(3);
        assertThat(eventRepository.findByProjectAfter(project.projectId(), 1))
            .extracting(e -> e.payload().get("n").asLong())
            .containsExactly(2L, 3L);

        assertThat(projectRepository.delete(project.projectId())).isTrue();
        assertThat(stageRepository.findByProject(project.projectId())).isEmpty();
        assertThat(eventRepository.findByProjectAfter(project.projectId(), 0)).isEmpty();
        assertThat(eventRepository.getLastSequenceNumber(UUID.randomUUID())).isZero();
    }

    private Project saveProject() {
        Project project = Project.create("Fixture", List.of(Scene.of(1, "Lighthouse", 2.0)));
        projectRepository.save(project);
        return project;
    }
}

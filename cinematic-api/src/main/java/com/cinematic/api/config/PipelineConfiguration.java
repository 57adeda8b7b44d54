package com.cinematic.api.config;

import com.cinematic.core.repository.EventRepository;
import com.cinematic.core.repository.ProjectRepository;
import com.cinematic.core.repository.StageRepository;
import com.cinematic.engine.config.PipelineSettings;
import com.cinematic.engine.coordinator.PipelineScheduler;
import com.cinematic.engine.metrics.PipelineMetrics;
import com.cinematic.engine.persistence.InMemoryEventRepository;
import com.cinematic.engine.persistence.InMemoryProjectRepository;
import com.cinematic.engine.persistence.InMemoryStageRepository;
import com.cinematic.engine.persistence.jdbc.JdbcEventRepository;
import com.cinematic.engine.persistence.jdbc.JdbcProjectRepository;
import com.cinematic.engine.persistence.jdbc.JdbcStageRepository;
import com.cinematic.recovery.RecoveryEngine;
import com.cinematic.worker.Capabilities;
import com.cinematic.worker.safety.KeywordSafetyGate;
import com.cinematic.worker.safety.SafetyGate;
import com.cinematic.worker.simulated.SimulatedCapabilities;
import com.cinematic.worker.storage.AssetStore;
import com.cinematic.worker.storage.InMemoryAssetStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Wires the engine, its stores and the capability adapters.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public PipelineSettings pipelineSettings(PipelineProperties properties) {
        PipelineSettings settings = properties.toSettings();
        log.info("Pipeline settings: slots={}, composition={}, persistence={}",
            settings.slots(), settings.compositionPolicy(), properties.persistence());
        return settings;
    }

    // ========== Capabilities ==========

    @Bean
    public AssetStore assetStore() {
        return new InMemoryAssetStore();
    }

    @Bean
    public SafetyGate safetyGate(PipelineProperties properties, AssetStore assetStore) {
        return new KeywordSafetyGate(properties.safety().blockedTerms(), assetStore);
    }

    @Bean
    public SimulatedCapabilities simulatedCapabilities(PipelineProperties properties, AssetStore assetStore) {
        return new SimulatedCapabilities(assetStore, properties.simulation().latency());
    }

    @Bean
    public Capabilities capabilities(SafetyGate safetyGate, SimulatedCapabilities simulated, AssetStore assetStore) {
        return Capabilities.simulated(safetyGate, simulated, assetStore);
    }

    // ========== Engine ==========

    @Bean(initMethod = "start")
    public PipelineScheduler pipelineScheduler(
            PipelineSettings settings,
            Capabilities capabilities,
            ProjectRepository projectRepository,
            StageRepository stageRepository,
            EventRepository eventRepository,
            ObjectMapper objectMapper,
            PipelineMetrics metrics) {
        return new PipelineScheduler(settings, capabilities, projectRepository, stageRepository,
            eventRepository, objectMapper, metrics);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RecoveryEngine recoveryEngine(
            PipelineProperties properties,
            ProjectRepository projectRepository,
            StageRepository stageRepository,
            PipelineScheduler scheduler) {
        return new RecoveryEngine(projectRepository, stageRepository, scheduler, properties.probeInterval());
    }

    // ========== Persistence ==========

    @Configuration
    @ConditionalOnProperty(prefix = "cinematic", name = "persistence", havingValue = "MEMORY", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public ProjectRepository projectRepository() {
            return new InMemoryProjectRepository();
        }

        @Bean
        public StageRepository stageRepository() {
            return new InMemoryStageRepository();
        }

        @Bean
        public EventRepository eventRepository() {
            return new InMemoryEventRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "cinematic", name = "persistence", havingValue = "JDBC")
    static class JdbcPersistence {

        @Bean
        public ProjectRepository projectRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcProjectRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public StageRepository stageRepository(
                JdbcTemplate jdbcTemplate,
                ObjectMapper objectMapper,
                PlatformTransactionManager transactionManager) {
            return new JdbcStageRepository(jdbcTemplate, objectMapper, transactionManager);
        }

        @Bean
        public EventRepository eventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcEventRepository(jdbcTemplate, objectMapper);
        }
    }
}

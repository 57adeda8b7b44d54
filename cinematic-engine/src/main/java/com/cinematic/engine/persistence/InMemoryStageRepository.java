package com.cinematic.engine.persistence;

import com.cinematic.core.exception.NotFoundException;
import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageState;
import com.cinematic.core.repository.StageRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StageRepository.
 * A batch update is checked in full before any stage is replaced, so it applies entirely or not at all.
 */
public class InMemoryStageRepository implements StageRepository {

    private final Map<UUID, Map<String, Stage>> stagesByProject = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public void saveAll(List<Stage> stages) {
        checkAvailable();
        for (Stage stage : stages) {
            stagesByProject
                .computeIfAbsent(stage.projectId(), id -> new ConcurrentHashMap<>())
                .put(stage.stageId(), stage);
        }
    }

    @Override
    public void updateAll(List<Stage> stages) {
        checkAvailable();
        if (stages.isEmpty()) {
            return;
        }
        UUID projectId = stages.get(0).projectId();
        Map<String, Stage> projectStages = stagesByProject.get(projectId);
        if (projectStages == null) {
            throw new NotFoundException("Project", projectId.toString());
        }
        synchronized (projectStages) {
            for (Stage stage : stages) {
                if (!stage.projectId().equals(projectId)) {
                    throw new IllegalArgumentException("Batch mixes stages of several projects");
                }
                if (!projectStages.containsKey(stage.stageId())) {
                    throw new NotFoundException("Stage", projectId + "/" + stage.stageId());
                }
            }
            for (Stage stage : stages) {
                projectStages.put(stage.stageId(), stage);
            }
        }
    }

    @Override
    public List<Stage> findByProject(UUID projectId) {
        checkAvailable();
        Map<String, Stage> projectStages = stagesByProject.get(projectId);
        if (projectStages == null) {
            return List.of();
        }
        return projectStages.values().stream()
            .sorted(Comparator.comparingInt(Stage::index))
            .toList();
    }

    @Override
    public List<Stage> findByState(StageState state, int limit) {
        checkAvailable();
        return stagesByProject.values().stream()
            .flatMap(m -> m.values().stream())
            .filter(s -> s.state() == state)
            .sorted(Comparator.comparing(Stage::updatedAt))
            .limit(limit)
            .toList();
    }

    @Override
    public void deleteByProject(UUID projectId) {
        checkAvailable();
        stagesByProject.remove(projectId);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    private void checkAvailable() {
        if (!available) {
            throw new PersistenceUnavailableException("Stage store is unavailable");
        }
    }
}

package com.cinematic.engine.persistence;

import com.cinematic.core.exception.NotFoundException;
import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.model.Project;
import com.cinematic.core.repository.ProjectRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ProjectRepository.
 * Used when no database is configured, and in tests. Availability can be
 * switched off to simulate a control-plane outage.
 */
public class InMemoryProjectRepository implements ProjectRepository {

    private final Map<UUID, Project> projects = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public void save(Project project) {
        checkAvailable();
        if (projects.putIfAbsent(project.projectId(), project) != null) {
            throw new IllegalStateException("Project already exists: " + project.projectId());
        }
    }

    @Override
    public void update(Project project) {
        checkAvailable();
        if (projects.replace(project.projectId(), project) == null) {
            throw new NotFoundException("Project", project.projectId().toString());
        }
    }

    @Override
    public Optional<Project> findById(UUID projectId) {
        checkAvailable();
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public List<Project> findAll() {
        checkAvailable();
        return projects.values().stream()
            .sorted(Comparator.comparing(Project::createdAt))
            .toList();
    }

    @Override
    public boolean delete(UUID projectId) {
        checkAvailable();
        return projects.remove(projectId) != null;
    }

    @Override
    public void ping() {
        checkAvailable();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    private void checkAvailable() {
        if (!available) {
            throw new PersistenceUnavailableException("Project store is unavailable");
        }
    }
}

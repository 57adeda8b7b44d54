package com.cinematic.core.repository;

import com.cinematic.core.model.Project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Project persistence.
 * Implementations throw {@link com.cinematic.core.exception.PersistenceUnavailableException}
 * when the underlying store cannot be reached.
 */
public interface ProjectRepository {

    /**
     * Save a new project.
     *
     * @param project The project to save
     */
    void save(Project project);

    /**
     * Update an existing project.
     *
     * @param project The project to update
     */
    void update(Project project);

    /**
     * Find a project by ID.
     *
     * @param projectId The project ID
     * @return The project if found
     */
    Optional<Project> findById(UUID projectId);

    /**
     * Find all projects, oldest first.
     *
     * @return All stored projects
     */
    List<Project> findAll();

    /**
     * Delete a project record.
     *
     * @param projectId The project ID
     * @return true if a project was deleted
     */
    boolean delete(UUID projectId);

    /**
     * Check that the store is reachable.
     *
     * @throws com.cinematic.core.exception.PersistenceUnavailableException if it is not
     */
    void ping();
}

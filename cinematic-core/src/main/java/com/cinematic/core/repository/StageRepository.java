package com.cinematic.core.repository;

import com.cinematic.core.model.Stage;
import com.cinematic.core.model.StageState;

import java.util.List;
import java.util.UUID;

/**
 * Repository for Stage persistence.
 */
public interface StageRepository {

    /**
     * Save the stages of a newly built graph.
     *
     * @param stages All stages of one project
     */
    void saveAll(List<Stage> stages);

    /**
     * Write a state transition together with its cascade.
     * Either every stage is written or none is.
     *
     * @param stages The changed stages, all belonging to one project
     */
    void updateAll(List<Stage> stages);

    /**
     * Find all stages of a project.
     *
     * @param projectId The project ID
     * @return Stages ordered by graph index
     */
    List<Stage> findByProject(UUID projectId);

    /**
     * Find stages in a given state across all projects.
     *
     * @param state The state to match
     * @param limit Maximum results
     * @return Matching stages
     */
    List<Stage> findByState(StageState state, int limit);

    /**
     * Delete every stage of a project.
     *
     * @param projectId The project ID
     */
    void deleteByProject(UUID projectId);
}

package com.cinematic.api.rest;

import com.cinematic.core.exception.BuildException;
import com.cinematic.core.exception.InvalidStateException;
import com.cinematic.core.exception.NotFoundException;
import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.core.model.ProjectStatus;
import com.cinematic.core.model.Scene;
import com.cinematic.core.model.StylePreset;
import com.cinematic.core.model.TransitionType;
import com.cinematic.engine.service.PipelineService;
import com.cinematic.engine.service.PipelineService.ProjectHandle;
import com.cinematic.engine.service.PipelineService.SubmitProjectRequest;
import com.cinematic.engine.progress.ProjectProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ProjectController.class, EventController.class})
class ProjectControllerTest {

    private static final String SUBMIT_BODY = """
        {
          "title": "Harbor",
          "aspectRatio": "9:16",
          "scenes": [
            {"prompt": "A lighthouse at dawn", "durationSeconds": 3.0, "style": "CINEMATIC",
             "transitionToNext": "CROSSFADE",
             "soundEffects": [{"type": "waves", "description": "gentle surf"}]},
            {"prompt": "Gulls over the harbor", "durationSeconds": 2.0}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PipelineService pipelineService;

    @Test
    @DisplayName("Submitting a project returns 202 with the handle")
    void testSubmitAccepted() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(pipelineService.submit(any()))
            .thenReturn(new ProjectHandle(projectId, ProjectStatus.QUEUED, 8, Instant.now()));

        mockMvc.perform(post("/api/v1/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUBMIT_BODY))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.projectId").value(projectId.toString()))
            .andExpect(jsonPath("$.status").value("QUEUED"))
            .andExpect(jsonPath("$.stageCount").value(8));

        ArgumentCaptor<SubmitProjectRequest> captor = ArgumentCaptor.forClass(SubmitProjectRequest.class);
        verify(pipelineService).submit(captor.capture());
        SubmitProjectRequest request = captor.getValue();
        assertThat(request.aspectRatio()).isEqualTo("9:16");
        assertThat(request.scenes()).extracting(Scene::sceneNumber).containsExactly(1, 2);
        Scene first = request.scenes().get(0);
        assertThat(first.stylePreset()).isEqualTo(StylePreset.CINEMATIC);
        assertThat(first.transitionToNext()).isEqualTo(TransitionType.CROSSFADE);
        assertThat(first.soundEffects()).hasSize(1);
    }

    @Test
    @DisplayName("A malformed project is 400 with every problem listed")
    void testSubmitRejected() throws Exception {
        when(pipelineService.submit(any()))
            .thenThrow(new BuildException(List.of("project has no scenes", "unsupported aspect ratio 4:3")));

        mockMvc.perform(post("/api/v1/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Empty\", \"scenes\": [], \"aspectRatio\": \"4:3\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(BuildException.ERROR_CODE))
            .andExpect(jsonPath("$.details.length()").value(2))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Submitting during a store outage is 503")
    void testSubmitDuringOutage() throws Exception {
        when(pipelineService.submit(any())).thenThrow(new PersistenceUnavailableException("store down"));

        mockMvc.perform(post("/api/v1/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUBMIT_BODY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode").value("PERSISTENCE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Unknown projects are 404")
    void testUnknownProject() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(pipelineService.progress(projectId)).thenThrow(new NotFoundException("Project", projectId.toString()));

        mockMvc.perform(get("/api/v1/projects/{id}/progress", projectId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Progress exposes the weighted percent and per-scene breakdown")
    void testProgress() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(pipelineService.progress(projectId)).thenReturn(
            new ProjectProgress(projectId, "Harbor", ProjectStatus.RUNNING, 42, 3, 8, List.of(), null));

        mockMvc.perform(get("/api/v1/projects/{id}/progress", projectId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.percent").value(42))
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andExpect(jsonPath("$.totalStages").value(8));
    }

    @Test
    @DisplayName("Retrying a project that is not Failed is 409")
    void testRetryConflict() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(pipelineService.retry(projectId))
            .thenThrow(new InvalidStateException("Project can only be retried when FAILED (status is RUNNING)"));

        mockMvc.perform(post("/api/v1/projects/{id}/retry", projectId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE"));
    }

    @Test
    @DisplayName("Cancel reports whether this call recorded the cancellation")
    void testCancel() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(pipelineService.cancel(projectId)).thenReturn(true);
        when(pipelineService.progress(projectId)).thenReturn(
            new ProjectProgress(projectId, "Harbor", ProjectStatus.CANCELLED, 20, 2, 8, List.of(), null));

        mockMvc.perform(post("/api/v1/projects/{id}/cancel", projectId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(true))
            .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("Deleting a running project is 409; a finished one is 204")
    void testDelete() throws Exception {
        UUID running = UUID.randomUUID();
        UUID finished = UUID.randomUUID();
        doThrow(new InvalidStateException("Project is RUNNING; only finished projects can be deleted"))
            .when(pipelineService).delete(running);

        mockMvc.perform(delete("/api/v1/projects/{id}", running))
            .andExpect(status().isConflict());
        mockMvc.perform(delete("/api/v1/projects/{id}", finished))
            .andExpect(status().isNoContent());
        verify(pipelineService).delete(finished);
    }

    @Test
    @DisplayName("Events are polled after a sequence number")
    void testPollEvents() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(pipelineService.events(projectId, 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/projects/{id}/events", projectId).param("after", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
        verify(pipelineService).events(projectId, 5);
    }
}

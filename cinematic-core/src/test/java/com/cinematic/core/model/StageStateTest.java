package com.cinematic.core.model;

import com.cinematic.core.exception.InvalidStateException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StageStateTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(StageState.SUCCEEDED.isTerminal());
        assertTrue(StageState.FAILED.isTerminal());
        assertTrue(StageState.CANCELLED.isTerminal());

        assertFalse(StageState.PENDING.isTerminal());
        assertFalse(StageState.READY.isTerminal());
        assertFalse(StageState.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldOnlyAllowReadyOrCancelled() {
        assertTrue(StageState.PENDING.canTransitionTo(StageState.READY));
        assertTrue(StageState.PENDING.canTransitionTo(StageState.CANCELLED));

        assertFalse(StageState.PENDING.canTransitionTo(StageState.RUNNING));
        assertFalse(StageState.PENDING.canTransitionTo(StageState.SUCCEEDED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowOutcomesAndCancel() {
        assertTrue(StageState.RUNNING.canTransitionTo(StageState.SUCCEEDED));
        assertTrue(StageState.RUNNING.canTransitionTo(StageState.FAILED));
        assertTrue(StageState.RUNNING.canTransitionTo(StageState.CANCELLED));

        assertFalse(StageState.RUNNING.canTransitionTo(StageState.READY));
    }

    @Test
    void canTransitionTo_fromFailed_shouldAllowRetryOrCancel() {
        assertTrue(StageState.FAILED.canTransitionTo(StageState.READY));
        assertTrue(StageState.FAILED.canTransitionTo(StageState.CANCELLED));

        assertFalse(StageState.FAILED.canTransitionTo(StageState.RUNNING));
        assertFalse(StageState.FAILED.canTransitionTo(StageState.SUCCEEDED));
    }

    @Test
    void canTransitionTo_fromSucceeded_shouldAllowNothing() {
        for (StageState target : StageState.values()) {
            assertFalse(StageState.SUCCEEDED.canTransitionTo(target));
        }
    }

    @Test
    void withSucceeded_fromPending_shouldThrow() {
        Stage stage = stage();

        assertThrows(InvalidStateException.class, () -> stage.withSucceeded("images/x.png"));
    }

    @Test
    void withRetryScheduled_shouldCountRetryAndKeepFailed() {
        Stage failed = stage().withReady().withRunning()
            .withFailed(FailureClass.TRANSIENT, "UPSTREAM_BUSY", "429 from provider");

        Stage scheduled = failed.withRetryScheduled(Instant.now().plusSeconds(2));

        assertEquals(StageState.FAILED, scheduled.state());
        assertEquals(1, scheduled.retryCount());
        assertTrue(scheduled.isAwaitingRetry());
        assertTrue(scheduled.isActive());
        assertFalse(scheduled.isFinallyFailed());
    }

    @Test
    void withRetryReset_shouldRestoreBudget() {
        Stage exhausted = stage().withReady().withRunning()
            .withFailed(FailureClass.TRANSIENT, "TIMEOUT", "timed out")
            .withRetryScheduled(Instant.now())
            .withReady().withRunning()
            .withFailed(FailureClass.TRANSIENT, "TIMEOUT", "timed out");

        Stage reset = exhausted.withRetryReset();

        assertEquals(StageState.READY, reset.state());
        assertEquals(0, reset.retryCount());
        assertNull(reset.failureClass());
    }

    @Test
    void withRecomposition_onNonCompositionStage_shouldThrow() {
        Stage succeeded = stage().withReady().withRunning().withSucceeded("images/a.png");

        assertThrows(InvalidStateException.class, succeeded::withRecomposition);
    }

    private Stage stage() {
        return Stage.create(UUID.randomUUID(), "s1:image-gen", 1, StageKind.IMAGE_GEN, 1, null, List.of("s1:prompt-check"));
    }
}

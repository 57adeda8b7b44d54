package com.cinematic.worker.safety;

import com.cinematic.worker.storage.InMemoryAssetStore;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordSafetyGateTest {

    private final InMemoryAssetStore store = new InMemoryAssetStore();
    private final KeywordSafetyGate gate = new KeywordSafetyGate(List.of("gore", " Weapon ", ""), store);

    @Test
    void evaluate_cleanPrompt_shouldAllow() throws Exception {
        SafetyVerdict verdict = gate.evaluate(SafetyContent.prompt(1, "A lighthouse at dusk, waves crashing"));

        assertTrue(verdict.allowed());
        assertNull(verdict.reason());
    }

    @Test
    void evaluate_blockedTerm_shouldRejectCaseInsensitively() throws Exception {
        SafetyVerdict verdict = gate.evaluate(SafetyContent.prompt(2, "A knight raising a WEAPON"));

        assertFalse(verdict.allowed());
        assertTrue(verdict.reason().contains("weapon"));
    }

    @Test
    void evaluate_shouldMatchWholeWordsOnly() throws Exception {
        assertTrue(gate.evaluate(SafetyContent.prompt(1, "A gorey old castle")).allowed());
    }

    @Test
    void evaluate_imageAsset_shouldScreenStoredContent() throws Exception {
        store.put("images/1_aaaaaa.png", "prompt: gore everywhere".getBytes(StandardCharsets.UTF_8), "image/png");

        SafetyVerdict verdict = gate.evaluate(SafetyContent.asset(1, "images/1_aaaaaa.png"));

        assertFalse(verdict.allowed());
    }

    @Test
    void constructor_shouldIgnoreBlankTerms() {
        assertEquals(2, gate.blockedTermCount());
    }
}

package com.cinematic.engine.coordinator;

import com.cinematic.core.exception.PersistenceUnavailableException;
import com.cinematic.engine.dispatch.DispatchGate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class DurableWriterTest {

    @Test
    @DisplayName("A write that succeeds leaves the gate open")
    void testWriteSucceeds() {
        DispatchGate gate = new DispatchGate();
        DurableWriter writer = new DurableWriter(gate);
        AtomicInteger calls = new AtomicInteger();

        writer.attempt("save", calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(gate.isPaused()).isFalse();
    }

    @Test
    @DisplayName("An outage pauses the gate and is rethrown to the caller")
    void testOutagePausesGate() {
        DispatchGate gate = new DispatchGate();
        DurableWriter writer = new DurableWriter(gate);

        assertThatThrownBy(() -> writer.attempt("update stages", () -> {
            throw new PersistenceUnavailableException("connection refused");
        })).isInstanceOf(PersistenceUnavailableException.class);

        assertThat(gate.isPaused()).isTrue();
        assertThat(gate.pauseReason()).contains("connection refused");
    }

    @Test
    @DisplayName("Waiting for the store returns once dispatch resumes")
    void testAwaitStoreReturnsOnResume() throws Exception {
        DispatchGate gate = new DispatchGate();
        DurableWriter writer = new DurableWriter(gate);
        PersistenceUnavailableException outage = new PersistenceUnavailableException("connection refused");
        gate.pause("Persistence unavailable: connection refused");
        CountDownLatch resumed = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            writer.awaitStore("update stages", outage);
            resumed.countDown();
        });
        waiter.start();

        assertThat(resumed.await(100, TimeUnit.MILLISECONDS)).isFalse();
        gate.resume();
        assertThat(resumed.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("An interrupted wait rethrows the outage")
    void testInterruptedWaitRethrows() {
        DispatchGate gate = new DispatchGate();
        DurableWriter writer = new DurableWriter(gate);
        PersistenceUnavailableException outage = new PersistenceUnavailableException("connection refused");
        gate.pause("Persistence unavailable: connection refused");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> writer.awaitStore("save", outage)).isSameAs(outage);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Other failures propagate unchanged")
    void testOtherErrorsPropagate() {
        DurableWriter writer = new DurableWriter(new DispatchGate());

        assertThatThrownBy(() -> writer.attempt("save", () -> {
            throw new IllegalArgumentException("bad row");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(writer.gate().isPaused()).isFalse();
    }
}

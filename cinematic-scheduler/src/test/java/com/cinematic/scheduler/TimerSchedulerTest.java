package com.cinematic.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TimerSchedulerTest {

    private TimerScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TimerScheduler();
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void scheduleDelay_shouldFireAfterDelay() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);

        scheduler.scheduleDelay(UUID.randomUUID(), "s1:image-gen", Duration.ofMillis(20), fired::countDown);

        assertTrue(fired.await(2, TimeUnit.SECONDS));
    }

    @Test
    void scheduleDelay_sameStage_shouldReplacePreviousTimer() throws Exception {
        UUID projectId = UUID.randomUUID();
        AtomicInteger first = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);

        scheduler.scheduleDelay(projectId, "s1:animate", Duration.ofMillis(200), first::incrementAndGet);
        scheduler.scheduleDelay(projectId, "s1:animate", Duration.ofMillis(10), second::countDown);

        assertTrue(second.await(2, TimeUnit.SECONDS));
        Thread.sleep(300);
        assertEquals(0, first.get());
    }

    @Test
    void cancelProjectTimers_shouldPreventFiring() throws Exception {
        UUID projectId = UUID.randomUUID();
        AtomicInteger fired = new AtomicInteger();
        scheduler.scheduleDelay(projectId, "s1:image-gen", Duration.ofMillis(150), fired::incrementAndGet);
        scheduler.scheduleDelay(projectId, "s2:image-gen", Duration.ofMillis(150), fired::incrementAndGet);

        assertEquals(2, scheduler.cancelProjectTimers(projectId));

        Thread.sleep(300);
        assertEquals(0, fired.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void firedTimers_shouldNotLeaveProjectEntries() throws Exception {
        UUID projectId = UUID.randomUUID();
        CountDownLatch fired = new CountDownLatch(2);
        scheduler.scheduleDelay(projectId, "s1:image-gen", Duration.ofMillis(100), fired::countDown);
        scheduler.scheduleDelay(projectId, "s2:image-gen", Duration.ofMillis(150), fired::countDown);
        assertEquals(1, scheduler.projectCount());

        assertTrue(fired.await(2, TimeUnit.SECONDS));

        assertEquals(0, scheduler.pendingCount());
        assertEquals(0, scheduler.projectCount());

        // A project whose entry was dropped can schedule again
        CountDownLatch again = new CountDownLatch(1);
        scheduler.scheduleDelay(projectId, "s1:image-gen", Duration.ofMillis(10), again::countDown);
        assertTrue(again.await(2, TimeUnit.SECONDS));
        assertEquals(0, scheduler.projectCount());
    }

    @Test
    void cancelTimer_lastOfProject_shouldDropProjectEntry() {
        UUID projectId = UUID.randomUUID();
        scheduler.scheduleDelay(projectId, "s1:animate", Duration.ofSeconds(5), () -> { });

        assertTrue(scheduler.cancelTimer(projectId, "s1:animate"));
        assertEquals(0, scheduler.projectCount());
    }

    @Test
    void cancelTimer_unknownStage_shouldReturnFalse() {
        assertFalse(scheduler.cancelTimer(UUID.randomUUID(), "s9:animate"));
    }

    @Test
    void scheduleDelay_afterStop_shouldThrow() {
        scheduler.stop();

        assertThrows(IllegalStateException.class,
            () -> scheduler.scheduleDelay(UUID.randomUUID(), "s1:image-gen", Duration.ZERO, () -> { }));
    }
}

package com.datafetch.infrastructure.persistence.entity;

import com.datafetch.domain.model.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FetchJobEntityTest {

    private FetchJobEntity job;

    @BeforeEach
    void setUp() {
        job = FetchJobEntity.builder()
                .jobId(UUID.randomUUID())
                .fingerprint("f")
                .requestJson("{}")
                .createdAt(Instant.now())
                .build();
    }

    @Test
    void testHappyPath() {
        job.markStarted();
        job.recordProgress("1 datasets requested.");
        job.markSucceeded("{\"count\":1}", "Result ready.");

        assertEquals(JobState.SUCCEEDED, job.getState());
        assertEquals("Result ready.", job.getProgressMessage());
        assertEquals(List.of("1 datasets requested.", "Result ready."), job.getProgressLog());
        assertEquals("{\"count\":1}", job.getResult());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
        assertTrue(job.getExecutionTimeMs() >= 0);
    }

    @Test
    void testFailureHasNoResult() {
        job.markStarted();
        job.markFailed("One of the datasets does not contain data.");

        assertEquals(JobState.FAILED, job.getState());
        assertNull(job.getResult());
        assertEquals("One of the datasets does not contain data.", job.getProgressMessage());
    }

    @Test
    void testPendingJobCanBeCancelled() {
        job.markCancelled("Job cancelled by SIGTERM.");

        assertEquals(JobState.CANCELLED, job.getState());
        assertNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
    }

    @Test
    void testTerminalJobRejectsFurtherMutation() {
        job.markStarted();
        job.markSucceeded("{}", "Result ready.");

        assertThrows(IllegalStateException.class, () -> job.markFailed("late"));
        assertThrows(IllegalStateException.class, () -> job.markCancelled("late"));
        assertThrows(IllegalStateException.class, () -> job.recordProgress("late"));
        assertEquals(JobState.SUCCEEDED, job.getState());
        assertEquals(1, job.getProgressLog().size());
    }

    @Test
    void testProgressRequiresRunning() {
        assertThrows(IllegalStateException.class, () -> job.recordProgress("too early"));
    }

    @Test
    void testLongMessagesAreAbbreviated() {
        job.markStarted();
        job.recordProgress("x".repeat(5_000));

        assertEquals(FetchJobEntity.MAX_MESSAGE_LENGTH, job.getProgressMessage().length());
    }
}

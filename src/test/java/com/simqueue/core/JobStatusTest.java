package com.simqueue.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testTerminalStates() {
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.CANCELLED.isTerminal());
    }

    @Test
    public void testAllowedTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
    }

    @Test
    public void testForbiddenTransitions() {
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED), "A job must run before it completes");
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED), "A running job cannot be cancelled");
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING), "A running job never goes back to pending");

        for (JobStatus terminal : new JobStatus[] {JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED}) {
            for (JobStatus target : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " must not move to " + target);
            }
        }
    }

    @Test
    public void testFromValue() {
        assertEquals(JobStatus.RUNNING, JobStatus.fromValue("running"));
        assertEquals(JobStatus.CANCELLED, JobStatus.fromValue(" CANCELLED "));
        assertEquals("pending", JobStatus.PENDING.toString());

        JobValidationException e = assertThrows(JobValidationException.class, () -> JobStatus.fromValue("paused"));
        assertTrue(e.getMessage().contains("paused"));
        assertThrows(JobValidationException.class, () -> JobStatus.fromValue(null));
    }
}

package com.sentryal.insar.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testHappyPathTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.SUBMITTED));
        assertTrue(JobStatus.SUBMITTED.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.SUCCEEDED));
    }

    @Test
    public void testNoShortcutsToSuccess() {
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SUCCEEDED));
        assertFalse(JobStatus.SUBMITTED.canTransitionTo(JobStatus.SUCCEEDED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING));
    }

    @Test
    public void testAnyActiveJobCanFailOrExpire() {
        for (JobStatus status : JobStatus.ACTIVE) {
            assertFalse(status.isTerminal());
            assertTrue(status.canTransitionTo(JobStatus.FAILED), status + " -> FAILED");
            assertTrue(status.canTransitionTo(JobStatus.EXPIRED), status + " -> EXPIRED");
        }
    }

    @Test
    public void testTerminalStatusesAreAbsorbing() {
        for (JobStatus terminal : new JobStatus[] {JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.EXPIRED}) {
            assertTrue(terminal.isTerminal());
            for (JobStatus next : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }
}

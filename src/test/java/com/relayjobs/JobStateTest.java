package com.relayjobs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStateTest {
    @Test
    public void testHappyPathEdges() {
        assertTrue(JobState.QUEUED.canTransitionTo(JobState.RUNNING));
        assertTrue(JobState.RUNNING.canTransitionTo(JobState.EXITED));
        assertTrue(JobState.EXITED.canTransitionTo(JobState.AWAITING_ARTIFACTS));
        assertTrue(JobState.AWAITING_ARTIFACTS.canTransitionTo(JobState.CALLBACK_QUEUED));
        assertTrue(JobState.CALLBACK_QUEUED.canTransitionTo(JobState.CALLBACK_RUNNING));
        assertTrue(JobState.CALLBACK_RUNNING.canTransitionTo(JobState.COMPLETED));
    }

    @Test
    public void testForbiddenEdges() {
        assertFalse(JobState.QUEUED.canTransitionTo(JobState.EXITED));
        assertFalse(JobState.RUNNING.canTransitionTo(JobState.CALLBACK_QUEUED));
        assertFalse(JobState.CALLBACK_QUEUED.canTransitionTo(JobState.COMPLETED));
        assertFalse(JobState.EXITED.canTransitionTo(JobState.RUNNING));
    }

    @Test
    public void testTerminalStatesHaveNoSuccessors() {
        for (JobState s : JobState.values()) {
            assertEquals(s.isTerminal(), s.successors().isEmpty(), s.wire());
        }
    }

    @Test
    public void testWireNames() {
        assertEquals("awaiting_artifacts", JobState.AWAITING_ARTIFACTS.wire());
        assertEquals(JobState.CALLBACK_RUNNING, JobState.fromWire("callback_running"));
        assertEquals(JobState.BLOCKED, JobState.fromWire("BLOCKED"));
        assertThrows(IllegalArgumentException.class, () -> JobState.fromWire("done"));
    }
}

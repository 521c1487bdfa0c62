package com.relayjobs;

import com.relayjobs.Models.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.relayjobs.JobFixtures.states;
import static org.junit.jupiter.api.Assertions.*;

public class LifecycleStoreTest {
    @TempDir
    Path dir;

    private LifecycleStore store;

    @BeforeEach
    public void setUp() {
        store = new LifecycleStore(dir.resolve("state.db"));
    }

    private Job queued(String id) {
        return store.create(new Job(id, "conv", "echo hi"), "job accepted", null);
    }

    @Test
    public void testHistoryIsAppendOnlyAcrossReload() {
        queued("job-1");
        store.transition("job-1", JobState.QUEUED, JobState.RUNNING, "spawned", null, j -> j.pid = 42L);
        store.note("job-1", "still going", JobEvents.details().put("tick", 3));
        store.transition("job-1", JobState.RUNNING, JobState.EXITED, "exit 0", null, j -> j.exitCode = 0);

        Job reloaded = new LifecycleStore(dir.resolve("state.db")).get("job-1");
        assertEquals(List.of(JobState.QUEUED, JobState.RUNNING, JobState.RUNNING, JobState.EXITED), states(reloaded));
        assertEquals("still going", reloaded.history.get(2).reason);
        assertEquals(3, reloaded.history.get(2).details.get("tick").asInt());
        assertEquals(JobState.EXITED, reloaded.state);
        assertNull(reloaded.pid);
        assertEquals(0, reloaded.exitCode);
        assertEquals(4, store.history("job-1").size());
    }

    @Test
    public void testPidKeptOnlyWhileRunning() {
        queued("job-p");
        Job running = store.transition("job-p", JobState.QUEUED, JobState.RUNNING, "spawned", null, j -> j.pid = 7L).orElseThrow();
        assertEquals(7L, running.pid);
        assertEquals(7L, store.get("job-p").pid);
    }

    @Test
    public void testIllegalTransitionThrowsAndChangesNothing() {
        queued("job-2");
        IllegalStateTransitionException e = assertThrows(IllegalStateTransitionException.class,
            () -> store.transition("job-2", JobState.QUEUED, JobState.COMPLETED, "skip", null, null));
        assertEquals(ErrorCode.ILLEGAL_TRANSITION, e.getCode());
        Job job = store.get("job-2");
        assertEquals(JobState.QUEUED, job.state);
        assertEquals(1, job.history.size());
    }

    @Test
    public void testStaleTransitionIsNoOp() {
        queued("job-3");
        assertTrue(store.transition("job-3", JobState.QUEUED, JobState.RUNNING, "spawned", null, null).isPresent());
        assertTrue(store.transition("job-3", JobState.QUEUED, JobState.RUNNING, "again", null, null).isEmpty());
        assertEquals(2, store.get("job-3").history.size());
    }

    @Test
    public void testTerminalJobsAreArchived() {
        queued("job-4");
        queued("job-5");
        store.transition("job-4", JobState.QUEUED, JobState.BLOCKED, "preflight failed", null,
            j -> j.errorCode = ErrorCode.PREFLIGHT_REJECTED.wire());

        assertTrue(store.findLive("job-4").isEmpty());
        Job archived = store.get("job-4");
        assertEquals(JobState.BLOCKED, archived.state);
        assertEquals("preflight failed", archived.reason);
        assertEquals(List.of("job-5"), store.list(null).stream().map(j -> j.id).toList());
        assertEquals(1, store.listArchived(JobState.BLOCKED).size());
        assertTrue(store.update("job-4", j -> j.visibilityStatus = "degraded").isEmpty());
    }

    @Test
    public void testLockIsDroppedOnceJobIsArchived() {
        queued("job-6");
        store.transition("job-6", JobState.QUEUED, JobState.RUNNING, "spawned", null, null);
        assertTrue(store.hasLock("job-6"));

        // released by the outer holder, not inside the nested transition
        store.withLock("job-6", () -> {
            store.transition("job-6", JobState.RUNNING, JobState.FAILED, "stopped", null, null);
            assertTrue(store.hasLock("job-6"));
            return null;
        });
        assertFalse(store.hasLock("job-6"));
    }

    @Test
    public void testDuplicateIdRejected() {
        queued("job-6");
        RelayException e = assertThrows(RelayException.class, () -> queued("job-6"));
        assertEquals(ErrorCode.INVALID_REQUEST, e.getCode());
    }

    @Test
    public void testCancelFlagSurvivesPayloadRewrite() {
        queued("job-7");
        store.transition("job-7", JobState.QUEUED, JobState.RUNNING, "spawned", null, null);
        LifecycleStore other = new LifecycleStore(dir.resolve("state.db"));
        assertTrue(other.requestCancel("job-7").orElseThrow().cancelRequested);

        store.update("job-7", j -> {
            j.cancelRequested = false;
            j.outputTail = List.of("line");
        });
        assertTrue(store.get("job-7").cancelRequested);
    }

    @Test
    public void testUpdateKeepsState() {
        queued("job-8");
        Optional<Job> updated = store.update("job-8", j -> {
            j.state = JobState.COMPLETED;
            j.visibilityStatus = Models.VISIBILITY_DEGRADED;
        });
        assertEquals(JobState.QUEUED, updated.orElseThrow().state);
        assertEquals(Models.VISIBILITY_DEGRADED, store.get("job-8").visibilityStatus);
    }

    @Test
    public void testUnknownJob() {
        assertTrue(store.find("nope").isEmpty());
        assertThrows(RelayException.class, () -> store.get("nope"));
    }
}

package com.relayjobs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.Job;
import com.relayjobs.Models.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.relayjobs.JobFixtures.action;
import static com.relayjobs.JobFixtures.json;
import static com.relayjobs.JobFixtures.states;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JobServiceTest {
    private static final Duration SETTLE = Duration.ofSeconds(30);

    @TempDir
    Path dir;

    private ObjectNode cfg;
    private LifecycleStore store;
    private TaskQueue queue;
    private RecordingEvents events;
    private JobService service;

    @BeforeEach
    public void setUp() {
        cfg = JobFixtures.config(dir);
        store = new LifecycleStore(dir.resolve("relay.db"));
        queue = mock(TaskQueue.class);
        when(queue.enqueue(anyString(), anyString(), anyString())).thenReturn("t-0001");
        events = new RecordingEvents();
        service = new JobService(cfg, store, queue, events);
    }

    @AfterEach
    public void tearDown() {
        service.close();
    }

    @Test
    public void testCommandWithoutFollowUpCompletes() throws Exception {
        Job started = service.start("conv", action("{\"command\":\"echo hi\"}", cfg));
        assertEquals(JobState.RUNNING, started.state);
        assertNotNull(started.pid);

        Job job = service.awaitSettled(started.id, SETTLE);
        assertEquals(JobState.COMPLETED, job.state);
        assertEquals(0, job.exitCode);
        assertNull(job.pid);
        assertTrue(job.outputTail.contains("hi"));
        assertEquals(List.of(JobState.QUEUED, JobState.RUNNING, JobState.EXITED, JobState.COMPLETED), states(job));
        assertEquals(List.of("job.started", "job.exited", "job.completed"), events.names(job.id));
        assertTrue(Files.exists(Path.of(job.logPath)));
    }

    @Test
    public void testThenTaskIsQueuedExactlyOnce() throws Exception {
        Job started = service.start("conv", action("{\"command\":\"true\",\"watch\":{\"thenTask\":\"summarize\"}}", cfg));
        Job job = service.awaitSettled(started.id, SETTLE);

        assertEquals(JobState.CALLBACK_QUEUED, job.state);
        assertTrue(job.callbackEnqueued);
        assertEquals("t-0001", job.callbackTaskId);
        verify(queue, times(1)).enqueue("conv", "summarize", job.id);

        // a later recovery pass must not queue it again
        service.recover();
        Thread.sleep(1500);
        verify(queue, times(1)).enqueue(anyString(), anyString(), anyString());
    }

    @Test
    public void testMissingFileBlocksAfterTimeout() throws Exception {
        Path out = dir.resolve("out.txt");
        String req = "{\"command\":\"true\",\"watch\":{\"thenTask\":\"next\",\"requireFiles\":[" + json(out.toString())
            + "],\"readyTimeoutSec\":2,\"readyPollSec\":1,\"onMissing\":\"block\"}}";
        Job started = service.start("conv", action(req, cfg));
        Job job = service.awaitSettled(started.id, SETTLE);

        assertEquals(JobState.BLOCKED, job.state);
        assertEquals(ErrorCode.ARTIFACT_TIMEOUT.wire(), job.errorCode);
        assertTrue(job.reason.contains(out.toString()), job.reason);
        assertEquals(List.of(out.toString()), job.missingFiles);
        assertFalse(job.callbackEnqueued);
        verify(queue, never()).enqueue(anyString(), anyString(), anyString());
        assertTrue(states(job).contains(JobState.AWAITING_ARTIFACTS));
        assertTrue(events.names(job.id).containsAll(List.of("job.await_artifacts.start", "job.await_artifacts.timeout", "job.blocked")));
    }

    @Test
    public void testFileWrittenAfterExitReleasesCallback() throws Exception {
        Path out = dir.resolve("out.txt");
        String req = "{\"command\":\"true\",\"watch\":{\"thenTask\":\"next\",\"requireFiles\":[" + json(out.toString())
            + "],\"readyTimeoutSec\":20,\"readyPollSec\":1}}";
        Job started = service.start("conv", action(req, cfg));

        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(2500);
                Files.writeString(out, "result\n");
            } catch (Exception e) {
                throw new RuntimeException(e);
            }
        });
        writer.start();
        Job job = service.awaitSettled(started.id, SETTLE);
        writer.join();

        assertEquals(JobState.CALLBACK_QUEUED, job.state);
        assertTrue(job.callbackEnqueued);
        assertTrue(job.missingFiles.isEmpty());
        verify(queue, times(1)).enqueue("conv", "next", job.id);
        assertNotNull(events.first(job.id, "job.await_artifacts.ready"));
    }

    @Test
    public void testFileAppearingMidWindowIsSeenBeforeDeadline() throws Exception {
        Path out = dir.resolve("out.txt");
        String req = "{\"command\":\"true\",\"watch\":{\"thenTask\":\"next\",\"requireFiles\":[" + json(out.toString())
            + "],\"readyTimeoutSec\":2,\"onMissing\":\"block\"}}";
        Job started = service.start("conv", action(req, cfg));

        long begin = System.nanoTime();
        while (!service.find(started.id).map(j -> j.state == JobState.AWAITING_ARTIFACTS).orElse(false)
            && System.nanoTime() - begin < TimeUnit.SECONDS.toNanos(10)) {
            Thread.sleep(10);
        }
        Thread.sleep(1000);
        Files.writeString(out, "result\n");
        Job job = service.awaitSettled(started.id, SETTLE);

        assertEquals(JobState.CALLBACK_QUEUED, job.state);
        assertNotNull(events.first(job.id, "job.await_artifacts.ready"));
        assertNull(events.first(job.id, "job.await_artifacts.timeout"));
        Instant gateStart = Instant.parse(job.history.stream()
            .filter(h -> h.state == JobState.AWAITING_ARTIFACTS).findFirst().get().at);
        long gateMs = Duration.between(gateStart, Instant.parse(job.lastEntry(JobState.CALLBACK_QUEUED).at)).toMillis();
        assertTrue(gateMs >= 900 && gateMs < 1700, "gate took " + gateMs + "ms");
    }

    @Test
    public void testProceedOnMissingAppendsNote() throws Exception {
        Path out = dir.resolve("never.txt");
        String req = "{\"command\":\"true\",\"watch\":{\"thenTask\":\"analyze\",\"requireFiles\":[" + json(out.toString())
            + "],\"readyTimeoutSec\":1,\"readyPollSec\":1,\"onMissing\":\"proceed\"}}";
        Job started = service.start("conv", action(req, cfg));
        Job job = service.awaitSettled(started.id, SETTLE);

        assertEquals(JobState.CALLBACK_QUEUED, job.state);
        assertEquals(List.of(out.toString()), job.missingFiles);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(queue).enqueue(eq("conv"), text.capture(), eq(job.id));
        assertTrue(text.getValue().startsWith("analyze"));
        assertTrue(text.getValue().contains(JobService.MISSING_NOTE));
        assertTrue(text.getValue().contains(out.toString()));
    }

    @Test
    public void testProceedWithoutThenTaskCompletesWithNote() throws Exception {
        Path out = dir.resolve("never.txt");
        String req = "{\"command\":\"true\",\"watch\":{\"requireFiles\":[" + json(out.toString())
            + "],\"readyTimeoutSec\":1,\"readyPollSec\":1,\"onMissing\":\"proceed\"}}";
        Job job = service.awaitSettled(service.start("conv", action(req, cfg)).id, SETTLE);

        assertEquals(JobState.COMPLETED, job.state);
        assertTrue(job.reason.startsWith(JobService.MISSING_NOTE));
        verify(queue, never()).enqueue(anyString(), anyString(), anyString());
    }

    @Test
    public void testNonZeroExitFailsWithoutWaitingForFiles() throws Exception {
        String req = "{\"command\":\"echo boom; exit 3\",\"watch\":{\"thenTask\":\"next\",\"requireFiles\":[\"/nonexistent/out.txt\"]}}";
        Job job = service.awaitSettled(service.start("conv", action(req, cfg)).id, SETTLE);

        assertEquals(JobState.FAILED, job.state);
        assertEquals(ErrorCode.NON_ZERO_EXIT.wire(), job.errorCode);
        assertEquals(3, job.exitCode);
        assertTrue(job.outputTail.contains("boom"));
        assertFalse(states(job).contains(JobState.AWAITING_ARTIFACTS));
        verify(queue, never()).enqueue(anyString(), anyString(), anyString());
    }

    @Test
    public void testSpawnFailureFailsJob() {
        cfg.put("shell", "/nonexistent/shell");
        try (JobService broken = new JobService(cfg, store, queue, events)) {
            JobRejectedException e = assertThrows(JobRejectedException.class,
                () -> broken.start("conv", "job-spawn", action("{\"command\":\"echo hi\"}", cfg)));
            assertEquals(ErrorCode.PROCESS_SPAWN_FAILED, e.getCode());
        }
        Job job = store.get("job-spawn");
        assertEquals(JobState.FAILED, job.state);
        assertEquals(ErrorCode.PROCESS_SPAWN_FAILED.wire(), job.errorCode);
        assertEquals(List.of(JobState.QUEUED, JobState.FAILED), states(job));
        assertEquals(List.of("job.failed"), events.names("job-spawn"));
    }

    @Test
    public void testSelfMatchingWaitLoopIsRejected() {
        String cmd = "while pgrep -f \"train.py\" > /dev/null; do sleep 5; done; echo done";
        JobRejectedException e = assertThrows(JobRejectedException.class,
            () -> service.start("conv", "job-wait", action("{\"command\":" + json(cmd) + "}", cfg)));
        assertEquals(ErrorCode.WAIT_PATTERN_REJECTED, e.getCode());
        assertEquals(JobState.BLOCKED, e.getJob().state);

        Job job = store.get("job-wait");
        assertEquals(JobState.BLOCKED, job.state);
        assertFalse(states(job).contains(JobState.RUNNING));
        assertTrue(job.reason.contains("train.py"));
    }

    @Test
    public void testWaitLoopInsideShellWrapperIsRejected() {
        String cmd = "bash -lc 'while pgrep -f \"pgrep -f\" >/dev/null; do sleep 1; done; echo done'";
        JobRejectedException e = assertThrows(JobRejectedException.class,
            () -> service.start("conv", "job-wrapped", action("{\"command\":" + json(cmd) + "}", cfg)));
        assertEquals(ErrorCode.WAIT_PATTERN_REJECTED, e.getCode());
        assertFalse(states(store.get("job-wrapped")).contains(JobState.RUNNING));
    }

    @Test
    public void testWaitPatternWarnModeStillRuns() throws Exception {
        String cmd = "pgrep -f \"zz-marker\" > /dev/null || true";
        String req = "{\"command\":" + json(cmd) + ",\"waitPatternGuard\":\"warn\"}";
        Job job = service.awaitSettled(service.start("conv", action(req, cfg)).id, SETTLE);

        assertEquals(JobState.COMPLETED, job.state);
        assertNotNull(events.first(job.id, "job.wait_pattern.warn"));
    }

    @Test
    public void testPreflightRejectBlocksBeforeSpawn() {
        String req = "{\"command\":\"echo hi\",\"preflight\":[{\"type\":\"path_exists\",\"params\":{\"path\":"
            + json(dir.resolve("missing").toString()) + "}}]}";
        JobRejectedException e = assertThrows(JobRejectedException.class, () -> service.start("conv", "job-pf", action(req, cfg)));
        assertEquals(ErrorCode.PREFLIGHT_REJECTED, e.getCode());
        assertEquals("path_exists", e.getDetails().get("checkType"));

        Job job = store.get("job-pf");
        assertEquals(JobState.BLOCKED, job.state);
        assertEquals(ErrorCode.PREFLIGHT_REJECTED.wire(), job.errorCode);
        assertEquals(List.of(JobState.QUEUED, JobState.BLOCKED), states(job));
        assertNull(job.pid);
    }

    @Test
    public void testPreflightWarnContinues() throws Exception {
        String req = "{\"command\":\"echo hi\",\"preflight\":[{\"type\":\"cmd_exit_zero\",\"params\":{\"cmd\":\"exit 1\"},\"onFail\":\"warn\"}]}";
        Job job = service.awaitSettled(service.start("conv", action(req, cfg)).id, SETTLE);

        assertEquals(JobState.COMPLETED, job.state);
        assertNotNull(events.first(job.id, "job.preflight.warn"));
    }

    @Test
    public void testStopCancelsRunningJob() throws Exception {
        Job started = service.start("conv", action("{\"command\":\"sleep 30\",\"watch\":{\"thenTask\":\"next\"}}", cfg));
        long pid = started.pid;

        Job job = service.stop(started.id);
        assertEquals(JobState.FAILED, job.state);
        assertEquals(ErrorCode.CANCELED.wire(), job.errorCode);
        assertTrue(ProcessHandle.of(pid).map(ph -> !ph.isAlive()).orElse(true));
        assertTrue(events.names(job.id).contains("job.stop_requested"));
        verify(queue, never()).enqueue(anyString(), anyString(), anyString());

        // stopping a finished job changes nothing
        assertEquals(JobState.FAILED, service.stop(started.id).state);
    }

    @Test
    public void testStopAbandonsArtifactWait() throws Exception {
        String req = "{\"command\":\"true\",\"watch\":{\"requireFiles\":[" + json(dir.resolve("x").toString())
            + "],\"readyTimeoutSec\":60}}";
        Job started = service.start("conv", action(req, cfg));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while (store.get(started.id).state != JobState.AWAITING_ARTIFACTS && System.nanoTime() < deadline) {
            Thread.sleep(100);
        }
        Job job = service.stop(started.id);
        assertEquals(JobState.FAILED, job.state);
        assertEquals(ErrorCode.CANCELED.wire(), job.errorCode);
    }

    @Test
    public void testConcurrentReadyEvaluationsEnqueueOnce() throws Exception {
        Path out = dir.resolve("out.txt");
        Files.writeString(out, "data");
        Job seeded = JobFixtures.seeded("job-dup", JobState.AWAITING_ARTIFACTS, dir);
        seeded.exitCode = 0;
        seeded.watch.thenTask = "next";
        seeded.watch.requireFiles.add(out.toString());
        store.create(seeded, "seeded", null);

        int callers = 8;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            Future<?>[] done = new Future<?>[callers];
            for (int i = 0; i < callers; i++) {
                done[i] = pool.submit(() -> {
                    go.await();
                    service.onArtifactsReady("job-dup", List.of(out));
                    return null;
                });
            }
            go.countDown();
            for (Future<?> f : done) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        verify(queue, times(1)).enqueue("conv", "next", "job-dup");
        Job job = store.get("job-dup");
        assertEquals(JobState.CALLBACK_QUEUED, job.state);
        assertEquals(1, job.history.stream().filter(h -> "required files ready".equals(h.reason)).count());
        assertEquals(1, events.names("job-dup").stream().filter("job.then_task.queued"::equals).count());
    }

    @Test
    public void testUnreadableArtifactFailsJob() throws Exception {
        Path file = Files.writeString(dir.resolve("plain"), "x");
        Path underFile = file.resolve("child.txt");
        String req = "{\"command\":\"true\",\"watch\":{\"thenTask\":\"next\",\"requireFiles\":[" + json(underFile.toString()) + "]}}";
        Job job = service.awaitSettled(service.start("conv", action(req, cfg)).id, SETTLE);

        assertEquals(JobState.FAILED, job.state);
        assertEquals(ErrorCode.ARTIFACT_READ_ERROR.wire(), job.errorCode);
        assertTrue(job.reason.contains(underFile.toString()));
        assertNotNull(events.first(job.id, "job.await_artifacts.error"));
        verify(queue, never()).enqueue(anyString(), anyString(), anyString());
    }

    @Test
    public void testEnqueueFailureFailsJob() throws Exception {
        when(queue.enqueue(anyString(), anyString(), anyString()))
            .thenThrow(new RelayException(ErrorCode.CALLBACK_ENQUEUE_FAILED, "queue is down"));
        Job job = service.awaitSettled(
            service.start("conv", action("{\"command\":\"true\",\"watch\":{\"thenTask\":\"next\"}}", cfg)).id, SETTLE);

        assertEquals(JobState.FAILED, job.state);
        assertEquals(ErrorCode.CALLBACK_ENQUEUE_FAILED.wire(), job.errorCode);
        assertFalse(job.callbackEnqueued);
        assertTrue(job.reason.contains("queue is down"));
        assertEquals(ErrorCode.CALLBACK_ENQUEUE_FAILED.wire(),
            events.first(job.id, "job.failed").details.get("errorCode").asText());
    }

    @Test
    public void testRunTasksKicksTrigger() throws Exception {
        TaskQueue.Trigger trigger = mock(TaskQueue.Trigger.class);
        try (JobService kicking = new JobService(cfg, store, queue, events, trigger)) {
            String req = "{\"command\":\"true\",\"watch\":{\"thenTask\":\"next\",\"runTasks\":true}}";
            Job job = kicking.awaitSettled(kicking.start("conv-k", action(req, cfg)).id, SETTLE);
            assertEquals(JobState.CALLBACK_QUEUED, job.state);
            verify(trigger, timeout(5000).times(1)).kick("conv-k");
        }
    }

    @Test
    public void testCallbackLifecycleWithStoredQueue() throws Exception {
        StoredTaskQueue tasks = new StoredTaskQueue(dir.resolve("relay.db"));
        try (JobService relay = new JobService(cfg, store, tasks, events)) {
            Job job = relay.awaitSettled(
                relay.start("conv", action("{\"command\":\"true\",\"watch\":{\"thenTask\":\"report\"}}", cfg)).id, SETTLE);
            assertEquals(JobState.CALLBACK_QUEUED, job.state);
            assertEquals("t-0001", job.callbackTaskId);

            Optional<Task> claimed = tasks.claimNext("conv");
            assertTrue(claimed.isPresent());
            assertEquals(job.id, claimed.get().sourceJobId);
            assertEquals(JobState.CALLBACK_RUNNING, relay.callbackStarted(job.id).orElseThrow().state);

            tasks.finish("conv", claimed.get().id, "done", null);
            Job done = relay.callbackFinished(job.id, true, null).orElseThrow();
            assertEquals(JobState.COMPLETED, done.state);
            assertTrue(store.findLive(job.id).isEmpty());
            assertEquals(JobState.COMPLETED, store.get(job.id).state);
        }
    }

    @Test
    public void testCallbackFailureIsRecorded() throws Exception {
        Job job = service.awaitSettled(
            service.start("conv", action("{\"command\":\"true\",\"watch\":{\"thenTask\":\"report\"}}", cfg)).id, SETTLE);
        Job failed = service.callbackFinished(job.id, false, "runner crashed").orElseThrow();
        assertEquals(JobState.FAILED, failed.state);
        assertEquals(ErrorCode.CALLBACK_TASK_FAILED.wire(), failed.errorCode);
        assertTrue(failed.reason.contains("runner crashed"));
    }

    @Test
    public void testSilentJobIsFlaggedDegraded() throws Exception {
        String req = "{\"command\":\"sleep 5\",\"watch\":{\"heartbeatEverySec\":1}}";
        Job job = service.awaitSettled(service.start("conv", action(req, cfg)).id, SETTLE);

        assertEquals(JobState.COMPLETED, job.state);
        assertNotNull(events.first(job.id, "job.watch.stale_progress"));
    }

    @Test
    public void testMissedStartupHeartbeatIsFlaggedBeforeFirstTick() throws Exception {
        String req = "{\"command\":\"sleep 4\",\"watch\":{\"everySec\":3,\"startupHeartbeatSec\":1,\"heartbeatEverySec\":0}}";
        Job started = service.start("conv", action(req, cfg));
        long begin = System.nanoTime();

        while (events.first(started.id, "job.watch.stale_progress") == null
            && System.nanoTime() - begin < TimeUnit.SECONDS.toNanos(10)) {
            Thread.sleep(50);
        }
        long flaggedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);
        assertNotNull(events.first(started.id, "job.watch.stale_progress"));
        assertTrue(flaggedMs < 2500, "flagged after " + flaggedMs + "ms");

        Job job = service.awaitSettled(started.id, SETTLE);
        assertEquals(JobState.COMPLETED, job.state);
        assertEquals(Models.VISIBILITY_DEGRADED, job.visibilityStatus);
        assertNull(events.first(job.id, "job.visibility.ok"));
    }

    @Test
    public void testInvalidRequestCreatesNothing() {
        assertThrows(InvalidJobRequestException.class, () -> service.start("conv", "job-bad", action("{\"watch\":{}}", cfg)));
        assertTrue(store.find("job-bad").isEmpty());
    }
}

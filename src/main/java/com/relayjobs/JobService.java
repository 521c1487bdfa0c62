package com.relayjobs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.HistoryEntry;
import com.relayjobs.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs watched jobs: validates and launches them, polls them to completion, gates the follow-up
 * task on the required files and hands it to the task queue at most once.
 *
 * <p>All state lives in the {@link LifecycleStore}; the in-memory maps only track which jobs this
 * instance is currently polling. A new instance over the same store picks unfinished jobs up again
 * through {@link #recover()}.
 */
public class JobService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String MISSING_NOTE = "[relay note]";

    private final LifecycleStore store;
    private final JobEvents events;
    private final CallbackEnqueuer enqueuer;
    private final JobLauncher launcher;
    private final PreflightValidator preflight;
    private final WaitPatternGuard.Mode guardMode;
    private final int stopGraceSec;
    private final Path workdir;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> pollers = new ConcurrentHashMap<>();
    private final Map<String, Process> owned = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public JobService(ObjectNode cfg, LifecycleStore store, TaskQueue queue, EventSink sink) {
        this(cfg, store, queue, sink, null);
    }

    public JobService(ObjectNode cfg, LifecycleStore store, TaskQueue queue, EventSink sink, TaskQueue.Trigger trigger) {
        this.store = store;
        this.events = new JobEvents(sink);
        this.enqueuer = new CallbackEnqueuer(store, queue, trigger, events);
        this.workdir = Path.of("").toAbsolutePath();
        String shell = cfg.path("shell").asText("bash");
        Path logDir = workdir.resolve(cfg.path("log_directory").asText("job_logs")).normalize();
        this.launcher = new JobLauncher(shell, cfg.path("detach").asBoolean(true), logDir);
        this.preflight = new PreflightValidator(shell, cfg.path("preflight_timeout_sec").asInt(30), workdir);
        this.guardMode = WaitPatternGuard.Mode.parse(cfg.path("wait_pattern_guard").asText("reject"));
        this.stopGraceSec = cfg.path("stop_grace_sec").asInt(5);
        int threads = Math.max(1, cfg.path("watcher_threads").asInt(4));
        AtomicInteger n = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "relayjobs-watch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public JobLauncher launcher() {
        return launcher;
    }

    public Job start(String conversationKey, JobStartAction action) {
        return start(conversationKey, null, action);
    }

    /**
     * Records, checks and spawns a job, then starts watching it.
     *
     * @throws JobRejectedException when preflight or the wait-pattern guard rejects the job, or the
     *     process cannot be spawned; the job is already recorded as blocked or failed
     */
    public Job start(String conversationKey, String jobId, JobStartAction action) {
        if (closed) throw new IllegalStateException("JobService is closed");
        if (conversationKey == null || conversationKey.isBlank()) {
            throw new InvalidJobRequestException(List.of("conversationKey must be a non-empty string"));
        }
        String id = jobId == null || jobId.isBlank() ? newId() : jobId;
        Job job = new Job(id, conversationKey, action.command);
        job.watch = action.watch;
        job.preflight = action.preflight;
        job.workdir = workdir.toString();
        job.logPath = launcher.logFile(id).toString();
        ObjectNode created = JobEvents.details();
        created.put("command", job.command);
        store.create(job, "job accepted", created);

        PreflightValidator.Result checks = preflight.run(job.preflight);
        for (PreflightValidator.Outcome w : checks.warnings()) {
            ObjectNode d = JobEvents.details();
            d.put("checkType", w.check.type);
            d.put("reason", w.reason);
            store.note(id, "preflight warning: " + w.reason, d);
            events.emit("job.preflight.warn", job, d);
        }
        if (checks.rejected()) {
            PreflightValidator.Outcome o = checks.rejection;
            ObjectNode d = JobEvents.details();
            d.put("checkType", o.check.type);
            d.put("reason", o.reason);
            throw reject(id, JobState.BLOCKED, ErrorCode.PREFLIGHT_REJECTED,
                "preflight " + o.check.type + " failed: " + o.reason, d);
        }

        WaitPatternGuard.Mode mode = action.waitPatternGuard != null ? action.waitPatternGuard : guardMode;
        if (mode != WaitPatternGuard.Mode.OFF) {
            String invocation = String.join(" ", launcher.commandLine(job));
            List<WaitPatternGuard.Finding> findings = WaitPatternGuard.scan(job.command, invocation);
            if (!findings.isEmpty()) {
                String what = findings.stream().map(WaitPatternGuard.Finding::describe).collect(Collectors.joining("; "));
                ObjectNode d = JobEvents.details();
                d.set("patterns", JobEvents.array(findings.stream().map(f -> f.pattern).collect(Collectors.toList())));
                d.put("mode", mode.wire());
                if (mode == WaitPatternGuard.Mode.REJECT) {
                    throw reject(id, JobState.BLOCKED, ErrorCode.WAIT_PATTERN_REJECTED,
                        "self-matching wait pattern: " + what, d);
                }
                log.warn("Job {} has a self-matching wait pattern: {}", id, what);
                store.note(id, "wait pattern warning: " + what, d);
                events.emit("job.wait_pattern.warn", job, d);
            }
        }

        JobLauncher.Launched launched;
        try {
            launched = launcher.launch(job);
        } catch (IOException e) {
            ObjectNode d = JobEvents.details();
            d.put("error", String.valueOf(e.getMessage()));
            throw reject(id, JobState.FAILED, ErrorCode.PROCESS_SPAWN_FAILED,
                "could not spawn process: " + e.getMessage(), d);
        }

        ObjectNode d = JobEvents.details();
        d.put("pid", launched.pid);
        d.put("logPath", launched.logFile.toString());
        Optional<Job> running = store.transition(id, JobState.QUEUED, JobState.RUNNING,
            "spawned as pid " + launched.pid, d, j -> {
                j.pid = launched.pid;
                j.startedAt = Models.nowIso();
            });
        if (running.isEmpty()) {
            // someone else settled the job between create and spawn
            JobLauncher.terminate(launched.process.toHandle(), stopGraceSec);
            throw new RelayException(ErrorCode.STORE_ERROR, "Job " + id + " left queued state during launch");
        }
        owned.put(id, launched.process);
        events.emit("job.started", running.get(), d);
        watch(running.get(), launched.process);
        return running.get();
    }

    private JobRejectedException reject(String id, JobState to, ErrorCode code, String reason, ObjectNode details) {
        details.put("errorCode", code.wire());
        Job settled = store.transition(id, JobState.QUEUED, to, reason, details, j -> j.errorCode = code.wire())
            .orElseGet(() -> store.get(id));
        log.warn("Job {} {}: {}", id, to, reason);
        events.emit(to == JobState.BLOCKED ? "job.blocked" : "job.failed", settled, details);
        Map<String, Object> ctx = new LinkedHashMap<>();
        details.fields().forEachRemaining(e -> ctx.put(e.getKey(), e.getValue().isTextual() ? e.getValue().asText() : e.getValue().toString()));
        return new JobRejectedException(code, reason, settled, ctx);
    }

    private void watch(Job job, Process process) {
        VisibilityMonitor visibility = new VisibilityMonitor(job.watch.startupHeartbeatSec,
            job.watch.heartbeatEverySec, System.nanoTime());
        JobWatcher watcher = new JobWatcher(this, store, job, process, launcher.exitFile(job.id), visibility, stopGraceSec);
        int every = job.watch.everySec;
        pollers.put(job.id, scheduler.scheduleWithFixedDelay(watcher, every, every, TimeUnit.SECONDS));
        int startup = job.watch.startupHeartbeatSec;
        if (startup > 0 && startup < every) {
            // just past the deadline, so the startup window has expired when it runs
            scheduler.schedule(watcher::checkStartup, TimeUnit.SECONDS.toMillis(startup) + 50, TimeUnit.MILLISECONDS);
        }
    }

    void stopPolling(String id) {
        ScheduledFuture<?> f = pollers.remove(id);
        if (f != null) f.cancel(false);
    }

    void schedulePoll(String id, Runnable poll, long delayNanos) {
        if (closed) return;
        pollers.put(id, scheduler.schedule(poll, delayNanos, TimeUnit.NANOSECONDS));
    }

    boolean isLiveIn(String id, JobState state) {
        return store.findLive(id).map(j -> j.state == state).orElse(false);
    }

    // ---- watcher callbacks ----

    void onExit(String id, int exitCode, List<String> tail) {
        stopPolling(id);
        owned.remove(id);
        Optional<Job> exited = store.withLock(id, () -> {
            Optional<Job> current = store.findLive(id);
            if (current.isEmpty() || current.get().state != JobState.RUNNING) return Optional.<Job>empty();
            Job job = current.get();
            if (job.cancelRequested) {
                finishCanceled(id, JobState.RUNNING, exitCode, tail);
                return Optional.<Job>empty();
            }
            ObjectNode d = JobEvents.details();
            d.put("exitCode", exitCode);
            d.put("pid", job.pid);
            d.set("tail", JobEvents.array(tail));
            Optional<Job> e = store.transition(id, JobState.RUNNING, JobState.EXITED,
                "process exited with code " + exitCode, d, j -> {
                    j.exitCode = exitCode;
                    j.outputTail = new ArrayList<>(tail);
                    j.exitedAt = Models.nowIso();
                });
            e.ifPresent(j -> events.emit("job.exited", j, d));
            return e;
        });
        exited.ifPresent(this::advanceAfterExit);
    }

    void onVanished(String id, long pid, List<String> tail) {
        stopPolling(id);
        owned.remove(id);
        store.withLock(id, () -> {
            Optional<Job> current = store.findLive(id);
            if (current.isEmpty() || current.get().state != JobState.RUNNING) return null;
            if (current.get().cancelRequested) {
                finishCanceled(id, JobState.RUNNING, null, tail);
                return null;
            }
            ObjectNode d = JobEvents.details();
            d.put("pid", pid);
            d.put("errorCode", ErrorCode.RESTART_RECOVERY_MISMATCH.wire());
            store.transition(id, JobState.RUNNING, JobState.BLOCKED,
                "process " + pid + " is gone and no exit status was recorded", d, j -> {
                    j.errorCode = ErrorCode.RESTART_RECOVERY_MISMATCH.wire();
                    j.outputTail = new ArrayList<>(tail);
                }).ifPresent(j -> events.emit("job.blocked", j, d));
            return null;
        });
    }

    void onVisibilityChange(String id, String status, long silentSec) {
        store.update(id, j -> j.visibilityStatus = status).ifPresent(j -> {
            ObjectNode d = JobEvents.details();
            d.put("visibilityStatus", status);
            d.put("silentSec", silentSec);
            if (Models.VISIBILITY_DEGRADED.equals(status)) {
                log.warn("Job {} shows no progress for {}s", id, silentSec);
                events.emit("job.watch.stale_progress", j, d);
            } else {
                log.info("Job {} is making progress again", id);
                events.emit("job.visibility.ok", j, d);
            }
        });
    }

    void advanceAfterExit(Job job) {
        String id = job.id;
        int exit = job.exitCode == null ? -1 : job.exitCode;
        if (exit != 0) {
            ObjectNode d = JobEvents.details();
            d.put("exitCode", exit);
            d.put("errorCode", ErrorCode.NON_ZERO_EXIT.wire());
            store.transition(id, JobState.EXITED, JobState.FAILED, "command exited with code " + exit, d,
                j -> j.errorCode = ErrorCode.NON_ZERO_EXIT.wire())
                .ifPresent(j -> events.emit("job.failed", j, d));
            return;
        }
        if (job.watch.hasRequiredFiles()) {
            List<Path> files = requiredFiles(job);
            ObjectNode d = JobEvents.details();
            d.set("files", JobEvents.array(files.stream().map(Path::toString).collect(Collectors.toList())));
            d.put("timeoutSec", job.watch.readyTimeoutSec);
            Optional<Job> awaiting = store.transition(id, JobState.EXITED, JobState.AWAITING_ARTIFACTS,
                "waiting up to " + job.watch.readyTimeoutSec + "s for required files", d, null);
            if (awaiting.isEmpty()) return;
            events.emit("job.await_artifacts.start", awaiting.get(), d);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(job.watch.readyTimeoutSec);
            startGate(awaiting.get(), files, deadline);
            return;
        }
        if (job.watch.hasThenTask()) {
            enqueuer.enqueue(id, JobState.EXITED, job.watch.thenTask);
            return;
        }
        complete(id, JobState.EXITED, "command exited with code 0", JobEvents.details());
    }

    private void startGate(Job job, List<Path> files, long deadlineNanos) {
        ArtifactGate gate = new ArtifactGate(this, job.id, files, deadlineNanos,
            job.watch.readyPollSec, job.watch.readyTimeoutSec);
        schedulePoll(job.id, gate, 0L);
    }

    List<Path> requiredFiles(Job job) {
        Path base = job.workdir != null ? Path.of(job.workdir) : workdir;
        List<Path> out = new ArrayList<>();
        for (String f : job.watch.requireFiles) {
            Path p = Path.of(f);
            out.add(p.isAbsolute() ? p.normalize() : base.resolve(p).normalize());
        }
        return out;
    }

    // ---- gate callbacks ----

    void onArtifactsReady(String id, List<Path> files) {
        pollers.remove(id);
        store.withLock(id, () -> {
            Optional<Job> current = store.findLive(id);
            if (current.isEmpty() || current.get().state != JobState.AWAITING_ARTIFACTS) return null;
            ObjectNode d = JobEvents.details();
            d.put("outcome", "ready");
            d.set("files", JobEvents.array(files.stream().map(Path::toString).collect(Collectors.toList())));
            store.note(id, "required files ready", d);
            events.emit("job.await_artifacts.ready", current.get(), d);
            finishAfterGate(current.get(), List.of());
            return null;
        });
    }

    void onArtifactsTimeout(String id, List<String> missing, int timeoutSec) {
        pollers.remove(id);
        store.withLock(id, () -> {
            Optional<Job> current = store.findLive(id);
            if (current.isEmpty() || current.get().state != JobState.AWAITING_ARTIFACTS) return null;
            Job job = current.get();
            String reason = "required files still missing after " + timeoutSec + "s: " + String.join(", ", missing);
            ObjectNode d = JobEvents.details();
            d.put("outcome", "timeout");
            d.set("missing", JobEvents.array(missing));
            d.put("onMissing", job.watch.onMissing);
            store.note(id, reason, d);
            events.emit("job.await_artifacts.timeout", job, d);
            log.warn("Job {}: {}", id, reason);
            if (job.watch.blockOnMissing()) {
                ObjectNode b = d.deepCopy();
                b.put("errorCode", ErrorCode.ARTIFACT_TIMEOUT.wire());
                store.transition(id, JobState.AWAITING_ARTIFACTS, JobState.BLOCKED, reason, b, j -> {
                    j.errorCode = ErrorCode.ARTIFACT_TIMEOUT.wire();
                    j.missingFiles = new ArrayList<>(missing);
                }).ifPresent(j -> events.emit("job.blocked", j, b));
                return null;
            }
            Job updated = store.update(id, j -> j.missingFiles = new ArrayList<>(missing)).orElse(job);
            finishAfterGate(updated, missing);
            return null;
        });
    }

    void onArtifactError(String id, Path path, IOException error) {
        pollers.remove(id);
        store.withLock(id, () -> {
            Optional<Job> current = store.findLive(id);
            if (current.isEmpty() || current.get().state != JobState.AWAITING_ARTIFACTS) return null;
            String reason = "could not check required file " + path + ": " + error;
            ObjectNode d = JobEvents.details();
            d.put("outcome", "error");
            d.put("path", path.toString());
            d.put("error", error.toString());
            d.put("errorCode", ErrorCode.ARTIFACT_READ_ERROR.wire());
            events.emit("job.await_artifacts.error", current.get(), d);
            store.transition(id, JobState.AWAITING_ARTIFACTS, JobState.FAILED, reason, d,
                j -> j.errorCode = ErrorCode.ARTIFACT_READ_ERROR.wire())
                .ifPresent(j -> events.emit("job.failed", j, d));
            return null;
        });
    }

    private void finishAfterGate(Job job, List<String> missing) {
        if (job.watch.hasThenTask()) {
            String text = job.watch.thenTask;
            if (!missing.isEmpty()) text = text + "\n\n" + missingNote(missing, job.watch.readyTimeoutSec);
            enqueuer.enqueue(job.id, JobState.AWAITING_ARTIFACTS, text);
            return;
        }
        ObjectNode d = JobEvents.details();
        if (missing.isEmpty()) {
            complete(job.id, JobState.AWAITING_ARTIFACTS, "required files ready", d);
        } else {
            d.set("missing", JobEvents.array(missing));
            complete(job.id, JobState.AWAITING_ARTIFACTS, missingNote(missing, job.watch.readyTimeoutSec), d);
        }
    }

    static String missingNote(List<String> missing, int timeoutSec) {
        return MISSING_NOTE + " required files were still missing after " + timeoutSec + "s: "
            + String.join(", ", missing) + ". Results may be incomplete.";
    }

    private void complete(String id, JobState from, String reason, ObjectNode details) {
        store.transition(id, from, JobState.COMPLETED, reason, details, null)
            .ifPresent(j -> {
                log.info("Job {} completed: {}", id, reason);
                events.emit("job.completed", j, details);
            });
    }

    // ---- stop ----

    /**
     * Stops a running job (SIGTERM to its process tree, SIGKILL after the grace period) or abandons
     * an artifact wait. The job ends {@code failed} with code {@code canceled}. Jobs in any other
     * state are returned unchanged.
     */
    public Job stop(String id) {
        Job job = store.get(id);
        if (job.state != JobState.RUNNING && job.state != JobState.AWAITING_ARTIFACTS) {
            log.info("Job {} is {}, nothing to stop", id, job.state);
            return job;
        }
        Job flagged = store.requestCancel(id).orElse(null);
        if (flagged == null) return store.get(id);
        ObjectNode d = JobEvents.details();
        d.put("from", flagged.state.wire());
        events.emit("job.stop_requested", flagged, d);

        stopPolling(id);
        Integer exit = null;
        if (flagged.state == JobState.RUNNING) {
            Process process = owned.remove(id);
            Optional<ProcessHandle> handle = process != null
                ? Optional.of(process.toHandle())
                : Optional.ofNullable(flagged.pid).flatMap(ProcessHandle::of);
            if (handle.isPresent() && handle.get().isAlive()) {
                log.info("Stopping job {} (pid {})", id, handle.get().pid());
                JobLauncher.terminate(handle.get(), stopGraceSec);
            }
            if (process != null && !process.isAlive()) exit = process.exitValue();
        }
        Integer exitCode = exit;
        List<String> tail = readTail(flagged);
        store.withLock(id, () -> {
            store.findLive(id).ifPresent(current -> {
                if (current.state == JobState.RUNNING || current.state == JobState.AWAITING_ARTIFACTS) {
                    finishCanceled(id, current.state, exitCode, tail);
                }
            });
            return null;
        });
        return store.get(id);
    }

    private void finishCanceled(String id, JobState from, Integer exitCode, List<String> tail) {
        ObjectNode d = JobEvents.details();
        d.put("errorCode", ErrorCode.CANCELED.wire());
        if (exitCode != null) d.put("exitCode", exitCode);
        store.transition(id, from, JobState.FAILED, "canceled by stop request", d, j -> {
            j.errorCode = ErrorCode.CANCELED.wire();
            if (exitCode != null) j.exitCode = exitCode;
            if (from == JobState.RUNNING) j.outputTail = new ArrayList<>(tail);
        }).ifPresent(j -> events.emit("job.failed", j, d));
    }

    // ---- restart recovery ----

    /**
     * Resumes every unfinished job found in the store that this instance is not already polling.
     *
     * @return the jobs that were looked at, as they are after recovery
     */
    public List<Job> recover() {
        List<Job> out = new ArrayList<>();
        for (Job job : store.list(null)) {
            if (pollers.containsKey(job.id)) continue;
            switch (job.state) {
                case RUNNING -> recoverRunning(job);
                case EXITED -> {
                    ObjectNode d = JobEvents.details();
                    d.put("action", "re-evaluate exit");
                    events.emit("job.recovered", job, d);
                    advanceAfterExit(job);
                }
                case AWAITING_ARTIFACTS -> recoverAwaiting(job);
                default -> {
                    continue;
                }
            }
            out.add(store.get(job.id));
        }
        log.info("Recovery looked at {} unfinished job(s)", out.size());
        return out;
    }

    private void recoverRunning(Job job) {
        Optional<ProcessHandle> handle = Optional.ofNullable(job.pid).flatMap(ProcessHandle::of);
        boolean alive = handle.map(ProcessHandle::isAlive).orElse(false) && sameProcess(handle.get(), job);
        if (alive && job.cancelRequested) {
            JobLauncher.terminate(handle.get(), stopGraceSec);
            alive = false;
        }
        ObjectNode d = JobEvents.details();
        d.put("pid", job.pid);
        if (alive) {
            d.put("action", "reattach watcher");
            store.note(job.id, "watcher re-attached after restart", d);
            events.emit("job.recovered", job, d);
            watch(job, null);
            return;
        }
        List<String> tail = readTail(job);
        Integer exit = JobLauncher.readExitStatus(launcher.exitFile(job.id));
        d.put("action", exit != null ? "record exit" : "no exit recorded");
        events.emit("job.recovered", job, d);
        if (exit != null) onExit(job.id, exit, tail);
        else onVanished(job.id, job.pid == null ? -1L : job.pid, tail);
    }

    private void recoverAwaiting(Job job) {
        ObjectNode d = JobEvents.details();
        if (job.exitCode == null) {
            d.put("errorCode", ErrorCode.RESTART_RECOVERY_MISMATCH.wire());
            d.put("action", "no exit recorded");
            events.emit("job.recovered", job, d);
            store.transition(job.id, JobState.AWAITING_ARTIFACTS, JobState.BLOCKED,
                "waiting for artifacts but no exit code was recorded", d,
                j -> j.errorCode = ErrorCode.RESTART_RECOVERY_MISMATCH.wire())
                .ifPresent(j -> events.emit("job.blocked", j, d));
            return;
        }
        long remainingMs = TimeUnit.SECONDS.toMillis(job.watch.readyTimeoutSec) - elapsedSince(job.lastEntry(JobState.AWAITING_ARTIFACTS));
        d.put("action", "resume artifact wait");
        d.put("remainingSec", Math.max(0L, remainingMs / 1000L));
        events.emit("job.recovered", job, d);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, remainingMs));
        startGate(job, requiredFiles(job), deadline);
    }

    private static long elapsedSince(HistoryEntry entry) {
        if (entry == null || entry.at == null) return 0L;
        try {
            return Math.max(0L, Duration.between(Instant.parse(entry.at), Instant.now()).toMillis());
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }

    /** Guards against a recycled pid: the process must not have started after the job did. */
    private static boolean sameProcess(ProcessHandle handle, Job job) {
        if (job.startedAt == null) return true;
        Optional<Instant> started = handle.info().startInstant();
        if (started.isEmpty()) return true;
        try {
            return !started.get().isAfter(Instant.parse(job.startedAt).plusSeconds(2));
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    private List<String> readTail(Job job) {
        if (job.logPath == null) return List.of();
        try {
            return TailBuffer.readFrom(Path.of(job.logPath), job.watch.tailLines).snapshot();
        } catch (IOException e) {
            log.warn("Could not read output of job {}: {}", job.id, e.getMessage());
            return List.of();
        }
    }

    // ---- task runner feedback ----

    public Optional<Job> callbackStarted(String id) {
        ObjectNode d = JobEvents.details();
        Optional<Job> running = store.transition(id, JobState.CALLBACK_QUEUED, JobState.CALLBACK_RUNNING,
            "then task started", d, null);
        running.ifPresent(j -> {
            d.put("taskId", j.callbackTaskId);
            events.emit("job.callback.running", j, d);
        });
        return running;
    }

    public Optional<Job> callbackFinished(String id, boolean success, String detail) {
        return store.withLock(id, () -> {
            Optional<Job> current = store.findLive(id);
            if (current.isEmpty()) return Optional.<Job>empty();
            JobState from = current.get().state;
            if (from != JobState.CALLBACK_QUEUED && from != JobState.CALLBACK_RUNNING) {
                log.warn("Job {} is {}, ignoring callback result", id, from);
                return Optional.<Job>empty();
            }
            ObjectNode d = JobEvents.details();
            if (detail != null) d.put("detail", detail);
            if (success) {
                if (from == JobState.CALLBACK_QUEUED && callbackStarted(id).isEmpty()) return Optional.<Job>empty();
                Optional<Job> done = store.transition(id, JobState.CALLBACK_RUNNING, JobState.COMPLETED,
                    detail == null ? "then task done" : "then task done: " + detail, d, null);
                done.ifPresent(j -> events.emit("job.completed", j, d));
                return done;
            }
            d.put("errorCode", ErrorCode.CALLBACK_TASK_FAILED.wire());
            Optional<Job> failed = store.transition(id, from, JobState.FAILED,
                detail == null ? "then task failed" : "then task failed: " + detail, d,
                j -> j.errorCode = ErrorCode.CALLBACK_TASK_FAILED.wire());
            failed.ifPresent(j -> events.emit("job.failed", j, d));
            return failed;
        });
    }

    // ---- queries ----

    public Optional<Job> find(String id) {
        return store.find(id);
    }

    public List<Job> list(JobState state) {
        return store.list(state);
    }

    /**
     * Blocks until the job is terminal or its callback has been handed to the task queue.
     *
     * @return the job as last read, settled or not
     */
    public Job awaitSettled(String id, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Job job = store.get(id);
        while (!settled(job) && System.nanoTime() < deadline) {
            Thread.sleep(100L);
            job = store.get(id);
        }
        return job;
    }

    static boolean settled(Job job) {
        return job.isTerminal() || job.state == JobState.CALLBACK_QUEUED || job.state == JobState.CALLBACK_RUNNING;
    }

    @Override
    public void close() {
        closed = true;
        pollers.values().forEach(f -> f.cancel(false));
        pollers.clear();
        owned.clear();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Watcher threads did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String newId() {
        return "job-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}

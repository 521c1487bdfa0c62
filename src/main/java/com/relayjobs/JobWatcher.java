package com.relayjobs;

import com.relayjobs.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Polling task for one running job. Scheduled with a fixed delay, so two ticks of the same watcher
 * never overlap.
 */
class JobWatcher implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(JobWatcher.class);

    private final JobService service;
    private final LifecycleStore store;
    private final String jobId;
    private final Process process; // null when re-attached after a restart
    private final long pid;
    private final int tailLines;
    private final Path logFile;
    private final Path exitFile;
    private final VisibilityMonitor visibility;
    private final int stopGraceSec;

    private boolean firstTick = true;
    private long lastLogSize = -1;

    JobWatcher(JobService service, LifecycleStore store, Job job, Process process, Path exitFile,
               VisibilityMonitor visibility, int stopGraceSec) {
        this.service = service;
        this.store = store;
        this.jobId = job.id;
        this.process = process;
        this.pid = process != null ? process.pid() : job.pid;
        this.tailLines = job.watch.tailLines;
        this.logFile = Path.of(job.logPath);
        this.exitFile = exitFile;
        this.visibility = visibility;
        this.stopGraceSec = stopGraceSec;
    }

    @Override
    public synchronized void run() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception would silently cancel the schedule; keep polling instead
            log.error("Watcher tick for job {} failed", jobId, e);
        }
    }

    void tick() {
        Optional<Job> current = store.findLive(jobId);
        if (current.isEmpty() || current.get().state != JobState.RUNNING) {
            service.stopPolling(jobId);
            return;
        }
        Job job = current.get();
        Optional<ProcessHandle> handle = process != null ? Optional.of(process.toHandle()) : ProcessHandle.of(pid);
        boolean alive = isAlive(handle);
        if (alive && job.cancelRequested) {
            log.info("Job {} has a pending stop request, terminating pid {}", jobId, pid);
            JobLauncher.terminate(handle.get(), stopGraceSec);
            alive = isAlive(handle);
        }

        if (!alive) {
            List<String> tail = readTail();
            Integer exit = process != null ? Integer.valueOf(process.exitValue()) : JobLauncher.readExitStatus(exitFile);
            if (exit == null) service.onVanished(jobId, pid, tail);
            else service.onExit(jobId, exit, tail);
            return;
        }

        long now = System.nanoTime();
        long size = logSize();
        if (firstTick) {
            visibility.signal(now);
            firstTick = false;
        } else if (size != lastLogSize) {
            visibility.signal(now);
        }
        if (size != lastLogSize) {
            List<String> tail = readTail();
            store.update(jobId, j -> j.outputTail = tail);
            lastLogSize = size;
        }
        String status = visibility.evaluate(now);
        if (!status.equals(job.visibilityStatus)) {
            service.onVisibilityChange(jobId, status, visibility.silentSeconds(now));
        }
    }

    synchronized void checkStartup() {
        if (!firstTick) return;
        try {
            Optional<Job> current = store.findLive(jobId);
            if (current.isEmpty() || current.get().state != JobState.RUNNING) return;
            long now = System.nanoTime();
            String status = visibility.evaluate(now);
            if (!status.equals(current.get().visibilityStatus)) {
                service.onVisibilityChange(jobId, status, visibility.silentSeconds(now));
            }
        } catch (RuntimeException e) {
            log.error("Startup check for job {} failed", jobId, e);
        }
    }

    private boolean isAlive(Optional<ProcessHandle> handle) {
        if (process != null) return process.isAlive();
        return handle.map(ProcessHandle::isAlive).orElse(false);
    }

    private long logSize() {
        try {
            return Files.size(logFile);
        } catch (IOException e) {
            return 0L;
        }
    }

    private List<String> readTail() {
        try {
            return TailBuffer.readFrom(logFile, tailLines).snapshot();
        } catch (IOException e) {
            log.warn("Could not read output of job {} from {}: {}", jobId, logFile, e.getMessage());
            return List.of();
        }
    }
}

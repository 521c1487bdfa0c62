package com.relayjobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

class ArtifactGate implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ArtifactGate.class);
    private static final long MIN_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    enum Status { READY, WAITING, ERROR }

    static final class Check {
        final Status status;
        final List<String> missing;
        final Path errorPath;
        final IOException error;

        private Check(Status status, List<String> missing, Path errorPath, IOException error) {
            this.status = status;
            this.missing = missing;
            this.errorPath = errorPath;
            this.error = error;
        }
    }

    private final JobService service;
    private final String jobId;
    private final List<Path> files;
    private final long deadlineNanos;
    private final long pollNanos;
    private final int timeoutSec;

    ArtifactGate(JobService service, String jobId, List<Path> files, long deadlineNanos, int pollSec, int timeoutSec) {
        this.service = service;
        this.jobId = jobId;
        this.files = List.copyOf(files);
        this.deadlineNanos = deadlineNanos;
        this.pollNanos = pollInterval(pollSec, timeoutSec);
        this.timeoutSec = timeoutSec;
    }

    @Override
    public void run() {
        try {
            poll();
        } catch (RuntimeException e) {
            log.error("Artifact poll for job {} failed", jobId, e);
            service.schedulePoll(jobId, this, pollNanos);
        }
    }

    void poll() {
        if (!service.isLiveIn(jobId, JobState.AWAITING_ARTIFACTS)) return;
        Check c = check(files);
        switch (c.status) {
            case READY -> service.onArtifactsReady(jobId, files);
            case ERROR -> service.onArtifactError(jobId, c.errorPath, c.error);
            case WAITING -> {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    service.onArtifactsTimeout(jobId, c.missing, timeoutSec);
                } else {
                    log.debug("Job {} still missing {} (next check in {}ms)", jobId, c.missing,
                        TimeUnit.NANOSECONDS.toMillis(Math.min(pollNanos, remaining)));
                    service.schedulePoll(jobId, this, Math.min(pollNanos, remaining));
                }
            }
        }
    }

    /** The configured interval, but at least eight checks per timeout window and no more than ten a second. */
    static long pollInterval(int pollSec, int timeoutSec) {
        long capped = Math.min(TimeUnit.SECONDS.toNanos(pollSec), TimeUnit.SECONDS.toNanos(timeoutSec) / 8);
        return Math.max(MIN_POLL_NANOS, capped);
    }

    static Check check(List<Path> files) {
        List<String> missing = new ArrayList<>();
        for (Path p : files) {
            try {
                BasicFileAttributes a = Files.readAttributes(p, BasicFileAttributes.class);
                if (!a.isRegularFile() || a.size() == 0) missing.add(p.toString());
            } catch (NoSuchFileException e) {
                missing.add(p.toString());
            } catch (IOException e) {
                return new Check(Status.ERROR, missing, p, e);
            }
        }
        if (missing.isEmpty()) return new Check(Status.READY, missing, null, null);
        return new Check(Status.WAITING, missing, null, null);
    }
}

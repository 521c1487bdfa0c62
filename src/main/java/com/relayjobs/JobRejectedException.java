package com.relayjobs;

import com.relayjobs.Models.Job;

import java.util.Map;

/**
 * Thrown by {@link JobService#start} when a job never reaches {@code running}: preflight or
 * wait-pattern rejection, or a spawn failure. The job has already been recorded in its terminal
 * state when this is thrown.
 */
public class JobRejectedException extends RelayException {
    private final transient Job job;

    public JobRejectedException(ErrorCode code, String message, Job job, Map<String, Object> details) {
        super(code, message, details, null);
        this.job = job;
    }

    public Job getJob() {
        return job;
    }
}

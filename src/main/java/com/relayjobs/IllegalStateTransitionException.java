package com.relayjobs;

import java.util.Map;

public class IllegalStateTransitionException extends RelayException {
    public IllegalStateTransitionException(String jobId, JobState from, JobState to) {
        super(ErrorCode.ILLEGAL_TRANSITION, "Job " + jobId + ": illegal transition " + from + " -> " + to,
            Map.of("jobId", jobId, "from", from.wire(), "to", to.wire()), null);
    }
}

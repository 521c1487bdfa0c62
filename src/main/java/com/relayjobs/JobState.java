package com.relayjobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a watched job.
 *
 * <pre>
 * queued -> running -> exited -> awaiting_artifacts -> callback_queued -> callback_running -> completed
 *                            \-> callback_queued / completed / failed
 * </pre>
 *
 * {@code completed}, {@code blocked} and {@code failed} are terminal.
 */
public enum JobState {
    QUEUED("queued"),
    RUNNING("running"),
    EXITED("exited"),
    AWAITING_ARTIFACTS("awaiting_artifacts"),
    CALLBACK_QUEUED("callback_queued"),
    CALLBACK_RUNNING("callback_running"),
    COMPLETED("completed"),
    BLOCKED("blocked"),
    FAILED("failed");

    private static final Map<JobState, Set<JobState>> NEXT = new EnumMap<>(JobState.class);

    static {
        NEXT.put(QUEUED, EnumSet.of(RUNNING, BLOCKED, FAILED));
        NEXT.put(RUNNING, EnumSet.of(EXITED, FAILED, BLOCKED));
        NEXT.put(EXITED, EnumSet.of(AWAITING_ARTIFACTS, CALLBACK_QUEUED, COMPLETED, FAILED));
        NEXT.put(AWAITING_ARTIFACTS, EnumSet.of(CALLBACK_QUEUED, COMPLETED, BLOCKED, FAILED));
        NEXT.put(CALLBACK_QUEUED, EnumSet.of(CALLBACK_RUNNING, FAILED));
        NEXT.put(CALLBACK_RUNNING, EnumSet.of(COMPLETED, FAILED));
        NEXT.put(COMPLETED, EnumSet.noneOf(JobState.class));
        NEXT.put(BLOCKED, EnumSet.noneOf(JobState.class));
        NEXT.put(FAILED, EnumSet.noneOf(JobState.class));
    }

    private final String wire;

    JobState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == BLOCKED || this == FAILED;
    }

    public boolean canTransitionTo(JobState next) {
        return NEXT.get(this).contains(next);
    }

    public Set<JobState> successors() {
        return Collections.unmodifiableSet(NEXT.get(this));
    }

    @JsonCreator
    public static JobState fromWire(String value) {
        if (value == null) return null;
        for (JobState s : values()) {
            if (s.wire.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown job state: " + value);
    }

    @Override
    public String toString() {
        return wire;
    }
}

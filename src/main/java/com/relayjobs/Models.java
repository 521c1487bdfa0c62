package com.relayjobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public class Models {
    public static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    public static String nowIso() {
        return ISO.format(Instant.now());
    }

    public static final String VISIBILITY_OK = "ok";
    public static final String VISIBILITY_DEGRADED = "degraded";

    public static final String ON_MISSING_BLOCK = "block";
    public static final String ON_MISSING_PROCEED = "proceed";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WatchSpec {
        public int everySec = 15;
        public int tailLines = 40;
        public String thenTask = null;
        public boolean runTasks = false;
        public List<String> requireFiles = new ArrayList<>();
        public int readyTimeoutSec = 600;
        public int readyPollSec = 1;
        public String onMissing = ON_MISSING_BLOCK; // block, proceed
        public int startupHeartbeatSec = 120; // 0 => disabled
        public int heartbeatEverySec = 600; // 0 => disabled

        @JsonIgnore
        public boolean hasThenTask() {
            return thenTask != null && !thenTask.isBlank();
        }

        @JsonIgnore
        public boolean hasRequiredFiles() {
            return requireFiles != null && !requireFiles.isEmpty();
        }

        @JsonIgnore
        public boolean blockOnMissing() {
            return !ON_MISSING_PROCEED.equals(onMissing);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreflightCheck {
        public String type; // path_exists, cmd_exit_zero, min_free_disk_gb
        public ObjectNode params = JsonNodeFactory.instance.objectNode();
        public String onFail = "reject"; // reject, warn

        public PreflightCheck() {}

        public PreflightCheck(String type, ObjectNode params, String onFail) {
            this.type = type;
            this.params = params;
            this.onFail = onFail;
        }

        @JsonIgnore
        public boolean rejectOnFail() {
            return !"warn".equals(onFail);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistoryEntry {
        public JobState state;
        public String at;
        public String reason;
        public ObjectNode details;

        public HistoryEntry() {}

        public HistoryEntry(JobState state, String at, String reason, ObjectNode details) {
            this.state = state;
            this.at = at;
            this.reason = reason;
            this.details = details;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Job {
        public String id;
        public String conversationKey;
        public String command;
        public Long pid = null; // only while running
        public WatchSpec watch = new WatchSpec();
        public List<PreflightCheck> preflight = new ArrayList<>();
        public JobState state = JobState.QUEUED;
        public List<HistoryEntry> history = new ArrayList<>();
        public Integer exitCode = null;
        public List<String> outputTail = new ArrayList<>();
        public String visibilityStatus = VISIBILITY_OK;
        public boolean callbackEnqueued = false;
        public String callbackTaskId = null;
        public String reason = null;
        public String errorCode = null;
        public List<String> missingFiles = new ArrayList<>();
        public String logPath = null;
        public String workdir = null;
        public boolean cancelRequested = false;
        public String createdAt = nowIso();
        public String updatedAt = createdAt;
        public String startedAt = null;
        public String exitedAt = null;

        public Job() {}

        public Job(String id, String conversationKey, String command) {
            this.id = id;
            this.conversationKey = conversationKey;
            this.command = command;
        }

        @JsonIgnore
        public boolean isTerminal() {
            return state != null && state.isTerminal();
        }

        public HistoryEntry lastEntry(JobState s) {
            for (int i = history.size() - 1; i >= 0; i--) {
                if (history.get(i).state == s) return history.get(i);
            }
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Task {
        public String id;
        public String conversationKey;
        public String text;
        public String status = "pending"; // pending, running, done, failed, blocked, canceled
        public String sourceJobId;
        public int attempts = 0;
        public String lastError;
        public String createdAt = nowIso();
        public String startedAt;
        public String finishedAt;

        public Task() {}

        public Task(String id, String conversationKey, String text, String sourceJobId) {
            this.id = id;
            this.conversationKey = conversationKey;
            this.text = text;
            this.sourceJobId = sourceJobId;
        }
    }
}

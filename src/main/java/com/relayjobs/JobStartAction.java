package com.relayjobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.PreflightCheck;
import com.relayjobs.Models.WatchSpec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public final class JobStartAction {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public final String command;
    public final WatchSpec watch;
    public final List<PreflightCheck> preflight;
    /** Per-request override of the configured guard mode; null means use the configuration. */
    public final WaitPatternGuard.Mode waitPatternGuard;

    private JobStartAction(String command, WatchSpec watch, List<PreflightCheck> preflight, WaitPatternGuard.Mode waitPatternGuard) {
        this.command = command;
        this.watch = watch;
        this.preflight = preflight;
        this.waitPatternGuard = waitPatternGuard;
    }

    public static JobStartAction parse(String json, ObjectNode cfg) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidJobRequestException("not valid JSON (" + e.getOriginalMessage() + ")", e);
        }
        return fromNode(root, cfg);
    }

    public static JobStartAction fromNode(JsonNode root, ObjectNode cfg) {
        List<String> problems = new ArrayList<>();
        if (root == null || !root.isObject()) {
            throw new InvalidJobRequestException(List.of("request must be a JSON object"));
        }
        JsonNode cmd = root.get("command");
        String command = null;
        if (cmd == null || !cmd.isTextual() || cmd.asText().isBlank()) {
            problems.add("command must be a non-empty string");
        } else {
            command = cmd.asText();
        }

        WatchSpec watch = defaults(cfg);
        JsonNode w = root.get("watch");
        if (w != null && !w.isNull()) {
            if (!w.isObject()) problems.add("watch must be an object");
            else readWatch(w, watch, cfg.path("max_tail_lines").asInt(500), problems);
        }

        List<PreflightCheck> checks = new ArrayList<>();
        JsonNode pf = root.get("preflight");
        if (pf != null && !pf.isNull()) {
            if (!pf.isArray()) problems.add("preflight must be an array");
            else readPreflight(pf, checks, problems);
        }

        WaitPatternGuard.Mode mode = null;
        JsonNode g = root.get("waitPatternGuard");
        if (g != null && !g.isNull()) {
            try {
                mode = WaitPatternGuard.Mode.parse(g.asText());
            } catch (IllegalArgumentException e) {
                problems.add("waitPatternGuard must be off, warn or reject");
            }
        }

        if (!problems.isEmpty()) throw new InvalidJobRequestException(problems);
        return new JobStartAction(command, watch, checks, mode);
    }

    static WatchSpec defaults(ObjectNode cfg) {
        WatchSpec w = new WatchSpec();
        w.everySec = cfg.path("every_sec").asInt(w.everySec);
        w.tailLines = cfg.path("tail_lines").asInt(w.tailLines);
        w.readyTimeoutSec = cfg.path("ready_timeout_sec").asInt(w.readyTimeoutSec);
        w.readyPollSec = cfg.path("ready_poll_sec").asInt(w.readyPollSec);
        w.startupHeartbeatSec = cfg.path("startup_heartbeat_sec").asInt(w.startupHeartbeatSec);
        w.heartbeatEverySec = cfg.path("heartbeat_every_sec").asInt(w.heartbeatEverySec);
        return w;
    }

    private static void readWatch(JsonNode w, WatchSpec out, int maxTailLines, List<String> problems) {
        out.everySec = intField(w, "everySec", out.everySec, 1, 86_400, problems);
        out.tailLines = intField(w, "tailLines", out.tailLines, 1, maxTailLines, problems);
        out.readyTimeoutSec = intField(w, "readyTimeoutSec", out.readyTimeoutSec, 1, 7 * 86_400, problems);
        out.readyPollSec = intField(w, "readyPollSec", out.readyPollSec, 1, 86_400, problems);
        out.startupHeartbeatSec = intField(w, "startupHeartbeatSec", out.startupHeartbeatSec, 0, 86_400, problems);
        out.heartbeatEverySec = intField(w, "heartbeatEverySec", out.heartbeatEverySec, 0, 86_400, problems);

        JsonNode then = w.get("thenTask");
        if (then != null && !then.isNull()) {
            if (!then.isTextual()) problems.add("watch.thenTask must be a string");
            else out.thenTask = then.asText().isBlank() ? null : then.asText();
        }
        JsonNode run = w.get("runTasks");
        if (run != null && !run.isNull()) {
            if (!run.isBoolean()) problems.add("watch.runTasks must be a boolean");
            else out.runTasks = run.asBoolean();
        }
        JsonNode files = w.get("requireFiles");
        if (files != null && !files.isNull()) {
            if (!files.isArray()) {
                problems.add("watch.requireFiles must be an array of paths");
            } else {
                for (JsonNode f : files) {
                    if (!f.isTextual() || f.asText().isBlank()) problems.add("watch.requireFiles entries must be non-empty strings");
                    else out.requireFiles.add(f.asText());
                }
            }
        }
        JsonNode onMissing = w.get("onMissing");
        if (onMissing != null && !onMissing.isNull()) {
            String v = onMissing.asText();
            if (!Models.ON_MISSING_BLOCK.equals(v) && !Models.ON_MISSING_PROCEED.equals(v)) {
                problems.add("watch.onMissing must be block or proceed");
            } else {
                out.onMissing = v;
            }
        }
    }

    private static void readPreflight(JsonNode pf, List<PreflightCheck> out, List<String> problems) {
        int i = 0;
        for (JsonNode c : pf) {
            String where = "preflight[" + i++ + "]";
            if (!c.isObject()) {
                problems.add(where + " must be an object");
                continue;
            }
            String type = c.path("type").asText("");
            if (!PreflightValidator.TYPES.contains(type)) {
                problems.add(where + ".type must be one of " + String.join(", ", PreflightValidator.TYPES.stream().sorted().toList()));
                continue;
            }
            ObjectNode params = MAPPER.createObjectNode();
            JsonNode p = c.get("params");
            if (p != null && !p.isNull()) {
                if (!p.isObject()) {
                    problems.add(where + ".params must be an object");
                    continue;
                }
                params = (ObjectNode) p;
            } else {
                // tolerate the params given inline next to type
                Iterator<String> names = c.fieldNames();
                while (names.hasNext()) {
                    String n = names.next();
                    if (!n.equals("type") && !n.equals("onFail")) params.set(n, c.get(n));
                }
            }
            String onFail = c.path("onFail").asText("reject");
            if (!onFail.equals("reject") && !onFail.equals("warn")) {
                problems.add(where + ".onFail must be reject or warn");
                continue;
            }
            switch (type) {
                case PreflightValidator.PATH_EXISTS -> requireText(params, "path", where, problems);
                case PreflightValidator.CMD_EXIT_ZERO -> {
                    requireText(params, "cmd", where, problems);
                    if (params.has("timeoutSec") && !params.get("timeoutSec").canConvertToInt()) {
                        problems.add(where + ".params.timeoutSec must be an integer");
                    }
                }
                case PreflightValidator.MIN_FREE_DISK_GB -> {
                    requireText(params, "path", where, problems);
                    if (!params.path("gb").isNumber() || params.path("gb").asDouble() < 0) {
                        problems.add(where + ".params.gb must be a non-negative number");
                    }
                }
                default -> { }
            }
            out.add(new PreflightCheck(type, params, onFail));
        }
    }

    private static void requireText(ObjectNode params, String name, String where, List<String> problems) {
        JsonNode v = params.get(name);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            problems.add(where + ".params." + name + " must be a non-empty string");
        }
    }

    private static int intField(JsonNode node, String name, int fallback, int min, int max, List<String> problems) {
        JsonNode v = node.get(name);
        if (v == null || v.isNull()) return fallback;
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            problems.add("watch." + name + " must be an integer");
            return fallback;
        }
        int i = v.asInt();
        if (i < min || i > max) {
            problems.add("watch." + name + " must be between " + min + " and " + max);
            return fallback;
        }
        return i;
    }
}

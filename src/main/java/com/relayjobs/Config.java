package com.relayjobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    public static final File CONFIG_FILE = new File("config.json");

    private static final Set<String> BOOLEAN_KEYS = Set.of("detach");
    private static final Set<String> TEXT_KEYS = Set.of("state_db", "log_directory", "shell", "wait_pattern_guard");

    public static ObjectNode defaults() {
        ObjectNode d = MAPPER.createObjectNode();
        d.put("state_db", "relayjobs.db");
        d.put("log_directory", "job_logs");
        d.put("shell", "bash");
        d.put("detach", true);
        d.put("every_sec", 15);
        d.put("tail_lines", 40);
        d.put("max_tail_lines", 500);
        d.put("ready_timeout_sec", 600);
        d.put("ready_poll_sec", 1);
        d.put("startup_heartbeat_sec", 120);
        d.put("heartbeat_every_sec", 600);
        d.put("wait_pattern_guard", "reject");
        d.put("preflight_timeout_sec", 30);
        d.put("stop_grace_sec", 5);
        d.put("watcher_threads", 4);
        return d;
    }

    public static ObjectNode load() {
        return load(CONFIG_FILE);
    }

    public static ObjectNode load(File file) {
        ObjectNode defaults = defaults();
        if (!file.exists()) {
            save(file, defaults);
            return defaults;
        }
        try {
            JsonNode raw = MAPPER.readTree(file);
            if (!(raw instanceof ObjectNode current)) {
                log.warn("Config file {} is not a JSON object, using defaults", file);
                return defaults;
            }
            Iterator<Map.Entry<String, JsonNode>> it = defaults.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!current.has(e.getKey())) current.set(e.getKey(), e.getValue());
            }
            return current;
        } catch (IOException e) {
            log.warn("Could not read config file {}: {}; using defaults", file, e.getMessage());
            return defaults;
        }
    }

    public static void save(File file, ObjectNode node) {
        try {
            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists()) parent.mkdirs();
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, node);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public static ObjectNode set(File file, String key, String value) {
        ObjectNode cfg = load(file);
        if (!defaults().has(key)) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        if (BOOLEAN_KEYS.contains(key)) {
            if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException(key + " must be true or false");
            }
            cfg.put(key, Boolean.parseBoolean(value));
        } else if (TEXT_KEYS.contains(key)) {
            if (key.equals("wait_pattern_guard")) WaitPatternGuard.Mode.parse(value);
            cfg.put(key, value);
        } else {
            try {
                int intVal = Integer.parseInt(value);
                if (intVal < 0) throw new IllegalArgumentException(key + " must not be negative");
                cfg.put(key, intVal);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer");
            }
        }
        save(file, cfg);
        return cfg;
    }
}

package com.relayjobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingEventSink implements EventSink {
    private static final Logger EVENTS = LoggerFactory.getLogger("relayjobs.events");
    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public void emit(String event, String jobId, ObjectNode details) {
        ObjectNode line = JSON.createObjectNode();
        line.put("subsystem", "relayjobs");
        line.put("event", event);
        line.put("at", Models.nowIso());
        line.put("jobId", jobId);
        if (details != null) line.setAll(details);
        try {
            EVENTS.info(JSON.writeValueAsString(line));
        } catch (JsonProcessingException e) {
            EVENTS.info("[relayjobs] {} job={}", event, jobId);
        }
    }
}

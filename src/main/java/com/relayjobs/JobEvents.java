package com.relayjobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

final class JobEvents {
    private static final Logger log = LoggerFactory.getLogger(JobEvents.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final EventSink sink;

    JobEvents(EventSink sink) {
        this.sink = sink;
    }

    void emit(String event, Job job, ObjectNode details) {
        ObjectNode d = details == null ? JSON.createObjectNode() : details.deepCopy();
        d.put("conversationKey", job.conversationKey);
        d.put("state", job.state.wire());
        if (job.isTerminal() && job.reason != null && !d.has("reason")) d.put("reason", job.reason);
        try {
            sink.emit(event, job.id, d);
        } catch (RuntimeException e) {
            log.warn("Event sink rejected {} for job {}: {}", event, job.id, e.toString());
        }
    }

    static ObjectNode details() {
        return JSON.createObjectNode();
    }

    static ArrayNode array(Collection<String> values) {
        ArrayNode a = JSON.createArrayNode();
        for (String v : values) a.add(v);
        return a;
    }
}

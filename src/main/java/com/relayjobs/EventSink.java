package com.relayjobs;

import com.fasterxml.jackson.databind.node.ObjectNode;

@FunctionalInterface
public interface EventSink {
    void emit(String event, String jobId, ObjectNode details);
}

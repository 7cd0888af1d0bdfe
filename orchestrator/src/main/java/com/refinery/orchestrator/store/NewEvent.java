package com.refinery.orchestrator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.refinery.orchestrator.model.JobEventType;

/**
 * An event before the store has given it a sequence number.
 */
public record NewEvent(JobEventType type, Integer passNumber, String message, JsonNode details) {

    public static NewEvent of(JobEventType type, Integer passNumber, String message) {
        return new NewEvent(type, passNumber, message, JsonNodeFactory.instance.objectNode());
    }

    public static NewEvent of(JobEventType type, Integer passNumber, String message, ObjectNode details) {
        return new NewEvent(type, passNumber, message, details);
    }
}

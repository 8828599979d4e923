package io.lanmesh.network.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Steady-state wire message {@code {"event": ..., "data": ...}}.
 */
public record Frame(String event, JsonNode data) {

    public static final String DEFAULT_EVENT = "message";

    public Frame {
        Objects.requireNonNull(event, "event");
        if (data == null) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }
}

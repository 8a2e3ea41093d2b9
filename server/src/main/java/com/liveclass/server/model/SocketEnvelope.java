package com.liveclass.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * Text frame wrapper used in both directions: {"event": "...", "data": ...}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SocketEnvelope {
    @NotBlank
    public String event;

    public JsonNode data;

    public SocketEnvelope() {
    }

    public SocketEnvelope(String event, JsonNode data) {
        this.event = event;
        this.data = data;
    }
}

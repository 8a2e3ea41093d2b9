package com.liveclass.server.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.liveclass.server.broadcast.Broadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Point-to-point forwarding of offer / answer / ICE messages. Payloads are opaque and
 * never stored; a target without a live connection means the message is dropped.
 */
@Component
public class SignalingRelay {
    private static final Logger log = LoggerFactory.getLogger(SignalingRelay.class);

    private final Broadcaster broadcaster;
    private final ObjectMapper mapper;

    public SignalingRelay(Broadcaster broadcaster, ObjectMapper mapper) {
        this.broadcaster = broadcaster;
        this.mapper = mapper;
    }

    /**
     * @return true if the target had a live connection
     */
    public boolean relay(SignalKind kind, JsonNode payload, String fromId, String toSocketId) {
        if (toSocketId == null || toSocketId.isBlank()) {
            log.debug("[RELAY] {} from={} has no target, dropped", kind.event(), fromId);
            return false;
        }
        ObjectNode body = mapper.createObjectNode();
        body.set(kind.payloadField(), payload);
        body.put("from", fromId);

        boolean delivered = broadcaster.sendTo(toSocketId, kind.event(), body);
        if (delivered) {
            log.debug("[RELAY] {} {} -> {}", kind.event(), fromId, toSocketId);
        } else {
            log.debug("[RELAY] {} {} -> {} dropped, target not connected", kind.event(), fromId, toSocketId);
        }
        return delivered;
    }
}

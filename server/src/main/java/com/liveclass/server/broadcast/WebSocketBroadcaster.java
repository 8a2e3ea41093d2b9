package com.liveclass.server.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveclass.server.model.SocketEnvelope;
import com.liveclass.server.room.RoomRegistry;
import com.liveclass.server.ws.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.Set;

/**
 * Delivers envelopes to live WebSocket sessions. Room fan-out resolves membership
 * through {@link RoomRegistry}.
 */
@Component
public class WebSocketBroadcaster implements Broadcaster {
    private static final Logger log = LoggerFactory.getLogger(WebSocketBroadcaster.class);

    private final ObjectMapper mapper;
    private final ConnectionRegistry connections;
    private final RoomRegistry roomRegistry;

    public WebSocketBroadcaster(ObjectMapper mapper, ConnectionRegistry connections, RoomRegistry roomRegistry) {
        this.mapper = mapper;
        this.connections = connections;
        this.roomRegistry = roomRegistry;
    }

    @Override
    public boolean sendTo(String socketId, String event, Object payload) {
        WebSocketSession ws = connections.get(socketId);
        if (ws == null || !ws.isOpen()) {
            log.debug("[DROP] event={} to={} (not connected)", event, socketId);
            return false;
        }
        TextMessage frame = encode(event, payload);
        return frame != null && deliver(ws, frame, event);
    }

    @Override
    public void broadcastToRoom(String roomId, String event, Object payload, String excludingSocketId) {
        Set<String> members = roomRegistry.members(roomId);
        if (members.isEmpty()) return;

        TextMessage frame = encode(event, payload);
        if (frame == null) return;

        int ok = 0;
        for (String socketId : members) {
            if (socketId.equals(excludingSocketId)) continue;
            WebSocketSession ws = connections.get(socketId);
            if (ws != null && ws.isOpen() && deliver(ws, frame, event)) ok++;
        }
        log.debug("[BROADCAST] room={} event={} delivered={}", roomId, event, ok);
    }

    private boolean deliver(WebSocketSession ws, TextMessage frame, String event) {
        try {
            ws.sendMessage(frame);
            return true;
        } catch (Exception e) {
            log.warn("[WARN] send fail socket={} event={} {}", ws.getId(), event, e.getMessage());
            return false;
        }
    }

    private TextMessage encode(String event, Object payload) {
        try {
            SocketEnvelope env = new SocketEnvelope(event, mapper.valueToTree(payload));
            return new TextMessage(mapper.writeValueAsString(env));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("[ERROR] cannot encode event={}", event, e);
            return null;
        }
    }
}

package com.liveclass.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveclass.server.model.Events;
import com.liveclass.server.model.JoinRoomRequest;
import com.liveclass.server.model.NameChangeRequest;
import com.liveclass.server.model.SocketEnvelope;
import com.liveclass.server.model.VoiceActivityRequest;
import com.liveclass.server.relay.SignalKind;
import com.liveclass.server.session.SessionCoordinator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Set;

/**
 * Classroom socket endpoint:
 * - connect: register the session under its id (the connection handle)
 * - text frame: decode the {event, data} envelope, validate, hand to {@link SessionCoordinator}
 * - close: unregister, then run the coordinator's disconnect
 */
@Component
public class ClassroomSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ClassroomSocketHandler.class);

    private final ObjectMapper mapper;
    private final Validator validator;
    private final ConnectionRegistry connections;
    private final SessionCoordinator coordinator;

    public ClassroomSocketHandler(ObjectMapper mapper,
                                  Validator validator,
                                  ConnectionRegistry connections,
                                  SessionCoordinator coordinator) {
        this.mapper = mapper;
        this.validator = validator;
        this.connections = connections;
        this.coordinator = coordinator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.register(session);
        log.info("[CONNECT] socket={} total={}", session.getId(), connections.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // 1) envelope
        SocketEnvelope env;
        try {
            env = mapper.readValue(message.getPayload(), SocketEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] invalid json from socket={}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        if (!isValid(env, session)) return;

        // 2) dispatch; nothing escapes to the container
        try {
            dispatch(session.getId(), env);
        } catch (RuntimeException e) {
            log.error("[ERROR] event={} socket={} failed", env.event, session.getId(), e);
        }
    }

    private void dispatch(String socketId, SocketEnvelope env) {
        switch (env.event) {
            case Events.JOIN_ROOM: {
                JoinRoomRequest req = bind(env, JoinRoomRequest.class, socketId);
                if (req != null) coordinator.join(req.userId, socketId, req.name, req.roomId, req.role);
                return;
            }
            case Events.NAME_CHANGED: {
                NameChangeRequest req = bind(env, NameChangeRequest.class, socketId);
                if (req != null) coordinator.rename(socketId, req.roomId, req.newName);
                return;
            }
            case Events.VOICE_ACTIVITY: {
                VoiceActivityRequest req = bind(env, VoiceActivityRequest.class, socketId);
                if (req != null) coordinator.voiceActivity(socketId, req.roomId, req.isActive);
                return;
            }
            default:
                break;
        }

        SignalKind kind = SignalKind.fromEvent(env.event);
        if (kind == null) {
            log.warn("[WARN] unknown event={} from socket={}", env.event, socketId);
            return;
        }
        if (env.data == null || !env.data.isObject()) {
            log.warn("[WARN] {} without body from socket={}", env.event, socketId);
            return;
        }
        JsonNode to = env.data.get("to");
        JsonNode from = env.data.get("from");
        String fromId = from != null && from.isTextual() ? from.asText() : socketId;
        coordinator.signal(kind, env.data.get(kind.payloadField()), fromId, to != null && to.isTextual() ? to.asText() : null);
    }

    private <T> T bind(SocketEnvelope env, Class<T> type, String socketId) {
        if (env.data == null || !env.data.isObject()) {
            log.warn("[WARN] {} without body from socket={}", env.event, socketId);
            return null;
        }
        T req;
        try {
            req = mapper.treeToValue(env.data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[WARN] bad {} payload from socket={}: {}", env.event, socketId, e.getMessage());
            return null;
        }
        Set<ConstraintViolation<T>> violations = validator.validate(req);
        if (!violations.isEmpty()) {
            log.warn("[WARN] validation failed for {} from socket={}: {}", env.event, socketId, violations);
            return null;
        }
        return req;
    }

    private boolean isValid(SocketEnvelope env, WebSocketSession session) {
        Set<ConstraintViolation<SocketEnvelope>> violations = validator.validate(env);
        if (!violations.isEmpty()) {
            log.warn("[WARN] envelope rejected from socket={}: {}", session.getId(), violations);
            return false;
        }
        return true;
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error socket={}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String socketId = session.getId();
        connections.unregister(socketId);
        try {
            coordinator.disconnect(socketId);
        } catch (RuntimeException e) {
            log.error("[ERROR] disconnect cleanup failed socket={}", socketId, e);
        }
        log.info("[DISCONNECT] socket={} status={}", socketId, status);
    }
}

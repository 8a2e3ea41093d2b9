package com.liveclass.server.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.liveclass.server.broadcast.Broadcaster;
import com.liveclass.server.dao.ClassRecordStore;
import com.liveclass.server.dao.PresenceStore;
import com.liveclass.server.dao.StorageUnavailableException;
import com.liveclass.server.lifecycle.ModeratorLifecycle;
import com.liveclass.server.model.Events;
import com.liveclass.server.model.ParticipantRecord;
import com.liveclass.server.model.Role;
import com.liveclass.server.relay.SignalKind;
import com.liveclass.server.relay.SignalingRelay;
import com.liveclass.server.room.RoomLocks;
import com.liveclass.server.room.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for connection events. Room membership and moderator transitions for a
 * room are applied under that room's lock; the presence store is only consulted for
 * display data, so its failures never block membership bookkeeping on disconnect.
 */
@Component
public class SessionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    static final String CLASS_ENDED_REASON = "Class ended by moderator";

    private final PresenceStore presence;
    private final RoomRegistry roomRegistry;
    private final RoomLocks locks;
    private final ModeratorLifecycle lifecycle;
    private final SignalingRelay relay;
    private final Broadcaster broadcaster;
    private final ClassRecordStore classRecords;
    private final ObjectMapper mapper;

    public SessionCoordinator(PresenceStore presence,
                              RoomRegistry roomRegistry,
                              RoomLocks locks,
                              ModeratorLifecycle lifecycle,
                              SignalingRelay relay,
                              Broadcaster broadcaster,
                              ClassRecordStore classRecords,
                              ObjectMapper mapper) {
        this.presence = presence;
        this.roomRegistry = roomRegistry;
        this.locks = locks;
        this.lifecycle = lifecycle;
        this.relay = relay;
        this.broadcaster = broadcaster;
        this.classRecords = classRecords;
        this.mapper = mapper;
    }

    public void join(String userId, String socketId, String name, String roomId, Role role) {
        Role effective = role == null ? Role.STUDENT : role;
        locks.run(roomId, () -> {
            int size = roomRegistry.join(roomId, socketId);

            // room state follows membership; presence only feeds the display lists
            if (effective == Role.MODERATOR) {
                lifecycle.onModeratorJoin(roomId, socketId);
            }

            List<ParticipantRecord> otherUsers;
            try {
                presence.upsertParticipant(userId, socketId, name, roomId, effective);

                Set<String> others = new LinkedHashSet<>(roomRegistry.members(roomId));
                others.remove(socketId);
                otherUsers = presence.listParticipants(others);
            } catch (StorageUnavailableException e) {
                log.error("[JOIN] room={} socket={} presence store unavailable", roomId, socketId, e);
                sendError(socketId, "Failed to join room");
                return;
            }

            broadcaster.sendTo(socketId, Events.USER_LIST, otherUsers);

            ObjectNode joined = mapper.createObjectNode()
                    .put("userId", userId)
                    .put("socketId", socketId)
                    .put("name", name)
                    .put("role", effective.wire());
            broadcaster.broadcastToRoom(roomId, Events.USER_JOINED, joined, socketId);

            log.info("[JOIN] room={} user={} name={} role={} socket={} total={}",
                    roomId, userId, name, effective.wire(), socketId, size);
        });
    }

    public void rename(String socketId, String roomId, String newName) {
        locks.run(roomId, () -> {
            boolean found;
            try {
                found = presence.renameParticipant(socketId, newName);
            } catch (StorageUnavailableException e) {
                log.error("[RENAME] socket={} presence store unavailable", socketId, e);
                sendError(socketId, "Failed to update name");
                return;
            }
            if (!found) {
                log.debug("[RENAME] socket={} has no presence record, ignored", socketId);
                return;
            }
            ObjectNode body = mapper.createObjectNode()
                    .put("socketId", socketId)
                    .put("newName", newName);
            broadcaster.broadcastToRoom(roomId, Events.USER_NAME_CHANGED, body, socketId);
            log.info("[RENAME] room={} socket={} newName={}", roomId, socketId, newName);
        });
    }

    public void voiceActivity(String socketId, String roomId, boolean isActive) {
        ObjectNode body = mapper.createObjectNode()
                .put("socketId", socketId)
                .put("isActive", isActive);
        broadcaster.broadcastToRoom(roomId, Events.USER_VOICE_ACTIVITY, body, socketId);
    }

    public boolean signal(SignalKind kind, JsonNode payload, String fromId, String toSocketId) {
        return relay.relay(kind, payload, fromId, toSocketId);
    }

    public void disconnect(String socketId) {
        ParticipantRecord user = null;
        try {
            user = presence.getParticipant(socketId).orElse(null);
        } catch (StorageUnavailableException e) {
            log.warn("[LEAVE] socket={} presence lookup failed: {}", socketId, e.getMessage());
        }
        try {
            presence.removeParticipant(socketId);
        } catch (StorageUnavailableException e) {
            log.warn("[LEAVE] socket={} presence delete failed: {}", socketId, e.getMessage());
        }

        if (user != null) {
            log.info("[LEAVE] socket={} was {} ({}) in room {}", socketId, user.getName(), user.getRole().wire(), user.getRoomId());
        } else {
            log.info("[LEAVE] socket={}", socketId);
        }

        roomRegistry.forEachRoomContaining(socketId, roomId -> locks.run(roomId, () -> leaveRoom(roomId, socketId)));
    }

    private void leaveRoom(String roomId, String socketId) {
        // the room may have been closed between the scan and taking the lock
        if (!roomRegistry.members(roomId).contains(socketId)) return;

        int remaining = roomRegistry.leave(roomId, socketId);
        broadcaster.broadcastToRoom(roomId, Events.USER_DISCONNECTED, socketId, socketId);

        if (lifecycle.isModerator(roomId, socketId)) {
            lifecycle.onModeratorDisconnect(roomId, socketId, remaining);
        }

        if (remaining == 0) {
            lifecycle.teardown(roomId);
            log.info("[LEAVE] room={} is now empty, removed", roomId);
        } else {
            log.info("[LEAVE] room={} remaining={}", roomId, remaining);
        }
    }

    /**
     * Marks the class live. Does not touch room state.
     */
    public void startClass(String accessCode) {
        classRecords.markClassLive(accessCode);
        log.info("[CLASS] {} is now live", accessCode);
    }

    /**
     * Marks the class ended, then closes its room whatever the moderator state.
     * A missing class record rejects the request before the room is touched.
     */
    public void endClass(String accessCode) {
        classRecords.markClassEnded(accessCode);
        lifecycle.closeRoom(accessCode, CLASS_ENDED_REASON);
        log.info("[CLASS] {} ended", accessCode);
    }

    private void sendError(String socketId, String message) {
        broadcaster.sendTo(socketId, Events.ERROR, mapper.createObjectNode().put("message", message));
    }
}

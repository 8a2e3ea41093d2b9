package com.liveclass.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One row of the presence store: who is behind a live connection and where they are.
 * Serializes to the {@code user-list} item shape {socketId, userId, name, role}.
 */
@JsonPropertyOrder({"socketId", "userId", "name", "role"})
public final class ParticipantRecord {
    private final String userId;
    private final String socketId;
    private final String name;
    private final String roomId;
    private final Role role;

    public ParticipantRecord(String userId, String socketId, String name, String roomId, Role role) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.socketId = Objects.requireNonNull(socketId, "socketId");
        this.name = name;
        this.roomId = roomId;
        this.role = role == null ? Role.STUDENT : role;
    }

    public String getUserId() { return userId; }
    public String getSocketId() { return socketId; }
    public String getName() { return name; }
    @JsonIgnore
    public String getRoomId() { return roomId; }
    public Role getRole() { return role; }

    public ParticipantRecord withName(String newName) {
        return new ParticipantRecord(userId, socketId, newName, roomId, role);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParticipantRecord)) return false;
        ParticipantRecord that = (ParticipantRecord) o;
        return userId.equals(that.userId) && socketId.equals(that.socketId)
                && Objects.equals(name, that.name) && Objects.equals(roomId, that.roomId)
                && role == that.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, socketId, name, roomId, role);
    }

    @Override
    public String toString() {
        return "ParticipantRecord{userId=" + userId + ", socketId=" + socketId + ", name=" + name
                + ", roomId=" + roomId + ", role=" + role.wire() + "}";
    }
}

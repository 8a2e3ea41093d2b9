package com.liveclass.server.dao;

import com.liveclass.server.model.ParticipantRecord;
import com.liveclass.server.model.Role;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local presence store, used when no database is configured.
 */
public class InMemoryPresenceStore implements PresenceStore {

    private final Map<String, ParticipantRecord> bySocket = new ConcurrentHashMap<>();

    @Override
    public synchronized void upsertParticipant(String userId, String socketId, String name, String roomId, Role role) {
        bySocket.remove(socketId);
        bySocket.values().removeIf(r -> r.getUserId().equals(userId));
        bySocket.put(socketId, new ParticipantRecord(userId, socketId, name, roomId, role));
    }

    @Override
    public Optional<ParticipantRecord> getParticipant(String socketId) {
        return Optional.ofNullable(bySocket.get(socketId));
    }

    @Override
    public synchronized boolean renameParticipant(String socketId, String newName) {
        return bySocket.computeIfPresent(socketId, (k, r) -> r.withName(newName)) != null;
    }

    @Override
    public synchronized void removeParticipant(String socketId) {
        bySocket.remove(socketId);
    }

    @Override
    public List<ParticipantRecord> listParticipants(Collection<String> socketIds) {
        List<ParticipantRecord> out = new ArrayList<>();
        if (socketIds == null) return out;
        for (String socketId : socketIds) {
            ParticipantRecord r = bySocket.get(socketId);
            if (r != null) out.add(r);
        }
        return out;
    }
}

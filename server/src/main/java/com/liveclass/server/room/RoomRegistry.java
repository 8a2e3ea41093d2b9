package com.liveclass.server.room;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Authoritative room membership: roomId -> live connection handles.
 * A room exists from its first join until its set becomes empty or it is removed.
 */
@Component
public class RoomRegistry {

    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    /**
     * @return room size after the join
     */
    public int join(String roomId, String socketId) {
        Set<String> set = rooms.compute(roomId, (k, v) -> {
            Set<String> s = v != null ? v : ConcurrentHashMap.newKeySet();
            s.add(socketId);
            return s;
        });
        return set.size();
    }

    /**
     * @return members left in the room; 0 when the room is gone or never existed
     */
    public int leave(String roomId, String socketId) {
        Set<String> set = rooms.computeIfPresent(roomId, (k, v) -> {
            v.remove(socketId);
            return v.isEmpty() ? null : v;
        });
        return set == null ? 0 : set.size();
    }

    public Set<String> members(String roomId) {
        Set<String> set = rooms.get(roomId);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    public int size(String roomId) {
        Set<String> set = rooms.get(roomId);
        return set == null ? 0 : set.size();
    }

    public boolean contains(String roomId) {
        return rooms.containsKey(roomId);
    }

    /** Drops the room regardless of membership. */
    public void remove(String roomId) {
        rooms.remove(roomId);
    }

    /**
     * Runs {@code fn} for every room holding the handle. Iterates a snapshot, so
     * {@code fn} may call {@link #leave}.
     */
    public void forEachRoomContaining(String socketId, Consumer<String> fn) {
        List<String> hits = new ArrayList<>();
        rooms.forEach((roomId, set) -> {
            if (set.contains(socketId)) hits.add(roomId);
        });
        hits.forEach(fn);
    }
}

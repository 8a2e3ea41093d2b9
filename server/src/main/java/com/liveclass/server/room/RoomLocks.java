package com.liveclass.server.room;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per room. A room's entry lives while some thread holds or waits for it and
 * is dropped by the last one out, so a slow room never blocks another.
 */
@Component
public class RoomLocks {

    private static final class RoomLock {
        final ReentrantLock lock = new ReentrantLock();
        int users; // guarded by the map's per-key compute
    }

    private final Map<String, RoomLock> locks = new ConcurrentHashMap<>();

    public void run(String roomId, Runnable task) {
        RoomLock l = acquire(roomId);
        try {
            task.run();
        } finally {
            release(roomId, l);
        }
    }

    public <T> T call(String roomId, Supplier<T> task) {
        RoomLock l = acquire(roomId);
        try {
            return task.get();
        } finally {
            release(roomId, l);
        }
    }

    public boolean isHeldByCurrentThread(String roomId) {
        RoomLock l = locks.get(roomId);
        return l != null && l.lock.isHeldByCurrentThread();
    }

    /** Rooms with a lock currently held or awaited. */
    public int activeRooms() {
        return locks.size();
    }

    private RoomLock acquire(String roomId) {
        RoomLock l = locks.compute(roomId, (k, cur) -> {
            RoomLock next = cur == null ? new RoomLock() : cur;
            next.users++;
            return next;
        });
        l.lock.lock();
        return l;
    }

    private void release(String roomId, RoomLock l) {
        l.lock.unlock();
        locks.computeIfPresent(roomId, (k, cur) -> --cur.users == 0 ? null : cur);
    }
}

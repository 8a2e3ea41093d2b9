package com.liveclass.server.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.liveclass.server.broadcast.Broadcaster;
import com.liveclass.server.dao.ClassRecordNotFoundException;
import com.liveclass.server.dao.ClassRecordStore;
import com.liveclass.server.model.Events;
import com.liveclass.server.room.RoomLocks;
import com.liveclass.server.room.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-room moderator state machine.
 * <pre>
 *   NO_MODERATOR --moderator join--> MODERATOR_PRESENT
 *   MODERATOR_PRESENT --moderator disconnect, members left--> PENDING_CLOSE
 *   MODERATOR_PRESENT --moderator disconnect, room empty--> (torn down)
 *   PENDING_CLOSE --moderator join--> MODERATOR_PRESENT
 *   PENDING_CLOSE --grace period elapsed--> CLOSED --> (torn down)
 *   any --explicit close--> (torn down)
 * </pre>
 * Every transition runs under the room lock from {@link RoomLocks}; the closure timer
 * takes the same lock and only acts if the room still holds the exact pending state
 * that scheduled it, so a cancelled timer never closes the room.
 */
@Component
public class ModeratorLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ModeratorLifecycle.class);

    private final Map<String, ModeratorState> states = new ConcurrentHashMap<>();

    private final RoomRegistry roomRegistry;
    private final RoomLocks locks;
    private final Broadcaster broadcaster;
    private final ClassRecordStore classRecords;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration gracePeriod;

    public ModeratorLifecycle(RoomRegistry roomRegistry,
                              RoomLocks locks,
                              Broadcaster broadcaster,
                              ClassRecordStore classRecords,
                              ObjectMapper mapper,
                              @Qualifier("roomCloserScheduler") ScheduledExecutorService scheduler,
                              Clock clock,
                              @Value("${classroom.moderator.grace-period-ms:60000}") long gracePeriodMs) {
        this.roomRegistry = roomRegistry;
        this.locks = locks;
        this.broadcaster = broadcaster;
        this.classRecords = classRecords;
        this.mapper = mapper;
        this.scheduler = scheduler;
        this.clock = clock;
        this.gracePeriod = Duration.ofMillis(gracePeriodMs);
    }

    public ModeratorState.Phase phase(String roomId) {
        return locks.call(roomId, () -> stateOf(roomId).phase());
    }

    public ModeratorState state(String roomId) {
        return locks.call(roomId, () -> stateOf(roomId));
    }

    public boolean isModerator(String roomId, String socketId) {
        return locks.call(roomId, () -> stateOf(roomId).isHeldBy(socketId));
    }

    /** Countdown announced to students, whole seconds rounded up. */
    public long countdownSeconds() {
        long ms = gracePeriod.toMillis();
        return (ms + 999) / 1000;
    }

    public void onModeratorJoin(String roomId, String socketId) {
        locks.run(roomId, () -> {
            ModeratorState cur = stateOf(roomId);
            switch (cur.phase()) {
                case PENDING_CLOSE:
                    cur.cancelTimer();
                    broadcaster.broadcastToRoom(roomId, Events.MODERATOR_RETURNED,
                            notice("message", "Moderator returned. Class will continue."), null);
                    log.info("[MODERATOR] room={} moderator returned socket={}, closure timer cancelled", roomId, socketId);
                    break;
                case MODERATOR_PRESENT:
                    if (!cur.isHeldBy(socketId)) {
                        log.warn("[MODERATOR] room={} already has moderator {}, replacing with {}",
                                roomId, cur.moderatorSocketId(), socketId);
                    }
                    break;
                default:
                    log.info("[MODERATOR] room={} moderator={}", roomId, socketId);
            }
            states.put(roomId, ModeratorState.present(socketId));
        });
    }

    /**
     * Applies only when {@code socketId} is the moderator currently held for the room.
     *
     * @param remaining room members left after the moderator's removal
     * @return true if a transition happened
     */
    public boolean onModeratorDisconnect(String roomId, String socketId, int remaining) {
        return locks.call(roomId, () -> {
            if (!stateOf(roomId).isHeldBy(socketId)) return false;

            if (remaining <= 0) {
                log.info("[MODERATOR] room={} moderator left an empty room, tearing down", roomId);
                teardown(roomId);
                return true;
            }

            Instant deadline = clock.instant().plus(gracePeriod);
            ModeratorState pending = ModeratorState.pendingClose(deadline);
            states.put(roomId, pending);

            long countdown = countdownSeconds();
            ObjectNode body = mapper.createObjectNode()
                    .put("message", "Moderator left the class. Room will close in " + describe(countdown)
                            + " unless moderator returns.")
                    .put("countdown", countdown)
                    .put("deadline", deadline.toEpochMilli());
            broadcaster.broadcastToRoom(roomId, Events.MODERATOR_LEFT, body, null);

            ScheduledFuture<?> timer = scheduler.schedule(() -> expire(roomId, pending),
                    gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            pending.attachTimer(timer);
            log.info("[MODERATOR] room={} moderator {} left, closing at {} unless they return ({} users remaining)",
                    roomId, socketId, deadline, remaining);
            return true;
        });
    }

    /**
     * Explicit end of class: notifies the room if it is live and tears it down whatever
     * the moderator state.
     *
     * @return true if the room was live
     */
    public boolean closeRoom(String roomId, String reason) {
        return locks.call(roomId, () -> {
            boolean live = roomRegistry.contains(roomId);
            if (live) {
                broadcaster.broadcastToRoom(roomId, Events.CLASS_ENDED, notice("reason", reason), null);
            }
            teardown(roomId);
            log.info("[CLOSE] room={} closed explicitly (wasLive={})", roomId, live);
            return live;
        });
    }

    /** Idempotent: drops membership, moderator state and any pending timer. */
    public void teardown(String roomId) {
        locks.run(roomId, () -> {
            ModeratorState s = states.remove(roomId);
            if (s != null) s.cancelTimer();
            roomRegistry.remove(roomId);
        });
    }

    private void expire(String roomId, ModeratorState expected) {
        try {
            locks.run(roomId, () -> {
                if (states.get(roomId) != expected) {
                    log.debug("[TIMER] room={} closure timer is stale, ignoring", roomId);
                    return;
                }
                states.put(roomId, ModeratorState.closed());
                log.info("[TIMER] room={} closing, moderator did not return", roomId);

                try {
                    classRecords.markClassEnded(roomId);
                } catch (ClassRecordNotFoundException e) {
                    log.warn("[TIMER] room={} has no class record to mark ended", roomId);
                } catch (RuntimeException e) {
                    log.error("[TIMER] room={} failed to mark class ended", roomId, e);
                }

                broadcaster.broadcastToRoom(roomId, Events.ROOM_CLOSED,
                        notice("reason", "Moderator left and didn't return within " + describe(countdownSeconds())), null);
                teardown(roomId);
            });
        } catch (RuntimeException e) {
            log.error("[TIMER] room={} closure failed", roomId, e);
        }
    }

    private ModeratorState stateOf(String roomId) {
        ModeratorState s = states.get(roomId);
        return s == null ? ModeratorState.none() : s;
    }

    private ObjectNode notice(String field, String text) {
        return mapper.createObjectNode().put(field, text);
    }

    private static String describe(long seconds) {
        if (seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes == 1 ? "1 minute" : minutes + " minutes";
        }
        return seconds == 1 ? "1 second" : seconds + " seconds";
    }
}

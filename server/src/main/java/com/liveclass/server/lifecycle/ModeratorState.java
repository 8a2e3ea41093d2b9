package com.liveclass.server.lifecycle;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Moderator presence for one room. The pending-close variant carries its own timer so
 * that cancelling the timer and leaving the state happen in one step.
 *
 * <p>Instances are only read or changed while the room lock is held.</p>
 */
public final class ModeratorState {

    public enum Phase {
        NO_MODERATOR,
        MODERATOR_PRESENT,
        PENDING_CLOSE,
        CLOSED
    }

    private static final ModeratorState NONE = new ModeratorState(Phase.NO_MODERATOR, null, null);
    private static final ModeratorState CLOSED = new ModeratorState(Phase.CLOSED, null, null);

    private final Phase phase;
    private final String moderatorSocketId;
    private final Instant deadline;
    private ScheduledFuture<?> timer;

    private ModeratorState(Phase phase, String moderatorSocketId, Instant deadline) {
        this.phase = phase;
        this.moderatorSocketId = moderatorSocketId;
        this.deadline = deadline;
    }

    public static ModeratorState none() {
        return NONE;
    }

    public static ModeratorState present(String socketId) {
        return new ModeratorState(Phase.MODERATOR_PRESENT, socketId, null);
    }

    public static ModeratorState pendingClose(Instant deadline) {
        return new ModeratorState(Phase.PENDING_CLOSE, null, deadline);
    }

    public static ModeratorState closed() {
        return CLOSED;
    }

    public Phase phase() {
        return phase;
    }

    /** Held handle, only for {@link Phase#MODERATOR_PRESENT}. */
    public String moderatorSocketId() {
        return moderatorSocketId;
    }

    /** Closure deadline, only for {@link Phase#PENDING_CLOSE}. */
    public Instant deadline() {
        return deadline;
    }

    public boolean isHeldBy(String socketId) {
        return phase == Phase.MODERATOR_PRESENT && moderatorSocketId.equals(socketId);
    }

    void attachTimer(ScheduledFuture<?> timer) {
        if (phase != Phase.PENDING_CLOSE) {
            throw new IllegalStateException("timer only belongs to PENDING_CLOSE, not " + phase);
        }
        this.timer = timer;
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    @Override
    public String toString() {
        switch (phase) {
            case MODERATOR_PRESENT:
                return "MODERATOR_PRESENT(" + moderatorSocketId + ")";
            case PENDING_CLOSE:
                return "PENDING_CLOSE(" + deadline + ")";
            default:
                return phase.name();
        }
    }
}

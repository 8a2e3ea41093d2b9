package com.liveclass.server.dao;

import com.liveclass.server.model.ParticipantRecord;
import com.liveclass.server.model.Role;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Connection handle to participant mapping used for display metadata.
 * Not authoritative for membership; see {@link com.liveclass.server.room.RoomRegistry}.
 *
 * <p>All methods throw {@link StorageUnavailableException} when the backing store fails.</p>
 */
public interface PresenceStore {

    /**
     * Removes any record keyed by {@code socketId} or {@code userId}, then inserts the new one.
     * A reconnecting participant silently supersedes their prior record.
     */
    void upsertParticipant(String userId, String socketId, String name, String roomId, Role role);

    Optional<ParticipantRecord> getParticipant(String socketId);

    /**
     * @return false when no record exists for {@code socketId} (nothing changed)
     */
    boolean renameParticipant(String socketId, String newName);

    /** Idempotent. */
    void removeParticipant(String socketId);

    /**
     * Resolves each handle in iteration order. Handles without a record are skipped.
     */
    List<ParticipantRecord> listParticipants(Collection<String> socketIds);
}

package com.liveclass.server.dao;

/**
 * Persisted class status, keyed by access code (which is also the room id).
 */
public interface ClassRecordStore {

    /**
     * @throws ClassRecordNotFoundException no class with that access code
     * @throws StorageUnavailableException  backing store failure
     */
    void markClassLive(String accessCode);

    /**
     * @throws ClassRecordNotFoundException no class with that access code
     * @throws StorageUnavailableException  backing store failure
     */
    void markClassEnded(String accessCode);
}

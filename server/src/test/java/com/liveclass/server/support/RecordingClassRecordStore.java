package com.liveclass.server.support;

import com.liveclass.server.dao.ClassRecordNotFoundException;
import com.liveclass.server.dao.ClassRecordStore;
import com.liveclass.server.dao.StorageUnavailableException;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingClassRecordStore implements ClassRecordStore {

    public final List<String> live = new CopyOnWriteArrayList<>();
    public final List<String> ended = new CopyOnWriteArrayList<>();
    private final Set<String> unknown = ConcurrentHashMap.newKeySet();
    private volatile boolean failing;

    public void markUnknown(String accessCode) {
        unknown.add(accessCode);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public void markClassLive(String accessCode) {
        check(accessCode);
        live.add(accessCode);
    }

    @Override
    public void markClassEnded(String accessCode) {
        check(accessCode);
        ended.add(accessCode);
    }

    private void check(String accessCode) {
        if (failing) throw new StorageUnavailableException("db down", new SQLException("connection refused"));
        if (unknown.contains(accessCode)) throw new ClassRecordNotFoundException(accessCode);
    }
}

package com.liveclass.server.dao;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Class statuses kept in memory. With a fixed set of known access codes, unknown ones are
 * rejected; with an empty set every code is accepted.
 */
public class InMemoryClassRecordStore implements ClassRecordStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryClassRecordStore.class);

    private final Set<String> knownCodes;
    private final Map<String, String> statuses = new ConcurrentHashMap<>();

    public InMemoryClassRecordStore(Set<String> knownCodes) {
        this.knownCodes = Set.copyOf(knownCodes);
    }

    @Override
    public void markClassLive(String accessCode) {
        update(accessCode, "live");
    }

    @Override
    public void markClassEnded(String accessCode) {
        update(accessCode, "ended");
    }

    /** @return null when the class has never changed status */
    public String statusOf(String accessCode) {
        return statuses.get(accessCode);
    }

    private void update(String accessCode, String status) {
        if (!knownCodes.isEmpty() && !knownCodes.contains(accessCode)) {
            throw new ClassRecordNotFoundException(accessCode);
        }
        statuses.put(accessCode, status);
        log.info("[CLASS] accessCode={} status={}", accessCode, status);
    }
}

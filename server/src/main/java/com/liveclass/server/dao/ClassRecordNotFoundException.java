package com.liveclass.server.dao;

public class ClassRecordNotFoundException extends RuntimeException {
    private final String accessCode;

    public ClassRecordNotFoundException(String accessCode) {
        super("Class not found: " + accessCode);
        this.accessCode = accessCode;
    }

    public String getAccessCode() {
        return accessCode;
    }
}

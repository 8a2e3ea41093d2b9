package com.liveclass.server.dao;

/**
 * The backing store could not complete an operation. The triggering connection gets a
 * generic failure notice; the process keeps running.
 */
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

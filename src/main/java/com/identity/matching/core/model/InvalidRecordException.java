package com.identity.matching.core.model;

/**
 * Runtime exception thrown when a local or directory record is malformed
 * (missing id, missing name). Only the offending record is rejected; the
 * surrounding batch continues.
 */
public class InvalidRecordException extends RuntimeException {

    private final String recordId;

    public InvalidRecordException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    /**
     * Returns the id of the rejected record, which may be null when the id itself is missing.
     */
    public String getRecordId() {
        return recordId;
    }
}

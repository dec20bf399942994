package com.identity.matching.store;

/**
 * Thrown when an approved link cannot be persisted.
 */
public class LinkPersistenceException extends RuntimeException {

    private final String localId;

    public LinkPersistenceException(String localId, String message) {
        super(message);
        this.localId = localId;
    }

    public LinkPersistenceException(String localId, String message, Throwable cause) {
        super(message, cause);
        this.localId = localId;
    }

    public String getLocalId() {
        return localId;
    }
}

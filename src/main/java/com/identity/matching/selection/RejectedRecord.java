package com.identity.matching.selection;

/**
 * A record left out of a matching run because it failed validation.
 *
 * @param recordId the record's id, or null when the id itself was missing
 * @param source   {@code "local"} or {@code "directory"}
 * @param reason   why the record was rejected
 */
public record RejectedRecord(String recordId, String source, String reason) {

    public static final String LOCAL = "local";
    public static final String DIRECTORY = "directory";
}

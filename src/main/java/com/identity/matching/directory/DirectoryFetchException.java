package com.identity.matching.directory;

/**
 * Thrown when the directory cannot be fetched completely: an error response,
 * an I/O failure, a timeout or a cancelled fetch. No partial result is returned.
 */
public class DirectoryFetchException extends RuntimeException {

    public DirectoryFetchException(String message) {
        super(message);
    }

    public DirectoryFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

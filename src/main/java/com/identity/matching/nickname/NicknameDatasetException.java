package com.identity.matching.nickname;

/**
 * Thrown while reading a missing or corrupt nickname dataset.
 * {@link NicknameDatasetLoader} turns it into a degraded {@link NicknameIndex}.
 */
public class NicknameDatasetException extends RuntimeException {

    public NicknameDatasetException(String message) {
        super(message);
    }

    public NicknameDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}

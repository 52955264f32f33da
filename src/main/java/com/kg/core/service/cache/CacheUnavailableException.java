package com.kg.core.service.cache;

/**
 * Exception thrown when the durable cache cannot be reached or refuses a command.
 */
public class CacheUnavailableException extends RuntimeException {

    public static final String DEPENDENCY_UNAVAILABLE = "DEPENDENCY_UNAVAILABLE";

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getErrorCode() {
        return DEPENDENCY_UNAVAILABLE;
    }
}

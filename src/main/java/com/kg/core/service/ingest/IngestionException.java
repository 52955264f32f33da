package com.kg.core.service.ingest;

/**
 * Exception thrown when an update cannot be decoded, validated or published.
 */
public class IngestionException extends RuntimeException {

    public static final String DECODE_ERROR = "DECODE_ERROR";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String DUPLICATE_UPDATE = "DUPLICATE_UPDATE";
    public static final String ENCODE_ERROR = "ENCODE_ERROR";
    public static final String PUBLISH_FAILED = "PUBLISH_FAILED";
    public static final String RECOVERY_FAILED = "RECOVERY_FAILED";

    private final String updateId;
    private final String errorCode;

    public IngestionException(String message, String updateId, String errorCode) {
        super(message);
        this.updateId = updateId;
        this.errorCode = errorCode;
    }

    public IngestionException(String message, String updateId, String errorCode, Throwable cause) {
        super(message, cause);
        this.updateId = updateId;
        this.errorCode = errorCode;
    }

    public String getUpdateId() {
        return updateId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

package com.rollup.service.flush;

/**
 * Exception thrown when drained rollups could not be committed.
 *
 * The uncommitted rollups have already been restored into the buffer when this is thrown.
 */
public class RollupFlushException extends RuntimeException {

    public static final String REPOSITORY_WRITE_FAILED = "REPOSITORY_WRITE_FAILED";
    public static final String FLUSH_CANCELLED = "FLUSH_CANCELLED";

    private final String errorCode;
    private final int attempts;

    public RollupFlushException(String message, String errorCode, int attempts) {
        super(message);
        this.errorCode = errorCode;
        this.attempts = attempts;
    }

    public RollupFlushException(String message, String errorCode, int attempts, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.attempts = attempts;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isCancelled() {
        return FLUSH_CANCELLED.equals(errorCode);
    }
}

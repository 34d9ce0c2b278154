package com.rollup.service.persistence;

/**
 * Exception thrown when the rollup store cannot be read or written. Write failures are retryable.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
